package com.lazyduck.types;

/** 32-bit integers. DuckDB's narrow integral column types all land here. */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int";
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public Object zeroValue() {
        return 0;
    }

    @Override
    public Object coerce(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        return TypeCoercion.toNumber(value).intValue();
    }

    @Override
    public Object parseStatistic(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return typeName();
    }
}
