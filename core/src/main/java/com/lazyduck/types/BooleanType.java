package com.lazyduck.types;

/** Boolean columns, the result type of every comparison and mask. */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public Object zeroValue() {
        return Boolean.FALSE;
    }

    @Override
    public Object coerce(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return Boolean.valueOf(value.toString().trim());
    }

    @Override
    public Object parseStatistic(String text) {
        return Boolean.valueOf(text.trim());
    }

    @Override
    public String toString() {
        return typeName();
    }
}
