package com.lazyduck.types;

/** Floating point columns; FLOAT and DECIMAL columns widen to this. */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "double";
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public Object zeroValue() {
        return 0.0d;
    }

    @Override
    public Object coerce(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0d : 0.0d;
        }
        return TypeCoercion.toNumber(value).doubleValue();
    }

    @Override
    public Object parseStatistic(String text) {
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return typeName();
    }
}
