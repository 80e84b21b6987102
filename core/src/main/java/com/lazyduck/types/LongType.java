package com.lazyduck.types;

/**
 * 64-bit integers. Integral sums and row counts are always reported in this
 * type regardless of the input width.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "long";
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public Object zeroValue() {
        return 0L;
    }

    @Override
    public Object coerce(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        }
        return TypeCoercion.toNumber(value).longValue();
    }

    @Override
    public Object parseStatistic(String text) {
        try {
            return Long.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return typeName();
    }
}
