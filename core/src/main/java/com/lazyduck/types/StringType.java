package com.lazyduck.types;

/** Text columns. Statistics on these are compared lexicographically. */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public Object zeroValue() {
        return "";
    }

    @Override
    public Object coerce(Object value) {
        return value.toString();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
