package com.lazyduck.types;

/**
 * Stands in where meta cannot name a type: reduction chunk intermediates and
 * scalar nulls. Unifies away against any concrete type.
 */
public final class UnresolvedType implements DataType {

    private static final UnresolvedType INSTANCE = new UnresolvedType();

    private UnresolvedType() {}

    public static UnresolvedType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "unresolved";
    }

    @Override
    public String toString() {
        return typeName();
    }
}
