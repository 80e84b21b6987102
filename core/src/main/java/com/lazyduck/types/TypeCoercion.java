package com.lazyduck.types;

import java.util.Objects;

/**
 * Value-level and type-level coercion rules shared by meta inference and the
 * in-memory compute kernels.
 */
public final class TypeCoercion {

    private TypeCoercion() {}

    /**
     * Promotes numeric types.
     *
     * <p>Promotion order: Integer &lt; Long &lt; Double. Booleans promote like
     * integers so that sums of masks are counts.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }
        if (left instanceof UnresolvedType || right instanceof UnresolvedType) {
            return UnresolvedType.get();
        }
        return LongType.get();
    }

    /**
     * Unifies two column types, for example when concatenating partitions.
     *
     * @param a first type (may be null)
     * @param b second type (may be null)
     * @return the unified type
     */
    public static DataType unifyTypes(DataType a, DataType b) {
        if (a == null) return b;
        if (b == null) return a;
        if (a.equals(b)) return a;
        if (a.isNumeric() && b.isNumeric()) {
            return promoteNumericTypes(a, b);
        }
        if (a instanceof UnresolvedType) return b;
        return a;
    }

    /**
     * Infers the type of a single Java value.
     *
     * @param value the value
     * @return its data type, {@link UnresolvedType} for null or unsupported values
     */
    public static DataType typeOf(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return IntegerType.get();
        }
        if (value instanceof Long) {
            return LongType.get();
        }
        if (value instanceof Double || value instanceof Float) {
            return DoubleType.get();
        }
        if (value instanceof Boolean) {
            return BooleanType.get();
        }
        if (value instanceof String) {
            return StringType.get();
        }
        return UnresolvedType.get();
    }

    /**
     * Returns the representative value used as the zero-row meta of a scalar.
     *
     * @param type the scalar type
     * @return a typed sample value
     */
    public static Object zeroValue(DataType type) {
        return Objects.requireNonNull(type, "type must not be null").zeroValue();
    }

    /**
     * Converts a value to the Java representation of the given type.
     *
     * @param value the value, may be null
     * @param type the target type
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be represented
     */
    public static Object coerce(Object value, DataType type) {
        return value == null ? null : type.coerce(value);
    }

    static Number toNumber(Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot convert '" + value + "' to a number", e);
        }
    }

    /**
     * Compares two values of compatible types, numbers numerically across
     * their boxed representations.
     *
     * @param a first value, not null
     * @param b second value, not null
     * @return negative, zero or positive
     * @throws IllegalArgumentException if the values are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareValues(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b)) {
                return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        throw new IllegalArgumentException(String.format(
            "Cannot compare %s (%s) with %s (%s)",
            a, a.getClass().getSimpleName(), b, b.getClass().getSimpleName()));
    }

    /**
     * Returns whether two values are equal under {@link #compareValues} rules.
     *
     * @param a first value, may be null
     * @param b second value, may be null
     * @return true when equal
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareValues(a, b) == 0;
        }
        return a.equals(b);
    }

    /**
     * Returns whether a value is an integral boxed number.
     *
     * @param value the value
     * @return true for Integer, Long, Short and Byte
     */
    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte;
    }
}
