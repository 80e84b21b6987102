package com.lazyduck.frame;

import com.lazyduck.types.BooleanType;
import com.lazyduck.types.DataType;
import com.lazyduck.types.DoubleType;
import com.lazyduck.types.StringType;
import com.lazyduck.types.TypeCoercion;

import java.util.Locale;

/**
 * Element-wise binary operators understood by the compute kernels.
 *
 * <p>Arithmetic on two integral values stays integral (except division),
 * anything involving a floating point value is computed in double. Null
 * propagates through arithmetic; comparisons against null are false, except
 * {@link #NOT_EQUAL} which is true.
 */
public enum BinaryOperator {
    ADD("+", Family.ARITHMETIC),
    SUBTRACT("-", Family.ARITHMETIC),
    MULTIPLY("*", Family.ARITHMETIC),
    DIVIDE("/", Family.ARITHMETIC),
    EQUAL("==", Family.COMPARISON),
    NOT_EQUAL("!=", Family.COMPARISON),
    LESS_THAN("<", Family.COMPARISON),
    LESS_THAN_OR_EQUAL("<=", Family.COMPARISON),
    GREATER_THAN(">", Family.COMPARISON),
    GREATER_THAN_OR_EQUAL(">=", Family.COMPARISON),
    AND("&", Family.LOGICAL),
    OR("|", Family.LOGICAL);

    private enum Family { ARITHMETIC, COMPARISON, LOGICAL }

    private final String symbol;
    private final Family family;

    BinaryOperator(String symbol, Family family) {
        this.symbol = symbol;
        this.family = family;
    }

    public String symbol() {
        return symbol;
    }

    /** Operator name for error messages, e.g. {@code less_than (<)}. */
    public String description() {
        return name().toLowerCase(Locale.ROOT) + " (" + symbol + ")";
    }

    public boolean isArithmetic() {
        return family == Family.ARITHMETIC;
    }

    public boolean isComparison() {
        return family == Family.COMPARISON;
    }

    public boolean isLogical() {
        return family == Family.LOGICAL;
    }

    /**
     * Returns the comparison with its operands swapped, so that
     * {@code a op b} equals {@code b op.flip() a}.
     *
     * @return the flipped operator
     * @throws UnsupportedOperationException for non-comparison operators
     */
    public BinaryOperator flip() {
        return switch (this) {
            case LESS_THAN -> GREATER_THAN;
            case LESS_THAN_OR_EQUAL -> GREATER_THAN_OR_EQUAL;
            case GREATER_THAN -> LESS_THAN;
            case GREATER_THAN_OR_EQUAL -> LESS_THAN_OR_EQUAL;
            case EQUAL, NOT_EQUAL -> this;
            default -> throw new UnsupportedOperationException("Cannot flip " + description());
        };
    }

    /**
     * Returns the SQL spelling of a comparison operator.
     *
     * @return the SQL operator
     */
    public String sqlSymbol() {
        return switch (this) {
            case EQUAL -> "=";
            case NOT_EQUAL -> "<>";
            case AND -> "AND";
            case OR -> "OR";
            default -> symbol;
        };
    }

    /**
     * Returns the result type of applying this operator to the given types.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the result type
     */
    public DataType resultType(DataType left, DataType right) {
        if (isComparison() || isLogical()) {
            return BooleanType.get();
        }
        if (this == DIVIDE) {
            return DoubleType.get();
        }
        if (this == ADD && left instanceof StringType && right instanceof StringType) {
            return StringType.get();
        }
        return TypeCoercion.promoteNumericTypes(left, right);
    }

    /**
     * Applies this operator to two scalar values.
     *
     * @param left the left value, may be null
     * @param right the right value, may be null
     * @return the result
     * @throws IllegalArgumentException if the values do not support the operator
     */
    public Object apply(Object left, Object right) {
        if (isComparison()) {
            return compare(left, right);
        }
        if (isLogical()) {
            boolean l = Boolean.TRUE.equals(left);
            boolean r = Boolean.TRUE.equals(right);
            return this == AND ? l && r : l || r;
        }
        if (left == null || right == null) {
            return null;
        }
        if (this == ADD && left instanceof String && right instanceof String) {
            return (String) left + right;
        }
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw new IllegalArgumentException(String.format(
                "Unsupported operand types for %s: %s and %s",
                symbol, left.getClass().getSimpleName(), right.getClass().getSimpleName()));
        }
        Number l = (Number) left;
        Number r = (Number) right;
        if (this != DIVIDE && TypeCoercion.isIntegral(l) && TypeCoercion.isIntegral(r)) {
            long a = l.longValue();
            long b = r.longValue();
            return switch (this) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                default -> throw new IllegalStateException("Unexpected operator " + this);
            };
        }
        double a = l.doubleValue();
        double b = r.doubleValue();
        return switch (this) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> a / b;
            default -> throw new IllegalStateException("Unexpected operator " + this);
        };
    }

    private Boolean compare(Object left, Object right) {
        if (left == null || right == null) {
            return this == NOT_EQUAL;
        }
        if (this == EQUAL) {
            return TypeCoercion.valuesEqual(left, right);
        }
        if (this == NOT_EQUAL) {
            return !TypeCoercion.valuesEqual(left, right);
        }
        int cmp = TypeCoercion.compareValues(left, right);
        return switch (this) {
            case LESS_THAN -> cmp < 0;
            case LESS_THAN_OR_EQUAL -> cmp <= 0;
            case GREATER_THAN -> cmp > 0;
            case GREATER_THAN_OR_EQUAL -> cmp >= 0;
            default -> throw new IllegalStateException("Unexpected operator " + this);
        };
    }
}
