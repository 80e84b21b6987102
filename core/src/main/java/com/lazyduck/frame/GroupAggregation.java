package com.lazyduck.frame;

import com.lazyduck.types.BooleanType;
import com.lazyduck.types.DataType;
import com.lazyduck.types.DoubleType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.TypeCoercion;
import com.lazyduck.types.UnresolvedType;

import java.util.Locale;

/**
 * Aggregations applied per group and column.
 *
 * <p>Each aggregation folds values into a running state. States built on
 * different partitions merge with {@link #merge}, and {@link #finish} turns
 * the last state into the output value. Null values are skipped.
 */
public enum GroupAggregation {
    SUM,
    MEAN,
    MIN,
    MAX,
    COUNT;

    /**
     * Looks up an aggregation by its lower-case name.
     *
     * @param name e.g. {@code "mean"}
     * @return the aggregation
     * @throws IllegalArgumentException for an unknown name
     */
    public static GroupAggregation fromName(String name) {
        for (GroupAggregation aggregation : values()) {
            if (aggregation.label().equals(name)) {
                return aggregation;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation '" + name + "'");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether a column of the given type can be aggregated.
     */
    public boolean accepts(DataType input) {
        if (this == SUM || this == MEAN) {
            return input.isNumeric() || input instanceof BooleanType || input instanceof UnresolvedType;
        }
        return true;
    }

    /**
     * Returns the output type for an input column type.
     *
     * @param input the column type
     * @return the aggregated type
     */
    public DataType resultType(DataType input) {
        switch (this) {
            case SUM:
                if (input instanceof DoubleType || input instanceof UnresolvedType) {
                    return input;
                }
                return LongType.get();
            case MEAN:
                return DoubleType.get();
            case COUNT:
                return LongType.get();
            default:
                return input;
        }
    }

    /**
     * Folds one value into a state.
     *
     * @param state the current state, null before the first value
     * @param value the value, may be null
     * @return the new state
     */
    public Object accumulate(Object state, Object value) {
        if (value == null) {
            return this == COUNT && state == null ? 0L : state;
        }
        switch (this) {
            case SUM:
                return state == null ? numeric(value) : BinaryOperator.ADD.apply(state, numeric(value));
            case MEAN:
                MeanState mean = state == null ? new MeanState(0L, 0) : (MeanState) state;
                return new MeanState(BinaryOperator.ADD.apply(mean.sum(), numeric(value)), mean.count() + 1);
            case COUNT:
                return (state == null ? 0L : (Long) state) + 1;
            default:
                return state == null ? value : pick(state, value);
        }
    }

    /**
     * Merges two states of the same group and column.
     */
    public Object merge(Object left, Object right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        switch (this) {
            case SUM:
            case COUNT:
                return BinaryOperator.ADD.apply(left, right);
            case MEAN:
                MeanState a = (MeanState) left;
                MeanState b = (MeanState) right;
                return new MeanState(BinaryOperator.ADD.apply(a.sum(), b.sum()), a.count() + b.count());
            default:
                return pick(left, right);
        }
    }

    /**
     * Turns a final state into the output value.
     *
     * @param state the state, null when the group had no values
     * @param resultType the output column type
     * @return the value
     */
    public Object finish(Object state, DataType resultType) {
        switch (this) {
            case SUM:
                return state == null ? resultType.zeroValue() : TypeCoercion.coerce(state, resultType);
            case COUNT:
                return state == null ? 0L : state;
            case MEAN:
                MeanState mean = (MeanState) state;
                if (mean == null || mean.count() == 0) {
                    return null;
                }
                return ((Number) mean.sum()).doubleValue() / mean.count();
            default:
                return state;
        }
    }

    private Object pick(Object current, Object candidate) {
        int cmp = TypeCoercion.compareValues(candidate, current);
        return (this == MIN ? cmp < 0 : cmp > 0) ? candidate : current;
    }

    private static Object numeric(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Cannot aggregate non-numeric value '" + value + "'");
        }
        return value;
    }

    private record MeanState(Object sum, long count) {}
}
