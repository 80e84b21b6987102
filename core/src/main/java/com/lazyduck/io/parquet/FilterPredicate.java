package com.lazyduck.io.parquet;

import com.lazyduck.expression.Tokenizable;
import com.lazyduck.frame.BinaryOperator;
import com.lazyduck.types.TypeCoercion;

import java.util.Objects;

/**
 * A {@code column op literal} comparison pushed into a dataset read.
 */
public record FilterPredicate(String column, BinaryOperator operator, Object value) implements Tokenizable {

    public FilterPredicate {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (!operator.isComparison()) {
            throw new IllegalArgumentException("Only comparisons can be pushed into a read: " + operator);
        }
    }

    /**
     * Returns whether a fragment with the given statistics may hold matching rows.
     *
     * @param statistics the column's statistics, may be null
     * @return false only when no row can match
     */
    public boolean mayMatch(ColumnStatistics statistics) {
        if (statistics == null || !statistics.hasBounds()) {
            return true;
        }
        if (operator == BinaryOperator.NOT_EQUAL && statistics.nullCount() > 0) {
            // null rows satisfy !=
            return true;
        }
        int low;
        int high;
        try {
            low = TypeCoercion.compareValues(statistics.min(), value);
            high = TypeCoercion.compareValues(statistics.max(), value);
        } catch (IllegalArgumentException e) {
            // statistics of another type than the literal prove nothing
            return true;
        }
        switch (operator) {
            case EQUAL:
                return low <= 0 && high >= 0;
            case NOT_EQUAL:
                return !(low == 0 && high == 0);
            case LESS_THAN:
                return low < 0;
            case LESS_THAN_OR_EQUAL:
                return low <= 0;
            case GREATER_THAN:
                return high > 0;
            case GREATER_THAN_OR_EQUAL:
                return high >= 0;
            default:
                return true;
        }
    }

    /**
     * Evaluates the predicate on one value with the same null semantics as
     * {@link BinaryOperator#apply}: a null only satisfies {@code !=}.
     *
     * @param candidate the column value, may be null
     * @return whether the row is kept
     */
    public boolean test(Object candidate) {
        return Boolean.TRUE.equals(operator.apply(candidate, value));
    }

    /**
     * Renders the predicate as a DuckDB {@code WHERE} term. SQL comparisons
     * are never true for NULL, so {@code !=} also admits null rows.
     *
     * @return the SQL condition
     */
    public String toSql() {
        String column = SQLQuoting.quoteIdentifier(this.column);
        String condition = column + " " + operator.sqlSymbol() + " " + SQLQuoting.renderValue(value);
        if (operator == BinaryOperator.NOT_EQUAL) {
            return "(" + condition + " OR " + column + " IS NULL)";
        }
        return condition;
    }

    @Override
    public String token() {
        return column + " " + operator.name() + " " + value.getClass().getSimpleName() + ":" + value;
    }

    @Override
    public String toString() {
        return "(" + column + " " + operator.symbol() + " " + value + ")";
    }
}
