package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.frame.GroupAggregation;

import java.util.Objects;

/**
 * A frame grouped by one key column, waiting for an aggregation.
 *
 * <pre>
 *   Expr totals = df.groupBy("a").sum();
 *   Expr means = df.groupBy("a").aggregate("mean", 4, 2);
 * </pre>
 */
public final class GroupBy {

    private final Expr frame;
    private final String by;

    public GroupBy(Expr frame, String by) {
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
        this.by = Objects.requireNonNull(by, "by must not be null");
    }

    public Expr sum() {
        return new GroupByAggregate(frame, by, GroupAggregation.SUM);
    }

    public Expr mean() {
        return new GroupByAggregate(frame, by, GroupAggregation.MEAN);
    }

    public Expr min() {
        return new GroupByAggregate(frame, by, GroupAggregation.MIN);
    }

    public Expr max() {
        return new GroupByAggregate(frame, by, GroupAggregation.MAX);
    }

    public Expr count() {
        return new GroupByAggregate(frame, by, GroupAggregation.COUNT);
    }

    /**
     * Aggregates by name with explicit tree shape.
     *
     * @param aggregation one of sum, mean, min, max, count
     * @param splitEvery the fan-in, null or false as for other reductions
     * @param splitOut the number of output partitions
     * @return the aggregation expression
     */
    public Expr aggregate(String aggregation, Object splitEvery, int splitOut) {
        return new GroupByAggregate(frame, by, GroupAggregation.fromName(aggregation), splitEvery, splitOut);
    }
}
