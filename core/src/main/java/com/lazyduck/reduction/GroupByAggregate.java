package com.lazyduck.reduction;

import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.GroupAggregation;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates every non-key column of a frame per distinct value of a key
 * column. The result is a frame indexed by the key, ordered by key within
 * each output partition. Rows with a null key are dropped.
 *
 * <p>Partial states are bucketed by key, so with {@code splitOut > 1} each
 * key lands in exactly one output partition.
 */
public final class GroupByAggregate extends ApplyConcatApply {

    static final Signature<GroupByAggregate> SIGNATURE = Signature.builder("groupby-aggregate", GroupByAggregate::new)
        .required("frame")
        .required("by")
        .required("aggregation")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    public GroupByAggregate(Expr frame, String by, GroupAggregation aggregation) {
        this(operandList(frame, by, aggregation));
    }

    public GroupByAggregate(Expr frame, String by, GroupAggregation aggregation, Object splitEvery, int splitOut) {
        this(operandList(frame, by, aggregation, splitEvery, splitOut));
    }

    private GroupByAggregate(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public String by() {
        return (String) operand("by");
    }

    public GroupAggregation aggregation() {
        return (GroupAggregation) operand("aggregation");
    }

    @Override
    public Reducer reducer() {
        String by = by();
        GroupAggregation aggregation = aggregation();
        StructType schema = meta().schema();
        return new Reducer("groupby-" + aggregation.label() + "-" + by,
            part -> Kernels.groupChunk(part, by, aggregation),
            partials -> Kernels.groupCombine(partials, aggregation),
            partials -> Kernels.groupAggregate(partials, aggregation, schema),
            true);
    }

    @Override
    protected Meta computeMeta() {
        Meta input = frame().meta();
        if (!input.isFrame()) {
            throw new PlanConstructionException(kind(), "groupBy requires a frame, got a " + input.kind());
        }
        String by = by();
        if (!input.columns().contains(by)) {
            throw new ColumnNotFoundException(by, input.columns());
        }
        GroupAggregation aggregation = aggregation();
        List<StructField> fields = new ArrayList<>();
        for (StructField field : input.schema().fields()) {
            if (field.name().equals(by)) {
                continue;
            }
            if (!aggregation.accepts(field.dataType())) {
                throw new PlanConstructionException(kind(), String.format(
                    "cannot %s column '%s' of type %s", aggregation.label(), field.name(), field.dataType()));
            }
            fields.add(new StructField(field.name(), aggregation.resultType(field.dataType())));
        }
        return Meta.frame(new StructType(fields), by, input.columnType(by));
    }

    @Override
    public String toString() {
        return frame() + ".groupBy(" + by() + ")." + aggregation().label() + "()";
    }
}
