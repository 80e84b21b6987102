package com.lazyduck.reduction;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.LongType;

import java.util.List;

/**
 * Occurrences of each distinct non-null value of a series, as a series named
 * {@code count} indexed by value. Output buckets are chosen by value, so
 * partial counts of one value always meet in the same output partition.
 */
public final class ValueCounts extends ApplyConcatApply {

    static final Signature<ValueCounts> SIGNATURE = Signature.builder("value-counts", ValueCounts::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = new Reducer("value-counts",
        Kernels::valueCounts, Kernels::mergeCounts, Kernels::mergeCounts, true);

    public ValueCounts(Expr frame) {
        this(operandList(frame));
    }

    public ValueCounts(Expr frame, Object splitEvery, int splitOut) {
        this(operandList(frame, splitEvery, splitOut));
    }

    private ValueCounts(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected Meta computeMeta() {
        Meta input = frame().meta();
        if (!input.isSeries()) {
            throw new PlanConstructionException(kind(), "valueCounts requires a series, got a " + input.kind());
        }
        return Meta.series("count", LongType.get(), input.seriesName(), input.dataType());
    }
}
