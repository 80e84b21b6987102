package com.lazyduck.reduction;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;

import java.util.List;

/**
 * Distinct values of a series, in first-seen order within each output partition.
 */
public final class Unique extends ApplyConcatApply {

    static final Signature<Unique> SIGNATURE = Signature.builder("unique", Unique::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("unique",
        Kernels::unique, parts -> Kernels.unique(Kernels.concat(parts)));

    public Unique(Expr frame) {
        this(operandList(frame));
    }

    public Unique(Expr frame, Object splitEvery, int splitOut) {
        this(operandList(frame, splitEvery, splitOut));
    }

    private Unique(List<Object> operands) {
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
            throw new PlanConstructionException(kind(), "unique requires a series, got a " + input.kind());
        }
        return Meta.series(input.seriesName(), input.dataType());
    }
}
