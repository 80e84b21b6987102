package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.LongType;

import java.util.List;

/**
 * Number of cells: rows of a series, rows times columns of a frame.
 */
public final class Size extends ApplyConcatApply {

    static final Signature<Size> SIGNATURE = Signature.builder("size", Size::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("size", Kernels::size, Kernels::sumAll);

    public Size(Expr frame) {
        this(operandList(frame));
    }

    private Size(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected Meta computeMeta() {
        return Meta.scalar(LongType.get());
    }
}
