package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.types.DataType;

import java.util.List;

/**
 * Largest non-null value of each column.
 */
public final class Max extends Reduction {

    static final Signature<Max> SIGNATURE = Signature.builder("max", Max::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("max", Kernels::max, Kernels::maxAll);

    public Max(Expr frame) {
        this(operandList(frame));
    }

    public Max(Expr frame, Object splitEvery) {
        this(operandList(frame, splitEvery));
    }

    private Max(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected DataType resultType(DataType input) {
        return input;
    }
}
