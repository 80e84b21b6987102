package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.types.DataType;

import java.util.List;

/**
 * Smallest non-null value of each column.
 */
public final class Min extends Reduction {

    static final Signature<Min> SIGNATURE = Signature.builder("min", Min::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("min", Kernels::min, Kernels::minAll);

    public Min(Expr frame) {
        this(operandList(frame));
    }

    public Min(Expr frame, Object splitEvery) {
        this(operandList(frame, splitEvery));
    }

    private Min(List<Object> operands) {
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
