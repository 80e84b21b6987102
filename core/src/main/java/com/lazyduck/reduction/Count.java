package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.types.DataType;
import com.lazyduck.types.LongType;

import java.util.List;

/**
 * Number of non-null values of each column.
 */
public final class Count extends Reduction {

    static final Signature<Count> SIGNATURE = Signature.builder("count", Count::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("count", Kernels::count, Kernels::sumAll);

    public Count(Expr frame) {
        this(operandList(frame));
    }

    public Count(Expr frame, Object splitEvery) {
        this(operandList(frame, splitEvery));
    }

    private Count(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected DataType resultType(DataType input) {
        return LongType.get();
    }
}
