package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.types.DataType;
import com.lazyduck.types.DoubleType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.UnresolvedType;

import java.util.List;

/**
 * Sum of each column, skipping nulls. Integral and boolean columns sum to longs.
 */
public final class Sum extends Reduction {

    static final Signature<Sum> SIGNATURE = Signature.builder("sum", Sum::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("sum", Kernels::sum, Kernels::sumAll);

    public Sum(Expr frame) {
        this(operandList(frame));
    }

    public Sum(Expr frame, Object splitEvery) {
        this(operandList(frame, splitEvery));
    }

    private Sum(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected DataType resultType(DataType input) {
        if (input instanceof DoubleType) {
            return DoubleType.get();
        }
        return input instanceof UnresolvedType ? input : LongType.get();
    }
}
