package com.lazyduck.reduction;

import com.lazyduck.expression.Elemwise;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Repartition;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.LongType;

import java.util.List;
import java.util.Map;

/**
 * Number of rows.
 *
 * <p>Row-preserving operators between the count and its source are dropped,
 * so that sources that know their row counts can answer without reading.
 */
public final class Len extends ApplyConcatApply {

    static final Signature<Len> SIGNATURE = Signature.builder("len", Len::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("len", Kernels::numRows, Kernels::sumAll);

    public Len(Expr frame) {
        this(operandList(frame));
    }

    private Len(List<Object> operands) {
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

    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (frame instanceof Repartition) {
            return withParameters(Map.of("frame", ((Repartition) frame).frame()));
        }
        if (frame instanceof Elemwise) {
            Elemwise elemwise = (Elemwise) frame;
            for (Expr dep : elemwise.dependencies()) {
                if (!elemwise.isBroadcast(dep) && dep.ndim() > 0) {
                    return withParameters(Map.of("frame", dep));
                }
            }
        }
        return null;
    }
}
