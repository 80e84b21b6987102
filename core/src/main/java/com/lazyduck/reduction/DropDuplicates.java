package com.lazyduck.reduction;

import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.schema.Meta;

import java.util.List;

/**
 * Removes repeated rows, keeping the first occurrence.
 */
public final class DropDuplicates extends ApplyConcatApply {

    static final Signature<DropDuplicates> SIGNATURE = Signature.builder("drop-duplicates", DropDuplicates::new)
        .required("frame")
        .optional("splitEvery", null)
        .optional("splitOut", 1)
        .build();

    private static final Reducer REDUCER = Reducer.of("drop-duplicates",
        Kernels::dropDuplicates, parts -> Kernels.dropDuplicates(Kernels.concat(parts)));

    public DropDuplicates(Expr frame) {
        this(operandList(frame));
    }

    public DropDuplicates(Expr frame, Object splitEvery, int splitOut) {
        this(operandList(frame, splitEvery, splitOut));
    }

    private DropDuplicates(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    public Reducer reducer() {
        return REDUCER;
    }

    @Override
    protected Meta computeMeta() {
        return frame().meta();
    }
}
