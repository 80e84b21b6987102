package com.lazyduck.reduction;

import com.lazyduck.expression.Blockwise;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.UnresolvedType;

import java.util.List;

/**
 * The per-partition step of a lowered reduction. Its partial results have
 * no declared type.
 */
public final class Chunk extends Blockwise {

    static final Signature<Chunk> SIGNATURE = Signature.builder("chunk", Chunk::new)
        .required("frame")
        .required("reducer")
        .build();

    public Chunk(Expr frame, Reducer reducer) {
        this(operandList(frame, reducer));
    }

    private Chunk(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Reducer reducer() {
        return (Reducer) operand("reducer");
    }

    @Override
    protected PartitionFunction operation() {
        Reducer reducer = reducer();
        return args -> reducer.chunk(args.get(0));
    }

    @Override
    protected Meta computeMeta() {
        return Meta.scalar(UnresolvedType.get());
    }
}
