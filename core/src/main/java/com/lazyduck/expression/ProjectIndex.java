package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;

import java.util.List;

/**
 * The index of a frame or series as a series.
 */
public final class ProjectIndex extends Elemwise {

    static final Signature<ProjectIndex> SIGNATURE = Signature.builder("index", ProjectIndex::new)
        .required("frame")
        .build();

    private static final PartitionFunction INDEX = args -> Kernels.index(args.get(0));

    public ProjectIndex(Expr frame) {
        this(operandList(frame));
    }

    private ProjectIndex(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    @Override
    protected PartitionFunction operation() {
        return INDEX;
    }

    /**
     * The index needs no columns, so the frame is narrowed to none.
     */
    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (frame.meta().isFrame() && !frame.columns().isEmpty()) {
            return new ProjectIndex(new Projection(frame, List.of()));
        }
        return null;
    }
}
