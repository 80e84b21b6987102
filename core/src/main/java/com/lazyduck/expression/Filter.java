package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;

import java.util.List;

/**
 * Row filter by a boolean series partitioned like the frame.
 */
public final class Filter extends Blockwise {

    static final Signature<Filter> SIGNATURE = Signature.builder("filter", Filter::new)
        .required("frame")
        .required("predicate")
        .build();

    private static final PartitionFunction FILTER = args -> Kernels.filter(args.get(0), args.get(1));

    public Filter(Expr frame, Expr predicate) {
        this(operandList(frame, predicate));
    }

    private Filter(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Expr predicate() {
        return exprOperand("predicate");
    }

    @Override
    protected PartitionFunction operation() {
        return FILTER;
    }

    /**
     * Moves a column selection below the filter: {@code df[c][cols]} becomes
     * {@code df[cols][c]}.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (parent instanceof Projection && ((Projection) parent).frame().equals(this) && meta().isFrame()) {
            Projection projection = (Projection) parent;
            return new Filter(new Projection(frame(), projection.columnsOperand()), predicate());
        }
        return null;
    }

    @Override
    public String toString() {
        return frame() + "[" + predicate() + "]";
    }
}
