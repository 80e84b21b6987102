package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.schema.Meta;

import java.util.List;

/**
 * Column selection. A single column name yields a series, a list of names a
 * frame. Applied to a series (such as a per-column aggregate) it selects
 * labels instead.
 */
public final class Projection extends Elemwise {

    static final Signature<Projection> SIGNATURE = Signature.builder("projection", Projection::new)
        .required("frame")
        .required("columns")
        .build();

    private static final PartitionFunction SELECT = args -> Kernels.select(args.get(0), args.get(1));

    public Projection(Expr frame, Object columns) {
        this(operandList(frame, columns));
    }

    private Projection(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Object columnsOperand() {
        return operand("columns");
    }

    /**
     * Returns the selected names as a list.
     *
     * @return the selected columns
     */
    @SuppressWarnings("unchecked")
    public List<String> selectedColumns() {
        Object columns = columnsOperand();
        return columns instanceof String ? List.of((String) columns) : (List<String>) columns;
    }

    public boolean selectsSeries() {
        return columnsOperand() instanceof String;
    }

    @Override
    protected PartitionFunction operation() {
        return SELECT;
    }

    @Override
    protected Meta computeMeta() {
        Meta frameMeta = frame().meta();
        if (frameMeta.isSeries()) {
            // label selection on an aggregate: labels are not part of meta
            return selectsSeries() ? Meta.scalar(frameMeta.dataType()) : frameMeta;
        }
        return super.computeMeta();
    }

    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (frame instanceof Projection) {
            Projection inner = (Projection) frame;
            if (!inner.selectsSeries() && inner.selectedColumns().containsAll(selectedColumns())) {
                return new Projection(inner.frame(), columnsOperand());
            }
            return null;
        }
        if (!selectsSeries() && frame.meta().isFrame() && frame.columns().equals(selectedColumns())) {
            return frame;
        }
        return null;
    }

    @Override
    public String toString() {
        return frame() + "[" + describeOperand(columnsOperand()) + "]";
    }
}
