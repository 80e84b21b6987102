package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds or replaces one column with a series or a broadcast scalar.
 */
public final class Assign extends Elemwise {

    static final Signature<Assign> SIGNATURE = Signature.builder("assign", Assign::new)
        .required("frame")
        .required("key")
        .required("value")
        .build();

    private static final PartitionFunction ASSIGN =
        args -> Kernels.assign(args.get(0), (String) args.get(1), args.get(2));

    public Assign(Expr frame, String key, Object value) {
        this(operandList(frame, key, value));
    }

    private Assign(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public String key() {
        return (String) operand("key");
    }

    public Object value() {
        return operand("value");
    }

    @Override
    protected PartitionFunction operation() {
        return ASSIGN;
    }

    /**
     * Narrows the assigned frame to the columns a projection keeps. When the
     * assigned column itself is not selected the assignment disappears.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (!(parent instanceof Projection) || !((Projection) parent).frame().equals(this)) {
            return null;
        }
        Projection projection = (Projection) parent;
        List<String> selected = projection.selectedColumns();
        if (!selected.contains(key())) {
            return new Projection(frame(), projection.columnsOperand());
        }
        List<String> needed = new ArrayList<>(selected);
        needed.remove(key());
        List<String> available = frame().columns();
        if (needed.size() >= available.size() || !available.containsAll(needed)) {
            return null;
        }
        Expr narrowed = new Assign(new Projection(frame(), List.copyOf(needed)), key(), value());
        return new Projection(narrowed, projection.columnsOperand());
    }
}
