package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.types.DataType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type conversion of all columns, or of the columns named in a map.
 */
public final class AsType extends Elemwise {

    static final Signature<AsType> SIGNATURE = Signature.builder("astype", AsType::new)
        .required("frame")
        .required("dtypes")
        .build();

    private static final PartitionFunction ASTYPE = args -> Kernels.astype(args.get(0), args.get(1));

    public AsType(Expr frame, Object dtypes) {
        this(operandList(frame, dtypes));
    }

    private AsType(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Object dtypes() {
        return operand("dtypes");
    }

    @Override
    protected PartitionFunction operation() {
        return ASTYPE;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Expr simplifyUp(Expr parent) {
        if (!(parent instanceof Projection) || !((Projection) parent).frame().equals(this) || !meta().isFrame()) {
            return null;
        }
        Projection projection = (Projection) parent;
        Expr projected = new Projection(frame(), projection.columnsOperand());
        if (dtypes() instanceof DataType) {
            return new AsType(projected, dtypes());
        }
        Map<String, DataType> all = (Map<String, DataType>) dtypes();
        if (projection.selectsSeries()) {
            DataType target = all.get((String) projection.columnsOperand());
            return target == null ? projected : new AsType(projected, target);
        }
        Map<String, DataType> kept = new LinkedHashMap<>();
        for (String column : projection.selectedColumns()) {
            if (all.containsKey(column)) {
                kept.put(column, all.get(column));
            }
        }
        return kept.isEmpty() ? projected : new AsType(projected, Map.copyOf(kept));
    }
}
