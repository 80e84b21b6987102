package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.types.DataType;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Applies a value function to every element.
 *
 * <p>The function is an opaque operand: two applications are only
 * recognized as the same node when they share the function instance.
 */
public final class Apply extends Elemwise {

    static final Signature<Apply> SIGNATURE = Signature.builder("apply", Apply::new)
        .required("frame")
        .required("function")
        .required("outputType")
        .build();

    @SuppressWarnings("unchecked")
    private static final PartitionFunction APPLY =
        args -> Kernels.map(args.get(0), (Function<Object, Object>) args.get(1), (DataType) args.get(2));

    public Apply(Expr frame, Function<Object, Object> function, DataType outputType) {
        this(operandList(frame, function, outputType));
    }

    private Apply(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    @Override
    protected PartitionFunction operation() {
        return APPLY;
    }

    @Override
    public Expr simplifyUp(Expr parent) {
        if (parent instanceof Projection && ((Projection) parent).frame().equals(this) && meta().isFrame()) {
            Projection projection = (Projection) parent;
            return withParameters(Map.of("frame", new Projection(frame(), projection.columnsOperand())));
        }
        return null;
    }
}
