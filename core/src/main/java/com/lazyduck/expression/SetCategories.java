package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;

import java.util.List;

/**
 * Marks a series, or one column of a frame, as categorical with known categories.
 */
public final class SetCategories extends Elemwise {

    static final Signature<SetCategories> SIGNATURE = Signature.builder("set-categories", SetCategories::new)
        .required("frame")
        .required("column")
        .required("categories")
        .build();

    @SuppressWarnings("unchecked")
    private static final PartitionFunction SET_CATEGORIES =
        args -> Kernels.setCategories(args.get(0), (String) args.get(1), (List<String>) args.get(2));

    public SetCategories(Expr frame, String column, List<String> categories) {
        this(operandList(frame, column, categories));
    }

    private SetCategories(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    protected PartitionFunction operation() {
        return SET_CATEGORIES;
    }
}
