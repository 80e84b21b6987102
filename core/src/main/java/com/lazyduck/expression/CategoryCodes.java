package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;

import java.util.List;

/**
 * Integer codes of a categorical series with known categories.
 *
 * @see Expr#categoryCodes()
 */
public final class CategoryCodes extends Elemwise {

    static final Signature<CategoryCodes> SIGNATURE = Signature.builder("cat-codes", CategoryCodes::new)
        .required("frame")
        .build();

    private static final PartitionFunction CODES = args -> Kernels.categoryCodes(args.get(0));

    public CategoryCodes(Expr frame) {
        this(operandList(frame));
    }

    private CategoryCodes(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    @Override
    protected PartitionFunction operation() {
        return CODES;
    }
}
