package com.lazyduck.expression;

import java.util.List;

/**
 * A blockwise operator that maps rows one to one: it never adds, drops or
 * reorders rows. Row-limiting operators such as {@link Head} can therefore
 * move below it.
 */
public abstract class Elemwise extends Blockwise {

    protected Elemwise(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
    }
}
