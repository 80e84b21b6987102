package com.lazyduck.reduction;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Projection;
import com.lazyduck.expression.Signature;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.DataType;
import com.lazyduck.types.StringType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.TypeCoercion;
import com.lazyduck.types.UnresolvedType;

import java.util.List;
import java.util.Map;

/**
 * A reduction applied column by column: a series reduces to a scalar, a
 * frame to a series labelled by column name.
 */
public abstract class Reduction extends ApplyConcatApply {

    protected Reduction(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
    }

    /**
     * Returns the result type of reducing a column of the given type.
     *
     * @param input the column type
     * @return the reduced type
     */
    protected abstract DataType resultType(DataType input);

    @Override
    protected Meta computeMeta() {
        Meta input = frame().meta();
        if (input.isSeries()) {
            return Meta.scalar(resultType(input.dataType()));
        }
        if (!input.isFrame()) {
            throw new PlanConstructionException(kind(), "cannot reduce a scalar");
        }
        DataType unified = null;
        for (StructField field : input.schema().fields()) {
            unified = TypeCoercion.unifyTypes(unified, resultType(field.dataType()));
        }
        return Meta.series(null, unified == null ? UnresolvedType.get() : unified, null, StringType.get());
    }

    /**
     * Reduces only the selected columns: {@code df.sum()[cols]} becomes
     * {@code df[cols].sum()}.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (!(parent instanceof Projection) || !((Projection) parent).frame().equals(this)
                || !frame().meta().isFrame()) {
            return null;
        }
        Projection projection = (Projection) parent;
        return withParameters(Map.of("frame", new Projection(frame(), projection.columnsOperand())));
    }
}
