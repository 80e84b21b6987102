package com.lazyduck.expression;

import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;

import java.util.List;
import java.util.Map;

/**
 * A constant with a single partition.
 */
public final class Literal extends Expr {

    static final Signature<Literal> SIGNATURE = Signature.builder("literal", Literal::new)
        .required("value")
        .build();

    private Literal(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public static Literal of(Object value) {
        return new Literal(operandList(value));
    }

    public Object value() {
        return operand("value");
    }

    @Override
    protected Meta computeMeta() {
        return Meta.of(value());
    }

    @Override
    protected List<Object> computeDivisions() {
        return Divisions.unknown(1);
    }

    @Override
    public Map<TaskKey, Task> layer() {
        return Map.of(new TaskKey(name(), 0), Task.constant(value()));
    }

    @Override
    public String toString() {
        return describeOperand(value());
    }
}
