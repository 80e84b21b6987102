package com.lazyduck.expression;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-wise concatenation of frames with the same columns. The partitions of
 * the inputs become the partitions of the output, in order.
 *
 * <p>Divisions stay known only when every input has known divisions and each
 * input ends strictly before the next one starts.
 */
public final class Concat extends Expr {

    static final Signature<Concat> SIGNATURE = Signature.builder("concat", Concat::new)
        .required("frames")
        .build();

    private Concat(List<Object> operands) {
        super(SIGNATURE, operands);
        List<Expr> frames = frames();
        if (frames.isEmpty()) {
            throw new PlanConstructionException(kind(), "at least one frame is required");
        }
        List<String> columns = frames.get(0).columns();
        for (Expr frame : frames) {
            if (!frame.columns().equals(columns)) {
                throw new PlanConstructionException(kind(), String.format(
                    "all inputs must have columns %s, got %s", columns, frame.columns()));
            }
        }
    }

    /**
     * Concatenates the given frames.
     *
     * @param frames the inputs, in order
     * @return the concatenation
     */
    public static Concat of(List<? extends Expr> frames) {
        return new Concat(operandList(List.copyOf(frames)));
    }

    @SuppressWarnings("unchecked")
    public List<Expr> frames() {
        return (List<Expr>) operand("frames");
    }

    @Override
    protected Meta computeMeta() {
        return frames().get(0).meta();
    }

    @Override
    protected List<Object> computeDivisions() {
        List<Expr> frames = frames();
        int total = 0;
        boolean ordered = true;
        Object previousEnd = null;
        for (Expr frame : frames) {
            total += frame.npartitions();
            if (!frame.knownDivisions()) {
                ordered = false;
                continue;
            }
            List<Object> divisions = frame.divisions();
            if (previousEnd != null && TypeCoercion.compareValues(previousEnd, divisions.get(0)) >= 0) {
                ordered = false;
            }
            previousEnd = divisions.get(divisions.size() - 1);
        }
        if (!ordered) {
            return Divisions.unknown(total);
        }
        List<Object> combined = new ArrayList<>(total + 1);
        for (Expr frame : frames) {
            List<Object> divisions = frame.divisions();
            combined.addAll(divisions.subList(0, divisions.size() - 1));
        }
        combined.add(previousEnd);
        return combined;
    }

    @Override
    public Expr simplifyDown() {
        return frames().size() == 1 ? frames().get(0) : null;
    }

    /**
     * Selects columns on every input instead of on the concatenation.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (!(parent instanceof Projection) || !((Projection) parent).frame().equals(this)) {
            return null;
        }
        Object columns = ((Projection) parent).columnsOperand();
        List<Expr> projected = new ArrayList<>();
        for (Expr frame : frames()) {
            projected.add(new Projection(frame, columns));
        }
        return Concat.of(projected);
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        int output = 0;
        for (Expr frame : frames()) {
            for (int i = 0; i < frame.npartitions(); i++) {
                layer.put(new TaskKey(name(), output++), Task.alias(new TaskKey(frame.name(), i)));
            }
        }
        return layer;
    }
}
