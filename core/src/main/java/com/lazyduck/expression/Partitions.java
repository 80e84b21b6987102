package com.lazyduck.expression;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.io.BlockwiseIO;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selection of an ascending subset of partitions.
 */
public final class Partitions extends Expr {

    static final Signature<Partitions> SIGNATURE = Signature.builder("partitions", Partitions::new)
        .required("frame")
        .required("partitions")
        .build();

    public Partitions(Expr frame, List<Integer> partitions) {
        this(operandList(frame, List.copyOf(partitions)));
    }

    private Partitions(List<Object> operands) {
        super(SIGNATURE, operands);
        List<Integer> selected = selected();
        if (selected.isEmpty()) {
            throw new PlanConstructionException(kind(), "at least one partition must be selected");
        }
        int limit = frame().npartitions();
        for (int i = 0; i < selected.size(); i++) {
            int partition = selected.get(i);
            if (partition < 0 || partition >= limit) {
                throw new PlanConstructionException(kind(), String.format(
                    "partition %d out of range, frame has %d partitions", partition, limit));
            }
            if (i > 0 && partition <= selected.get(i - 1)) {
                throw new PlanConstructionException(kind(), "partitions must be strictly ascending: " + selected);
            }
        }
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    @SuppressWarnings("unchecked")
    public List<Integer> selected() {
        return (List<Integer>) operand("partitions");
    }

    @Override
    protected Meta computeMeta() {
        return frame().meta();
    }

    @Override
    protected List<Object> computeDivisions() {
        return Divisions.select(frame().divisions(), selected());
    }

    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (selected().size() == frame.npartitions()) {
            return frame;
        }
        if (frame instanceof Partitions) {
            Partitions inner = (Partitions) frame;
            List<Integer> composed = new ArrayList<>(selected().size());
            for (int partition : selected()) {
                composed.add(inner.selected().get(partition));
            }
            return new Partitions(inner.frame(), composed);
        }
        if (frame instanceof Blockwise && !(frame instanceof BlockwiseIO) && !(frame instanceof Fused)) {
            Blockwise blockwise = (Blockwise) frame;
            return blockwise.mapDependencies(dep ->
                blockwise.isBroadcast(dep) || dep.npartitions() != frame.npartitions()
                    ? dep : new Partitions(dep, selected()));
        }
        return null;
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        List<Integer> selected = selected();
        for (int i = 0; i < selected.size(); i++) {
            layer.put(new TaskKey(name(), i), Task.alias(new TaskKey(frame().name(), selected.get(i))));
        }
        return layer;
    }

    @Override
    public String toString() {
        return frame() + ".partitions(" + selected() + ")";
    }
}
