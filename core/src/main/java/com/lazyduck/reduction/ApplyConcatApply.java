package com.lazyduck.reduction;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of reductions computed as a chunk / combine / aggregate tree.
 *
 * <p>Subclasses declare {@code frame}, {@code splitEvery} and
 * {@code splitOut} parameters, and supply a {@link Reducer}.
 * Output divisions are always unknown, one partition per {@code splitOut}.
 *
 * <p>{@code splitEvery} is null for the configured default fan-in,
 * {@code Boolean.FALSE} to combine every chunk at once, or an integer of at
 * least 2.
 */
public abstract class ApplyConcatApply extends Expr {

    /** Fan-in used when {@code splitEvery} is not given. */
    public static final int DEFAULT_SPLIT_EVERY = 8;

    protected ApplyConcatApply(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
        checkSplitEvery(kind(), splitEvery());
        if (splitOut() < 1) {
            throw new PlanConstructionException(kind(), "splitOut must be at least 1: " + splitOut());
        }
    }

    static void checkSplitEvery(String kind, Object splitEvery) {
        if (splitEvery == null || Boolean.FALSE.equals(splitEvery)) {
            return;
        }
        if (!(splitEvery instanceof Integer) || (Integer) splitEvery < 2) {
            throw new PlanConstructionException(kind,
                "splitEvery must be null, false or an integer of at least 2, got " + splitEvery);
        }
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Object splitEvery() {
        return operand("splitEvery");
    }

    public int splitOut() {
        return (Integer) operand("splitOut");
    }

    /**
     * Returns the steps of this reduction.
     *
     * @return the reducer
     */
    public abstract Reducer reducer();

    @Override
    protected List<Object> computeDivisions() {
        return Divisions.unknown(splitOut());
    }

    /**
     * Expands into a blockwise chunk step followed by the reduction tree.
     */
    @Override
    public Expr lower() {
        Reducer reducer = reducer();
        return new TreeReduce(new Chunk(frame(), reducer), reducer, splitEvery(), splitOut(), meta());
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Reducer reducer = reducer();
        PartitionFunction chunk = args -> reducer.chunk(args.get(0));
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        String chunkName = name() + "-chunk";
        List<TaskKey> inputs = frame().keys();
        List<TaskKey> chunked = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            TaskKey key = new TaskKey(chunkName, i);
            layer.put(key, new Task(chunk, List.of(inputs.get(i))));
            chunked.add(key);
        }
        layer.putAll(TreeReduce.reduceLayer(name(), chunked, reducer, splitEvery(), splitOut()));
        return layer;
    }

    @Override
    public String toString() {
        return frame() + "." + kind() + "()";
    }
}
