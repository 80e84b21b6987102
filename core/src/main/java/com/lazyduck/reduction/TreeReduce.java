package com.lazyduck.reduction;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the chunk results of a reduction level by level.
 *
 * <p>With fan-in {@code k}, each level groups at most {@code k} partial
 * results into one combine task until at most {@code k} remain, which the
 * aggregate step turns into the output. With {@code splitOut > 1}, every
 * chunk result is first split into hash buckets and each bucket is reduced
 * separately into its own output partition.
 */
public final class TreeReduce extends Expr {

    static final Signature<TreeReduce> SIGNATURE = Signature.builder("tree-reduce", TreeReduce::new)
        .required("chunked")
        .required("reducer")
        .required("splitEvery")
        .required("splitOut")
        .required("meta")
        .build();

    public TreeReduce(Expr chunked, Reducer reducer, Object splitEvery, int splitOut, Meta meta) {
        this(operandList(chunked, reducer, splitEvery, splitOut, meta));
    }

    private TreeReduce(List<Object> operands) {
        super(SIGNATURE, operands);
        ApplyConcatApply.checkSplitEvery(kind(), operand("splitEvery"));
        if (splitOut() < 1) {
            throw new PlanConstructionException(kind(), "splitOut must be at least 1: " + splitOut());
        }
    }

    public Expr chunked() {
        return exprOperand("chunked");
    }

    public Reducer reducer() {
        return (Reducer) operand("reducer");
    }

    public Object splitEvery() {
        return operand("splitEvery");
    }

    public int splitOut() {
        return (Integer) operand("splitOut");
    }

    @Override
    protected Meta computeMeta() {
        return (Meta) operand("meta");
    }

    @Override
    protected List<Object> computeDivisions() {
        return Divisions.unknown(splitOut());
    }

    @Override
    public Map<TaskKey, Task> layer() {
        return reduceLayer(name(), chunked().keys(), reducer(), splitEvery(), splitOut());
    }

    /**
     * Builds the combine and aggregate tasks over already chunked inputs.
     *
     * @param name the output name; intermediate keys are derived from it
     * @param inputs the keys of the chunk results
     * @param reducer the reduction steps
     * @param splitEvery the fan-in: null for the default, {@code Boolean.FALSE} for unbounded
     * @param splitOut the number of output partitions
     * @return the tasks, outputs keyed {@code (name, j)}
     */
    static Map<TaskKey, Task> reduceLayer(String name, List<TaskKey> inputs, Reducer reducer,
                                          Object splitEvery, int splitOut) {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        int fanIn = fanIn(splitEvery);
        PartitionFunction combine = args -> reducer.combine(castList(args.get(0)));
        PartitionFunction aggregate = args -> reducer.aggregate(castList(args.get(0)));
        for (int bucket = 0; bucket < splitOut; bucket++) {
            List<Object> level = new ArrayList<>(inputs.size());
            for (int i = 0; i < inputs.size(); i++) {
                if (splitOut == 1) {
                    level.add(inputs.get(i));
                    continue;
                }
                TaskKey shard = new TaskKey(name + "-shard", i * splitOut + bucket);
                final int target = bucket;
                layer.put(shard, new Task(
                    args -> Kernels.hashBucket(args.get(0), reducer.bucketByIndex(), target, splitOut),
                    List.of(inputs.get(i))));
                level.add(shard);
            }
            int depth = 0;
            while (level.size() > fanIn) {
                List<Object> next = new ArrayList<>();
                for (int start = 0; start < level.size(); start += fanIn) {
                    List<Object> group = level.subList(start, Math.min(start + fanIn, level.size()));
                    TaskKey key = new TaskKey(name + "-combine-" + depth, bucket * inputs.size() + next.size());
                    layer.put(key, new Task(combine, List.of(new ArrayList<>(group))));
                    next.add(key);
                }
                level = next;
                depth++;
            }
            layer.put(new TaskKey(name, bucket), new Task(aggregate, List.of(level)));
        }
        return layer;
    }

    private static int fanIn(Object splitEvery) {
        if (splitEvery == null) {
            return ApplyConcatApply.DEFAULT_SPLIT_EVERY;
        }
        if (Boolean.FALSE.equals(splitEvery)) {
            return Integer.MAX_VALUE;
        }
        return (Integer) splitEvery;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> castList(Object value) {
        return (List<Object>) value;
    }

    @Override
    public String toString() {
        return "TreeReduce(" + chunked() + ", " + reducer().token() + ")";
    }
}
