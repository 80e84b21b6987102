package com.lazyduck.io;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Signature;
import com.lazyduck.expression.Tokenizer;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Meta;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A leaf backed by an existing task graph, one key per partition.
 *
 * <p>Used to continue planning on top of persisted results. The name is
 * derived from the keys, meta and divisions; the graph itself is not hashed.
 */
public final class FromGraph extends Expr {

    static final Signature<FromGraph> SIGNATURE = Signature.builder("from-graph", FromGraph::new)
        .required("graph")
        .required("keys")
        .required("meta")
        .required("divisions")
        .build();

    public FromGraph(TaskGraph graph, List<TaskKey> keys, Meta meta, List<Object> divisions) {
        this(operandList(graph, List.copyOf(keys), meta, divisions));
    }

    private FromGraph(List<Object> operands) {
        super(SIGNATURE, operands);
        if (sourceKeys().size() + 1 != divisions().size()) {
            throw new PlanConstructionException(kind(), String.format(
                "%d keys do not match %d division boundaries", sourceKeys().size(), divisions().size()));
        }
        for (TaskKey key : sourceKeys()) {
            if (!graph().containsKey(key)) {
                throw new PlanConstructionException(kind(), "graph has no task for " + key);
            }
        }
    }

    public TaskGraph graph() {
        return (TaskGraph) operand("graph");
    }

    @SuppressWarnings("unchecked")
    public List<TaskKey> sourceKeys() {
        return (List<TaskKey>) operand("keys");
    }

    @Override
    protected String computeName() {
        return kind() + "-" + Tokenizer.tokenize(kind(), sourceKeys(), operand("meta"), operand("divisions"));
    }

    @Override
    protected Meta computeMeta() {
        return (Meta) operand("meta");
    }

    @Override
    @SuppressWarnings("unchecked")
    protected List<Object> computeDivisions() {
        return (List<Object>) operand("divisions");
    }

    @Override
    public Map<TaskKey, Task> layer() {
        List<TaskKey> keys = sourceKeys();
        TaskGraph needed = graph().cull(keys);
        Set<TaskKey> referenced = new HashSet<>();
        for (Task task : needed.asMap().values()) {
            referenced.addAll(task.dependencies());
        }
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        for (Map.Entry<TaskKey, Task> entry : needed.asMap().entrySet()) {
            if (!keys.contains(entry.getKey()) || referenced.contains(entry.getKey())) {
                layer.put(entry.getKey(), entry.getValue());
            }
        }
        for (int i = 0; i < keys.size(); i++) {
            TaskKey source = keys.get(i);
            TaskKey output = new TaskKey(name(), i);
            layer.put(output, referenced.contains(source) ? Task.alias(source) : needed.get(source));
        }
        return layer;
    }

    @Override
    public String toString() {
        return "FromGraph(" + sourceKeys().size() + " partitions)";
    }
}
