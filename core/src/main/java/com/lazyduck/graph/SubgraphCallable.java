package com.lazyduck.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A partition function that evaluates a small task graph in place.
 *
 * <p>The fused task of a group of blockwise expressions calls one of these:
 * its arguments are bound to {@code inputs} in order, the local tasks are
 * evaluated on demand and the value of {@code output} is returned.
 */
public final class SubgraphCallable implements PartitionFunction {

    private final String name;
    private final Map<TaskKey, Task> tasks;
    private final TaskKey output;
    private final List<TaskKey> inputs;

    public SubgraphCallable(String name, Map<TaskKey, Task> tasks, TaskKey output, List<TaskKey> inputs) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        if (!this.tasks.containsKey(output)) {
            throw new IllegalArgumentException("Output " + output + " is not part of subgraph " + name);
        }
    }

    public String name() {
        return name;
    }

    public Map<TaskKey, Task> tasks() {
        return tasks;
    }

    public TaskKey output() {
        return output;
    }

    public List<TaskKey> inputs() {
        return inputs;
    }

    @Override
    public Object apply(List<Object> args) {
        if (args.size() != inputs.size()) {
            throw new IllegalArgumentException(String.format(
                "Subgraph %s expects %d inputs, got %d", name, inputs.size(), args.size()));
        }
        Map<TaskKey, Object> values = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            values.put(inputs.get(i), args.get(i));
        }
        return compute(output, values);
    }

    private Object compute(TaskKey key, Map<TaskKey, Object> values) {
        if (values.containsKey(key)) {
            return values.get(key);
        }
        Task task = tasks.get(key);
        if (task == null) {
            throw new IllegalStateException("Subgraph " + name + " has no task or input for " + key);
        }
        Object value = TaskEvaluator.evaluate(task, dep -> compute(dep, values));
        values.put(key, value);
        return value;
    }

    @Override
    public String toString() {
        return "SubgraphCallable(" + name + ", tasks=" + tasks.size() + ", inputs=" + inputs + ")";
    }
}
