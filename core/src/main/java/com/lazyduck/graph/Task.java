package com.lazyduck.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A function call in a task graph.
 *
 * <p>Arguments are literals, {@link TaskKey} references to other tasks'
 * outputs, nested tasks evaluated inline, or lists of any of these.
 */
public final class Task {

    private static final PartitionFunction IDENTITY = args -> args.get(0);

    private final PartitionFunction function;
    private final List<Object> args;

    public Task(PartitionFunction function, List<?> args) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Returns a task that forwards the value of another key.
     *
     * @param source the key to forward
     * @return the alias task
     */
    public static Task alias(TaskKey source) {
        return new Task(IDENTITY, List.of(source));
    }

    /**
     * Returns a task that produces a constant.
     *
     * @param value the value, may be null
     * @return the constant task
     */
    public static Task constant(Object value) {
        return new Task(IDENTITY, Collections.singletonList(value));
    }

    public PartitionFunction function() {
        return function;
    }

    public List<Object> args() {
        return args;
    }

    /**
     * Returns the keys this task reads, including those of nested tasks and lists.
     *
     * @return the dependency keys in first-seen order
     */
    public Set<TaskKey> dependencies() {
        Set<TaskKey> keys = new LinkedHashSet<>();
        collect(args, keys);
        return keys;
    }

    private static void collect(Object arg, Set<TaskKey> keys) {
        if (arg instanceof TaskKey) {
            keys.add((TaskKey) arg);
        } else if (arg instanceof Task) {
            collect(((Task) arg).args, keys);
        } else if (arg instanceof List) {
            for (Object item : (List<?>) arg) {
                collect(item, keys);
            }
        }
    }

    @Override
    public String toString() {
        return "Task(" + function.getClass().getSimpleName() + ", " + args + ")";
    }
}
