package com.lazyduck.graph;

import java.util.List;

/**
 * Runs a task graph and returns the values of the requested keys.
 *
 * <p>Implementations must never evaluate a task before the tasks it reads,
 * and must report a failing task with
 * {@link com.lazyduck.exception.TaskExecutionException} naming its key.
 */
public interface TaskExecutor extends AutoCloseable {

    /**
     * Computes the requested keys.
     *
     * @param graph the task graph
     * @param keys the keys whose values are returned
     * @return the values, in the order of {@code keys}
     */
    List<Object> execute(TaskGraph graph, List<TaskKey> keys);

    @Override
    default void close() {
    }
}
