package com.lazyduck.runtime;

import com.lazyduck.exception.TaskExecutionException;
import com.lazyduck.graph.TaskEvaluator;
import com.lazyduck.graph.TaskExecutor;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs tasks one at a time on the calling thread, in topological order.
 */
public final class LocalTaskExecutor implements TaskExecutor {

    @Override
    public List<Object> execute(TaskGraph graph, List<TaskKey> keys) {
        Map<TaskKey, Object> values = new HashMap<>();
        for (TaskKey key : graph.topologicalOrder(keys)) {
            values.put(key, run(graph, key, values::get));
        }
        List<Object> results = new ArrayList<>(keys.size());
        for (TaskKey key : keys) {
            results.add(values.get(key));
        }
        return results;
    }

    static Object run(TaskGraph graph, TaskKey key, Function<TaskKey, Object> resolver) {
        try {
            return TaskEvaluator.evaluate(graph.get(key), resolver);
        } catch (TaskExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TaskExecutionException(key, e);
        }
    }
}
