package com.lazyduck.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Evaluates a single task given a resolver for the keys it references.
 *
 * <p>Shared by the executors and by {@link SubgraphCallable}.
 */
public final class TaskEvaluator {

    private TaskEvaluator() {}

    /**
     * Resolves the task's arguments and applies its function.
     *
     * @param task the task
     * @param resolver maps a key to its computed value
     * @return the task's value
     */
    public static Object evaluate(Task task, Function<TaskKey, Object> resolver) {
        List<Object> resolved = new ArrayList<>(task.args().size());
        for (Object arg : task.args()) {
            resolved.add(resolve(arg, resolver));
        }
        return task.function().apply(resolved);
    }

    private static Object resolve(Object arg, Function<TaskKey, Object> resolver) {
        if (arg instanceof TaskKey) {
            return resolver.apply((TaskKey) arg);
        }
        if (arg instanceof Task) {
            return evaluate((Task) arg, resolver);
        }
        if (arg instanceof List) {
            List<?> items = (List<?>) arg;
            List<Object> resolved = new ArrayList<>(items.size());
            for (Object item : items) {
                resolved.add(resolve(item, resolver));
            }
            return resolved;
        }
        return arg;
    }
}
