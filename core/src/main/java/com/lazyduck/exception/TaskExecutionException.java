package com.lazyduck.exception;

import com.lazyduck.graph.TaskKey;

/**
 * Exception thrown when a task of a materialized graph fails.
 *
 * <p>The failure is reported against the key of the task whose function
 * raised; tasks are not retried.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Object result = queryExecutor.compute(expr);
 *   } catch (TaskExecutionException e) {
 *       System.err.println("Failed task: " + e.getFailedKey());
 *   }
 * </pre>
 */
public class TaskExecutionException extends RuntimeException {

    private final TaskKey failedKey;

    public TaskExecutionException(TaskKey failedKey, Throwable cause) {
        super(String.format("Task %s failed: %s", failedKey,
            cause == null ? "unknown error" : cause.getMessage()), cause);
        this.failedKey = failedKey;
    }

    public TaskExecutionException(TaskKey failedKey, String message) {
        super(String.format("Task %s failed: %s", failedKey, message));
        this.failedKey = failedKey;
    }

    /**
     * Returns the key of the task that failed.
     *
     * @return the failed key
     */
    public TaskKey getFailedKey() {
        return failedKey;
    }
}
