package com.lazyduck.runtime;

import com.lazyduck.exception.TaskExecutionException;
import com.lazyduck.graph.TaskExecutor;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent tasks concurrently on a fixed pool of worker threads.
 *
 * <p>Each task starts once every task it reads has finished. The first
 * failure is reported with the key of the task that raised it.
 */
public final class ThreadPoolTaskExecutor implements TaskExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ThreadPoolTaskExecutor.class);

    private final ExecutorService pool;
    private final int threads;

    public ThreadPoolTaskExecutor(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.threads = threads;
        this.pool = Executors.newFixedThreadPool(threads, new WorkerFactory());
        logger.info("Started task executor with {} threads", threads);
    }

    public ThreadPoolTaskExecutor(PlannerConfig config) {
        this(config.resolvedExecutorThreads());
    }

    public int threads() {
        return threads;
    }

    @Override
    public List<Object> execute(TaskGraph graph, List<TaskKey> keys) {
        Map<TaskKey, CompletableFuture<Object>> futures = new ConcurrentHashMap<>();
        for (TaskKey key : graph.topologicalOrder(keys)) {
            List<CompletableFuture<Object>> inputs = new ArrayList<>();
            for (TaskKey dep : graph.get(key).dependencies()) {
                inputs.add(futures.get(dep));
            }
            CompletableFuture<Object> future = CompletableFuture
                .allOf(inputs.toArray(new CompletableFuture<?>[0]))
                .thenApplyAsync(ignored -> LocalTaskExecutor.run(graph, key, dep -> futures.get(dep).join()), pool);
            futures.put(key, future);
        }
        List<Object> results = new ArrayList<>(keys.size());
        for (TaskKey key : keys) {
            try {
                results.add(futures.get(key).join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof TaskExecutionException) {
                    throw (TaskExecutionException) e.getCause();
                }
                throw new TaskExecutionException(key, e.getCause());
            }
        }
        return results;
    }

    @Override
    public void close() {
        logger.info("Shutting down task executor");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Task executor did not terminate in time, interrupting workers");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "lazyduck-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
