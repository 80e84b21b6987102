package com.lazyduck.runtime;

import com.lazyduck.expression.Expr;
import com.lazyduck.frame.ArrowColumns;
import com.lazyduck.frame.Kernels;
import com.lazyduck.frame.Series;
import com.lazyduck.frame.Table;
import com.lazyduck.graph.GraphBuilder;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskExecutor;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.io.FromGraph;
import com.lazyduck.optimizer.Optimizer;
import com.lazyduck.types.TypeCoercion;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Optimizes an expression, materializes it and runs the resulting graph.
 *
 * <p>Example usage:
 * <pre>
 *   try (QueryExecutor executor = new QueryExecutor()) {
 *       Object total = executor.compute(frame.get("x").sum());
 *   }
 * </pre>
 */
public class QueryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final Optimizer optimizer;
    private final TaskExecutor taskExecutor;

    /**
     * Creates an executor that runs tasks on the calling thread.
     */
    public QueryExecutor() {
        this(PlannerConfig.defaults(), new LocalTaskExecutor());
    }

    public QueryExecutor(PlannerConfig config, TaskExecutor taskExecutor) {
        this.optimizer = new Optimizer(Objects.requireNonNull(config, "config must not be null"));
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor must not be null");
    }

    public Optimizer optimizer() {
        return optimizer;
    }

    /**
     * Optimizes and materializes an expression.
     *
     * @param expr the expression
     * @return the optimized expression's task graph
     */
    public TaskGraph plan(Expr expr) {
        return GraphBuilder.build(optimizer.run(expr));
    }

    /**
     * Computes every partition of an expression.
     *
     * @param expr the expression
     * @return one value per output partition
     */
    public List<Object> computePartitions(Expr expr) {
        Expr optimized = optimizer.run(expr);
        TaskGraph graph = GraphBuilder.build(optimized);
        long start = System.nanoTime();
        List<Object> parts = taskExecutor.execute(graph, optimized.keys());
        logger.debug("Computed {} partitions of {} from {} tasks in {} ms", parts.size(), optimized.kind(),
            graph.size(), (System.nanoTime() - start) / 1_000_000);
        return parts;
    }

    /**
     * Computes an expression and concatenates its partitions.
     *
     * @param expr the expression
     * @return a table, a series, or a scalar
     */
    public Object compute(Expr expr) {
        List<Object> parts = computePartitions(expr);
        if (parts.size() == 1 && expr.meta().isScalar()) {
            return parts.get(0);
        }
        return Kernels.concat(parts);
    }

    /**
     * Computes an expression and exports the result as one Arrow batch, the
     * index first. A scalar becomes a single row in a column named {@code value}.
     *
     * <p>The returned VectorSchemaRoot must be closed by the caller to free memory.
     *
     * @param expr the expression
     * @param allocator allocates the result vectors
     * @return the result batch
     */
    public VectorSchemaRoot computeArrow(Expr expr, BufferAllocator allocator) {
        Object result = compute(expr);
        if (result instanceof Table) {
            return ArrowColumns.toArrow((Table) result, allocator);
        }
        if (result instanceof Series) {
            return ArrowColumns.toArrow((Series) result, allocator);
        }
        return ArrowColumns.toArrow(
            Series.of("value", TypeCoercion.typeOf(result), Collections.singletonList(result)), allocator);
    }

    /**
     * Computes an expression and wraps its partitions as constants.
     *
     * <p>The returned expression has the same meta and divisions and reads no sources.
     *
     * @param expr the expression
     * @return an expression over the computed partitions
     */
    public Expr persist(Expr expr) {
        List<Object> parts = computePartitions(expr);
        TaskGraph graph = new TaskGraph();
        List<TaskKey> keys = new ArrayList<>(parts.size());
        String name = "persisted-" + expr.name();
        for (int i = 0; i < parts.size(); i++) {
            TaskKey key = new TaskKey(name, i);
            graph.put(key, Task.constant(parts.get(i)));
            keys.add(key);
        }
        return new FromGraph(graph, keys, expr.meta(), expr.divisions());
    }

    @Override
    public void close() {
        taskExecutor.close();
    }
}
