package com.lazyduck.graph;

import com.lazyduck.expression.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Materializes an expression tree into a task graph.
 *
 * <p>Walks the tree depth-first, visiting each distinct node (by name) once
 * and merging its {@link Expr#layer() layer}. Shared subtrees therefore
 * contribute their tasks a single time.
 */
public final class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    private GraphBuilder() {}

    /**
     * Builds the task graph of an expression.
     *
     * @param root the expression
     * @return the graph containing every task the root's keys depend on
     */
    public static TaskGraph build(Expr root) {
        return build(List.of(root));
    }

    /**
     * Builds one task graph for several expressions.
     *
     * @param roots the expressions
     * @return the combined graph
     */
    public static TaskGraph build(List<Expr> roots) {
        TaskGraph graph = new TaskGraph();
        Set<String> seen = new HashSet<>();
        Deque<Expr> stack = new ArrayDeque<>(roots);
        int nodes = 0;
        while (!stack.isEmpty()) {
            Expr next = stack.pop();
            if (!seen.add(next.name())) {
                continue;
            }
            nodes++;
            graph.putAll(next.layer());
            for (Expr dep : next.dependencies()) {
                stack.push(dep);
            }
        }
        logger.debug("Materialized {} nodes into {} tasks", nodes, graph.size());
        return graph;
    }
}
