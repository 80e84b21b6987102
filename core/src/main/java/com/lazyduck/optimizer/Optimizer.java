package com.lazyduck.optimizer;

import com.lazyduck.expression.Expr;
import com.lazyduck.reduction.ApplyConcatApply;
import com.lazyduck.runtime.PlannerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites an expression tree into an equivalent, cheaper one.
 *
 * <p>The pipeline is:
 * <ol>
 *   <li>{@link #simplify}: local, algebraic and parent-context rules to a fixed point</li>
 *   <li>{@link #combineSimilar}: merge reads of the same source</li>
 *   <li>{@link #lower}: expand reductions into chunk and combine steps</li>
 *   <li>{@link BlockwiseFusion#fuse}: group blockwise chains into single tasks</li>
 * </ol>
 *
 * <p>Optimization is single-threaded and never mutates its input. Fixed
 * points are detected by comparing names.
 */
public final class Optimizer {

    private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

    private final PlannerConfig config;

    public Optimizer() {
        this(PlannerConfig.defaults());
    }

    public Optimizer(PlannerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public PlannerConfig config() {
        return config;
    }

    /**
     * Optimizes with the default configuration.
     *
     * @param expr the tree
     * @return the optimized tree
     */
    public static Expr optimize(Expr expr) {
        return new Optimizer().run(expr);
    }

    /**
     * Runs the whole pipeline.
     *
     * @param expr the tree
     * @return the optimized tree
     */
    public Expr run(Expr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        long start = System.nanoTime();
        Expr result = simplify(expr);
        result = combineSimilar(result);
        result = lower(result);
        if (config.fuse()) {
            result = BlockwiseFusion.fuse(result);
        }
        logger.debug("Optimized {} into {} in {} ms", expr.name(), result.name(),
            (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    // ==================== Simplify ====================

    /**
     * Applies rewrite rules until no name changes.
     *
     * @param expr the tree
     * @return the simplified tree
     */
    public Expr simplify(Expr expr) {
        Expr current = expr;
        for (int pass = 1; pass <= config.maxIterations(); pass++) {
            Expr next = simplifyOnce(current, new HashMap<>());
            if (next.name().equals(current.name())) {
                logger.debug("Simplify reached a fixed point after {} passes", pass);
                return next;
            }
            current = next;
        }
        logger.warn("Simplify stopped after {} passes without reaching a fixed point for {}",
            config.maxIterations(), current.kind());
        return current;
    }

    private Expr simplifyOnce(Expr expr, Map<String, Expr> done) {
        Expr cached = done.get(expr.name());
        if (cached != null) {
            return cached;
        }
        Expr current = expr;
        boolean settled = false;
        for (int step = 0; step < config.maxIterations() && !settled; step++) {
            Expr rewritten = rewriteNode(current);
            if (rewritten != null) {
                current = rewritten;
                continue;
            }
            Expr children = current.mapDependencies(dep -> simplifyOnce(dep, done));
            settled = children.name().equals(current.name());
            current = children;
        }
        if (!settled) {
            logger.warn("Simplify stopped rewriting {} after {} steps without reaching a fixed point",
                expr.kind(), config.maxIterations());
        }
        done.put(expr.name(), current);
        return current;
    }

    /**
     * Tries local rules, then operator algebra, then each child's view of this node.
     *
     * @return the replacement, or null when no rule changes the name
     */
    private Expr rewriteNode(Expr expr) {
        Expr out = expr.simplifyDown();
        if (changed(expr, out)) {
            trace("simplify-down", expr, out);
            return out;
        }
        for (RewriteRule rule : expr.rewriteRules()) {
            out = rule.apply(expr);
            if (changed(expr, out)) {
                trace(rule.name(), expr, out);
                return out;
            }
        }
        for (Expr child : expr.dependencies()) {
            out = child.simplifyUp(expr);
            if (changed(expr, out)) {
                trace("simplify-up " + child.kind(), expr, out);
                return out;
            }
        }
        return null;
    }

    private static boolean changed(Expr before, Expr after) {
        return after != null && !after.name().equals(before.name());
    }

    private static void trace(String rule, Expr before, Expr after) {
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {} -> {}", rule, before, after);
        }
    }

    // ==================== Combine similar ====================

    /**
     * Lets every node merge with similar nodes elsewhere in the tree.
     *
     * @param expr the tree
     * @return the tree with merged nodes
     */
    public Expr combineSimilar(Expr expr) {
        Map<String, Expr> replacements = new LinkedHashMap<>();
        List<Expr> nodes = expr.findAll(Expr.class);
        for (Expr node : nodes) {
            Expr out = node.combineSimilar(expr);
            if (changed(node, out)) {
                replacements.put(node.name(), out);
            }
        }
        if (replacements.isEmpty()) {
            return expr;
        }
        logger.debug("Combined {} similar nodes", replacements.size());
        return expr.substitute(replacements);
    }

    // ==================== Lower ====================

    /**
     * Expands high-level nodes into the nodes that are materialized.
     *
     * @param expr the tree
     * @return the lowered tree
     */
    public Expr lower(Expr expr) {
        return lower(expr, new HashMap<>());
    }

    private Expr lower(Expr expr, Map<String, Expr> done) {
        Expr cached = done.get(expr.name());
        if (cached != null) {
            return cached;
        }
        Expr current = expr;
        if (current instanceof ApplyConcatApply && ((ApplyConcatApply) current).splitEvery() == null) {
            Map<String, Object> fanIn = new HashMap<>();
            fanIn.put("splitEvery", config.splitEvery());
            current = current.withParameters(fanIn);
        }
        Expr lowered = current.lower();
        while (lowered != null) {
            current = lowered;
            lowered = current.lower();
        }
        Expr result = current.mapDependencies(dep -> lower(dep, done));
        done.put(expr.name(), result);
        return result;
    }
}
