package com.lazyduck.optimizer;

import com.lazyduck.expression.Expr;

/**
 * Local rewrite of a single expression node.
 *
 * <p>Rules transform a node into an equivalent, cheaper one. A rule that
 * does not apply declines by returning {@code null}; rules never raise for
 * inputs they do not recognize.
 *
 * <p>Rules must preserve results and must make progress: applying a rule to
 * its own output must eventually decline.
 */
@FunctionalInterface
public interface RewriteRule {

    /**
     * Applies this rule to a node.
     *
     * @param expr the node
     * @return the replacement, or null when the rule does not apply
     */
    Expr apply(Expr expr);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Creates a named rule from a function.
     *
     * @param name the rule name
     * @param rule the rewrite
     * @return the rule
     */
    static RewriteRule of(String name, RewriteRule rule) {
        return new RewriteRule() {
            @Override
            public Expr apply(Expr expr) {
                return rule.apply(expr);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
