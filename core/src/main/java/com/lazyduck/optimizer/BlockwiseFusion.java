package com.lazyduck.optimizer;

import com.lazyduck.expression.Blockwise;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Fused;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups chains of blockwise expressions into {@link Fused} nodes.
 *
 * <p>A blockwise dependency joins its consumer's group when it has the same
 * number of partitions, is not broadcast, and every one of its dependents is
 * already in the group. Any other blockwise dependency starts a group of its
 * own. Groups are collected consumers first. Non-blockwise nodes are left in place with fused dependencies.
 */
public final class BlockwiseFusion {

    private static final Logger logger = LoggerFactory.getLogger(BlockwiseFusion.class);

    private BlockwiseFusion() {
    }

    /**
     * Fuses every eligible blockwise chain under {@code root}.
     *
     * @param root the lowered tree
     * @return the tree with fused groups
     */
    public static Expr fuse(Expr root) {
        Map<String, Set<String>> dependents = dependents(root);
        Map<String, List<Expr>> groups = new LinkedHashMap<>();
        Set<String> grouped = new HashSet<>();

        for (Expr node : consumersFirst(root)) {
            if (!(node instanceof Blockwise) || grouped.contains(node.name())) {
                continue;
            }
            List<Expr> group = collectGroup((Blockwise) node, dependents);
            for (Expr member : group) {
                grouped.add(member.name());
            }
            if (group.size() > 1) {
                groups.put(node.name(), group);
            }
        }
        if (groups.isEmpty()) {
            return root;
        }
        logger.debug("Fusing {} blockwise groups", groups.size());
        return rebuild(root, groups, new HashMap<>());
    }

    private static Map<String, Set<String>> dependents(Expr root) {
        Map<String, Set<String>> dependents = new HashMap<>();
        for (Expr node : root.findAll(Expr.class)) {
            dependents.computeIfAbsent(node.name(), k -> new LinkedHashSet<>());
            for (Expr dep : node.dependencies()) {
                dependents.computeIfAbsent(dep.name(), k -> new LinkedHashSet<>()).add(node.name());
            }
        }
        return dependents;
    }

    /**
     * Orders the tree so that every node comes after all of its dependents.
     */
    static List<Expr> consumersFirst(Expr root) {
        List<Expr> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[] {root, Boolean.FALSE});
        while (!stack.isEmpty()) {
            Object[] frame = stack.pop();
            Expr node = (Expr) frame[0];
            if ((Boolean) frame[1]) {
                order.add(node);
                continue;
            }
            if (!visited.add(node.name())) {
                continue;
            }
            stack.push(new Object[] {node, Boolean.TRUE});
            for (Expr dep : node.dependencies()) {
                if (!visited.contains(dep.name())) {
                    stack.push(new Object[] {dep, Boolean.FALSE});
                }
            }
        }
        Collections.reverse(order);
        return order;
    }

    /**
     * Walks down from a group root, output first, members in discovery order.
     */
    private static List<Expr> collectGroup(Blockwise groupRoot, Map<String, Set<String>> dependents) {
        Map<String, Expr> group = new LinkedHashMap<>();
        group.put(groupRoot.name(), groupRoot);
        Deque<Blockwise> stack = new ArrayDeque<>();
        stack.push(groupRoot);
        while (!stack.isEmpty()) {
            Blockwise consumer = stack.pop();
            for (Expr dep : consumer.dependencies()) {
                if (group.containsKey(dep.name()) || !joinsGroup(consumer, dep, groupRoot, dependents, group)) {
                    continue;
                }
                group.put(dep.name(), dep);
                stack.push((Blockwise) dep);
            }
        }
        return new ArrayList<>(group.values());
    }

    private static boolean joinsGroup(Blockwise consumer, Expr dep, Expr groupRoot,
                                      Map<String, Set<String>> dependents, Map<String, Expr> group) {
        if (!(dep instanceof Blockwise) || dep.npartitions() != groupRoot.npartitions() || consumer.isBroadcast(dep)) {
            return false;
        }
        for (String consumerName : dependents.get(dep.name())) {
            if (!group.containsKey(consumerName)) {
                return false;
            }
        }
        return true;
    }

    private static Expr rebuild(Expr node, Map<String, List<Expr>> groups, Map<String, Expr> done) {
        Expr cached = done.get(node.name());
        if (cached != null) {
            return cached;
        }
        List<Expr> group = groups.get(node.name());
        Expr result;
        if (group == null) {
            result = node.mapDependencies(dep -> rebuild(dep, groups, done));
        } else {
            result = rebuildGroup(group, groups, done);
        }
        done.put(node.name(), result);
        return result;
    }

    private static Expr rebuildGroup(List<Expr> group, Map<String, List<Expr>> groups, Map<String, Expr> done) {
        Set<String> names = new HashSet<>();
        for (Expr member : group) {
            names.add(member.name());
        }
        Map<String, Expr> externals = new LinkedHashMap<>();
        for (Expr member : group) {
            for (Expr dep : member.dependencies()) {
                if (!names.contains(dep.name()) && !externals.containsKey(dep.name())) {
                    externals.put(dep.name(), rebuild(dep, groups, done));
                }
            }
        }
        Map<String, Expr> rebuilt = new HashMap<>();
        List<Expr> members = new ArrayList<>(group.size());
        for (Expr member : group) {
            members.add(rebuildMember(member, names, externals, rebuilt));
        }
        return Fused.of(members, new ArrayList<>(externals.values()));
    }

    private static Expr rebuildMember(Expr member, Set<String> names, Map<String, Expr> externals,
                                      Map<String, Expr> rebuilt) {
        Expr cached = rebuilt.get(member.name());
        if (cached != null) {
            return cached;
        }
        Expr result = member.mapDependencies(dep -> names.contains(dep.name())
            ? rebuildMember(dep, names, externals, rebuilt)
            : externals.get(dep.name()));
        rebuilt.put(member.name(), result);
        return result;
    }
}
