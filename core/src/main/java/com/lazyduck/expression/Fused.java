package com.lazyduck.expression;

import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.SubgraphCallable;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Meta;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A group of blockwise expressions computed by one task per partition.
 *
 * <p>The first member is the group's output; the others are consumed only
 * inside the group. Each output task calls a {@link SubgraphCallable} that
 * evaluates the members' partition tasks in place, reading the external
 * dependencies as its inputs.
 */
public final class Fused extends Blockwise {

    static final Signature<Fused> SIGNATURE = Signature.builder("fused", Fused::new)
        .required("exprs")
        .required("externals")
        .build();

    private Fused(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    /**
     * Fuses a group of blockwise expressions.
     *
     * @param exprs the members, output first
     * @param externals the dependencies of members that are outside the group
     * @return the fused expression
     */
    public static Fused of(List<? extends Expr> exprs, List<? extends Expr> externals) {
        return new Fused(operandList(List.copyOf(exprs), List.copyOf(externals)));
    }

    @SuppressWarnings("unchecked")
    public List<Expr> exprs() {
        return (List<Expr>) operand("exprs");
    }

    @SuppressWarnings("unchecked")
    public List<Expr> externals() {
        return (List<Expr>) operand("externals");
    }

    @Override
    public List<Expr> dependencies() {
        return externals();
    }

    @Override
    protected PartitionFunction operation() {
        throw new UnsupportedOperationException("Fused tasks are built from their members");
    }

    @Override
    protected Meta computeMeta() {
        return exprs().get(0).meta();
    }

    @Override
    protected List<Object> computeDivisions() {
        return exprs().get(0).divisions();
    }

    /**
     * Replaces external dependencies, rewriting the members that read them.
     */
    @Override
    public Expr mapDependencies(UnaryOperator<Expr> function) {
        Map<String, Expr> replaced = new LinkedHashMap<>();
        List<Expr> externals = new ArrayList<>();
        for (Expr dep : externals()) {
            Expr mapped = function.apply(dep);
            if (mapped.name().equals(dep.name())) {
                externals.add(dep);
            } else {
                replaced.put(dep.name(), mapped);
                externals.add(mapped);
            }
        }
        if (replaced.isEmpty()) {
            return this;
        }
        List<Expr> members = new ArrayList<>();
        for (Expr member : exprs()) {
            members.add(member.substitute(replaced));
        }
        return Fused.of(members, externals);
    }

    @Override
    public Task partitionTask(int index, Function<Expr, Object> reference) {
        Set<String> group = new HashSet<>();
        for (Expr member : exprs()) {
            group.add(member.name());
        }
        Map<TaskKey, Task> local = new LinkedHashMap<>();
        for (Expr member : exprs()) {
            Task task = ((Blockwise) member).partitionTask(index, dep ->
                group.contains(dep.name()) ? new TaskKey(dep.name(), index) : dependencyKey(dep, index));
            local.put(new TaskKey(member.name(), index), task);
        }
        List<TaskKey> inputs = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        for (Expr dep : externals()) {
            inputs.add(dependencyKey(dep, index));
            args.add(reference.apply(dep));
        }
        TaskKey output = new TaskKey(exprs().get(0).name(), index);
        return new Task(new SubgraphCallable(name(), local, output, inputs), args);
    }

    @Override
    public String toString() {
        List<String> kinds = new ArrayList<>();
        for (Expr member : exprs()) {
            kinds.add(member.kind());
        }
        return "Fused(" + String.join(", ", kinds) + ")";
    }
}
