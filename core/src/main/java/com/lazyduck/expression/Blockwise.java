package com.lazyduck.expression;

import com.lazyduck.exception.DivisionMismatchException;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * An operator whose output partition {@code i} depends only on partition
 * {@code i} of each input.
 *
 * <p>The partition function receives the operands in declaration order with
 * every expression operand replaced by the corresponding partition. Meta is
 * computed by running the same function on the inputs' meta. Inputs with a
 * single partition and fewer dimensions (scalars next to series, series next
 * to frames) are broadcast: every output partition reads their partition 0.
 *
 * <p>Blockwise operators are the unit of fusion.
 */
public abstract class Blockwise extends Expr {

    protected Blockwise(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
    }

    /**
     * Returns the function applied to each partition.
     *
     * @return the partition function
     */
    protected abstract PartitionFunction operation();

    @Override
    protected Meta computeMeta() {
        List<Object> args = new ArrayList<>(operands().size());
        for (Object operand : operands()) {
            args.add(metaArgument(operand));
        }
        return Meta.of(operation().apply(args));
    }

    private static Object metaArgument(Object operand) {
        if (operand instanceof Expr) {
            return ((Expr) operand).meta().empty();
        }
        if (operand instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) operand) {
                items.add(metaArgument(item));
            }
            return items;
        }
        return operand;
    }

    @Override
    protected List<Object> computeDivisions() {
        List<Object> reference = null;
        for (Expr dep : dependencies()) {
            if (isBroadcast(dep)) {
                continue;
            }
            if (reference == null) {
                reference = dep.divisions();
            } else if (!sameDivisions(reference, dep.divisions())) {
                throw new DivisionMismatchException(kind(), reference, dep.divisions());
            }
        }
        return reference != null ? reference : Divisions.unknown(1);
    }

    private static boolean sameDivisions(List<Object> a, List<Object> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!TypeCoercion.valuesEqual(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether a dependency is broadcast to every partition of this node.
     *
     * @param dep a dependency
     * @return true for single-partition, lower-dimensional dependencies
     */
    public boolean isBroadcast(Expr dep) {
        return dep.npartitions() == 1 && dep.ndim() < ndim();
    }

    /**
     * Returns the key of the dependency partition read by partition {@code index}.
     *
     * @param dep the dependency
     * @param index the output partition
     * @return the dependency key
     */
    public static TaskKey dependencyKey(Expr dep, int index) {
        return new TaskKey(dep.name(), dep.npartitions() == 1 ? 0 : index);
    }

    /**
     * Builds the task of one output partition.
     *
     * @param index the output partition
     * @param reference maps each dependency to the argument that stands for its partition
     * @return the task
     */
    public Task partitionTask(int index, Function<Expr, Object> reference) {
        List<Object> args = new ArrayList<>(operands().size());
        for (Object operand : operands()) {
            args.add(taskArgument(operand, reference));
        }
        return new Task(operation(), args);
    }

    private static Object taskArgument(Object operand, Function<Expr, Object> reference) {
        if (operand instanceof Expr) {
            return reference.apply((Expr) operand);
        }
        if (operand instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) operand) {
                items.add(taskArgument(item, reference));
            }
            return items;
        }
        return operand;
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        for (int i = 0; i < npartitions(); i++) {
            final int index = i;
            layer.put(new TaskKey(name(), i), partitionTask(i, dep -> dependencyKey(dep, index)));
        }
        return layer;
    }
}
