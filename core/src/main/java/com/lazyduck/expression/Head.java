package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Meta;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The first {@code n} rows of the first partition.
 *
 * <p>Rewrites move the row limit below element-wise operators and narrow
 * the input to its first partition, so that only one partition is ever
 * read or computed.
 */
public final class Head extends Expr {

    static final Signature<Head> SIGNATURE = Signature.builder("head", Head::new)
        .required("frame")
        .optional("n", 5)
        .build();

    private static final PartitionFunction HEAD = args -> Kernels.head(args.get(0), (Integer) args.get(1));

    public Head(Expr frame, int n) {
        this(operandList(frame, n));
    }

    private Head(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public int n() {
        return (Integer) operand("n");
    }

    @Override
    protected Meta computeMeta() {
        return frame().meta();
    }

    @Override
    protected List<Object> computeDivisions() {
        List<Object> divisions = frame().divisions();
        return divisions.subList(0, 2);
    }

    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (frame instanceof Head) {
            Head inner = (Head) frame;
            return new Head(inner.frame(), Math.min(n(), inner.n()));
        }
        if (frame instanceof Elemwise) {
            Elemwise elemwise = (Elemwise) frame;
            return elemwise.mapDependencies(dep -> elemwise.isBroadcast(dep) ? dep : new Head(dep, n()));
        }
        if (frame.npartitions() > 1) {
            return new Head(new Partitions(frame, List.of(0)), n());
        }
        return null;
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        layer.put(new TaskKey(name(), 0), new Task(HEAD, List.of(new TaskKey(frame().name(), 0), n())));
        return layer;
    }

    @Override
    public String toString() {
        return frame() + ".head(" + n() + ")";
    }
}
