package com.lazyduck.expression;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.TypeCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Changes the number of partitions, or moves rows to new boundaries.
 *
 * <p>Reducing the partition count concatenates neighbouring partitions and
 * keeps boundaries known. Increasing it splits partitions by row position,
 * which says nothing about index ranges, so divisions become unknown.
 * Repartitioning to explicit divisions requires known input divisions.
 */
public final class Repartition extends Expr {

    private static final Logger logger = LoggerFactory.getLogger(Repartition.class);

    static final Signature<Repartition> SIGNATURE = Signature.builder("repartition", Repartition::new)
        .required("frame")
        .optional("npartitions", null)
        .optional("newDivisions", null)
        .build();

    private static final PartitionFunction CONCAT = args -> Kernels.concat((List<?>) args.get(0));

    private static final PartitionFunction SPLIT =
        args -> Kernels.splitRows(args.get(0), (Integer) args.get(1), (Integer) args.get(2));

    private static final PartitionFunction RANGE = args -> {
        List<?> parts = (List<?>) args.get(0);
        List<Object> pieces = new ArrayList<>();
        for (Object part : parts) {
            pieces.add(Kernels.indexRange(part, args.get(1), args.get(2), (Boolean) args.get(3)));
        }
        return pieces.isEmpty() ? args.get(4) : Kernels.concat(pieces);
    };

    private Repartition(List<Object> operands) {
        super(SIGNATURE, operands);
        Object npartitions = operand("npartitions");
        Object newDivisions = operand("newDivisions");
        if ((npartitions == null) == (newDivisions == null)) {
            throw new PlanConstructionException(kind(), "exactly one of npartitions and newDivisions is required");
        }
        if (npartitions != null && (Integer) npartitions < 1) {
            throw new PlanConstructionException(kind(), "npartitions must be positive: " + npartitions);
        }
        if (newDivisions != null) {
            validateDivisions(frame(), targetDivisions());
        }
    }

    /**
     * Repartitions to a partition count.
     *
     * @param frame the input
     * @param npartitions the new partition count
     * @return the repartition
     */
    public static Repartition toPartitions(Expr frame, int npartitions) {
        return new Repartition(operandList(frame, npartitions, null));
    }

    /**
     * Repartitions to explicit boundaries.
     *
     * @param frame the input, with known divisions
     * @param divisions the new boundaries
     * @return the repartition
     */
    public static Repartition toDivisions(Expr frame, List<Object> divisions) {
        return new Repartition(operandList(frame, null, List.copyOf(divisions)));
    }

    private void validateDivisions(Expr frame, List<Object> target) {
        if (!frame.knownDivisions()) {
            throw new PlanConstructionException(kind(),
                "repartitioning by divisions requires known input divisions");
        }
        if (target.size() < 2 || !Divisions.isKnown(target) || !Divisions.isMonotonic(target)) {
            throw new PlanConstructionException(kind(), "new divisions must be known and non-decreasing: " + target);
        }
        List<Object> current = frame.divisions();
        if (TypeCoercion.compareValues(target.get(0), current.get(0)) > 0
                || TypeCoercion.compareValues(target.get(target.size() - 1), current.get(current.size() - 1)) < 0) {
            throw new PlanConstructionException(kind(), String.format(
                "new divisions %s must cover the input range [%s, %s]",
                target, current.get(0), current.get(current.size() - 1)));
        }
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    public Integer targetPartitions() {
        return (Integer) operand("npartitions");
    }

    @SuppressWarnings("unchecked")
    public List<Object> targetDivisions() {
        return (List<Object>) operand("newDivisions");
    }

    @Override
    protected Meta computeMeta() {
        return frame().meta();
    }

    @Override
    protected List<Object> computeDivisions() {
        if (targetDivisions() != null) {
            return targetDivisions();
        }
        Expr frame = frame();
        int n = targetPartitions();
        if (n > frame.npartitions()) {
            if (frame.knownDivisions()) {
                logger.debug("Clearing divisions of {}: splitting partitions by position", name());
            }
            return Divisions.unknown(n);
        }
        List<Object> divisions = frame.divisions();
        int[] bounds = coalesceBounds(frame.npartitions(), n);
        List<Object> coalesced = new ArrayList<>(n + 1);
        for (int bound : bounds) {
            coalesced.add(divisions.get(bound));
        }
        return coalesced;
    }

    private static int[] coalesceBounds(int from, int to) {
        int[] bounds = new int[to + 1];
        for (int j = 0; j <= to; j++) {
            bounds[j] = (int) Math.round((double) j * from / to);
        }
        return bounds;
    }

    @Override
    public Expr simplifyDown() {
        Expr frame = frame();
        if (targetPartitions() != null && targetPartitions() == frame.npartitions()) {
            return frame;
        }
        if (targetDivisions() != null && targetDivisions().equals(frame.divisions())) {
            return frame;
        }
        return null;
    }

    @Override
    public Map<TaskKey, Task> layer() {
        Map<TaskKey, Task> layer = new LinkedHashMap<>();
        Expr frame = frame();
        String input = frame.name();
        if (targetDivisions() != null) {
            List<Object> current = frame.divisions();
            List<Object> target = targetDivisions();
            for (int j = 0; j + 1 < target.size(); j++) {
                Object low = target.get(j);
                Object high = target.get(j + 1);
                boolean last = j + 2 == target.size();
                List<Object> inputs = new ArrayList<>();
                for (int i = 0; i < frame.npartitions(); i++) {
                    boolean overlaps = TypeCoercion.compareValues(current.get(i), high) <= 0
                        && TypeCoercion.compareValues(current.get(i + 1), low) >= 0;
                    if (overlaps) {
                        inputs.add(new TaskKey(input, i));
                    }
                }
                layer.put(new TaskKey(name(), j),
                    new Task(RANGE, List.of(inputs, low, high, last, meta().empty())));
            }
            return layer;
        }
        int from = frame.npartitions();
        int to = targetPartitions();
        if (to <= from) {
            int[] bounds = coalesceBounds(from, to);
            for (int j = 0; j < to; j++) {
                List<Object> inputs = new ArrayList<>();
                for (int i = bounds[j]; i < bounds[j + 1]; i++) {
                    inputs.add(new TaskKey(input, i));
                }
                layer.put(new TaskKey(name(), j), new Task(CONCAT, List.of(inputs)));
            }
            return layer;
        }
        int output = 0;
        for (int i = 0; i < from; i++) {
            int pieces = to / from + (i < to % from ? 1 : 0);
            for (int piece = 0; piece < pieces; piece++) {
                layer.put(new TaskKey(name(), output++),
                    new Task(SPLIT, List.of(new TaskKey(input, i), piece, pieces)));
            }
        }
        return layer;
    }
}
