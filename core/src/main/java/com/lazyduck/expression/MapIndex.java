package com.lazyduck.expression;

import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.schema.Divisions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Transforms the index labels with a function.
 *
 * <p>Partition boundaries survive only when the caller declares the
 * function monotonic non-decreasing; otherwise their effect cannot be known
 * and divisions become unknown.
 */
public final class MapIndex extends Elemwise {

    private static final Logger logger = LoggerFactory.getLogger(MapIndex.class);

    static final Signature<MapIndex> SIGNATURE = Signature.builder("map-index", MapIndex::new)
        .required("frame")
        .required("function")
        .optional("monotonic", Boolean.FALSE)
        .build();

    @SuppressWarnings("unchecked")
    private static final PartitionFunction MAP_INDEX =
        args -> Kernels.mapIndex(args.get(0), (Function<Object, Object>) args.get(1));

    public MapIndex(Expr frame, Function<Object, Object> function, boolean monotonic) {
        this(operandList(frame, function, monotonic));
    }

    private MapIndex(List<Object> operands) {
        super(SIGNATURE, operands);
    }

    public Expr frame() {
        return exprOperand("frame");
    }

    @SuppressWarnings("unchecked")
    public Function<Object, Object> function() {
        return (Function<Object, Object>) operand("function");
    }

    public boolean monotonic() {
        return Boolean.TRUE.equals(operand("monotonic"));
    }

    @Override
    protected PartitionFunction operation() {
        return MAP_INDEX;
    }

    @Override
    protected List<Object> computeDivisions() {
        Expr frame = frame();
        if (!frame.knownDivisions()) {
            return frame.divisions();
        }
        if (!monotonic()) {
            logger.debug("Clearing divisions of {}: index mapping is not declared monotonic", name());
            return Divisions.unknown(frame.npartitions());
        }
        List<Object> mapped = new ArrayList<>(frame.divisions().size());
        for (Object boundary : frame.divisions()) {
            mapped.add(function().apply(boundary));
        }
        return mapped;
    }
}
