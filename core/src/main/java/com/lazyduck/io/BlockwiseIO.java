package com.lazyduck.io;

import com.lazyduck.expression.Blockwise;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Partitions;
import com.lazyduck.expression.Projection;
import com.lazyduck.expression.Signature;
import com.lazyduck.expression.Tokenizer;
import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class of source leaves whose partitions are read independently.
 *
 * <p>Subclasses declare three trailing parameters: {@code columns} (null to
 * read every column), {@code partitions} (null to read every partition) and
 * {@code series} (whether the single selected column is returned as a
 * series). Column selections and partition selections directly above a read
 * are absorbed into these parameters, so only the needed data is read.
 */
public abstract class BlockwiseIO extends Blockwise {

    protected BlockwiseIO(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
    }

    /**
     * Returns the meta of the full source, before column selection.
     *
     * @return the source meta
     */
    protected abstract Meta sourceMeta();

    /**
     * Returns the divisions of the full source, before partition selection.
     *
     * @return the source divisions
     */
    protected abstract List<Object> sourceDivisions();

    /**
     * Builds the task that reads one source partition with the current column selection.
     *
     * @param sourcePartition the partition of the full source
     * @return the read task
     */
    protected abstract Task readTask(int sourcePartition);

    @SuppressWarnings("unchecked")
    public List<String> projectedColumns() {
        return (List<String>) operand("columns");
    }

    @SuppressWarnings("unchecked")
    public List<Integer> partitionFilter() {
        return (List<Integer>) operand("partitions");
    }

    public boolean series() {
        return Boolean.TRUE.equals(operand("series"));
    }

    /**
     * Returns the columns to read: the projection, or every source column.
     *
     * @return the column names
     */
    public List<String> readColumns() {
        List<String> projected = projectedColumns();
        return projected != null ? projected : sourceMeta().columns();
    }

    /**
     * Returns the selection applied to a full partition: a column name, a list of names or null.
     */
    protected Object selection() {
        List<String> projected = projectedColumns();
        if (projected == null) {
            return null;
        }
        return series() ? projected.get(0) : projected;
    }

    @Override
    protected PartitionFunction operation() {
        throw new UnsupportedOperationException(kind() + " builds its tasks with readTask");
    }

    @Override
    protected Meta computeMeta() {
        Meta source = sourceMeta();
        Object selection = selection();
        return selection == null ? source : Meta.of(Kernels.select(source.empty(), selection));
    }

    @Override
    protected List<Object> computeDivisions() {
        List<Integer> selected = partitionFilter();
        List<Object> divisions = sourceDivisions();
        return selected == null ? divisions : Divisions.select(divisions, selected);
    }

    /**
     * Maps an output partition to the partition of the full source.
     *
     * @param index the output partition
     * @return the source partition
     */
    protected int sourcePartition(int index) {
        List<Integer> selected = partitionFilter();
        return selected == null ? index : selected.get(index);
    }

    @Override
    public Task partitionTask(int index, Function<Expr, Object> reference) {
        return readTask(sourcePartition(index));
    }

    @Override
    public Expr simplifyUp(Expr parent) {
        if (parent instanceof Projection && ((Projection) parent).frame().equals(this)) {
            if (projectedColumns() != null || series()) {
                return null;
            }
            Projection projection = (Projection) parent;
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("columns", List.copyOf(projection.selectedColumns()));
            parameters.put("series", projection.selectsSeries());
            return withParameters(parameters);
        }
        if (parent instanceof Partitions && ((Partitions) parent).frame().equals(this)) {
            List<Integer> requested = ((Partitions) parent).selected();
            List<Integer> composed = new ArrayList<>(requested.size());
            for (int partition : requested) {
                composed.add(sourcePartition(partition));
            }
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("partitions", List.copyOf(composed));
            return withParameters(parameters);
        }
        return null;
    }

    /**
     * Token of every operand except the column selection: reads with equal
     * base tokens differ only in the columns they return.
     *
     * @return the base token
     */
    protected String baseToken() {
        List<Object> operands = new ArrayList<>(operands());
        operands.set(signature().indexOf("columns"), null);
        operands.set(signature().indexOf("series"), null);
        return Tokenizer.tokenize(getClass().getName(), operands);
    }

    /**
     * Replaces this read by a selection from one read of the union of the
     * columns that similar reads in the tree need.
     */
    @Override
    public Expr combineSimilar(Expr root) {
        if (projectedColumns() == null && !series()) {
            return null;
        }
        String base = baseToken();
        List<BlockwiseIO> similar = new ArrayList<>();
        for (BlockwiseIO read : root.findAll(BlockwiseIO.class)) {
            if (read.getClass() == getClass() && read.baseToken().equals(base)) {
                similar.add(read);
            }
        }
        if (similar.size() < 2) {
            return null;
        }
        Set<String> needed = new LinkedHashSet<>();
        boolean everything = false;
        for (BlockwiseIO read : similar) {
            if (read.projectedColumns() == null) {
                everything = true;
            } else {
                needed.addAll(read.projectedColumns());
            }
        }
        List<String> union = null;
        if (!everything) {
            union = new ArrayList<>();
            for (String column : sourceMeta().columns()) {
                if (needed.contains(column)) {
                    union.add(column);
                }
            }
        }
        if (!series() && projectedColumns().equals(union)) {
            return null;
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("columns", union);
        parameters.put("series", false);
        return new Projection(withParameters(parameters), selection());
    }

    static List<Object> arguments(Object... values) {
        return Arrays.asList(values);
    }
}
