package com.lazyduck.io;

import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Literal;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.Index;
import com.lazyduck.frame.Kernels;
import com.lazyduck.frame.Table;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.reduction.Len;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An in-memory table split into row ranges.
 *
 * <p>When {@code sort} is set the rows are ordered by index first and
 * partition boundaries are moved forward past repeated index values, so that
 * every index value lives in exactly one partition and divisions are known.
 * Without sorting, rows are split evenly and divisions are unknown.
 */
public final class FromTable extends BlockwiseIO {

    static final Signature<FromTable> SIGNATURE = Signature.builder("from-table", FromTable::new)
        .required("table")
        .optional("npartitions", 1)
        .optional("sort", true)
        .optional("columns", null)
        .optional("partitions", null)
        .optional("series", false)
        .build();

    private static final PartitionFunction SLICE = args -> {
        Table part = ((Table) args.get(0)).slice((Integer) args.get(1), (Integer) args.get(2));
        Object selection = args.get(3);
        return selection == null ? part : Kernels.select(part, selection);
    };

    private volatile Layout layout;

    public FromTable(Table table, int npartitions, boolean sort) {
        this(operandList(table, npartitions, sort));
    }

    private FromTable(List<Object> operands) {
        super(SIGNATURE, operands);
        if ((Integer) operand("npartitions") < 1) {
            throw new PlanConstructionException(kind(), "npartitions must be positive: " + operand("npartitions"));
        }
    }

    public Table table() {
        return (Table) operand("table");
    }

    public boolean sort() {
        return Boolean.TRUE.equals(operand("sort"));
    }

    @Override
    protected Meta sourceMeta() {
        return Meta.of(table());
    }

    @Override
    protected List<Object> sourceDivisions() {
        return layout().divisions;
    }

    @Override
    protected Task readTask(int sourcePartition) {
        Layout current = layout();
        return new Task(SLICE, arguments(current.data,
            current.locations.get(sourcePartition), current.locations.get(sourcePartition + 1), selection()));
    }

    /**
     * Answers a row count from the table itself.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (parent instanceof Len && ((Len) parent).frame().equals(this)) {
            long rows = 0;
            Layout current = layout();
            for (int i = 0; i < npartitions(); i++) {
                int source = sourcePartition(i);
                rows += current.locations.get(source + 1) - current.locations.get(source);
            }
            return Literal.of(rows);
        }
        return super.simplifyUp(parent);
    }

    private Layout layout() {
        Layout result = layout;
        if (result == null) {
            result = computeLayout(sort() ? table().sortByIndex() : table(), (Integer) operand("npartitions"), sort());
            layout = result;
        }
        return result;
    }

    private static Layout computeLayout(Table data, int npartitions, boolean sorted) {
        int rows = data.numRows();
        if (rows == 0) {
            return new Layout(data, List.of(0, 0), Divisions.unknown(1));
        }
        Index index = data.index();
        int chunk = (rows + npartitions - 1) / npartitions;
        List<Integer> locations = new ArrayList<>();
        locations.add(0);
        for (int j = 1; j < npartitions; j++) {
            int location = j * chunk;
            while (sorted && location < rows && TypeCoercion.valuesEqual(index.get(location - 1), index.get(location))) {
                location++;
            }
            if (location >= rows) {
                break;
            }
            if (location > locations.get(locations.size() - 1)) {
                locations.add(location);
            }
        }
        locations.add(rows);
        int partitions = locations.size() - 1;
        if (!sorted || index.values().contains(null)) {
            return new Layout(data, locations, Divisions.unknown(partitions));
        }
        List<Object> divisions = new ArrayList<>(partitions + 1);
        for (int i = 0; i < partitions; i++) {
            divisions.add(index.get(locations.get(i)));
        }
        divisions.add(index.get(rows - 1));
        return new Layout(data, locations, divisions);
    }

    @Override
    public String toString() {
        List<String> columns = projectedColumns();
        return "FromTable(" + (columns == null ? "" : "columns=" + columns) + ")";
    }

    private static final class Layout {
        private final Table data;
        private final List<Integer> locations;
        private final List<Object> divisions;

        private Layout(Table data, List<Integer> locations, List<Object> divisions) {
            this.data = data;
            this.locations = Collections.unmodifiableList(locations);
            this.divisions = divisions;
        }
    }
}
