package com.lazyduck.io;

import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.expression.Binop;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Filter;
import com.lazyduck.expression.Literal;
import com.lazyduck.expression.Signature;
import com.lazyduck.frame.BinaryOperator;
import com.lazyduck.frame.Kernels;
import com.lazyduck.frame.Table;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.graph.Task;
import com.lazyduck.io.parquet.FilterPredicate;
import com.lazyduck.io.parquet.Fragment;
import com.lazyduck.io.parquet.ParquetDataset;
import com.lazyduck.io.parquet.ScanPlan;
import com.lazyduck.reduction.Len;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a Parquet dataset, one partition per non-empty row group.
 *
 * <p>Comparisons between a column of the same dataset and a literal are
 * absorbed as {@link FilterPredicate filters}: they are evaluated by the
 * reader and row groups whose statistics rule them out are never read.
 * With an index column and {@code calculateDivisions}, divisions come from
 * the index column's row group statistics.
 */
public final class ReadParquet extends BlockwiseIO {

    static final Signature<ReadParquet> SIGNATURE = Signature.builder("read-parquet", ReadParquet::new)
        .required("dataset")
        .optional("filters", List.of())
        .optional("index", null)
        .optional("calculateDivisions", true)
        .optional("columns", null)
        .optional("partitions", null)
        .optional("series", false)
        .build();

    private static final PartitionFunction READ = args -> {
        ParquetDataset dataset = (ParquetDataset) args.get(0);
        Fragment fragment = (Fragment) args.get(1);
        Object selection = args.get(5);
        if (fragment == null) {
            return args.get(6);
        }
        @SuppressWarnings("unchecked")
        List<String> columns = (List<String>) args.get(2);
        @SuppressWarnings("unchecked")
        List<FilterPredicate> filters = (List<FilterPredicate>) args.get(3);
        Table table = dataset.reader().read(dataset.path(), fragment, columns, filters, (String) args.get(4));
        return selection instanceof String ? Kernels.select(table, selection) : table;
    };

    public ReadParquet(ParquetDataset dataset) {
        this(operandList(dataset));
    }

    public ReadParquet(ParquetDataset dataset, String index) {
        this(operandList(dataset, List.of(), index));
    }

    private ReadParquet(List<Object> operands) {
        super(SIGNATURE, operands);
        Objects.requireNonNull(operand("dataset"), "dataset must not be null");
    }

    public ParquetDataset dataset() {
        return (ParquetDataset) operand("dataset");
    }

    @SuppressWarnings("unchecked")
    public List<FilterPredicate> filters() {
        return (List<FilterPredicate>) operand("filters");
    }

    public String indexColumn() {
        return (String) operand("index");
    }

    public boolean calculateDivisions() {
        return Boolean.TRUE.equals(operand("calculateDivisions"));
    }

    public ScanPlan scanPlan() {
        return dataset().scanPlan(filters(), indexColumn(), calculateDivisions());
    }

    @Override
    protected Meta sourceMeta() {
        StructType schema = dataset().schema();
        String index = indexColumn();
        if (index == null) {
            return Meta.frame(schema, null, LongType.get());
        }
        List<StructField> remaining = new ArrayList<>();
        for (StructField field : schema.fields()) {
            if (!field.name().equals(index)) {
                remaining.add(field);
            }
        }
        StructField indexField = schema.fieldByName(index);
        if (indexField == null) {
            throw new ColumnNotFoundException(index, schema.fieldNames());
        }
        return Meta.frame(new StructType(remaining), index, indexField.dataType());
    }

    @Override
    protected List<Object> sourceDivisions() {
        return scanPlan().divisions();
    }

    @Override
    protected Task readTask(int sourcePartition) {
        Object selection = selection();
        return new Task(READ, arguments(dataset(), scanPlan().fragment(sourcePartition), readColumns(),
            filters(), indexColumn(), selection, meta().empty()));
    }

    @Override
    public Expr simplifyUp(Expr parent) {
        if (parent instanceof Filter && ((Filter) parent).frame().equals(this)) {
            FilterPredicate predicate = pushdownPredicate(((Filter) parent).predicate());
            if (predicate == null) {
                return alignPredicate((Filter) parent);
            }
            List<FilterPredicate> filters = new ArrayList<>(filters());
            if (!filters.contains(predicate)) {
                filters.add(predicate);
            }
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("filters", List.copyOf(filters));
            return withParameters(parameters);
        }
        if (parent instanceof Len && ((Len) parent).frame().equals(this) && filters().isEmpty()) {
            ScanPlan plan = scanPlan();
            long rows = 0;
            for (int i = 0; i < npartitions(); i++) {
                Fragment fragment = plan.fragment(sourcePartition(i));
                rows += fragment == null ? 0 : fragment.numRows();
            }
            return Literal.of(rows);
        }
        return super.simplifyUp(parent);
    }

    /**
     * Converts {@code column op literal} or {@code literal op column} into a
     * filter, when the column is read from this dataset with the same
     * partitions and at most the filters this read already applies.
     */
    private FilterPredicate pushdownPredicate(Expr predicate) {
        if (!(predicate instanceof Binop)) {
            return null;
        }
        Binop comparison = (Binop) predicate;
        BinaryOperator operator = comparison.operator();
        if (!operator.isComparison()) {
            return null;
        }
        Object left = comparison.left();
        Object right = comparison.right();
        ReadParquet column;
        Object value;
        if (left instanceof ReadParquet && !(right instanceof Expr)) {
            column = (ReadParquet) left;
            value = right;
        } else if (right instanceof ReadParquet && !(left instanceof Expr)) {
            column = (ReadParquet) right;
            value = left;
            operator = operator.flip();
        } else {
            return null;
        }
        if (value == null || !column.series() || !column.dataset().equals(dataset())
                || !Objects.equals(column.indexColumn(), indexColumn())
                || !Objects.equals(column.partitionFilter(), partitionFilter())
                || !filters().containsAll(column.filters())) {
            return null;
        }
        return new FilterPredicate(column.projectedColumns().get(0), operator, value);
    }

    /**
     * Makes reads of this dataset inside a predicate apply this read's
     * filters, so the predicate has the same partitions as the filtered frame.
     *
     * @return the filter over the aligned predicate, or null when nothing changes
     */
    private Expr alignPredicate(Filter filter) {
        if (filters().isEmpty()) {
            return null;
        }
        Map<String, Expr> aligned = new LinkedHashMap<>();
        for (ReadParquet read : filter.predicate().findAll(ReadParquet.class)) {
            if (read.dataset().equals(dataset()) && Objects.equals(read.indexColumn(), indexColumn())
                    && Objects.equals(read.partitionFilter(), partitionFilter())
                    && !read.filters().equals(filters()) && filters().containsAll(read.filters())) {
                Map<String, Object> parameters = new LinkedHashMap<>();
                parameters.put("filters", filters());
                aligned.put(read.name(), read.withParameters(parameters));
            }
        }
        if (aligned.isEmpty()) {
            return null;
        }
        return new Filter(this, filter.predicate().substitute(aligned));
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("ReadParquet(").append(dataset().path());
        if (projectedColumns() != null) {
            out.append(", columns=").append(projectedColumns());
        }
        if (!filters().isEmpty()) {
            out.append(", filters=").append(filters());
        }
        return out.append(')').toString();
    }
}
