package com.lazyduck.frame;

import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.expression.Tokenizer;
import com.lazyduck.expression.Tokenizable;
import com.lazyduck.types.DataType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory columnar table: named, typed columns sharing one row index.
 *
 * <p>This is the compute backend's tabular type. A zero-row table is the
 * meta of a frame-valued expression, so every operation here must also
 * work on empty input.
 *
 * <p>Example usage:
 * <pre>
 *   Table table = Table.builder()
 *       .column("x", LongType.get(), List.of(1L, 2L, 3L))
 *       .column("y", DoubleType.get(), List.of(0.5, 1.5, 2.5))
 *       .build();
 * </pre>
 */
public final class Table implements Tokenizable {

    private final LinkedHashMap<String, Series> columns;
    private final Index index;

    private Table(LinkedHashMap<String, Series> columns, Index index) {
        this.columns = columns;
        this.index = index;
    }

    /**
     * Creates a table from series that share the given index.
     *
     * @param series the columns, in order
     * @param index the shared index
     * @return the table
     */
    public static Table of(List<Series> series, Index index) {
        Objects.requireNonNull(index, "index must not be null");
        LinkedHashMap<String, Series> columns = new LinkedHashMap<>();
        for (Series column : series) {
            if (column.size() != index.size()) {
                throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d rows, expected %d", column.name(), column.size(), index.size()));
            }
            columns.put(column.name(), column.withIndex(index));
        }
        return new Table(columns, index);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Accessors ====================

    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public StructType schema() {
        List<StructField> fields = new ArrayList<>(columns.size());
        for (Series column : columns.values()) {
            fields.add(new StructField(column.name(), column.dataType()));
        }
        return new StructType(fields);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns the named column.
     *
     * @param name the column name
     * @return the column as a series
     * @throws ColumnNotFoundException if the column does not exist
     */
    public Series column(String name) {
        Series column = columns.get(name);
        if (column == null) {
            throw new ColumnNotFoundException(name, columnNames());
        }
        return column;
    }

    public List<Series> columns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    public Index index() {
        return index;
    }

    public int numRows() {
        return index.size();
    }

    public int numColumns() {
        return columns.size();
    }

    /**
     * Returns the values of one row in column order.
     *
     * @param position the row position
     * @return the row values
     */
    public List<Object> row(int position) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Series column : columns.values()) {
            row.add(column.get(position));
        }
        return row;
    }

    // ==================== Transformations ====================

    public Table select(List<String> names) {
        LinkedHashMap<String, Series> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, column(name));
        }
        return new Table(selected, index);
    }

    /**
     * Returns a table with the column added, or replaced in place if present.
     *
     * @param name the column name
     * @param column the column values, aligned by position
     * @return the new table
     */
    public Table withColumn(String name, Series column) {
        if (column.size() != numRows()) {
            throw new IllegalArgumentException(String.format(
                "Cannot assign column '%s' with %d rows to a table with %d rows",
                name, column.size(), numRows()));
        }
        LinkedHashMap<String, Series> updated = new LinkedHashMap<>(columns);
        updated.put(name, column.withName(name).withIndex(index));
        return new Table(updated, index);
    }

    public Table withIndex(Index newIndex) {
        List<Series> series = new ArrayList<>(columns.values());
        return of(series, newIndex);
    }

    /**
     * Moves a column into the index.
     *
     * @param name the column to use as index
     * @return the re-indexed table
     */
    public Table setIndex(String name) {
        Series key = column(name);
        LinkedHashMap<String, Series> remaining = new LinkedHashMap<>(columns);
        remaining.remove(name);
        Index newIndex = new Index(name, key.dataType(), key.values());
        return of(new ArrayList<>(remaining.values()), newIndex);
    }

    public Table slice(int from, int to) {
        LinkedHashMap<String, Series> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            sliced.put(entry.getKey(), entry.getValue().slice(from, to));
        }
        return new Table(sliced, index.slice(from, to));
    }

    public Table take(List<Integer> positions) {
        LinkedHashMap<String, Series> taken = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            taken.put(entry.getKey(), entry.getValue().take(positions));
        }
        return new Table(taken, index.take(positions));
    }

    public Table head(int n) {
        return slice(0, Math.min(n, numRows()));
    }

    /**
     * Returns the zero-row table with this table's schema and index type.
     *
     * @return the empty table
     */
    public Table emptyLike() {
        return slice(0, 0);
    }

    /**
     * Returns the rows ordered by index label. The sort is stable and nulls go last.
     *
     * @return the sorted table
     */
    public Table sortByIndex() {
        if (index.isMonotonicIncreasing()) {
            return this;
        }
        List<Integer> positions = new ArrayList<>(numRows());
        for (int i = 0; i < numRows(); i++) {
            positions.add(i);
        }
        Comparator<Object> byLabel = Comparator.nullsLast(TypeCoercion::compareValues);
        positions.sort((a, b) -> byLabel.compare(index.get(a), index.get(b)));
        return take(positions);
    }

    /**
     * Concatenates tables row-wise. All tables must share the first table's columns.
     *
     * @param tables the tables, not empty
     * @return the concatenated table
     */
    public static Table concat(List<Table> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("tables must not be empty");
        }
        Table first = tables.get(0);
        List<Index> indexes = new ArrayList<>(tables.size());
        for (Table table : tables) {
            indexes.add(table.index);
        }
        List<Series> merged = new ArrayList<>();
        for (String name : first.columnNames()) {
            List<Series> parts = new ArrayList<>(tables.size());
            for (Table table : tables) {
                parts.add(table.column(name));
            }
            merged.add(Series.concat(parts));
        }
        return of(merged, Index.concat(indexes));
    }

    @Override
    public String token() {
        List<Object> parts = new ArrayList<>();
        for (Series column : columns.values()) {
            parts.add(column.name());
            parts.add(column.dataType().toString());
            parts.add(column.values());
        }
        parts.add(index);
        return Tokenizer.tokenize(parts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table)) return false;
        Table that = (Table) o;
        return columns.equals(that.columns) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, index);
    }

    @Override
    public String toString() {
        return "Table(" + schema().fields() + ", rows=" + numRows() + ")";
    }

    /**
     * Builder for tables with a default range index.
     */
    public static final class Builder {
        private final List<Series> series = new ArrayList<>();
        private Index index;

        private Builder() {}

        public Builder column(String name, DataType dataType, List<?> values) {
            series.add(Series.of(name, dataType, values));
            return this;
        }

        public Builder index(String name, DataType dataType, List<?> values) {
            this.index = new Index(name, dataType, values);
            return this;
        }

        public Table build() {
            int rows = series.isEmpty() ? (index == null ? 0 : index.size()) : series.get(0).size();
            Index resolved = index != null ? index : Index.range(0, rows);
            return of(series, resolved);
        }
    }
}
