package com.lazyduck.frame;

import com.lazyduck.expression.Tokenizer;
import com.lazyduck.expression.Tokenizable;
import com.lazyduck.types.DataType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Row labels of a {@link Table} or {@link Series}.
 *
 * <p>Partition boundaries (divisions) are expressed in index values, so the
 * index is what sorting and range selection operate on.
 */
public final class Index implements Tokenizable {

    private final String name;
    private final DataType dataType;
    private final List<Object> values;

    public Index(String name, DataType dataType, List<?> values) {
        this.name = name;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Creates a default integer index {@code start, start+1, ...}.
     *
     * @param start the first label
     * @param length the number of labels
     * @return the range index
     */
    public static Index range(long start, int length) {
        List<Object> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(start + i);
        }
        return new Index(null, LongType.get(), values);
    }

    public String name() {
        return name;
    }

    public DataType dataType() {
        return dataType;
    }

    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Object get(int position) {
        return values.get(position);
    }

    public Index slice(int from, int to) {
        return new Index(name, dataType, values.subList(from, to));
    }

    public Index take(List<Integer> positions) {
        List<Object> taken = new ArrayList<>(positions.size());
        for (int position : positions) {
            taken.add(values.get(position));
        }
        return new Index(name, dataType, taken);
    }

    /**
     * Returns whether labels never decrease. Nulls are treated as unordered.
     *
     * @return true if monotonic increasing
     */
    public boolean isMonotonicIncreasing() {
        for (int i = 1; i < values.size(); i++) {
            Object previous = values.get(i - 1);
            Object current = values.get(i);
            if (previous == null || current == null || TypeCoercion.compareValues(previous, current) > 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Concatenates indexes in order, keeping the first index's name.
     *
     * @param indexes the indexes, not empty
     * @return the concatenated index
     */
    public static Index concat(List<Index> indexes) {
        if (indexes.isEmpty()) {
            throw new IllegalArgumentException("indexes must not be empty");
        }
        List<Object> all = new ArrayList<>();
        DataType type = null;
        for (Index index : indexes) {
            all.addAll(index.values);
            type = TypeCoercion.unifyTypes(type, index.dataType);
        }
        return new Index(indexes.get(0).name, type, all);
    }

    @Override
    public String token() {
        return Tokenizer.tokenize(name, dataType.toString(), values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Index)) return false;
        Index that = (Index) o;
        return Objects.equals(name, that.name)
            && dataType.equals(that.dataType)
            && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, values);
    }

    @Override
    public String toString() {
        return "Index(" + (name == null ? "" : name + ", ") + values + ")";
    }
}
