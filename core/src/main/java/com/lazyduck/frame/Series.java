package com.lazyduck.frame;

import com.lazyduck.expression.Tokenizer;
import com.lazyduck.expression.Tokenizable;
import com.lazyduck.types.DataType;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single named, typed column with its row index.
 *
 * <p>Series are immutable; every transformation returns a new instance.
 */
public final class Series implements Tokenizable {

    private final String name;
    private final DataType dataType;
    private final List<Object> values;
    private final Index index;

    public Series(String name, DataType dataType, List<?> values, Index index) {
        this.name = name;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.index = Objects.requireNonNull(index, "index must not be null");
        if (index.size() != this.values.size()) {
            throw new IllegalArgumentException(String.format(
                "Series '%s' has %d values but its index has %d labels",
                name, this.values.size(), index.size()));
        }
    }

    /**
     * Creates a series with a default range index.
     *
     * @param name the series name
     * @param dataType the value type
     * @param values the values
     * @return the series
     */
    public static Series of(String name, DataType dataType, List<?> values) {
        return new Series(name, dataType, values, Index.range(0, values.size()));
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

    public Index index() {
        return index;
    }

    public int size() {
        return values.size();
    }

    public Object get(int position) {
        return values.get(position);
    }

    public Series withName(String newName) {
        return new Series(newName, dataType, values, index);
    }

    public Series withValues(DataType newType, List<?> newValues) {
        return new Series(name, newType, newValues, index);
    }

    public Series withIndex(Index newIndex) {
        return new Series(name, dataType, values, newIndex);
    }

    public Series slice(int from, int to) {
        return new Series(name, dataType, values.subList(from, to), index.slice(from, to));
    }

    public Series take(List<Integer> positions) {
        List<Object> taken = new ArrayList<>(positions.size());
        for (int position : positions) {
            taken.add(values.get(position));
        }
        return new Series(name, dataType, taken, index.take(positions));
    }

    public Series head(int n) {
        return slice(0, Math.min(n, size()));
    }

    /**
     * Concatenates series in order, unifying their types.
     *
     * @param parts the series, not empty
     * @return the concatenated series
     */
    public static Series concat(List<Series> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        List<Object> all = new ArrayList<>();
        List<Index> indexes = new ArrayList<>(parts.size());
        DataType type = null;
        for (Series part : parts) {
            all.addAll(part.values);
            indexes.add(part.index);
            type = TypeCoercion.unifyTypes(type, part.dataType);
        }
        return new Series(parts.get(0).name, type, all, Index.concat(indexes));
    }

    @Override
    public String token() {
        return Tokenizer.tokenize(name, dataType.toString(), values, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series that = (Series) o;
        return Objects.equals(name, that.name)
            && dataType.equals(that.dataType)
            && values.equals(that.values)
            && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, values, index);
    }

    @Override
    public String toString() {
        return "Series(" + name + ": " + dataType + ", " + values + ")";
    }
}
