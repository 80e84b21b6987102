package com.lazyduck.frame;

import com.lazyduck.types.BooleanType;
import com.lazyduck.types.CategoricalType;
import com.lazyduck.types.DataType;
import com.lazyduck.types.IntegerType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StringType;
import com.lazyduck.types.StructType;
import com.lazyduck.types.TypeCoercion;
import com.lazyduck.types.UnresolvedType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Partition-level compute kernels over {@link Table}, {@link Series} and
 * scalar values.
 *
 * <p>Every kernel accepts zero-row input and returns zero-row output for it,
 * which is what meta inference relies on. Kernels never mutate their inputs.
 */
public final class Kernels {

    private Kernels() {}

    // ==================== Element-wise ====================

    /**
     * Applies a binary operator to two partitions or scalars.
     *
     * <p>Supported combinations are table/table (column-wise by the left
     * table's columns), table/scalar, series/series (positional),
     * series/scalar and scalar/scalar.
     *
     * @param op the operator
     * @param left the left operand
     * @param right the right operand
     * @return the result
     */
    public static Object binary(BinaryOperator op, Object left, Object right) {
        if (left instanceof Table && right instanceof Table) {
            Table l = (Table) left;
            Table r = (Table) right;
            List<Series> columns = new ArrayList<>();
            for (String name : l.columnNames()) {
                columns.add((Series) binary(op, l.column(name), r.column(name)));
            }
            return Table.of(columns, l.index());
        }
        if (left instanceof Table && !(right instanceof Series)) {
            Table l = (Table) left;
            List<Series> columns = new ArrayList<>();
            for (Series column : l.columns()) {
                columns.add((Series) binary(op, column, right));
            }
            return Table.of(columns, l.index());
        }
        if (right instanceof Table && !(left instanceof Series)) {
            Table r = (Table) right;
            List<Series> columns = new ArrayList<>();
            for (Series column : r.columns()) {
                columns.add((Series) binary(op, left, column));
            }
            return Table.of(columns, r.index());
        }
        if (left instanceof Series && right instanceof Series) {
            Series l = (Series) left;
            Series r = (Series) right;
            if (l.size() != r.size()) {
                throw new IllegalArgumentException(String.format(
                    "Cannot apply %s to series of length %d and %d", op.description(), l.size(), r.size()));
            }
            List<Object> values = new ArrayList<>(l.size());
            for (int i = 0; i < l.size(); i++) {
                values.add(op.apply(l.get(i), r.get(i)));
            }
            String name = Objects.equals(l.name(), r.name()) ? l.name() : null;
            return new Series(name, op.resultType(l.dataType(), r.dataType()), values, l.index());
        }
        if (left instanceof Series) {
            Series l = (Series) left;
            List<Object> values = new ArrayList<>(l.size());
            for (Object value : l.values()) {
                values.add(op.apply(value, right));
            }
            return l.withValues(op.resultType(l.dataType(), TypeCoercion.typeOf(right)), values);
        }
        if (right instanceof Series) {
            Series r = (Series) right;
            List<Object> values = new ArrayList<>(r.size());
            for (Object value : r.values()) {
                values.add(op.apply(left, value));
            }
            return r.withValues(op.resultType(TypeCoercion.typeOf(left), r.dataType()), values);
        }
        if (left instanceof Table || right instanceof Table) {
            throw new IllegalArgumentException("Cannot combine a table with a series using " + op.description());
        }
        return op.apply(left, right);
    }

    /**
     * Selects columns of a table or labels of a series.
     *
     * <p>A string selects one column as a series (or one label of a series as
     * a scalar); a list selects several columns as a table (or several labels
     * as a series).
     *
     * @param part the partition
     * @param columns a column name or a list of column names
     * @return the selection
     */
    @SuppressWarnings("unchecked")
    public static Object select(Object part, Object columns) {
        if (part instanceof Table) {
            Table table = (Table) part;
            if (columns instanceof String) {
                return table.column((String) columns);
            }
            return table.select((List<String>) columns);
        }
        if (part instanceof Series) {
            Series series = (Series) part;
            if (columns instanceof String) {
                int position = series.index().values().indexOf(columns);
                if (position < 0) {
                    throw new IllegalArgumentException("Label '" + columns + "' not found in " + series);
                }
                return series.get(position);
            }
            List<Integer> positions = new ArrayList<>();
            for (String label : (List<String>) columns) {
                int position = series.index().values().indexOf(label);
                if (position >= 0) {
                    positions.add(position);
                }
            }
            return series.take(positions);
        }
        throw new IllegalArgumentException("Cannot select columns from " + describe(part));
    }

    /**
     * Keeps the rows whose mask value is {@code true}.
     *
     * <p>A mask of the same length is aligned by position, any other mask by
     * index label; labels missing from the mask are dropped.
     *
     * @param part a table or series
     * @param mask a boolean series
     * @return the filtered partition
     */
    public static Object filter(Object part, Object mask) {
        if (!(mask instanceof Series)) {
            throw new IllegalArgumentException("Filter predicate must be a boolean series, got " + describe(mask));
        }
        Series predicate = (Series) mask;
        List<Integer> positions = new ArrayList<>();
        Index index = partIndex(part);
        if (index == null || index.size() == predicate.size()) {
            for (int i = 0; i < predicate.size(); i++) {
                if (Boolean.TRUE.equals(predicate.get(i))) {
                    positions.add(i);
                }
            }
        } else {
            Map<Object, Boolean> byLabel = new HashMap<>();
            for (int i = 0; i < predicate.size(); i++) {
                byLabel.putIfAbsent(predicate.index().get(i), Boolean.TRUE.equals(predicate.get(i)));
            }
            for (int i = 0; i < index.size(); i++) {
                if (Boolean.TRUE.equals(byLabel.get(index.get(i)))) {
                    positions.add(i);
                }
            }
        }
        if (part instanceof Table) {
            return ((Table) part).take(positions);
        }
        if (part instanceof Series) {
            return ((Series) part).take(positions);
        }
        throw new IllegalArgumentException("Cannot filter " + describe(part));
    }

    private static Index partIndex(Object part) {
        if (part instanceof Table) {
            return ((Table) part).index();
        }
        if (part instanceof Series) {
            return ((Series) part).index();
        }
        return null;
    }

    public static Object head(Object part, int n) {
        if (part instanceof Table) {
            return ((Table) part).head(n);
        }
        if (part instanceof Series) {
            return ((Series) part).head(n);
        }
        return part;
    }

    /**
     * Adds or replaces a column with a series or a broadcast scalar.
     *
     * @param part the table
     * @param key the column name
     * @param value a series or a scalar
     * @return the updated table
     */
    public static Table assign(Object part, String key, Object value) {
        Table table = asTable(part);
        Series column;
        if (value instanceof Series) {
            column = (Series) value;
        } else {
            List<Object> values = new ArrayList<>(table.numRows());
            for (int i = 0; i < table.numRows(); i++) {
                values.add(value);
            }
            column = new Series(key, TypeCoercion.typeOf(value), values, table.index());
        }
        return table.withColumn(key, column);
    }

    /**
     * Converts column types.
     *
     * @param part a table or series
     * @param dtypes a single type or a map from column name to type
     * @return the converted partition
     */
    @SuppressWarnings("unchecked")
    public static Object astype(Object part, Object dtypes) {
        if (part instanceof Series) {
            return convert((Series) part, (DataType) dtypes);
        }
        Table table = asTable(part);
        List<Series> columns = new ArrayList<>();
        for (Series column : table.columns()) {
            DataType target = dtypes instanceof Map
                ? ((Map<String, DataType>) dtypes).get(column.name())
                : (DataType) dtypes;
            columns.add(target == null ? column : convert(column, target));
        }
        return Table.of(columns, table.index());
    }

    private static Series convert(Series series, DataType target) {
        List<Object> values = new ArrayList<>(series.size());
        for (Object value : series.values()) {
            values.add(TypeCoercion.coerce(value, target));
        }
        return series.withValues(target, values);
    }

    /**
     * Applies a function to every value.
     *
     * @param part a table or series
     * @param function the value function
     * @param outputType the declared result type
     * @return the mapped partition
     */
    public static Object map(Object part, Function<Object, Object> function, DataType outputType) {
        if (part instanceof Series) {
            Series series = (Series) part;
            List<Object> values = new ArrayList<>(series.size());
            for (Object value : series.values()) {
                values.add(function.apply(value));
            }
            return series.withValues(outputType, values);
        }
        Table table = asTable(part);
        List<Series> columns = new ArrayList<>();
        for (Series column : table.columns()) {
            columns.add((Series) map(column, function, outputType));
        }
        return Table.of(columns, table.index());
    }

    /**
     * Returns the index labels as a series named after the index.
     *
     * @param part a table or series
     * @return the index series
     */
    public static Series index(Object part) {
        Index index = part instanceof Table ? ((Table) part).index() : asSeries(part).index();
        return new Series(index.name(), index.dataType(), index.values(), index);
    }

    /**
     * Applies a function to every index label.
     *
     * @param part a table or series
     * @param function the label function
     * @return the re-labelled partition
     */
    public static Object mapIndex(Object part, Function<Object, Object> function) {
        Index index = part instanceof Table ? ((Table) part).index() : asSeries(part).index();
        List<Object> labels = new ArrayList<>(index.size());
        DataType type = null;
        for (Object label : index.values()) {
            Object mapped = function.apply(label);
            labels.add(mapped);
            type = TypeCoercion.unifyTypes(type, TypeCoercion.typeOf(mapped));
        }
        Index mappedIndex = new Index(index.name(), type == null ? index.dataType() : type, labels);
        if (part instanceof Table) {
            return ((Table) part).withIndex(mappedIndex);
        }
        return asSeries(part).withIndex(mappedIndex);
    }

    // ==================== Categoricals ====================

    /**
     * Marks a column (or a series when column is null) as categorical with
     * the given known categories.
     *
     * @param part a table or series
     * @param column the column name, or null for a series
     * @param categories the ordered categories
     * @return the converted partition
     */
    public static Object setCategories(Object part, String column, List<String> categories) {
        CategoricalType type = CategoricalType.of(categories);
        if (column == null) {
            return convert(asSeries(part), type);
        }
        Table table = asTable(part);
        return table.withColumn(column, convert(table.column(column), type));
    }

    /**
     * Returns the integer codes of a categorical series, -1 for missing values.
     *
     * @param part a categorical series with known categories
     * @return the codes
     */
    public static Series categoryCodes(Object part) {
        Series series = asSeries(part);
        if (!(series.dataType() instanceof CategoricalType)
                || !((CategoricalType) series.dataType()).knownCategories()) {
            throw new IllegalArgumentException("Series '" + series.name() + "' has no known categories");
        }
        List<String> categories = ((CategoricalType) series.dataType()).categories();
        List<Object> codes = new ArrayList<>(series.size());
        for (Object value : series.values()) {
            codes.add(value == null ? -1 : categories.indexOf(value.toString()));
        }
        return series.withValues(IntegerType.get(), codes);
    }

    // ==================== Reductions ====================

    public static Object sum(Object part) {
        return reduceColumns(part, Kernels::sumValues);
    }

    public static Object min(Object part) {
        return reduceColumns(part, values -> extreme(values, true));
    }

    public static Object max(Object part) {
        return reduceColumns(part, values -> extreme(values, false));
    }

    public static Object count(Object part) {
        return reduceColumns(part, values -> {
            long n = 0;
            for (Object value : values) {
                if (value != null) n++;
            }
            return n;
        });
    }

    /**
     * Returns the number of cells: rows for a series, rows times columns for a table.
     *
     * @param part a table or series
     * @return the size
     */
    public static long size(Object part) {
        if (part instanceof Table) {
            Table table = (Table) part;
            return (long) table.numRows() * table.numColumns();
        }
        return asSeries(part).size();
    }

    public static long numRows(Object part) {
        if (part instanceof Table) {
            return ((Table) part).numRows();
        }
        return asSeries(part).size();
    }

    /**
     * Combines partial sums: scalars add up, series add up label by label.
     *
     * @param partials the partial results
     * @return the combined result
     */
    public static Object sumAll(List<Object> partials) {
        return combineByLabel(partials, BinaryOperator.ADD::apply);
    }

    public static Object minAll(List<Object> partials) {
        return combineByLabel(partials, (a, b) -> TypeCoercion.compareValues(a, b) <= 0 ? a : b);
    }

    public static Object maxAll(List<Object> partials) {
        return combineByLabel(partials, (a, b) -> TypeCoercion.compareValues(a, b) >= 0 ? a : b);
    }

    private static Object reduceColumns(Object part, Function<List<Object>, Object> reducer) {
        if (part instanceof Table) {
            Table table = (Table) part;
            List<Object> results = new ArrayList<>(table.numColumns());
            DataType type = null;
            for (Series column : table.columns()) {
                Object result = reducer.apply(column.values());
                results.add(result);
                type = TypeCoercion.unifyTypes(type, TypeCoercion.typeOf(result));
            }
            Index labels = new Index(null, StringType.get(), table.columnNames());
            return new Series(null, type == null ? UnresolvedType.get() : type, results, labels);
        }
        return reducer.apply(asSeries(part).values());
    }

    private static Object sumValues(List<Object> values) {
        boolean integral = true;
        long longSum = 0;
        double doubleSum = 0.0;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (value instanceof Boolean) {
                value = ((Boolean) value) ? 1L : 0L;
            }
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Cannot sum non-numeric value '" + value + "'");
            }
            if (integral && TypeCoercion.isIntegral(value)) {
                longSum += ((Number) value).longValue();
            } else {
                integral = false;
                doubleSum += ((Number) value).doubleValue();
            }
        }
        return integral ? (Object) longSum : (Object) (doubleSum + longSum);
    }

    private static Object extreme(List<Object> values, boolean minimum) {
        Object best = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (best == null) {
                best = value;
                continue;
            }
            int cmp = TypeCoercion.compareValues(value, best);
            if (minimum ? cmp < 0 : cmp > 0) {
                best = value;
            }
        }
        return best;
    }

    private static Object combineByLabel(List<Object> partials, java.util.function.BinaryOperator<Object> merge) {
        if (partials.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        if (!(partials.get(0) instanceof Series)) {
            Object result = null;
            for (Object partial : partials) {
                if (partial == null) continue;
                result = result == null ? partial : merge.apply(result, partial);
            }
            return result;
        }
        LinkedHashMap<Object, Object> byLabel = new LinkedHashMap<>();
        Series first = (Series) partials.get(0);
        DataType type = null;
        for (Object partial : partials) {
            Series series = (Series) partial;
            type = TypeCoercion.unifyTypes(type, series.dataType());
            for (int i = 0; i < series.size(); i++) {
                Object label = series.index().get(i);
                Object value = series.get(i);
                Object current = byLabel.get(label);
                if (!byLabel.containsKey(label) || current == null) {
                    byLabel.put(label, value);
                } else if (value != null) {
                    byLabel.put(label, merge.apply(current, value));
                }
            }
        }
        Index labels = new Index(first.index().name(), first.index().dataType(), new ArrayList<>(byLabel.keySet()));
        return new Series(first.name(), type, new ArrayList<>(byLabel.values()), labels);
    }

    // ==================== Distinct values ====================

    /**
     * Returns the distinct values of a series in first-seen order.
     *
     * @param part a series
     * @return the distinct values with a range index
     */
    public static Series unique(Object part) {
        Series series = asSeries(part);
        Set<Object> seen = new LinkedHashSet<>(series.values());
        return Series.of(series.name(), series.dataType(), new ArrayList<>(seen));
    }

    /**
     * Removes repeated rows, keeping the first occurrence and its index label.
     *
     * @param part a table or series
     * @return the deduplicated partition
     */
    public static Object dropDuplicates(Object part) {
        if (part instanceof Series) {
            Series series = (Series) part;
            Set<Object> seen = new LinkedHashSet<>();
            List<Integer> positions = new ArrayList<>();
            for (int i = 0; i < series.size(); i++) {
                if (seen.add(series.get(i))) {
                    positions.add(i);
                }
            }
            return series.take(positions);
        }
        Table table = asTable(part);
        Set<List<Object>> seen = new LinkedHashSet<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < table.numRows(); i++) {
            if (seen.add(table.row(i))) {
                positions.add(i);
            }
        }
        return table.take(positions);
    }

    /**
     * Counts occurrences of each distinct non-null value.
     *
     * @param part a series
     * @return counts named {@code count}, indexed by value, most frequent first
     */
    public static Series valueCounts(Object part) {
        Series series = asSeries(part);
        LinkedHashMap<Object, Object> counts = new LinkedHashMap<>();
        for (Object value : series.values()) {
            if (value != null) {
                counts.merge(value, 1L, (a, b) -> (Long) a + (Long) b);
            }
        }
        return sortedCounts(series.name(), series.dataType(), counts);
    }

    /**
     * Merges partial value counts by label.
     *
     * @param partials partial count series
     * @return the merged counts, most frequent first
     */
    public static Series mergeCounts(List<Object> partials) {
        Series merged = (Series) sumAll(partials);
        LinkedHashMap<Object, Object> counts = new LinkedHashMap<>();
        for (int i = 0; i < merged.size(); i++) {
            counts.put(merged.index().get(i), merged.get(i));
        }
        return sortedCounts(merged.index().name(), merged.index().dataType(), counts);
    }

    private static Series sortedCounts(String valueName, DataType valueType, Map<Object, Object> counts) {
        List<Map.Entry<Object, Object>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Long.compare((Long) b.getValue(), (Long) a.getValue()));
        List<Object> labels = new ArrayList<>(entries.size());
        List<Object> values = new ArrayList<>(entries.size());
        for (Map.Entry<Object, Object> entry : entries) {
            labels.add(entry.getKey());
            values.add(entry.getValue());
        }
        return new Series("count", LongType.get(), values, new Index(valueName, valueType, labels));
    }

    /**
     * Keeps the rows whose key hashes into the given bucket.
     *
     * @param part a table or series
     * @param byIndex hash the index label instead of the row values
     * @param bucket the bucket to keep
     * @param buckets the number of buckets
     * @return the rows of that bucket
     */
    public static Object hashBucket(Object part, boolean byIndex, int bucket, int buckets) {
        int rows = (int) numRows(part);
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            Object key;
            if (byIndex) {
                key = part instanceof Table ? ((Table) part).index().get(i) : asSeries(part).index().get(i);
            } else {
                key = part instanceof Table ? ((Table) part).row(i) : asSeries(part).get(i);
            }
            if (Math.floorMod(Objects.hashCode(key), buckets) == bucket) {
                positions.add(i);
            }
        }
        return part instanceof Table ? ((Table) part).take(positions) : asSeries(part).take(positions);
    }

    // ==================== Group-by ====================

    /**
     * Folds the rows of a table into one state row per non-null key.
     *
     * @param part a table holding the key column
     * @param by the key column
     * @param aggregation the aggregation
     * @return partial states indexed by key, one column per value column
     */
    public static Table groupChunk(Object part, String by, GroupAggregation aggregation) {
        Table table = asTable(part);
        Series keys = table.column(by);
        List<Series> values = new ArrayList<>();
        for (Series column : table.columns()) {
            if (!column.name().equals(by)) {
                values.add(column);
            }
        }
        LinkedHashMap<Object, Object[]> groups = new LinkedHashMap<>();
        for (int row = 0; row < table.numRows(); row++) {
            Object key = keys.get(row);
            if (key == null) {
                continue;
            }
            Object[] states = groups.computeIfAbsent(key, k -> new Object[values.size()]);
            for (int c = 0; c < values.size(); c++) {
                states[c] = aggregation.accumulate(states[c], values.get(c).get(row));
            }
        }
        List<String> names = new ArrayList<>(values.size());
        values.forEach(column -> names.add(column.name()));
        return stateTable(by, keys.dataType(), names, groups);
    }

    /**
     * Merges partial group states by key.
     *
     * @param partials outputs of {@link #groupChunk} or of this method
     * @param aggregation the aggregation
     * @return the merged states
     */
    public static Table groupCombine(List<Object> partials, GroupAggregation aggregation) {
        if (partials.isEmpty()) {
            throw new IllegalArgumentException("Nothing to combine");
        }
        Table first = asTable(partials.get(0));
        LinkedHashMap<Object, Object[]> groups = new LinkedHashMap<>();
        for (Object partial : partials) {
            Table table = asTable(partial);
            for (int row = 0; row < table.numRows(); row++) {
                Object key = table.index().get(row);
                List<Object> states = table.row(row);
                Object[] merged = groups.get(key);
                if (merged == null) {
                    groups.put(key, states.toArray());
                    continue;
                }
                for (int c = 0; c < merged.length; c++) {
                    merged[c] = aggregation.merge(merged[c], states.get(c));
                }
            }
        }
        return stateTable(first.index().name(), first.index().dataType(), first.columnNames(), groups);
    }

    /**
     * Merges partial group states and finishes them, ordered by key.
     *
     * @param partials partial states
     * @param aggregation the aggregation
     * @param schema the output column types
     * @return the aggregated table indexed by key
     */
    public static Table groupAggregate(List<Object> partials, GroupAggregation aggregation, StructType schema) {
        Table merged = groupCombine(partials, aggregation);
        List<Series> columns = new ArrayList<>(merged.numColumns());
        for (Series states : merged.columns()) {
            DataType type = schema.fieldByName(states.name()).dataType();
            List<Object> values = new ArrayList<>(states.size());
            for (Object state : states.values()) {
                values.add(aggregation.finish(state, type));
            }
            columns.add(new Series(states.name(), type, values, merged.index()));
        }
        return Table.of(columns, merged.index()).sortByIndex();
    }

    private static Table stateTable(String by, DataType keyType, List<String> names,
                                    LinkedHashMap<Object, Object[]> groups) {
        Index index = new Index(by, keyType, new ArrayList<>(groups.keySet()));
        List<Series> columns = new ArrayList<>(names.size());
        for (int c = 0; c < names.size(); c++) {
            List<Object> states = new ArrayList<>(groups.size());
            for (Object[] row : groups.values()) {
                states.add(row[c]);
            }
            columns.add(new Series(names.get(c), UnresolvedType.get(), states, index));
        }
        return Table.of(columns, index);
    }

    // ==================== Partition reshaping ====================

    /**
     * Returns piece {@code piece} of {@code pieces} near-equal row ranges.
     *
     * @param part a table or series
     * @param piece the piece number, from 0
     * @param pieces the number of pieces
     * @return the rows of that piece
     */
    public static Object splitRows(Object part, int piece, int pieces) {
        int rows = (int) numRows(part);
        int from = (int) ((long) rows * piece / pieces);
        int to = (int) ((long) rows * (piece + 1) / pieces);
        return sliceRows(part, from, to);
    }

    /**
     * Returns the rows whose index label lies in {@code [low, high)}, or
     * {@code [low, high]} when {@code includeHigh} is set.
     *
     * @param part a table or series with a sorted index
     * @param low the lower bound
     * @param high the upper bound
     * @param includeHigh whether the upper bound is inclusive
     * @return the selected rows
     */
    public static Object indexRange(Object part, Object low, Object high, boolean includeHigh) {
        Index index = part instanceof Table ? ((Table) part).index() : asSeries(part).index();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            Object label = index.get(i);
            if (label == null || TypeCoercion.compareValues(label, low) < 0) {
                continue;
            }
            int upper = TypeCoercion.compareValues(label, high);
            if (upper < 0 || (includeHigh && upper == 0)) {
                positions.add(i);
            }
        }
        return part instanceof Table ? ((Table) part).take(positions) : asSeries(part).take(positions);
    }

    public static Object sliceRows(Object part, int from, int to) {
        if (part instanceof Table) {
            return ((Table) part).slice(from, to);
        }
        return asSeries(part).slice(from, to);
    }

    /**
     * Concatenates partitions row-wise. Scalars are returned as a list.
     *
     * @param parts the partitions, not empty
     * @return the concatenation
     */
    public static Object concat(Collection<?> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        Object first = parts.iterator().next();
        if (first instanceof Table) {
            List<Table> tables = new ArrayList<>(parts.size());
            for (Object part : parts) {
                tables.add((Table) part);
            }
            return Table.concat(tables);
        }
        if (first instanceof Series) {
            List<Series> series = new ArrayList<>(parts.size());
            for (Object part : parts) {
                series.add((Series) part);
            }
            return Series.concat(series);
        }
        return new ArrayList<>(parts);
    }

    // ==================== Helpers ====================

    public static Table asTable(Object part) {
        if (part instanceof Table) {
            return (Table) part;
        }
        throw new IllegalArgumentException("Expected a table, got " + describe(part));
    }

    public static Series asSeries(Object part) {
        if (part instanceof Series) {
            return (Series) part;
        }
        throw new IllegalArgumentException("Expected a series, got " + describe(part));
    }

    /**
     * Returns whether the value is a boolean mask series.
     *
     * @param value the value
     * @return true for a boolean series
     */
    public static boolean isMask(Object value) {
        return value instanceof Series && ((Series) value).dataType() instanceof BooleanType;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
