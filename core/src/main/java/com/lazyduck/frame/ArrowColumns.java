package com.lazyduck.frame;

import com.lazyduck.types.BooleanType;
import com.lazyduck.types.DataType;
import com.lazyduck.types.DoubleType;
import com.lazyduck.types.IntegerType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StringType;
import com.lazyduck.types.TypeCoercion;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversion between Arrow record batches and in-memory partitions.
 *
 * <p>Storage readers receive DuckDB results as {@link VectorSchemaRoot}
 * batches and append them to heap columns with {@link #append}; computed
 * results leave the planner as Arrow batches through {@link #toArrow}.
 *
 * <p>Example usage:
 * <pre>
 *   try (VectorSchemaRoot root = ArrowColumns.toArrow(table, allocator)) {
 *       Table back = ArrowColumns.fromArrow(root, "id");
 *   }
 * </pre>
 */
public final class ArrowColumns {

    /** Column name used for an unnamed index when exporting. */
    public static final String INDEX_COLUMN = "__index__";

    private ArrowColumns() {}

    /**
     * Appends every value of a vector to a column, converted to the column type.
     *
     * @param vector the Arrow vector
     * @param type the planner type of the column
     * @param out the column values
     */
    public static void append(FieldVector vector, DataType type, List<Object> out) {
        int count = vector.getValueCount();
        for (int row = 0; row < count; row++) {
            out.add(TypeCoercion.coerce(valueAt(vector, row), type));
        }
    }

    /**
     * Reads one value as a plain Java object.
     *
     * @param vector the vector
     * @param row the row position
     * @return the value, or null
     */
    static Object valueAt(FieldVector vector, int row) {
        if (vector.isNull(row)) {
            return null;
        }
        if (vector instanceof VarCharVector) {
            return new String(((VarCharVector) vector).get(row), StandardCharsets.UTF_8);
        }
        if (vector instanceof BitVector) {
            return ((BitVector) vector).get(row) != 0;
        }
        // unsigned vectors box their raw bits as signed values
        if (vector instanceof UInt1Vector) {
            return ((UInt1Vector) vector).getObjectNoOverflow(row);
        }
        if (vector instanceof UInt2Vector) {
            return (int) ((UInt2Vector) vector).get(row);
        }
        if (vector instanceof UInt4Vector) {
            return ((UInt4Vector) vector).getValueAsLong(row);
        }
        if (vector instanceof UInt8Vector) {
            return ((UInt8Vector) vector).getObjectNoOverflow(row);
        }
        // Decimals, timestamps and narrow integers come back as their boxed Java form
        return vector.getObject(row);
    }

    /**
     * Builds a table from one batch.
     *
     * @param root the batch
     * @param indexColumn the column to use as index, or null for positional labels
     * @return the table; the index column is not repeated as a data column
     */
    public static Table fromArrow(VectorSchemaRoot root, String indexColumn) {
        Objects.requireNonNull(root, "root must not be null");
        int rows = root.getRowCount();
        Index index;
        if (indexColumn != null) {
            FieldVector vector = root.getVector(indexColumn);
            if (vector == null) {
                throw new IllegalArgumentException("Index column '" + indexColumn + "' not in batch");
            }
            DataType type = typeOf(vector.getField());
            List<Object> labels = new ArrayList<>(rows);
            append(vector, type, labels);
            index = new Index(INDEX_COLUMN.equals(indexColumn) ? null : indexColumn, type, labels);
        } else {
            index = Index.range(0, rows);
        }
        List<Series> columns = new ArrayList<>();
        for (FieldVector vector : root.getFieldVectors()) {
            String name = vector.getField().getName();
            if (name.equals(indexColumn)) {
                continue;
            }
            DataType type = typeOf(vector.getField());
            List<Object> values = new ArrayList<>(rows);
            append(vector, type, values);
            columns.add(new Series(name, type, values, index));
        }
        return Table.of(columns, index);
    }

    /**
     * Exports a table, its index first. An unnamed index is exported as
     * {@value #INDEX_COLUMN}. The caller owns the returned batch.
     *
     * @param table the table
     * @param allocator allocates the vectors
     * @return the batch
     */
    public static VectorSchemaRoot toArrow(Table table, BufferAllocator allocator) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");
        Index index = table.index();
        List<FieldVector> vectors = new ArrayList<>(table.numColumns() + 1);
        try {
            vectors.add(vector(index.name() == null ? INDEX_COLUMN : index.name(),
                index.dataType(), index.values(), allocator));
            for (Series column : table.columns()) {
                vectors.add(vector(column.name(), column.dataType(), column.values(), allocator));
            }
        } catch (RuntimeException e) {
            vectors.forEach(FieldVector::close);
            throw e;
        }
        VectorSchemaRoot root = new VectorSchemaRoot(vectors);
        root.setRowCount(table.numRows());
        return root;
    }

    /**
     * Exports a series as a one-column table with its index.
     */
    public static VectorSchemaRoot toArrow(Series series, BufferAllocator allocator) {
        String name = series.name() == null ? "value" : series.name();
        return toArrow(Table.of(List.of(series.withName(name)), series.index()), allocator);
    }

    /**
     * Maps an Arrow field to the planner type its values are read as.
     *
     * @param field the field
     * @return the type
     */
    public static DataType typeOf(Field field) {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Bool:
                return BooleanType.get();
            case Int:
                ArrowType.Int integer = (ArrowType.Int) type;
                if (integer.getBitWidth() < 32 || (integer.getBitWidth() == 32 && integer.getIsSigned())) {
                    return IntegerType.get();
                }
                if (integer.getBitWidth() == 64 && !integer.getIsSigned()) {
                    return StringType.get();
                }
                return LongType.get();
            case FloatingPoint:
            case Decimal:
                return DoubleType.get();
            default:
                return StringType.get();
        }
    }

    private static FieldVector vector(String name, DataType type, List<Object> values, BufferAllocator allocator) {
        int rows = values.size();
        if (type instanceof IntegerType) {
            IntVector vector = new IntVector(name, FieldType.nullable(new ArrowType.Int(32, true)), allocator);
            vector.allocateNew(rows);
            for (int i = 0; i < rows; i++) {
                Object value = values.get(i);
                if (value == null) {
                    vector.setNull(i);
                } else {
                    vector.set(i, ((Number) value).intValue());
                }
            }
            vector.setValueCount(rows);
            return vector;
        }
        if (type instanceof LongType) {
            BigIntVector vector = new BigIntVector(name, FieldType.nullable(new ArrowType.Int(64, true)), allocator);
            vector.allocateNew(rows);
            for (int i = 0; i < rows; i++) {
                Object value = values.get(i);
                if (value == null) {
                    vector.setNull(i);
                } else {
                    vector.set(i, ((Number) value).longValue());
                }
            }
            vector.setValueCount(rows);
            return vector;
        }
        if (type instanceof DoubleType) {
            Float8Vector vector = new Float8Vector(name,
                FieldType.nullable(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)), allocator);
            vector.allocateNew(rows);
            for (int i = 0; i < rows; i++) {
                Object value = values.get(i);
                if (value == null) {
                    vector.setNull(i);
                } else {
                    vector.set(i, ((Number) value).doubleValue());
                }
            }
            vector.setValueCount(rows);
            return vector;
        }
        if (type instanceof BooleanType) {
            BitVector vector = new BitVector(name, FieldType.nullable(ArrowType.Bool.INSTANCE), allocator);
            vector.allocateNew(rows);
            for (int i = 0; i < rows; i++) {
                Object value = values.get(i);
                if (value == null) {
                    vector.setNull(i);
                } else {
                    vector.set(i, Boolean.TRUE.equals(value) ? 1 : 0);
                }
            }
            vector.setValueCount(rows);
            return vector;
        }
        // strings, categories and unresolved values travel as text
        VarCharVector vector = new VarCharVector(name, FieldType.nullable(ArrowType.Utf8.INSTANCE), allocator);
        vector.allocateNew(rows);
        for (int i = 0; i < rows; i++) {
            Object value = values.get(i);
            if (value == null) {
                vector.setNull(i);
            } else {
                vector.setSafe(i, value.toString().getBytes(StandardCharsets.UTF_8));
            }
        }
        vector.setValueCount(rows);
        return vector;
    }
}
