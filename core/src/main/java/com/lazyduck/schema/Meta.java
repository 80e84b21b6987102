package com.lazyduck.schema;

import com.lazyduck.expression.Tokenizable;
import com.lazyduck.frame.Index;
import com.lazyduck.frame.Series;
import com.lazyduck.frame.Table;
import com.lazyduck.types.DataType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;
import com.lazyduck.types.TypeCoercion;
import com.lazyduck.types.UnresolvedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Zero-row description of an expression's output.
 *
 * <p>A frame's meta is an empty {@link Table}, a series' meta an empty
 * {@link Series}, and a scalar's meta a typed sample value. Meta never holds
 * partition data; operators compute it by running their partition function
 * on their inputs' meta.
 */
public final class Meta implements Tokenizable {

    /**
     * Shape of the described value.
     */
    public enum Kind {
        FRAME(2), SERIES(1), SCALAR(0);

        private final int ndim;

        Kind(int ndim) {
            this.ndim = ndim;
        }

        public int ndim() {
            return ndim;
        }
    }

    private final Kind kind;
    private final Object empty;
    private final DataType scalarType;

    private Meta(Kind kind, Object empty, DataType scalarType) {
        this.kind = kind;
        this.empty = empty;
        this.scalarType = scalarType;
    }

    // ==================== Factory Methods ====================

    /**
     * Derives meta from a value produced by a partition function.
     *
     * @param value a table, a series or a scalar
     * @return the meta describing it
     */
    public static Meta of(Object value) {
        if (value instanceof Table) {
            return new Meta(Kind.FRAME, ((Table) value).emptyLike(), null);
        }
        if (value instanceof Series) {
            return new Meta(Kind.SERIES, ((Series) value).head(0), null);
        }
        if (value instanceof Meta) {
            return (Meta) value;
        }
        return scalar(TypeCoercion.typeOf(value));
    }

    /**
     * Creates the meta of a scalar of the given type.
     *
     * @param type the scalar type
     * @return the scalar meta
     */
    public static Meta scalar(DataType type) {
        Objects.requireNonNull(type, "type must not be null");
        return new Meta(Kind.SCALAR, TypeCoercion.zeroValue(type), type);
    }

    /**
     * Creates the meta of a frame with the given columns and index.
     *
     * @param schema the column manifest
     * @param indexName the index name, may be null
     * @param indexType the index type
     * @return the frame meta
     */
    public static Meta frame(StructType schema, String indexName, DataType indexType) {
        List<Series> columns = new ArrayList<>(schema.fields().size());
        Index index = new Index(indexName, indexType, Collections.emptyList());
        for (StructField field : schema.fields()) {
            columns.add(new Series(field.name(), field.dataType(), Collections.emptyList(), index));
        }
        return new Meta(Kind.FRAME, Table.of(columns, index), null);
    }

    /**
     * Creates the meta of a series.
     *
     * @param name the series name, may be null
     * @param type the value type
     * @param indexName the index name, may be null
     * @param indexType the index type
     * @return the series meta
     */
    public static Meta series(String name, DataType type, String indexName, DataType indexType) {
        Index index = new Index(indexName, indexType, Collections.emptyList());
        return new Meta(Kind.SERIES, new Series(name, type, Collections.emptyList(), index), null);
    }

    /**
     * Creates the meta of a series with a default integer index.
     *
     * @param name the series name, may be null
     * @param type the value type
     * @return the series meta
     */
    public static Meta series(String name, DataType type) {
        return series(name, type, null, LongType.get());
    }

    // ==================== Accessors ====================

    public Kind kind() {
        return kind;
    }

    public int ndim() {
        return kind.ndim();
    }

    public boolean isFrame() {
        return kind == Kind.FRAME;
    }

    public boolean isSeries() {
        return kind == Kind.SERIES;
    }

    public boolean isScalar() {
        return kind == Kind.SCALAR;
    }

    /**
     * Returns the zero-row artifact: an empty table, an empty series or a scalar sample.
     *
     * @return the empty value
     */
    public Object empty() {
        return empty;
    }

    /**
     * Returns the column names of a frame, the name of a series, or nothing for a scalar.
     *
     * @return the columns
     */
    public List<String> columns() {
        if (kind == Kind.FRAME) {
            return ((Table) empty).columnNames();
        }
        if (kind == Kind.SERIES && ((Series) empty).name() != null) {
            return List.of(((Series) empty).name());
        }
        return List.of();
    }

    /**
     * Returns the column manifest of a frame.
     *
     * @return the schema
     * @throws IllegalStateException if this is not a frame
     */
    public StructType schema() {
        if (kind != Kind.FRAME) {
            throw new IllegalStateException("Only frames have a schema, this is a " + kind);
        }
        return ((Table) empty).schema();
    }

    /**
     * Returns the value type of a series or scalar.
     *
     * @return the data type
     */
    public DataType dataType() {
        if (kind == Kind.SERIES) {
            return ((Series) empty).dataType();
        }
        if (kind == Kind.SCALAR) {
            return scalarType;
        }
        return schema();
    }

    /**
     * Returns the type of one column of a frame, or of the series itself.
     *
     * @param column the column name
     * @return the type, or null when absent
     */
    public DataType columnType(String column) {
        if (kind == Kind.FRAME) {
            StructField field = schema().fieldByName(column);
            return field == null ? null : field.dataType();
        }
        if (kind == Kind.SERIES) {
            return dataType();
        }
        return null;
    }

    public String seriesName() {
        return kind == Kind.SERIES ? ((Series) empty).name() : null;
    }

    public Index index() {
        if (kind == Kind.FRAME) {
            return ((Table) empty).index();
        }
        if (kind == Kind.SERIES) {
            return ((Series) empty).index();
        }
        return null;
    }

    public DataType indexType() {
        Index index = index();
        return index == null ? UnresolvedType.get() : index.dataType();
    }

    @Override
    public String token() {
        if (kind == Kind.SCALAR) {
            return "scalar:" + scalarType;
        }
        return kind + ":" + ((Tokenizable) empty).token();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Meta)) return false;
        Meta that = (Meta) o;
        return kind == that.kind
            && Objects.equals(empty, that.empty)
            && Objects.equals(scalarType, that.scalarType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, empty, scalarType);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FRAME -> "Meta(frame " + schema().fields() + ")";
            case SERIES -> "Meta(series " + seriesName() + ": " + dataType() + ")";
            case SCALAR -> "Meta(scalar " + scalarType + ")";
        };
    }
}
