package com.lazyduck.io.parquet;

import com.lazyduck.exception.DatasetReadException;
import com.lazyduck.frame.ArrowColumns;
import com.lazyduck.frame.Index;
import com.lazyduck.frame.Series;
import com.lazyduck.frame.Table;
import com.lazyduck.types.DataType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;
import com.lazyduck.types.TypeMapper;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads Parquet files through an embedded DuckDB database.
 *
 * <ul>
 *   <li>schema: {@code DESCRIBE SELECT * FROM read_parquet(path)}</li>
 *   <li>fragments: one per row group, from {@code parquet_metadata(path)}</li>
 *   <li>reads: {@code read_parquet(file, file_row_number=true)} restricted to
 *       the row group's row range, with filters rendered as SQL, streamed back
 *       as Arrow batches through DuckDB's Arrow export</li>
 * </ul>
 *
 * <p>Every call runs on its own duplicate of the root connection, so one
 * reader can serve concurrent tasks.
 */
public class DuckDBParquetReader implements DatasetReader, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBParquetReader.class);

    private static final String ROW_NUMBER = "file_row_number";

    /** Rows per Arrow batch exported by DuckDB. */
    public static final int DEFAULT_BATCH_SIZE = 8192;

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private final BufferAllocator allocator;
    private final int batchSize;
    private final Map<String, StructType> schemas = new HashMap<>();
    private volatile boolean closed = false;

    /**
     * Creates a reader backed by an in-memory database.
     */
    public DuckDBParquetReader() {
        this("jdbc:duckdb:");
    }

    /**
     * Creates a reader backed by the database at the given JDBC URL.
     *
     * @param jdbcUrl a {@code jdbc:duckdb:} URL
     */
    public DuckDBParquetReader(String jdbcUrl) {
        this(jdbcUrl, DEFAULT_BATCH_SIZE);
    }

    /**
     * Creates a reader backed by the database at the given JDBC URL.
     *
     * @param jdbcUrl a {@code jdbc:duckdb:} URL
     * @param batchSize rows per Arrow batch
     */
    public DuckDBParquetReader(String jdbcUrl, int batchSize) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.allocator = new RootAllocator(Long.MAX_VALUE);
        try {
            Connection conn = DriverManager.getConnection(jdbcUrl);
            this.connection = conn.unwrap(DuckDBConnection.class);
        } catch (SQLException e) {
            allocator.close();
            throw new IllegalStateException("Failed to open DuckDB database " + jdbcUrl, e);
        }
    }

    @Override
    public String token() {
        return "duckdb|" + jdbcUrl;
    }

    @Override
    public StructType schema(String path) {
        synchronized (schemas) {
            StructType cached = schemas.get(path);
            if (cached != null) {
                return cached;
            }
        }
        String sql = "DESCRIBE SELECT * FROM read_parquet(" + SQLQuoting.quoteFilePath(path) + ")";
        List<StructField> fields = new ArrayList<>();
        try (Connection conn = open(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                fields.add(new StructField(rs.getString("column_name"),
                    TypeMapper.fromDuckDBType(rs.getString("column_type")), true));
            }
        } catch (SQLException e) {
            throw new DatasetReadException("Failed to read schema of " + path, e, path);
        }
        StructType schema = new StructType(fields);
        synchronized (schemas) {
            schemas.put(path, schema);
        }
        return schema;
    }

    @Override
    public List<Fragment> fragments(String path) {
        StructType schema = schema(path);
        String sql = "SELECT file_name, row_group_id, row_group_num_rows, path_in_schema, "
            + "stats_min_value, stats_max_value, stats_null_count "
            + "FROM parquet_metadata(" + SQLQuoting.quoteFilePath(path) + ") "
            + "ORDER BY file_name, row_group_id";
        Map<String, FragmentBuilder> builders = new LinkedHashMap<>();
        try (Connection conn = open(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                String file = rs.getString("file_name");
                int rowGroup = rs.getInt("row_group_id");
                FragmentBuilder builder = builders.computeIfAbsent(file + "#" + rowGroup,
                    k -> new FragmentBuilder(file, rowGroup));
                builder.numRows = rs.getLong("row_group_num_rows");
                String column = rs.getString("path_in_schema");
                StructField field = column == null ? null : schema.fieldByName(column);
                if (field != null) {
                    long nulls = rs.getLong("stats_null_count");
                    if (rs.wasNull()) {
                        nulls = 0;
                    }
                    builder.statistics.put(column, new ColumnStatistics(
                        TypeMapper.parseValue(rs.getString("stats_min_value"), field.dataType()),
                        TypeMapper.parseValue(rs.getString("stats_max_value"), field.dataType()),
                        nulls));
                }
            }
        } catch (SQLException e) {
            throw new DatasetReadException("Failed to list row groups of " + path, e, path);
        }
        List<Fragment> fragments = new ArrayList<>(builders.size());
        Map<String, Long> offsets = new HashMap<>();
        for (FragmentBuilder builder : builders.values()) {
            long offset = offsets.getOrDefault(builder.file, 0L);
            fragments.add(new Fragment(builder.file, builder.rowGroup, offset, builder.numRows, builder.statistics));
            offsets.put(builder.file, offset + builder.numRows);
        }
        return fragments;
    }

    @Override
    public Table read(String path, Fragment fragment, List<String> columns, List<FilterPredicate> filters,
                      String index) {
        StructType schema = schema(path);
        List<String> selected = new ArrayList<>(columns);
        if (index != null && !selected.contains(index)) {
            selected.add(index);
        }
        String sql = buildReadQuery(fragment, selected, filters);
        logger.debug("Reading {} row group {}: {}", fragment.file(), fragment.rowGroup(), sql);

        List<List<Object>> values = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            values.add(new ArrayList<>());
        }
        List<Object> rowNumbers = new ArrayList<>();
        int batches = 0;
        try (Connection conn = open();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql);
             ArrowReader batchReader = (ArrowReader) rs.unwrap(DuckDBResultSet.class)
                 .arrowExportStream(allocator, batchSize)) {
            while (batchReader.loadNextBatch()) {
                VectorSchemaRoot batch = batchReader.getVectorSchemaRoot();
                for (int i = 0; i < selected.size(); i++) {
                    ArrowColumns.append(batch.getVector(i), columnType(schema, selected.get(i)), values.get(i));
                }
                ArrowColumns.append(batch.getVector(selected.size()), LongType.get(), rowNumbers);
                batches++;
            }
        } catch (SQLException | IOException e) {
            throw new DatasetReadException("Failed to read " + fragment.file() + " row group " + fragment.rowGroup(),
                e, path);
        }
        logger.debug("Read {} rows in {} Arrow batches", rowNumbers.size(), batches);

        Index rowIndex = index != null
            ? new Index(index, columnType(schema, index), values.get(selected.indexOf(index)))
            : new Index(null, LongType.get(), rowNumbers);
        List<Series> series = new ArrayList<>(columns.size());
        for (String column : columns) {
            series.add(new Series(column, columnType(schema, column), values.get(selected.indexOf(column)), rowIndex));
        }
        return Table.of(series, rowIndex);
    }

    private static String buildReadQuery(Fragment fragment, List<String> selected, List<FilterPredicate> filters) {
        StringBuilder sql = new StringBuilder("SELECT ");
        for (String column : selected) {
            sql.append(SQLQuoting.quoteIdentifier(column)).append(", ");
        }
        sql.append(ROW_NUMBER)
            .append(" FROM read_parquet(").append(SQLQuoting.quoteFilePath(fragment.file()))
            .append(", file_row_number=true)")
            .append(" WHERE ").append(ROW_NUMBER).append(" >= ").append(fragment.rowOffset())
            .append(" AND ").append(ROW_NUMBER).append(" < ").append(fragment.rowOffset() + fragment.numRows());
        for (FilterPredicate filter : filters) {
            sql.append(" AND ").append(filter.toSql());
        }
        sql.append(" ORDER BY ").append(ROW_NUMBER);
        return sql.toString();
    }

    private static DataType columnType(StructType schema, String column) {
        StructField field = schema.fieldByName(column);
        if (field == null) {
            throw new IllegalArgumentException("Column '" + column + "' not found in " + schema.fieldNames());
        }
        return field.dataType();
    }

    private Connection open() throws SQLException {
        if (closed) {
            throw new SQLException("Reader is closed");
        }
        return connection.duplicate();
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } finally {
            allocator.close();
        }
        logger.debug("Closed DuckDB Parquet reader");
    }

    private static final class FragmentBuilder {
        private final String file;
        private final int rowGroup;
        private final Map<String, ColumnStatistics> statistics = new LinkedHashMap<>();
        private long numRows;

        private FragmentBuilder(String file, int rowGroup) {
            this.file = file;
            this.rowGroup = rowGroup;
        }
    }
}
