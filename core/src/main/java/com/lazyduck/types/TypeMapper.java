package com.lazyduck.types;

import java.util.Locale;

/**
 * Reads DuckDB type names and statistic strings.
 *
 * <p>Used by the Parquet reader to turn the column manifest reported by
 * {@code DESCRIBE} into a {@link StructType}, and to parse the textual
 * statistics values reported by {@code parquet_metadata}.
 */
public final class TypeMapper {

    private TypeMapper() {}

    /**
     * Resolves a DuckDB column type.
     *
     * <p>Narrow integral types widen to {@link IntegerType}, {@code FLOAT} and
     * {@code DECIMAL} widen to {@link DoubleType}. Integers wider than 64 bits
     * ({@code UBIGINT}, {@code HUGEINT}, {@code UHUGEINT}), timestamps, dates and
     * other types the planner has no exact representation for are read as strings.
     *
     * @param duckdbType the DuckDB SQL type string
     * @return the data type
     * @throws UnsupportedOperationException for nested types
     */
    public static DataType fromDuckDBType(String duckdbType) {
        if (duckdbType == null || duckdbType.isBlank()) {
            throw new IllegalArgumentException("duckdbType must not be null or empty");
        }
        String normalized = duckdbType.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("DECIMAL") || normalized.startsWith("NUMERIC")) {
            return DoubleType.get();
        }
        if (normalized.endsWith("[]") || normalized.startsWith("STRUCT") || normalized.startsWith("MAP")) {
            throw new UnsupportedOperationException("Nested column type not supported: " + duckdbType);
        }
        switch (normalized) {
            case "TINYINT":
            case "SMALLINT":
            case "INTEGER":
            case "INT":
            case "UTINYINT":
            case "USMALLINT":
                return IntegerType.get();
            case "BIGINT":
            case "UINTEGER":
                return LongType.get();
            case "FLOAT":
            case "REAL":
            case "DOUBLE":
                return DoubleType.get();
            case "BOOLEAN":
            case "BOOL":
                return BooleanType.get();
            default:
                return StringType.get();
        }
    }

    /**
     * Parses a textual statistics value into a value of the given type.
     *
     * @param text the text as reported by DuckDB, may be null
     * @param type the column type
     * @return the typed value, or null when the text is null or unparseable
     */
    public static Object parseValue(String text, DataType type) {
        return text == null ? null : type.parseStatistic(text);
    }
}
