package com.lazyduck.io.parquet;

/**
 * Renders names, paths and filter values into the DuckDB SQL the Parquet
 * reader issues.
 *
 * <pre>
 *   SQLQuoting.quoteIdentifier("order");         // "order"
 *   SQLQuoting.quoteFilePath("/data/*.parquet"); // '/data/*.parquet'
 *   SQLQuoting.renderValue("O'Reilly");          // 'O''Reilly'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /** Double-quoted column name. */
    public static String quoteIdentifier(String column) {
        return enclose(requireText(column, "column"), '"');
    }

    /**
     * Single-quoted path or glob for {@code read_parquet} and
     * {@code parquet_metadata}. Statement separators are rejected outright.
     */
    public static String quoteFilePath(String path) {
        requireText(path, "path");
        if (path.indexOf(';') >= 0 || path.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid characters in file path: " + path);
        }
        return enclose(path, '\'');
    }

    /**
     * Filter literal: numbers and booleans verbatim, non-finite doubles cast
     * from text, anything else as a string literal.
     */
    public static String renderValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Double && !Double.isFinite((Double) value)) {
            return enclose(value.toString(), '\'') + "::DOUBLE";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "TRUE" : "FALSE";
        }
        return enclose(value.toString(), '\'');
    }

    private static String enclose(String text, char quote) {
        String q = String.valueOf(quote);
        return q + text.replace(q, q + q) + q;
    }

    private static String requireText(String text, String what) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be null or empty");
        }
        return text;
    }
}
