package com.lazyduck.exception;

/**
 * Exception thrown when a storage reader fails to list or read a dataset.
 *
 * <p>Wraps the underlying {@link java.sql.SQLException} together with the
 * dataset path and offers a user-facing translation of common DuckDB errors.
 */
public class DatasetReadException extends RuntimeException {

    private final String path;

    public DatasetReadException(String message, Throwable cause, String path) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Returns the dataset path that could not be read.
     *
     * @return the path, or null if not available
     */
    public String getPath() {
        return path;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        Throwable cause = getCause();
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : getMessage();
        if (detail == null) {
            return "Reading dataset " + path + " failed.";
        }
        if (detail.contains("No files found") || detail.contains("No such file")) {
            return "Dataset not found: " + path + ". Check that the path or glob is correct.";
        }
        if (detail.contains("Permission denied")) {
            return "Permission denied reading " + path + ". Check file permissions.";
        }
        if (detail.contains("Binder Error") && detail.contains("not found")) {
            return "Column not found in " + path + ": " + detail;
        }
        return "Reading dataset " + path + " failed: " + detail;
    }
}
