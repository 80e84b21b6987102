package com.lazyduck.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a column reference is absent from the child schema.
 */
public class ColumnNotFoundException extends PlanConstructionException {

    private final String column;
    private final List<String> availableColumns;

    public ColumnNotFoundException(String column, List<String> availableColumns) {
        super(null, String.format("Column '%s' not found. Available columns: %s",
            column, availableColumns));
        this.column = column;
        this.availableColumns = Collections.unmodifiableList(new ArrayList<>(availableColumns));
    }

    public String getColumn() {
        return column;
    }

    public List<String> getAvailableColumns() {
        return availableColumns;
    }
}
