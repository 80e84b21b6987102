package com.lazyduck.io.parquet;

import com.lazyduck.expression.Tokenizable;

import java.util.Map;
import java.util.Objects;

/**
 * One independently readable piece of a dataset: a row group of a file.
 *
 * @param file the file path
 * @param rowGroup the row group number within the file
 * @param rowOffset the position of the row group's first row within the file
 * @param numRows the number of rows
 * @param statistics per-column statistics, possibly incomplete
 */
public record Fragment(String file, int rowGroup, long rowOffset, long numRows,
                       Map<String, ColumnStatistics> statistics) implements Tokenizable {

    public Fragment {
        Objects.requireNonNull(file, "file must not be null");
        statistics = statistics == null ? Map.of() : Map.copyOf(statistics);
    }

    /**
     * Returns the statistics of one column.
     *
     * @param column the column name
     * @return the statistics, or null when unknown
     */
    public ColumnStatistics statistics(String column) {
        return statistics.get(column);
    }

    @Override
    public String token() {
        return file + "#" + rowGroup + "@" + rowOffset + "+" + numRows;
    }
}
