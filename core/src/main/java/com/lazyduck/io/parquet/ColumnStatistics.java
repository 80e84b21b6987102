package com.lazyduck.io.parquet;

/**
 * Min/max statistics of one column in one fragment. Bounds are null when
 * the file does not record them.
 */
public record ColumnStatistics(Object min, Object max, long nullCount) {

    public boolean hasBounds() {
        return min != null && max != null;
    }
}
