package com.lazyduck.types;

/**
 * Column and scalar types known to the planner.
 *
 * <p>Each type knows how to produce the sample value that stands in for it in
 * zero-row meta, how to convert an arbitrary Java value into its own boxed
 * representation, and how to read a textual Parquet statistic.
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType,
            CategoricalType, StructType, UnresolvedType {

    String typeName();

    /** True for types that take part in arithmetic. */
    default boolean isNumeric() {
        return false;
    }

    /**
     * Sample value carried by scalar meta of this type.
     *
     * @return a typed value, or null when the type has no sample
     */
    default Object zeroValue() {
        return null;
    }

    /**
     * Converts a value to this type's boxed representation.
     *
     * @param value a non-null value
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be represented
     */
    default Object coerce(Object value) {
        return value;
    }

    /**
     * Parses a min/max statistic as DuckDB prints it.
     *
     * @param text the non-null statistic text
     * @return the typed value, or null when the text does not parse
     */
    default Object parseStatistic(String text) {
        return text;
    }
}
