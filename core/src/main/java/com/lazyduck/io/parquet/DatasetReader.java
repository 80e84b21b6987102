package com.lazyduck.io.parquet;

import com.lazyduck.frame.Table;
import com.lazyduck.types.StructType;

import java.util.List;

/**
 * Storage access used by Parquet reads.
 *
 * <p>Implementations raise {@link com.lazyduck.exception.DatasetReadException}
 * for storage failures and must be safe to call from several threads.
 */
public interface DatasetReader {

    /**
     * Identifies the data source behind this reader. Two readers with equal
     * tokens return the same data for the same path; reads through readers
     * with different tokens are never merged.
     *
     * @return a stable token
     */
    String token();

    /**
     * Returns the column manifest of the dataset.
     *
     * @param path the dataset location
     * @return the columns and their types
     */
    StructType schema(String path);

    /**
     * Lists the readable fragments of the dataset, in row order.
     *
     * @param path the dataset location
     * @return the fragments with their statistics
     */
    List<Fragment> fragments(String path);

    /**
     * Reads one fragment.
     *
     * @param path the dataset location
     * @param fragment the fragment to read
     * @param columns the columns to return, excluding the index column
     * @param filters row predicates, all of which must hold
     * @param index the column to use as index, or null for positional labels
     * @return the rows of the fragment that satisfy the filters
     */
    Table read(String path, Fragment fragment, List<String> columns, List<FilterPredicate> filters, String index);
}
