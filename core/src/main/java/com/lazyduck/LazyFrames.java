package com.lazyduck;

import com.lazyduck.expression.Expr;
import com.lazyduck.frame.Table;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.io.FromGraph;
import com.lazyduck.io.FromTable;
import com.lazyduck.io.ReadParquet;
import com.lazyduck.io.parquet.DatasetReader;
import com.lazyduck.io.parquet.ParquetDataset;
import com.lazyduck.runtime.PlannerConfig;
import com.lazyduck.schema.Meta;

import java.util.List;

/**
 * Entry points for building lazy frames.
 *
 * <p>Example usage:
 * <pre>
 *   Expr df = LazyFrames.fromTable(table, 4);
 *   Expr total = df.get(df.get("a").greaterThan(5)).get("b").sum();
 * </pre>
 */
public final class LazyFrames {

    private LazyFrames() {}

    /**
     * Splits an in-memory table into partitions, sorting by index.
     *
     * @param table the table
     * @param npartitions the number of partitions
     * @return the frame
     */
    public static Expr fromTable(Table table, int npartitions) {
        return fromTable(table, npartitions, true);
    }

    public static Expr fromTable(Table table, int npartitions, boolean sort) {
        return new FromTable(table, npartitions, sort);
    }

    /**
     * Reads a Parquet dataset, one partition per row group.
     *
     * @param path the file, directory or glob
     * @param reader the reader for the dataset
     * @return the frame
     */
    public static Expr readParquet(String path, DatasetReader reader) {
        return new ReadParquet(new ParquetDataset(path, reader));
    }

    /**
     * Reads a Parquet dataset indexed by one of its columns.
     *
     * @param path the file, directory or glob
     * @param reader the reader for the dataset
     * @param index the index column
     * @return the frame, with divisions when row group statistics allow
     */
    public static Expr readParquet(String path, DatasetReader reader, String index) {
        return new ReadParquet(new ParquetDataset(path, reader), index);
    }

    public static Expr readParquet(String path, DatasetReader reader, String index, PlannerConfig config) {
        ParquetDataset dataset = new ParquetDataset(path, reader, config.planCacheSize());
        return index == null ? new ReadParquet(dataset) : new ReadParquet(dataset, index);
    }

    public static Expr readParquet(ParquetDataset dataset) {
        return new ReadParquet(dataset);
    }

    /**
     * Wraps tasks of an existing graph.
     *
     * @param graph the graph
     * @param keys the keys of the partitions, in order
     * @param meta the meta of the partitions
     * @param divisions the divisions, or unknown
     * @return the frame
     */
    public static Expr fromGraph(TaskGraph graph, List<TaskKey> keys, Meta meta, List<Object> divisions) {
        return new FromGraph(graph, keys, meta, divisions);
    }
}
