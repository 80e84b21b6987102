package com.lazyduck.io.parquet;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.lazyduck.exception.DatasetReadException;
import com.lazyduck.expression.Tokenizable;
import com.lazyduck.expression.Tokenizer;
import com.lazyduck.schema.Divisions;
import com.lazyduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * A Parquet dataset: a location plus the reader that accesses it.
 *
 * <p>The schema and fragment listing are fetched once. Scan plans, which
 * depend on the pushed-down filters, are kept in a bounded cache owned
 * by the dataset, so plans are shared by all reads of the same dataset and
 * nothing is shared between datasets.
 */
public final class ParquetDataset implements Tokenizable {

    private static final Logger logger = LoggerFactory.getLogger(ParquetDataset.class);

    /** Default number of cached scan plans. */
    public static final int DEFAULT_CACHE_CAPACITY = 16;

    private final String path;
    private final DatasetReader reader;
    private final Cache<String, ScanPlan> plans;

    private volatile StructType schema;
    private volatile List<Fragment> fragments;

    public ParquetDataset(String path, DatasetReader reader) {
        this(path, reader, DEFAULT_CACHE_CAPACITY);
    }

    public ParquetDataset(String path, DatasetReader reader, int cacheCapacity) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
        }
        this.plans = CacheBuilder.newBuilder()
            .maximumSize(cacheCapacity)
            .build();
    }

    public String path() {
        return path;
    }

    public DatasetReader reader() {
        return reader;
    }

    public StructType schema() {
        StructType result = schema;
        if (result == null) {
            result = reader.schema(path);
            schema = result;
        }
        return result;
    }

    public List<Fragment> fragments() {
        List<Fragment> result = fragments;
        if (result == null) {
            result = List.copyOf(reader.fragments(path));
            fragments = result;
            logger.debug("Dataset {} has {} fragments", path, result.size());
        }
        return result;
    }

    /**
     * Returns the scan plan for the given read options, from cache when possible.
     *
     * @param filters pushed-down predicates
     * @param index the index column, or null
     * @param calculateDivisions whether to infer divisions from index statistics
     * @return the plan
     */
    public ScanPlan scanPlan(List<FilterPredicate> filters, String index, boolean calculateDivisions) {
        String key = Tokenizer.tokenize(filters, index, calculateDivisions);
        try {
            return plans.get(key, () -> buildPlan(filters, index, calculateDivisions));
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        } catch (ExecutionException e) {
            throw new DatasetReadException("Failed to plan a scan of " + path, e.getCause(), path);
        }
    }

    Cache<String, ScanPlan> planCache() {
        return plans;
    }

    private ScanPlan buildPlan(List<FilterPredicate> filters, String index, boolean calculateDivisions) {
        List<Fragment> kept = new ArrayList<>();
        int empty = 0;
        int pruned = 0;
        for (Fragment fragment : fragments()) {
            if (fragment.numRows() == 0) {
                empty++;
            } else if (!mayMatch(fragment, filters)) {
                pruned++;
            } else {
                kept.add(fragment);
            }
        }
        List<Object> divisions;
        if (kept.isEmpty()) {
            divisions = Divisions.unknown(1);
        } else if (index != null && calculateDivisions) {
            divisions = ScanPlan.inferDivisions(kept, index);
        } else {
            divisions = Divisions.unknown(kept.size());
        }
        logger.debug("Scan of {} with filters {}: kept {} fragments, pruned {}, skipped {} empty",
            path, filters, kept.size(), pruned, empty);
        return new ScanPlan(kept, divisions, pruned);
    }

    private static boolean mayMatch(Fragment fragment, List<FilterPredicate> filters) {
        for (FilterPredicate filter : filters) {
            if (!filter.mayMatch(fragment.statistics(filter.column()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String token() {
        return path + "|" + reader.token();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParquetDataset)) return false;
        return token().equals(((ParquetDataset) o).token());
    }

    @Override
    public int hashCode() {
        return token().hashCode();
    }

    @Override
    public String toString() {
        return "ParquetDataset(" + path + ")";
    }
}
