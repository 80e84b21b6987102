package com.lazyduck.runtime;

import com.lazyduck.io.parquet.ParquetDataset;
import com.lazyduck.reduction.ApplyConcatApply;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the optimizer and the executors.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 * Properties use the {@code lazyduck.} prefix:
 * <ul>
 *   <li>{@code lazyduck.optimizer.maxIterations}: bound on simplify passes (default 100)</li>
 *   <li>{@code lazyduck.optimizer.fuse}: run blockwise fusion (default true)</li>
 *   <li>{@code lazyduck.reduction.splitEvery}: default fan-in of reduction trees (default 8)</li>
 *   <li>{@code lazyduck.parquet.planCacheSize}: scan plans cached per dataset (default 16)</li>
 *   <li>{@code lazyduck.executor.threads}: worker threads, 0 for one per processor (default 0)</li>
 * </ul>
 */
public final class PlannerConfig {

    public static final String PREFIX = "lazyduck.";

    /** Default bound on simplify passes */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final int maxIterations;
    private final boolean fuse;
    private final int splitEvery;
    private final int planCacheSize;
    private final int executorThreads;

    private PlannerConfig(int maxIterations, boolean fuse, int splitEvery, int planCacheSize, int executorThreads) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (splitEvery < 2) {
            throw new IllegalArgumentException("splitEvery must be at least 2: " + splitEvery);
        }
        if (planCacheSize < 1) {
            throw new IllegalArgumentException("planCacheSize must be positive: " + planCacheSize);
        }
        if (executorThreads < 0) {
            throw new IllegalArgumentException("executorThreads must not be negative: " + executorThreads);
        }
        this.maxIterations = maxIterations;
        this.fuse = fuse;
        this.splitEvery = splitEvery;
        this.planCacheSize = planCacheSize;
        this.executorThreads = executorThreads;
    }

    public static PlannerConfig defaults() {
        return new PlannerConfig(DEFAULT_MAX_ITERATIONS, true, ApplyConcatApply.DEFAULT_SPLIT_EVERY,
            ParquetDataset.DEFAULT_CACHE_CAPACITY, 0);
    }

    /**
     * Reads settings from properties, falling back to defaults for absent keys.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static PlannerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        PlannerConfig defaults = defaults();
        return new PlannerConfig(
            intValue(properties, "optimizer.maxIterations", defaults.maxIterations),
            booleanValue(properties, "optimizer.fuse", defaults.fuse),
            intValue(properties, "reduction.splitEvery", defaults.splitEvery),
            intValue(properties, "parquet.planCacheSize", defaults.planCacheSize),
            intValue(properties, "executor.threads", defaults.executorThreads));
    }

    public static PlannerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase();
        if (!normalized.equals("true") && !normalized.equals("false")) {
            throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + value);
        }
        return Boolean.parseBoolean(normalized);
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean fuse() {
        return fuse;
    }

    public int splitEvery() {
        return splitEvery;
    }

    public int planCacheSize() {
        return planCacheSize;
    }

    public int executorThreads() {
        return executorThreads;
    }

    /**
     * Returns the worker count: the configured value, or one per available processor.
     */
    public int resolvedExecutorThreads() {
        return executorThreads > 0 ? executorThreads : Runtime.getRuntime().availableProcessors();
    }

    public PlannerConfig withMaxIterations(int value) {
        return new PlannerConfig(value, fuse, splitEvery, planCacheSize, executorThreads);
    }

    public PlannerConfig withFuse(boolean value) {
        return new PlannerConfig(maxIterations, value, splitEvery, planCacheSize, executorThreads);
    }

    public PlannerConfig withSplitEvery(int value) {
        return new PlannerConfig(maxIterations, fuse, value, planCacheSize, executorThreads);
    }

    public PlannerConfig withPlanCacheSize(int value) {
        return new PlannerConfig(maxIterations, fuse, splitEvery, value, executorThreads);
    }

    public PlannerConfig withExecutorThreads(int value) {
        return new PlannerConfig(maxIterations, fuse, splitEvery, planCacheSize, value);
    }

    @Override
    public String toString() {
        return String.format("PlannerConfig(maxIterations=%d, fuse=%s, splitEvery=%d, planCacheSize=%d, threads=%d)",
            maxIterations, fuse, splitEvery, planCacheSize, executorThreads);
    }
}
