package com.lazyduck.reduction;

import com.lazyduck.expression.Tokenizable;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The three steps of a tree reduction.
 *
 * <p>{@code chunk} runs on every input partition, {@code combine} merges a
 * bounded number of partial results into one, and {@code aggregate} turns
 * the last level of partial results into the output. Combine must accept its
 * own outputs as well as chunk outputs.
 */
public final class Reducer implements Tokenizable {

    private final String token;
    private final Function<Object, Object> chunk;
    private final Function<List<Object>, Object> combine;
    private final Function<List<Object>, Object> aggregate;
    private final boolean bucketByIndex;

    /**
     * Creates a reducer.
     *
     * @param token identifies the reduction in expression names
     * @param chunk the per-partition step
     * @param combine the intermediate merge
     * @param aggregate the final merge
     * @param bucketByIndex whether output buckets hash the index label instead of the row
     */
    public Reducer(String token, Function<Object, Object> chunk, Function<List<Object>, Object> combine,
                   Function<List<Object>, Object> aggregate, boolean bucketByIndex) {
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.chunk = Objects.requireNonNull(chunk, "chunk must not be null");
        this.combine = Objects.requireNonNull(combine, "combine must not be null");
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate must not be null");
        this.bucketByIndex = bucketByIndex;
    }

    /**
     * Creates a reducer whose combine and aggregate steps are the same.
     */
    public static Reducer of(String token, Function<Object, Object> chunk, Function<List<Object>, Object> merge) {
        return new Reducer(token, chunk, merge, merge, false);
    }

    public Object chunk(Object partition) {
        return chunk.apply(partition);
    }

    public Object combine(List<Object> partials) {
        return combine.apply(partials);
    }

    public Object aggregate(List<Object> partials) {
        return aggregate.apply(partials);
    }

    public boolean bucketByIndex() {
        return bucketByIndex;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public String toString() {
        return "Reducer(" + token + ")";
    }
}
