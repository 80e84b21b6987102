package com.lazyduck.io.parquet;

import com.lazyduck.schema.Divisions;
import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fragments a filtered read visits, one partition each, and their divisions.
 *
 * <p>A plan without fragments still has one partition, which reads as empty.
 */
public final class ScanPlan {

    private final List<Fragment> fragments;
    private final List<Object> divisions;
    private final int pruned;

    ScanPlan(List<Fragment> fragments, List<Object> divisions, int pruned) {
        this.fragments = Collections.unmodifiableList(new ArrayList<>(fragments));
        this.divisions = divisions;
        this.pruned = pruned;
    }

    public List<Fragment> fragments() {
        return fragments;
    }

    public List<Object> divisions() {
        return divisions;
    }

    public int npartitions() {
        return Math.max(1, fragments.size());
    }

    /**
     * Returns the number of fragments skipped because of their statistics.
     */
    public int pruned() {
        return pruned;
    }

    /**
     * Returns the fragment read by a partition, or null for the empty partition.
     *
     * @param partition the partition
     * @return the fragment or null
     */
    public Fragment fragment(int partition) {
        return fragments.isEmpty() ? null : fragments.get(partition);
    }

    /**
     * Infers divisions from the index column's statistics.
     *
     * <p>Divisions are known only when every fragment has bounds and each
     * fragment's maximum lies strictly below the next fragment's minimum.
     * Partition {@code i} then starts at its minimum and the last partition
     * ends at its maximum.
     *
     * @param fragments the fragments in read order, not empty
     * @param column the index column
     * @return the divisions, unknown when the rule does not hold
     */
    static List<Object> inferDivisions(List<Fragment> fragments, String column) {
        List<Object> divisions = new ArrayList<>(fragments.size() + 1);
        Object previousMax = null;
        for (Fragment fragment : fragments) {
            ColumnStatistics statistics = fragment.statistics(column);
            if (statistics == null || !statistics.hasBounds()) {
                return Divisions.unknown(fragments.size());
            }
            try {
                if (TypeCoercion.compareValues(statistics.min(), statistics.max()) > 0
                        || (previousMax != null && TypeCoercion.compareValues(previousMax, statistics.min()) >= 0)) {
                    return Divisions.unknown(fragments.size());
                }
            } catch (IllegalArgumentException e) {
                return Divisions.unknown(fragments.size());
            }
            divisions.add(statistics.min());
            previousMax = statistics.max();
        }
        divisions.add(previousMax);
        return divisions;
    }

    @Override
    public String toString() {
        return "ScanPlan(" + fragments.size() + " fragments, " + pruned + " pruned)";
    }
}
