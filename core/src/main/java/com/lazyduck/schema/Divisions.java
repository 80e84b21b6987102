package com.lazyduck.schema;

import com.lazyduck.types.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for partition boundary lists.
 *
 * <p>A divisions list has {@code npartitions + 1} entries. Partition
 * {@code i} holds index values in {@code [d[i], d[i+1])}, the last partition
 * also includes {@code d[n]}. When boundaries are unknown every entry is null.
 */
public final class Divisions {

    private Divisions() {}

    /**
     * Returns the unknown divisions for the given partition count.
     *
     * @param npartitions the number of partitions
     * @return a list of {@code npartitions + 1} nulls
     */
    public static List<Object> unknown(int npartitions) {
        return Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(npartitions + 1, null)));
    }

    /**
     * Returns whether every boundary is known.
     *
     * @param divisions the divisions
     * @return true if known
     */
    public static boolean isKnown(List<Object> divisions) {
        if (divisions.isEmpty()) {
            return false;
        }
        for (Object boundary : divisions) {
            if (boundary == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies and checks a divisions list.
     *
     * @param divisions the divisions
     * @param owner the producing expression, for the error message
     * @return an unmodifiable copy
     * @throws IllegalStateException if known boundaries decrease or the list is too short
     */
    public static List<Object> validate(List<Object> divisions, String owner) {
        if (divisions.size() < 2) {
            throw new IllegalStateException(String.format(
                "%s produced %d division boundaries, at least 2 are required", owner, divisions.size()));
        }
        if (isKnown(divisions) && !isMonotonic(divisions)) {
            throw new IllegalStateException(String.format(
                "%s produced decreasing divisions %s", owner, divisions));
        }
        return Collections.unmodifiableList(new ArrayList<>(divisions));
    }

    /**
     * Returns whether known boundaries never decrease.
     *
     * @param divisions known divisions
     * @return true when non-decreasing
     */
    public static boolean isMonotonic(List<Object> divisions) {
        for (int i = 1; i < divisions.size(); i++) {
            if (TypeCoercion.compareValues(divisions.get(i - 1), divisions.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Restricts divisions to an ascending subset of partitions.
     *
     * @param divisions the full divisions
     * @param partitions ascending partition indices
     * @return the divisions of the selected partitions
     */
    public static List<Object> select(List<Object> divisions, List<Integer> partitions) {
        List<Object> selected = new ArrayList<>(partitions.size() + 1);
        for (int partition : partitions) {
            selected.add(divisions.get(partition));
        }
        selected.add(divisions.get(partitions.get(partitions.size() - 1) + 1));
        return selected;
    }
}
