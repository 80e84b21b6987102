package com.lazyduck.graph;

import com.lazyduck.expression.Tokenizable;

import java.util.Objects;

/**
 * Identity of one output partition in a task graph: the producing
 * expression's name and the partition index.
 */
public record TaskKey(String name, int index) implements Comparable<TaskKey>, Tokenizable {

    public TaskKey {
        Objects.requireNonNull(name, "name must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
    }

    @Override
    public int compareTo(TaskKey other) {
        int cmp = name.compareTo(other.name);
        return cmp != 0 ? cmp : Integer.compare(index, other.index);
    }

    @Override
    public String token() {
        return name + "#" + index;
    }

    @Override
    public String toString() {
        return "('" + name + "', " + index + ")";
    }
}
