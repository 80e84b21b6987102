package com.lazyduck.graph;

import java.util.List;

/**
 * Pure function evaluated by a task.
 *
 * <p>Arguments arrive with every {@link TaskKey} already replaced by the
 * value it identifies. Implementations must not mutate their arguments.
 */
@FunctionalInterface
public interface PartitionFunction {

    /**
     * Computes the task's value.
     *
     * @param args the resolved arguments
     * @return the result
     */
    Object apply(List<Object> args);
}
