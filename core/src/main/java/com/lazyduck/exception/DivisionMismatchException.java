package com.lazyduck.exception;

import java.util.List;

/**
 * Exception thrown when the inputs of a partition-wise operator are not
 * partitioned the same way.
 */
public class DivisionMismatchException extends PlanConstructionException {

    public DivisionMismatchException(String kind, List<Object> expected, List<Object> actual) {
        super(kind, String.format(
            "Inputs are not aligned: divisions %s do not match %s. Repartition one side first.",
            actual, expected));
    }
}
