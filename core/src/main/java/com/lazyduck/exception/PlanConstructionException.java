package com.lazyduck.exception;

/**
 * Exception thrown when an expression cannot be built.
 *
 * <p>Raised synchronously by constructors and builder methods, before any
 * data is touched. Common causes:
 * <ul>
 *   <li>Unknown operand name passed to a signature</li>
 *   <li>Missing required operand or too many operands</li>
 *   <li>Invalid operand values (negative partition counts, unsorted divisions)</li>
 * </ul>
 */
public class PlanConstructionException extends RuntimeException {

    private final String kind;

    /**
     * Creates a plan construction exception.
     *
     * @param kind the operator kind being built, may be null
     * @param message the error message
     */
    public PlanConstructionException(String kind, String message) {
        super(kind == null ? message : kind + ": " + message);
        this.kind = kind;
    }

    /**
     * Creates a plan construction exception with a cause.
     *
     * @param kind the operator kind being built, may be null
     * @param message the error message
     * @param cause the underlying cause
     */
    public PlanConstructionException(String kind, String message, Throwable cause) {
        super(kind == null ? message : kind + ": " + message, cause);
        this.kind = kind;
    }

    /**
     * Returns the operator kind whose construction failed.
     *
     * @return the kind, or null if not available
     */
    public String getKind() {
        return kind;
    }
}
