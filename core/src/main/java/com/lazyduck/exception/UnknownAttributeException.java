package com.lazyduck.exception;

/**
 * Exception thrown when an attribute lookup matches neither a declared
 * property nor an operand name.
 */
public class UnknownAttributeException extends PlanConstructionException {

    private final String attribute;

    public UnknownAttributeException(String kind, String attribute) {
        super(kind, String.format("no property or operand named '%s'", attribute));
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
