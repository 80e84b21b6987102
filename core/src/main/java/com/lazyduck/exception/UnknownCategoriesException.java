package com.lazyduck.exception;

/**
 * Exception thrown when an operation needs the full category list of a
 * categorical column whose categories are not recorded in meta.
 *
 * <p>The message names the remediation: compute the categories (for example
 * with {@code unique()}) and attach them with {@code setCategories(...)}.
 */
public class UnknownCategoriesException extends PlanConstructionException {

    private final String column;

    public UnknownCategoriesException(String column, String operation) {
        super(null, String.format(
            "%s requires known categories, but the categories of '%s' are unknown. "
                + "Compute them (e.g. with unique()) and call setCategories(...) first.",
            operation, column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
