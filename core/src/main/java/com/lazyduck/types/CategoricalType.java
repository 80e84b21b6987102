package com.lazyduck.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * String-valued column restricted to a set of categories.
 *
 * <p>Categories are either <em>known</em> (the full, ordered list is part of
 * the type) or <em>unknown</em> (each partition may hold a different subset
 * and nothing is recorded in meta). Operations whose result depends on the
 * complete category list, such as category codes, are only defined for known
 * categories.
 */
public final class CategoricalType implements DataType {

    private static final CategoricalType UNKNOWN = new CategoricalType(null);

    private final List<String> categories;

    private CategoricalType(List<String> categories) {
        this.categories = categories == null ? null
            : Collections.unmodifiableList(new ArrayList<>(categories));
    }

    /**
     * Returns the categorical type whose categories are not recorded in meta.
     *
     * @return the unknown-categories type
     */
    public static CategoricalType unknown() {
        return UNKNOWN;
    }

    /**
     * Returns a categorical type with the given ordered categories.
     *
     * @param categories the categories
     * @return the known-categories type
     */
    public static CategoricalType of(List<String> categories) {
        Objects.requireNonNull(categories, "categories must not be null");
        return new CategoricalType(categories);
    }

    public boolean knownCategories() {
        return categories != null;
    }

    /**
     * Returns the categories, or null when they are unknown.
     *
     * @return the categories or null
     */
    public List<String> categories() {
        return categories;
    }

    @Override
    public String typeName() {
        return "category";
    }

    @Override
    public Object zeroValue() {
        return "";
    }

    @Override
    public Object coerce(Object value) {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoricalType)) return false;
        return Objects.equals(categories, ((CategoricalType) o).categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName(), categories);
    }

    @Override
    public String toString() {
        return knownCategories() ? "category" + categories : "category[unknown]";
    }
}
