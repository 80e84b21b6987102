package com.lazyduck.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered column manifest of a table: the schema half of a frame's meta.
 * Column names are unique.
 */
public final class StructType implements DataType {

    private final Map<String, StructField> byName;

    public StructType(List<StructField> fields) {
        Map<String, StructField> map = new LinkedHashMap<>();
        for (StructField field : fields) {
            if (map.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate column '" + field.name() + "'");
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public List<StructField> fields() {
        return List.copyOf(byName.values());
    }

    /** Null when there is no such column. */
    public StructField fieldByName(String name) {
        return byName.get(name);
    }

    public List<String> fieldNames() {
        return List.copyOf(byName.keySet());
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType && fields().equals(((StructType) o).fields());
    }

    @Override
    public int hashCode() {
        return fields().hashCode();
    }

    @Override
    public String toString() {
        return "struct" + byName.values();
    }
}
