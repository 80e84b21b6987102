package com.lazyduck.types;

import java.util.Objects;

/** One column of a {@link StructType}. */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
    }

    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    @Override
    public String toString() {
        return nullable ? name + ":" + dataType : name + ":" + dataType + "!";
    }
}
