package com.lumenlog.search.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One column of a stream schema
 */
public class SchemaField {

    private final String name;
    private final String dataType;

    @JsonCreator
    public SchemaField(@JsonProperty("name") String name,
                       @JsonProperty("dataType") String dataType) {
        this.name = name;
        this.dataType = dataType;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaField that = (SchemaField) o;
        return name.equals(that.name) && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType);
    }

    @Override
    public String toString() {
        return name + ":" + dataType;
    }
}
