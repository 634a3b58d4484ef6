package com.lumenlog.search.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, immutable column list of a stream.
 *
 * Derived schemas (retain, without, withField) keep the original column order.
 */
public class StreamSchema {

    private final Map<String, SchemaField> fields;

    @JsonCreator
    public StreamSchema(@JsonProperty("fields") List<SchemaField> fields) {
        Map<String, SchemaField> map = new LinkedHashMap<>();
        if (fields != null) {
            for (SchemaField field : fields) {
                map.putIfAbsent(field.getName(), field);
            }
        }
        this.fields = Collections.unmodifiableMap(map);
    }

    public static StreamSchema empty() {
        return new StreamSchema(Collections.emptyList());
    }

    @JsonProperty("fields")
    public List<SchemaField> getFields() {
        return new ArrayList<>(fields.values());
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public SchemaField getField(String name) {
        return fields.get(name);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /**
     * Keep only the named columns, in schema order. Unknown names are ignored.
     */
    public StreamSchema retain(Collection<String> names) {
        List<SchemaField> kept = new ArrayList<>();
        for (SchemaField field : fields.values()) {
            if (names.contains(field.getName())) {
                kept.add(field);
            }
        }
        return new StreamSchema(kept);
    }

    public StreamSchema without(String name) {
        List<SchemaField> kept = new ArrayList<>(fields.values());
        kept.removeIf(f -> f.getName().equals(name));
        return new StreamSchema(kept);
    }

    /**
     * Append a column when the schema does not already carry it
     */
    public StreamSchema withField(String name, String dataType) {
        if (fields.containsKey(name)) {
            return this;
        }
        List<SchemaField> extended = new ArrayList<>(fields.values());
        extended.add(new SchemaField(name, dataType));
        return new StreamSchema(extended);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getFields().equals(((StreamSchema) o).getFields());
    }

    @Override
    public int hashCode() {
        return getFields().hashCode();
    }

    @Override
    public String toString() {
        return "StreamSchema" + fieldNames();
    }
}
