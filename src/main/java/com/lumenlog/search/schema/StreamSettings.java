package com.lumenlog.search.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-stream settings that shape query planning
 */
public class StreamSettings {

    private List<StreamPartition> partitionKeys = new ArrayList<>();
    private Set<String> ftsFields = new LinkedHashSet<>();
    private Set<String> indexFields = new LinkedHashSet<>();
    private Set<String> definedSchemaFields = new LinkedHashSet<>();
    private boolean storeOriginalData = false;

    public static StreamSettings defaults() {
        return new StreamSettings();
    }

    public List<StreamPartition> getPartitionKeys() {
        return Collections.unmodifiableList(partitionKeys);
    }

    public StreamSettings setPartitionKeys(List<StreamPartition> partitionKeys) {
        this.partitionKeys = new ArrayList<>(partitionKeys);
        return this;
    }

    public Set<String> getFtsFields() {
        return Collections.unmodifiableSet(ftsFields);
    }

    public StreamSettings setFtsFields(Set<String> ftsFields) {
        this.ftsFields = new LinkedHashSet<>(ftsFields);
        return this;
    }

    public Set<String> getIndexFields() {
        return Collections.unmodifiableSet(indexFields);
    }

    public StreamSettings setIndexFields(Set<String> indexFields) {
        this.indexFields = new LinkedHashSet<>(indexFields);
        return this;
    }

    public Set<String> getDefinedSchemaFields() {
        return Collections.unmodifiableSet(definedSchemaFields);
    }

    public StreamSettings setDefinedSchemaFields(Set<String> definedSchemaFields) {
        this.definedSchemaFields = new LinkedHashSet<>(definedSchemaFields);
        return this;
    }

    public boolean isStoreOriginalData() {
        return storeOriginalData;
    }

    public StreamSettings setStoreOriginalData(boolean storeOriginalData) {
        this.storeOriginalData = storeOriginalData;
        return this;
    }
}
