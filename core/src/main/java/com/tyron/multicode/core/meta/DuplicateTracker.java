package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remembers which ids were seen during one read pass. The first record registered under an id is kept, later
 * ones only mark the id as duplicated.
 *
 * Not thread safe. A tracker belongs to a single read.
 */
public final class DuplicateTracker {

    private final Map<String, MetadataRecord> records = new LinkedHashMap<>();
    private final Set<String> duplicates = new LinkedHashSet<>();

    /**
     * @return true if the record was the first with its id
     */
    public boolean register(MetadataRecord record) {
        String id = record.getId();
        if (records.containsKey(id)) {
            duplicates.add(id);
            return false;
        }
        records.put(id, record);
        return true;
    }

    /**
     * @return the kept records by id, in registration order
     */
    public Map<String, MetadataRecord> records() {
        return Collections.unmodifiableMap(records);
    }

    public List<String> duplicateIds() {
        return new ArrayList<>(duplicates);
    }
}
