package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.List;

/**
 * Records read from a text, inheritance already applied, in document order.
 *
 * @param duplicateIds ids that appeared more than once; only their first occurrence is in {@code records}
 */
public record ReadResult(List<MetadataRecord> records, List<String> duplicateIds) {

    public ReadResult {
        records = List.copyOf(records);
        duplicateIds = List.copyOf(duplicateIds);
    }
}
