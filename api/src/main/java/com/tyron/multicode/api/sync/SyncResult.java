package com.tyron.multicode.api.sync;

import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.List;
import java.util.Optional;

/**
 * What the engine hands back to both views after processing one message.
 */
public record SyncResult(
        String code,
        List<MetadataRecord> records,
        List<Conflict> conflicts,
        SyncDiagnostics diagnostics,
        IdChanges changes
) {

    public SyncResult {
        records = List.copyOf(records);
        conflicts = List.copyOf(conflicts);
    }

    public Optional<MetadataRecord> record(String id) {
        return records.stream().filter(r -> r.getId().equals(id)).findFirst();
    }
}
