package com.tyron.multicode.api.sync;

import com.tyron.multicode.api.model.TextRange;

import java.util.List;

/**
 * Inconsistencies between the parsed code and its metadata, surfaced to the UI for attach/detach affordances.
 *
 * @param parsed          false when no parser was available for the document language
 * @param parseErrors     number of syntax error regions in the parsed text
 * @param orphanedIds     metadata ids without a matching block
 * @param unmappedCode    merged code ranges that no metadata describes
 * @param duplicateIds    ids declared by more than one metadata comment
 * @param overlappingIds  pairs of annotated blocks whose ranges cross
 */
public record SyncDiagnostics(
        boolean parsed,
        int parseErrors,
        List<String> orphanedIds,
        List<TextRange> unmappedCode,
        List<String> duplicateIds,
        List<List<String>> overlappingIds
) {

    public SyncDiagnostics {
        orphanedIds = List.copyOf(orphanedIds);
        unmappedCode = List.copyOf(unmappedCode);
        duplicateIds = List.copyOf(duplicateIds);
        overlappingIds = List.copyOf(overlappingIds);
    }

    public static SyncDiagnostics empty() {
        return new SyncDiagnostics(false, 0, List.of(), List.of(), List.of(), List.of());
    }
}
