package com.tyron.multicode.core.conflict;

import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.sync.Conflict;

/**
 * The record to write back after a conflict, and how it was decided.
 */
public record Resolved(MetadataRecord record, Conflict conflict) {
}
