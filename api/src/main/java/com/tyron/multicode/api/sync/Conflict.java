package com.tyron.multicode.api.sync;

import java.util.Objects;

/**
 * Describes how a divergence between the text and visual versions of one record was resolved.
 *
 * Conflicts are informational; they are never persisted and never block synchronization.
 */
public record Conflict(String id, ConflictType type, Resolution resolution) {

    public Conflict {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resolution, "resolution");
    }
}
