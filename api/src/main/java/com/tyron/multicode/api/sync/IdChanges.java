package com.tyron.multicode.api.sync;

import java.util.List;

/**
 * Metadata ids touched by one processed message, each list sorted.
 */
public record IdChanges(List<String> added, List<String> removed, List<String> modified) {

    private static final IdChanges NONE = new IdChanges(List.of(), List.of(), List.of());

    public IdChanges {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
    }

    public static IdChanges none() {
        return NONE;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
