package com.tyron.multicode.api.meta;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Free-text note attached to a block plus an ordered list of hints.
 */
public record AiNote(@Nullable String description, List<String> hints) {

    public AiNote {
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
