package com.tyron.multicode.api.model;

import com.tyron.multicode.api.language.BlockKind;

import java.util.List;
import java.util.Objects;

/**
 * One syntax node surfaced to the visual view.
 *
 * Blocks are produced fresh by every parse and never mutated. The {@code visualId} is derived from the
 * node's text and position, not from parse tree identity, so it survives reparses of unrelated regions.
 *
 * @param visualId stable identifier, joins to {@code MetadataRecord#getId()}
 * @param kind     normalized category
 * @param rawKind  the grammar's own node name, kept for diagnostics
 * @param range    the node's span in the source text
 * @param anchors  sub-ranges used for fine-grained highlighting (operator tokens, identifiers)
 */
public record Block(String visualId, BlockKind kind, String rawKind, TextRange range, List<TextRange> anchors) {

    public Block {
        Objects.requireNonNull(visualId, "visualId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(rawKind, "rawKind");
        Objects.requireNonNull(range, "range");
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
    }
}
