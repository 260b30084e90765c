package com.tyron.multicode.api.language;

import com.tyron.multicode.api.model.TextRange;

import java.util.List;

/**
 * Receives the nodes of a {@link ParsedSource} in pre-order.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * @param kind    normalized category
     * @param rawKind the grammar's node name
     * @param range   node span in the parsed text
     * @param anchors highlight sub-ranges, may be empty
     */
    void visit(BlockKind kind, String rawKind, TextRange range, List<TextRange> anchors);
}
