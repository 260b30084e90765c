package com.tyron.multicode.api.language;

/**
 * A parse tree of one exact text snapshot.
 *
 * A tree is returned even for source with syntax errors; those regions surface as {@link BlockKind#ERROR}
 * nodes and are counted by {@link #errorCount()}.
 */
public interface ParsedSource {

    Lang lang();

    /**
     * @return the text this tree was parsed from
     */
    String text();

    int errorCount();

    /**
     * Walks the tree in pre-order. Nodes without a source position are skipped.
     */
    void walk(NodeVisitor visitor);
}
