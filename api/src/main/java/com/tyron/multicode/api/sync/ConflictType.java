package com.tyron.multicode.api.sync;

public enum ConflictType {
    /**
     * translations, extends or origin differ.
     */
    STRUCTURAL,
    /**
     * Canvas coordinates differ.
     */
    MOVEMENT,
    /**
     * Only auxiliary metadata differs (tags, links, anchors, tests, ai, extras).
     */
    META_COMMENT
}
