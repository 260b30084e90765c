package com.tyron.multicode.api.sync;

public enum Resolution {
    /** The text-derived record was kept. */
    TEXT,
    /** The visual record was taken as is. */
    VISUAL,
    /** Fields of both records were combined. */
    MERGE
}
