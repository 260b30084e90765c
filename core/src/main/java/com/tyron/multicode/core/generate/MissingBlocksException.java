package com.tyron.multicode.core.generate;

import java.util.List;

/**
 * Code generation was asked for records whose blocks are not in the current parse.
 */
public class MissingBlocksException extends GenerationException {

    private final List<String> missingIds;

    public MissingBlocksException(List<String> missingIds) {
        super("No block for metadata " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<String> getMissingIds() {
        return missingIds;
    }
}
