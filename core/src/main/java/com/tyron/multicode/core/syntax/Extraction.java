package com.tyron.multicode.core.syntax;

import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.Block;

import java.util.List;

/**
 * Blocks of one parse in pre-order, with the tree they came from so the next parse can reuse it.
 */
public record Extraction(ParsedSource tree, List<Block> blocks) {

    public Extraction {
        blocks = List.copyOf(blocks);
    }
}
