package com.tyron.multicode.lang.treesitter.rust;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.lang.treesitter.TreeSitterLanguageParser;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterRust;

public class RustLanguageParser extends TreeSitterLanguageParser {

    public RustLanguageParser() {
        super(Lang.RUST, RustNodeKinds.KINDS);
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterRust();
    }
}
