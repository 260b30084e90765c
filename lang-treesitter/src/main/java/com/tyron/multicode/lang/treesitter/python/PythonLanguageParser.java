package com.tyron.multicode.lang.treesitter.python;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.lang.treesitter.TreeSitterLanguageParser;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

public class PythonLanguageParser extends TreeSitterLanguageParser {

    public PythonLanguageParser() {
        super(Lang.PYTHON, PythonNodeKinds.KINDS);
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterPython();
    }
}
