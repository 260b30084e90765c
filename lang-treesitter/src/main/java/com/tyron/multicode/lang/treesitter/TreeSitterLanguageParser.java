package com.tyron.multicode.lang.treesitter;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.LanguageParser;
import com.tyron.multicode.api.language.ParsedSource;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base for grammars backed by tree-sitter.
 *
 * The native parser is created on first use. If the native library cannot be loaded the language is reported
 * as unavailable once and every later parse returns empty. Parsing is serialized on this instance; the trees
 * it returns may be walked from any thread.
 */
public abstract class TreeSitterLanguageParser implements LanguageParser {

    private static final Logger LOG = Logger.getLogger(TreeSitterLanguageParser.class.getName());

    private final Lang lang;
    private final NodeKinds kinds;

    private final Object lock = new Object();
    private TSParser parser;
    private boolean unavailable;

    protected TreeSitterLanguageParser(Lang lang, NodeKinds kinds) {
        this.lang = lang;
        this.kinds = kinds;
    }

    /**
     * Creates the grammar handle. Called at most once, under the parse lock.
     */
    protected abstract TSLanguage createLanguage();

    @Override
    public Lang lang() {
        return lang;
    }

    @Override
    public Optional<ParsedSource> parse(String text, @Nullable ParsedSource previous) {
        if (previous instanceof TreeSitterParsedSource cached && cached.lang() == lang
                && cached.text().equals(text)) {
            return Optional.of(cached);
        }
        synchronized (lock) {
            TSParser tsParser = parser();
            if (tsParser == null) {
                return Optional.empty();
            }
            TSTree tree = tsParser.parseString(null, text);
            if (tree == null) {
                LOG.warning("tree-sitter returned no tree for " + lang);
                return Optional.empty();
            }
            return Optional.of(new TreeSitterParsedSource(lang, text, tree, kinds));
        }
    }

    @Nullable
    private TSParser parser() {
        if (parser == null && !unavailable) {
            try {
                TSParser created = new TSParser();
                created.setLanguage(createLanguage());
                parser = created;
            } catch (LinkageError | RuntimeException e) {
                LOG.log(Level.WARNING, "tree-sitter could not be initialized; " + lang + " sources cannot be parsed",
                        e);
                unavailable = true;
            }
        }
        return parser;
    }
}
