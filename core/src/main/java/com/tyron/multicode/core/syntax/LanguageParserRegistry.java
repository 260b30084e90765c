package com.tyron.multicode.core.syntax;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.LanguageParser;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Maps each {@link Lang} to the parser that handles it. One parser per language; registering again replaces.
 */
public final class LanguageParserRegistry {

    private static final Logger LOG = Logger.getLogger(LanguageParserRegistry.class.getName());

    private final ConcurrentHashMap<Lang, LanguageParser> parsers = new ConcurrentHashMap<>();

    /**
     * @return a registry holding every parser found on the class path
     */
    public static LanguageParserRegistry withInstalledParsers() {
        LanguageParserRegistry registry = new LanguageParserRegistry();
        for (LanguageParser parser : ServiceLoader.load(LanguageParser.class)) {
            registry.register(parser);
        }
        return registry;
    }

    public void register(LanguageParser parser) {
        if (parser == null) {
            throw new IllegalArgumentException("parser is null");
        }
        LanguageParser previous = parsers.put(parser.lang(), parser);
        if (previous != null && previous != parser) {
            LOG.fine("Replaced parser for " + parser.lang() + ": " + previous.getClass().getName()
                    + " -> " + parser.getClass().getName());
        }
    }

    public void unregister(Lang lang) {
        if (lang == null) return;
        parsers.remove(lang);
    }

    public Optional<LanguageParser> find(Lang lang) {
        if (lang == null) return Optional.empty();
        return Optional.ofNullable(parsers.get(lang));
    }

    public Set<Lang> languages() {
        return Set.copyOf(parsers.keySet());
    }
}
