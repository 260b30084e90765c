package com.tyron.multicode.api.language;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Grammar-specific parser plugged into the syntax extractor.
 *
 * Implementations are discovered with {@link java.util.ServiceLoader} or registered by hand.
 */
public interface LanguageParser {

    Lang lang();

    /**
     * Parses {@code text}.
     *
     * @param previous the last tree produced for this document, if any. Implementations may reuse it when it
     *                 corresponds to the exact same text; otherwise the whole text is reparsed.
     * @return empty when the grammar cannot be initialized. Syntax errors inside the text never cause an empty
     * result.
     */
    Optional<ParsedSource> parse(String text, @Nullable ParsedSource previous);
}
