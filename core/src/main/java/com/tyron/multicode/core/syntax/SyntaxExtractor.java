package com.tyron.multicode.core.syntax;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.LanguageParser;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.model.TextRange;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns source text into {@link Block}s using the parser registered for the document language.
 *
 * Block ids are computed from the {@link SourceProjection} of the text rather than the raw text, so spans the
 * projection hides (metadata comments) never shift them.
 */
public final class SyntaxExtractor {

    private static final Logger LOG = Logger.getLogger(SyntaxExtractor.class.getName());

    private final LanguageParserRegistry registry;

    public SyntaxExtractor(LanguageParserRegistry registry) {
        this.registry = registry;
    }

    public LanguageParserRegistry getRegistry() {
        return registry;
    }

    public Optional<Extraction> extract(String text, Lang lang) {
        return extract(text, lang, null, SourceProjection.identity(text));
    }

    /**
     * @param previous   the last tree of this document; reused when it was parsed from the same text
     * @param projection the view block ids are computed on; must be derived from {@code text}
     * @return empty when no parser handles {@code lang} or the parser could not start
     */
    public Optional<Extraction> extract(String text, Lang lang, @Nullable ParsedSource previous,
                                        SourceProjection projection) {
        Optional<LanguageParser> parser = registry.find(lang);
        if (parser.isEmpty()) {
            LOG.fine("No parser registered for " + lang);
            return Optional.empty();
        }

        ParsedSource reusable = previous != null && previous.lang() == lang ? previous : null;
        Optional<ParsedSource> tree;
        if (reusable != null && reusable.text().equals(text)) {
            tree = Optional.of(reusable);
        } else {
            tree = parser.get().parse(text, reusable);
        }
        if (tree.isEmpty()) {
            LOG.warning("Parser for " + lang + " could not produce a tree");
            return Optional.empty();
        }
        return Optional.of(new Extraction(tree.get(), collect(tree.get(), projection)));
    }

    private static List<Block> collect(ParsedSource tree, SourceProjection projection) {
        String clean = projection.text();
        List<Block> blocks = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        tree.walk((kind, rawKind, range, anchors) -> {
            int start = projection.toProjected(range.start());
            int end = Math.max(start, projection.toProjected(range.end()));
            String snippet = clean.substring(Math.min(start, clean.length()), Math.min(end, clean.length()));
            String id = StableIds.compute(snippet, start);

            int occurrence = seen.merge(id, 1, Integer::sum);
            if (occurrence > 1) {
                id = id + "-" + (occurrence - 1);
            }
            blocks.add(new Block(id, kind, rawKind, TextRange.of(range.start(), range.end()), anchors));
        });
        return blocks;
    }
}
