package com.tyron.multicode.testFramework;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.LanguageParser;
import com.tyron.multicode.api.language.NodeVisitor;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.TextRange;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A line-based toy grammar for exercising the sync pipeline without a real parser.
 *
 * <ul>
 *     <li>the whole text is a {@link BlockKind#MODULE}</li>
 *     <li>a line starting with {@code fn } is a {@link BlockKind#FUNCTION_DEFINE}</li>
 *     <li>a line containing {@code ??} is an {@link BlockKind#ERROR}</li>
 *     <li>any other non-blank line is a {@link BlockKind#STATEMENT}, except comment lines starting with
 *     {@code //}, {@code #}, {@code /*} or {@code <!--}, which produce nothing</li>
 * </ul>
 * Line blocks span the line without leading indentation and without the newline.
 */
public final class TestLanguageParser implements LanguageParser {

    private final Lang lang;
    private final AtomicInteger parseCount = new AtomicInteger();

    public TestLanguageParser(Lang lang) {
        this.lang = lang;
    }

    @Override
    public Lang lang() {
        return lang;
    }

    @Override
    public Optional<ParsedSource> parse(String text, @Nullable ParsedSource previous) {
        if (previous instanceof LineSource source && source.text().equals(text)) {
            return Optional.of(source);
        }
        parseCount.incrementAndGet();
        return Optional.of(new LineSource(lang, text, lines(text)));
    }

    /**
     * @return how many times a text was actually parsed
     */
    public int getParseCount() {
        return parseCount.get();
    }

    private static List<Node> lines(String text) {
        List<Node> nodes = new ArrayList<>();
        if (!text.isEmpty()) {
            nodes.add(new Node(BlockKind.MODULE, "module", TextRange.of(0, text.length())));
        }
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            int end = nl < 0 ? text.length() : nl;
            int from = start;
            while (from < end && Character.isWhitespace(text.charAt(from))) from++;
            int to = end;
            while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
            if (to > from) {
                String line = text.substring(from, to);
                if (!isComment(line)) {
                    nodes.add(classify(line, TextRange.of(from, to)));
                }
            }
            start = end + 1;
        }
        return nodes;
    }

    private static boolean isComment(String line) {
        return line.startsWith("//") || line.startsWith("#") || line.startsWith("/*") || line.startsWith("<!--");
    }

    private static Node classify(String line, TextRange range) {
        if (line.contains("??")) {
            return new Node(BlockKind.ERROR, "error", range);
        }
        if (line.startsWith("fn ")) {
            return new Node(BlockKind.FUNCTION_DEFINE, "function", range);
        }
        return new Node(BlockKind.STATEMENT, "statement", range);
    }

    private record Node(BlockKind kind, String rawKind, TextRange range) {
    }

    private static final class LineSource implements ParsedSource {
        private final Lang lang;
        private final String text;
        private final List<Node> nodes;

        LineSource(Lang lang, String text, List<Node> nodes) {
            this.lang = lang;
            this.text = text;
            this.nodes = List.copyOf(nodes);
        }

        @Override
        public Lang lang() {
            return lang;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public int errorCount() {
            return (int) nodes.stream().filter(n -> n.kind() == BlockKind.ERROR).count();
        }

        @Override
        public void walk(NodeVisitor visitor) {
            for (Node node : nodes) {
                visitor.visit(node.kind(), node.rawKind(), node.range(), List.of());
            }
        }
    }
}
