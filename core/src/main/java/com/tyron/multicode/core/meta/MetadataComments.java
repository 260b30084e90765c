package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.model.TextRange;
import com.tyron.multicode.core.syntax.SourceProjection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Locates metadata comments of every {@link CommentStyle} in a text.
 */
public final class MetadataComments {

    private MetadataComments() {
    }

    /**
     * @return the comments in document order. When two styles match overlapping text, the one starting first
     * wins.
     */
    public static List<MetadataComment> find(String text) {
        List<MetadataComment> all = new ArrayList<>();
        for (CommentStyle style : CommentStyle.values()) {
            Matcher m = style.pattern().matcher(text);
            while (m.find()) {
                TextRange comment = TextRange.of(m.start(CommentStyle.COMMENT_GROUP), m.end(CommentStyle.COMMENT_GROUP));
                TextRange json = TextRange.of(m.start(CommentStyle.JSON_GROUP), m.end(CommentStyle.JSON_GROUP));
                all.add(new MetadataComment(style, comment, json, removalSpan(text, comment), replaceSpan(text, comment)));
            }
        }
        all.sort(Comparator.comparingInt((MetadataComment c) -> c.comment().start())
                .thenComparing(c -> -c.comment().end()));

        List<MetadataComment> result = new ArrayList<>(all.size());
        int coveredUntil = -1;
        for (MetadataComment c : all) {
            if (c.comment().start() < coveredUntil) {
                continue;
            }
            result.add(c);
            coveredUntil = c.comment().end();
        }
        return result;
    }

    /**
     * Removes every metadata comment.
     *
     * @return the cleaned text together with a mapping from offsets in {@code text} to offsets in the result
     */
    public static StrippedText strip(String text) {
        List<MetadataComment> comments = find(text);
        if (comments.isEmpty()) {
            return new StrippedText(text, new int[0], new int[0]);
        }

        StringBuilder out = new StringBuilder(text.length());
        int[] starts = new int[comments.size()];
        int[] ends = new int[comments.size()];
        int n = 0;
        int cursor = 0;
        for (MetadataComment c : comments) {
            TextRange removal = c.removal();
            if (removal.start() < cursor) {
                // two comments on one line; the earlier removal already took the shared newline
                removal = TextRange.of(cursor, Math.max(cursor, removal.end()));
            }
            out.append(text, cursor, removal.start());
            starts[n] = removal.start();
            ends[n] = removal.end();
            n++;
            cursor = removal.end();
        }
        out.append(text, cursor, text.length());
        return new StrippedText(out.toString(), Arrays.copyOf(starts, n), Arrays.copyOf(ends, n));
    }

    private static TextRange removalSpan(String text, TextRange comment) {
        int lineStart = lineStart(text, comment.start());
        int lineEnd = lineEnd(text, comment.end());
        if (isBlank(text, lineStart, comment.start()) && isBlank(text, comment.end(), lineEnd)) {
            int end = lineEnd < text.length() ? lineEnd + 1 : lineEnd;
            return TextRange.of(lineStart, end);
        }
        return comment;
    }

    private static TextRange replaceSpan(String text, TextRange comment) {
        int lineStart = lineStart(text, comment.start());
        int lineEnd = lineEnd(text, comment.end());
        int start = isBlank(text, lineStart, comment.start()) ? lineStart : comment.start();
        int end = isBlank(text, comment.end(), lineEnd) ? lineEnd : comment.end();
        return TextRange.of(start, end);
    }

    private static int lineStart(String text, int offset) {
        int nl = text.lastIndexOf('\n', offset - 1);
        return nl + 1;
    }

    /**
     * @return the offset of the terminating newline, or the text length
     */
    private static int lineEnd(String text, int offset) {
        int nl = text.indexOf('\n', offset);
        return nl < 0 ? text.length() : nl;
    }

    private static boolean isBlank(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    /**
     * Result of {@link #strip(String)}.
     */
    public static final class StrippedText implements SourceProjection {
        private final String text;
        private final int[] removedStarts;
        private final int[] removedEnds;

        StrippedText(String text, int[] removedStarts, int[] removedEnds) {
            this.text = text;
            this.removedStarts = removedStarts;
            this.removedEnds = removedEnds;
        }

        @Override
        public String text() {
            return text;
        }

        /**
         * Offsets inside a removed span map to where that span used to start.
         */
        @Override
        public int toProjected(int rawOffset) {
            int removed = 0;
            for (int i = 0; i < removedStarts.length; i++) {
                if (rawOffset <= removedStarts[i]) {
                    break;
                }
                if (rawOffset < removedEnds[i]) {
                    return removedStarts[i] - removed;
                }
                removed += removedEnds[i] - removedStarts[i];
            }
            return rawOffset - removed;
        }

        public int removedCount() {
            return removedStarts.length;
        }
    }
}
