package com.tyron.multicode.api.model;

/**
 * A half-open character range {@code [start, end)} in a source text.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(TextRange other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * @return true if both ranges share at least one offset but neither contains the other.
     */
    public boolean crosses(TextRange other) {
        boolean intersects = other.start < end && start < other.end;
        return intersects && !contains(other) && !other.contains(this);
    }

    public String substring(String text) {
        return text.substring(Math.min(start, text.length()), Math.min(end, text.length()));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
