package com.tyron.multicode.core.syntax;

/**
 * A view of a text with some spans removed, able to translate offsets of the original text into the view.
 */
public interface SourceProjection {

    String text();

    int toProjected(int rawOffset);

    static SourceProjection identity(String text) {
        return new SourceProjection() {
            @Override
            public String text() {
                return text;
            }

            @Override
            public int toProjected(int rawOffset) {
                return rawOffset;
            }
        };
    }
}
