package com.tyron.multicode.lang.treesitter;

import java.nio.charset.StandardCharsets;

/**
 * Converts the UTF-8 byte offsets tree-sitter reports into {@code String} indices.
 */
final class Utf8Offsets {

    // null when every char is a single byte
    private final int[] charAt;
    private final int length;

    private Utf8Offsets(int[] charAt, int length) {
        this.charAt = charAt;
        this.length = length;
    }

    static Utf8Offsets of(String text) {
        int bytes = text.getBytes(StandardCharsets.UTF_8).length;
        if (bytes == text.length()) {
            return new Utf8Offsets(null, text.length());
        }
        int[] charAt = new int[bytes + 1];
        int b = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = utf8Width(codePoint);
            for (int k = 0; k < width; k++) {
                charAt[b + k] = i;
            }
            b += width;
            i += Character.charCount(codePoint);
        }
        charAt[bytes] = text.length();
        return new Utf8Offsets(charAt, text.length());
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    /**
     * Offsets inside a multi-byte character map to the start of that character.
     */
    int toChar(int byteOffset) {
        if (charAt == null) {
            return Math.min(Math.max(byteOffset, 0), length);
        }
        if (byteOffset <= 0) {
            return 0;
        }
        if (byteOffset >= charAt.length) {
            return length;
        }
        return charAt[byteOffset];
    }
}
