package com.tyron.multicode.core.syntax;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic block ids derived from a node's trimmed text and its start offset.
 */
public final class StableIds {

    private static final HashFunction HASH = Hashing.farmHashFingerprint64();

    private StableIds() {
    }

    /**
     * @return 16 lowercase hex digits
     */
    public static String compute(String snippet, int start) {
        return HASH.newHasher()
                .putString(snippet.trim(), StandardCharsets.UTF_8)
                .putInt(start)
                .hash()
                .toString();
    }
}
