package com.tyron.multicode.api.language;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages a document can be tagged with.
 *
 * A tag does not imply that a parser is installed; see {@code LanguageParserRegistry}.
 */
public enum Lang {
    RUST("rust"),
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    CSS("css"),
    HTML("html"),
    GO("go"),
    C("c"),
    CPP("cpp"),
    JAVA("java"),
    CSHARP("csharp");

    private final String id;

    Lang(String id) {
        this.id = id;
    }

    /**
     * @return the lowercase key used in translation tables and settings
     */
    public String id() {
        return id;
    }

    public static Optional<Lang> fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "c++":
                return Optional.of(CPP);
            case "c#":
                return Optional.of(CSHARP);
            default:
                for (Lang lang : values()) {
                    if (lang.id.equals(key)) {
                        return Optional.of(lang);
                    }
                }
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
