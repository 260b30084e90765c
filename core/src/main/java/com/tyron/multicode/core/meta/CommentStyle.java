package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.language.Lang;

import java.util.regex.Pattern;

/**
 * Comment syntaxes that can carry a metadata payload.
 */
public enum CommentStyle {
    HASH("# ", "",
            Pattern.compile("(?m)^[ \\t]*(#[ \\t]*" + MetadataStore.MARKER + "[ \\t]*(\\{.*\\}))[ \\t\\r]*$")),
    SLASH("// ", "",
            Pattern.compile("(?m)^[ \\t]*(//[ \\t]*" + MetadataStore.MARKER + "[ \\t]*(\\{.*\\}))[ \\t\\r]*$")),
    BLOCK("/* ", " */",
            Pattern.compile("(?s)(/\\*\\s*" + MetadataStore.MARKER + "\\s*(\\{.*?\\})\\s*\\*/)")),
    HTML("<!-- ", " -->",
            Pattern.compile("(?s)(<!--\\s*" + MetadataStore.MARKER + "\\s*(\\{.*?\\})\\s*-->)"));

    static final int COMMENT_GROUP = 1;
    static final int JSON_GROUP = 2;

    private final String open;
    private final String close;
    private final Pattern pattern;

    CommentStyle(String open, String close, Pattern pattern) {
        this.open = open;
        this.close = close;
        this.pattern = pattern;
    }

    Pattern pattern() {
        return pattern;
    }

    /**
     * Renders a complete comment around an already serialized payload.
     */
    public String format(String json) {
        return open + MetadataStore.MARKER + " " + json + close;
    }

    /**
     * @return the style new metadata comments get in sources of {@code lang}
     */
    public static CommentStyle forLang(Lang lang) {
        if (lang == null) {
            return SLASH;
        }
        switch (lang) {
            case PYTHON:
                return HASH;
            case HTML:
                return HTML;
            case CSS:
                return BLOCK;
            default:
                return SLASH;
        }
    }
}
