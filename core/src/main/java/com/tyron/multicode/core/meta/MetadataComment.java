package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.model.TextRange;

/**
 * One metadata comment found in a text.
 *
 * @param style   the comment syntax
 * @param comment span of the comment itself, from the opening token to the closing one
 * @param json    span of the JSON payload
 * @param removal span removed when stripping: whole lines when the comment is alone on them, otherwise just
 *                the comment
 * @param replace span overwritten by an upsert that does not preserve formatting: leading indentation and
 *                trailing blanks are dropped when they are the only other content on the line
 */
public record MetadataComment(CommentStyle style, TextRange comment, TextRange json, TextRange removal,
                              TextRange replace) {

    public String payload(String text) {
        return json.substring(text);
    }
}
