package com.tyron.multicode.api.meta;

/**
 * One problem found while validating a {@link MetadataRecord}.
 */
public record ValidationError(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
