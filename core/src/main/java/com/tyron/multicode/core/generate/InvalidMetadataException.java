package com.tyron.multicode.core.generate;

import com.tyron.multicode.api.meta.ValidationError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Code generation was asked for records that would not survive a round trip through their comments.
 */
public class InvalidMetadataException extends GenerationException {

    private final Map<String, List<ValidationError>> errors;

    /**
     * @param errors problems per record id, in record order
     */
    public InvalidMetadataException(Map<String, List<ValidationError>> errors) {
        super("Invalid metadata " + errors);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public List<String> getInvalidIds() {
        return List.copyOf(errors.keySet());
    }

    public Map<String, List<ValidationError>> getErrors() {
        return errors;
    }
}
