package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.meta.ValidationError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a record before it is written into a text. All problems are reported, not just the first one.
 */
public final class RecordValidator {

    private RecordValidator() {
    }

    public static List<ValidationError> validate(MetadataRecord record) {
        List<ValidationError> errors = new ArrayList<>();
        if (record.getId().isBlank()) {
            errors.add(new ValidationError("id", "must not be blank"));
        }
        if (!Double.isFinite(record.getX())) {
            errors.add(new ValidationError("x", "must be a finite number, was " + record.getX()));
        }
        if (!Double.isFinite(record.getY())) {
            errors.add(new ValidationError("y", "must be a finite number, was " + record.getY()));
        }
        checkUnique("tags", record.getTags(), errors);
        checkUnique("links", record.getLinks(), errors);
        checkUnique("anchors", record.getAnchors(), errors);
        String parent = record.getExtends();
        if (parent != null && parent.isBlank()) {
            errors.add(new ValidationError("extends", "must not be blank when present"));
        }
        return errors;
    }

    private static void checkUnique(String field, List<String> values, List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (!seen.add(value)) {
                errors.add(new ValidationError(field, "duplicate entry '" + value + "'"));
            }
        }
    }
}
