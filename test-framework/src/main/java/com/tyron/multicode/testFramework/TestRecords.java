package com.tyron.multicode.testFramework;

import com.tyron.multicode.api.meta.MetadataRecord;

/**
 * Shorthands for metadata records used across tests.
 */
public final class TestRecords {

    private TestRecords() {
    }

    public static MetadataRecord record(String id) {
        return MetadataRecord.builder(id).build();
    }

    public static MetadataRecord record(String id, double x, double y) {
        return MetadataRecord.builder(id).position(x, y).build();
    }

    public static MetadataRecord.Builder builder(String id, double x, double y) {
        return MetadataRecord.builder(id).position(x, y);
    }
}
