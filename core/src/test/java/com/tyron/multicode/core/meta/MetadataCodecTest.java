package com.tyron.multicode.core.meta;

import com.fasterxml.jackson.databind.JsonNode;
import com.tyron.multicode.api.meta.AiNote;
import com.tyron.multicode.api.meta.MetadataRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;

class MetadataCodecTest {

    private final MetadataCodec codec = new MetadataCodec();

    @Test
    void unknownTopLevelFieldsMoveIntoExtras() {
        MetadataRecord record = codec.decode(
                "{\"id\":\"a\",\"x\":1,\"y\":2,\"color\":\"red\",\"k\":\"top\",\"extras\":{\"k\":\"inner\"}}").orElseThrow();

        JsonNode extras = record.getExtras();
        assertThat(extras).isNotNull();
        assertThat(extras.get("color").asText()).isEqualTo("red");
        assertThat(extras.get("k").asText()).isEqualTo("inner");
    }

    @Test
    void missingOptionalFieldsGetDefaults() {
        MetadataRecord record = codec.decode("{\"id\":\"a\",\"x\":1.5,\"y\":-2}").orElseThrow();

        assertThat(record.getVersion()).isEqualTo(MetadataRecord.DEFAULT_VERSION);
        assertThat(record.getX()).isEqualTo(1.5);
        assertThat(record.getY()).isEqualTo(-2.0);
        assertThat(record.getTags()).isEmpty();
        assertThat(record.getTranslations()).isEmpty();
        assertThat(record.getExtends()).isNull();
        assertThat(record.getAi()).isNull();
        assertThat(record.getUpdatedAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void versionBelowOneIsMigrated() {
        assertThat(codec.decode("{\"id\":\"a\",\"x\":0,\"y\":0,\"version\":0}").orElseThrow().getVersion())
                .isEqualTo(1);
        assertThat(codec.decode("{\"id\":\"a\",\"x\":0,\"y\":0,\"version\":7}").orElseThrow().getVersion())
                .isEqualTo(7);
    }

    @Test
    void malformedPayloadsAreRejected() {
        assertThat(codec.decode("not json")).isEmpty();
        assertThat(codec.decode("[1,2]")).isEmpty();
        assertThat(codec.decode("{\"id\":\"a\"}")).isEmpty();
        assertThat(codec.decode("{\"id\":3,\"x\":0,\"y\":0}")).isEmpty();
        assertThat(codec.decode("{\"id\":\"a\",\"x\":0,\"y\":0,\"tags\":\"one\"}")).isEmpty();
        assertThat(codec.decode("{\"id\":\"a\",\"x\":0,\"y\":0,\"updated_at\":\"yesterday\"}")).isEmpty();
    }

    @Test
    void encodesOnOneLineAndReadsBack() {
        MetadataRecord record = MetadataRecord.builder("node-1")
                .version(3)
                .position(10, 20.5)
                .tag("io").tag("hot")
                .link("https://example.org/doc")
                .anchor("a1")
                .test("node_test")
                .extendsId("base")
                .origin("lib/util.rs")
                .translation("en", "Read file")
                .translation("rust", "let f = open();")
                .ai(new AiNote("Opens the file", List.of("check errors")))
                .updatedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        String json = codec.encode(record);

        assertThat(json).doesNotContain("\n");
        assertThat(json).contains("\"updated_at\":\"2024-05-01T10:00:00Z\"");
        Optional<MetadataRecord> decoded = codec.decode(json);
        assertThat(decoded).hasValue(record);
    }
}
