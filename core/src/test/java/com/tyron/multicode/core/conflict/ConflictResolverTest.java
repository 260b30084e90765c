package com.tyron.multicode.core.conflict;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tyron.multicode.api.meta.AiNote;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.sync.ConflictType;
import com.tyron.multicode.api.sync.Resolution;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static com.tyron.multicode.testFramework.TestRecords.builder;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConflictResolverTest {

    @Test
    void structuralChangeKeepsTextSideEvenAgainstNewerVisual() {
        MetadataRecord text = builder("n", 0, 0).version(1).translation("en", "Hello").build();
        MetadataRecord visual = builder("n", 50, 60).version(5).translation("en", "Hola").tag("new").build();

        Resolved resolved = ConflictResolver.resolve(text, visual);

        assertThat(resolved.conflict().type()).isEqualTo(ConflictType.STRUCTURAL);
        assertThat(resolved.conflict().resolution()).isEqualTo(Resolution.TEXT);
        assertThat(resolved.record().getTranslations()).containsExactly("en", "Hello");
        assertThat(resolved.record().getX()).isEqualTo(0.0);
        assertThat(resolved.record().getTags()).isEmpty();
        assertThat(resolved.record().getVersion()).isEqualTo(5);
    }

    @Test
    void changedExtendsOrOriginIsStructural() {
        MetadataRecord text = builder("n", 0, 0).extendsId("a").build();

        assertThat(ConflictResolver.detect(text, text.toBuilder().extendsId("b").build()))
                .hasValue(ConflictType.STRUCTURAL);
        assertThat(ConflictResolver.detect(text, text.toBuilder().origin("elsewhere.rs").build()))
                .hasValue(ConflictType.STRUCTURAL);
    }

    @Test
    void pureMovementTakesVisualSide() {
        MetadataRecord text = builder("n", 0, 0).version(2).tag("t").build();
        MetadataRecord visual = text.toBuilder().position(30, 40).version(1).build();

        Resolved resolved = ConflictResolver.resolve(text, visual);

        assertThat(resolved.conflict().type()).isEqualTo(ConflictType.MOVEMENT);
        assertThat(resolved.conflict().resolution()).isEqualTo(Resolution.VISUAL);
        assertThat(resolved.record().getX()).isEqualTo(30.0);
        assertThat(resolved.record().getY()).isEqualTo(40.0);
        assertThat(resolved.record().getVersion()).isEqualTo(2);
    }

    @Test
    void movementWithAuxiliaryChangesMerges() {
        MetadataRecord text = builder("n", 0, 0).tag("a").build();
        MetadataRecord visual = builder("n", 7, 8).tag("b").build();

        Resolved resolved = ConflictResolver.resolve(text, visual);

        assertThat(resolved.conflict().type()).isEqualTo(ConflictType.MOVEMENT);
        assertThat(resolved.conflict().resolution()).isEqualTo(Resolution.MERGE);
        assertThat(resolved.record().getX()).isEqualTo(7.0);
        assertThat(resolved.record().getTags()).containsExactly("a", "b").inOrder();
    }

    @Test
    void auxiliaryOnlyChangesMerge() {
        MetadataRecord text = builder("n", 1, 1)
                .tag("a").link("l1").test("t1")
                .ai(new AiNote("text side", List.of("h1")))
                .extras(JsonNodeFactory.instance.objectNode().put("color", "red").put("size", 1))
                .build();
        MetadataRecord visual = builder("n", 1, 1)
                .tag("b").tag("a").link("l2")
                .ai(new AiNote("visual side", List.of("h2")))
                .extras(JsonNodeFactory.instance.objectNode().put("color", "blue"))
                .build();

        Resolved resolved = ConflictResolver.resolve(text, visual);

        MetadataRecord merged = resolved.record();
        assertThat(resolved.conflict().type()).isEqualTo(ConflictType.META_COMMENT);
        assertThat(resolved.conflict().resolution()).isEqualTo(Resolution.MERGE);
        assertThat(merged.getTags()).containsExactly("a", "b").inOrder();
        assertThat(merged.getLinks()).containsExactly("l1", "l2").inOrder();
        assertThat(merged.getTests()).containsExactly("t1");
        assertThat(merged.getAi().description()).isEqualTo("visual side");
        assertThat(merged.getAi().hints()).containsExactly("h1", "h2").inOrder();
        assertThat(merged.getExtras().get("color").asText()).isEqualTo("blue");
        assertThat(merged.getExtras().get("size").asInt()).isEqualTo(1);
    }

    @Test
    void blankVisualDescriptionKeepsTextDescription() {
        MetadataRecord text = builder("n", 0, 0).ai(new AiNote("keep me", List.of())).build();
        MetadataRecord visual = builder("n", 0, 0).ai(new AiNote("", List.of("hint"))).build();

        MetadataRecord merged = ConflictResolver.resolve(text, visual).record();

        assertThat(merged.getAi().description()).isEqualTo("keep me");
        assertThat(merged.getAi().hints()).containsExactly("hint");
    }

    @Test
    void identicalRecordsDoNotConflict() {
        MetadataRecord record = builder("n", 3, 4).tag("t").translation("en", "x").build();

        assertThat(ConflictResolver.detect(record, record.withVersion(9))).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> ConflictResolver.resolve(record, record));
    }

    @Test
    void differentIdsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ConflictResolver.resolve(builder("a", 0, 0).build(), builder("b", 1, 0).build()));
    }
}
