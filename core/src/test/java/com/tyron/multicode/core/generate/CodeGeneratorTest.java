package com.tyron.multicode.core.generate;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.model.TextRange;
import com.tyron.multicode.core.meta.MetadataStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static com.tyron.multicode.testFramework.TestRecords.builder;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CodeGeneratorTest {

    private final MetadataStore store = new MetadataStore();

    private final List<MetadataRecord> records = List.of(
            builder("last", 0, 10).translation("rust", "let b = 2;").build(),
            builder("right", 5, 0).translation("rust", "let a = 1;").build(),
            builder("left", 1, 0).translation("rust", "let z = 0;\n").translation("en", "Zero").build());

    private static List<Block> blocksFor(String... ids) {
        int offset = 0;
        List<Block> blocks = new ArrayList<>();
        for (String id : ids) {
            blocks.add(new Block(id, BlockKind.STATEMENT, "statement", TextRange.of(offset, offset + 1), List.of()));
            offset += 2;
        }
        return blocks;
    }

    @Test
    void laysOutTopToBottomThenLeftToRight() throws Exception {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, false);

        String code = generator.generate(records, blocksFor("last", "right", "left"));

        assertThat(code).isEqualTo("let z = 0;\nlet a = 1;\nlet b = 2;\n");
    }

    @Test
    void metadataCommentFollowsEachSnippet() throws Exception {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, true);

        String code = generator.generate(records, blocksFor("last", "right", "left"));

        String[] lines = code.split("\n");
        assertThat(lines).hasLength(6);
        assertThat(lines[0]).isEqualTo("let z = 0;");
        assertThat(lines[1]).startsWith("// @VISUAL_META {\"id\":\"left\"");
        assertThat(lines[3]).startsWith("// @VISUAL_META {\"id\":\"right\"");
        assertThat(store.readAll(code).stream().map(MetadataRecord::getId).toList())
                .containsExactly("left", "right", "last").inOrder();
    }

    @Test
    void outputIsDeterministic() throws Exception {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, true);
        List<Block> blocks = blocksFor("last", "right", "left");

        assertThat(generator.generate(records, blocks)).isEqualTo(generator.generate(records, blocks));
    }

    @Test
    void missingTranslationEmitsOnlyTheComment() throws Exception {
        CodeGenerator generator = new CodeGenerator(Lang.PYTHON, store, true);

        String code = generator.generate(List.of(builder("p", 0, 0).build()), blocksFor("p"));

        assertThat(code).startsWith("# @VISUAL_META {\"id\":\"p\"");
        assertThat(code.split("\n")).hasLength(1);
    }

    @Test
    void everyMissingBlockIsReported() {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, true);

        MissingBlocksException e = assertThrows(MissingBlocksException.class,
                () -> generator.generate(records, blocksFor("right")));

        assertThat(e.getMissingIds()).containsExactly("last", "left").inOrder();
    }

    @Test
    void everyInvalidRecordIsReportedBeforeAnythingIsEmitted() {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, false);
        List<MetadataRecord> invalid = List.of(
                builder("ok", 0, 0).build(),
                builder("tags", 0, 1).tag("t").tag("t").build(),
                builder("anchors", 0, 2).anchor("a").anchor("a").build());

        InvalidMetadataException e = assertThrows(InvalidMetadataException.class,
                () -> generator.generate(invalid, blocksFor("ok", "tags", "anchors")));

        assertThat(e.getInvalidIds()).containsExactly("tags", "anchors").inOrder();
        assertThat(e.getErrors().get("tags").get(0).field()).isEqualTo("tags");
    }

    @Test
    void indentsGeneratedCode() throws Exception {
        CodeGenerator generator = new CodeGenerator(Lang.RUST, store, false);

        String code = generator.generate(records, blocksFor("last", "right", "left"), 2, IndentStyle.SPACES);

        assertThat(code).isEqualTo("  let z = 0;\n  let a = 1;\n  let b = 2;\n");
    }
}
