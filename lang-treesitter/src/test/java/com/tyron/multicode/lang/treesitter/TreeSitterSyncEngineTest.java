package com.tyron.multicode.lang.treesitter;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.sync.SyncMessage;
import com.tyron.multicode.api.sync.SyncResult;
import com.tyron.multicode.core.meta.MetadataStore;
import com.tyron.multicode.core.sync.SyncEngine;
import com.tyron.multicode.core.sync.SyncSettings;
import com.tyron.multicode.core.syntax.LanguageParserRegistry;
import com.tyron.multicode.lang.treesitter.python.PythonLanguageParser;
import com.tyron.multicode.lang.treesitter.rust.RustLanguageParser;
import com.tyron.multicode.testFramework.TestLoggingExtension;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static com.tyron.multicode.testFramework.TestRecords.record;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@ExtendWith(TestLoggingExtension.class)
class TreeSitterSyncEngineTest {

    @BeforeAll
    static void requireNativeParser() {
        assumeTrue(new RustLanguageParser().parse("", null).isPresent(), "tree-sitter native library required");
    }

    private static Block firstOfKind(List<Block> blocks, BlockKind kind) {
        return blocks.stream().filter(b -> b.kind() == kind).findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind));
    }

    private static SyncEngine engine(Lang lang) {
        return new SyncEngine(lang, LanguageParserRegistry.withInstalledParsers(), new MetadataStore(),
                SyncSettings.defaults());
    }

    @Test
    void grammarsAreDiscoveredFromTheClassPath() {
        LanguageParserRegistry registry = LanguageParserRegistry.withInstalledParsers();

        assertThat(registry.find(Lang.RUST).orElseThrow()).isInstanceOf(RustLanguageParser.class);
        assertThat(registry.find(Lang.PYTHON).orElseThrow()).isInstanceOf(PythonLanguageParser.class);
    }

    @Test
    void rustFunctionKeepsItsIdOnceAnnotated() throws Exception {
        String source = "fn area(w: u32, h: u32) -> u32 {\n    w * h\n}\n";
        SyncEngine engine = engine(Lang.RUST);

        engine.handle(SyncMessage.textChanged(source, Lang.RUST));
        String id = firstOfKind(engine.state().blocks(), BlockKind.FUNCTION_DEFINE).visualId();
        SyncResult placed = engine.handle(SyncMessage.visualChanged(record(id, 40, 80)));

        assertThat(placed.code()).startsWith("// @VISUAL_META {\"id\":\"" + id + "\"");
        assertThat(placed.code()).endsWith(source);
        assertThat(placed.diagnostics().parseErrors()).isEqualTo(0);
        assertThat(placed.diagnostics().orphanedIds()).isEmpty();
        assertThat(firstOfKind(engine.state().blocks(), BlockKind.FUNCTION_DEFINE).visualId()).isEqualTo(id);
        assertThat(engine.state().mapper().rangeOf(id).orElseThrow().substring(placed.code()))
                .startsWith("fn area(");
    }

    @Test
    void pythonMetadataUsesHashComments() throws Exception {
        String source = "def inc(x):\n    return x + 1\n";
        SyncEngine engine = engine(Lang.PYTHON);

        engine.handle(SyncMessage.textChanged(source, Lang.PYTHON));
        String id = firstOfKind(engine.state().blocks(), BlockKind.FUNCTION_DEFINE).visualId();
        SyncResult placed = engine.handle(SyncMessage.visualChanged(record(id, 1, 2)));

        assertThat(placed.code()).startsWith("# @VISUAL_META {\"id\":\"" + id + "\"");
        assertThat(placed.diagnostics().parsed()).isTrue();
        assertThat(placed.diagnostics().parseErrors()).isEqualTo(0);
        assertThat(placed.record(id).orElseThrow().getX()).isEqualTo(1.0);
        assertThat(engine.state().mapper().idAt(placed.code().indexOf("return"))).hasValue(id);
    }
}
