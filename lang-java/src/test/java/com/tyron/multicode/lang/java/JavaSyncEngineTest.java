package com.tyron.multicode.lang.java;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.sync.SyncMessage;
import com.tyron.multicode.api.sync.SyncResult;
import com.tyron.multicode.core.meta.MetadataStore;
import com.tyron.multicode.core.sync.SyncEngine;
import com.tyron.multicode.core.sync.SyncSettings;
import com.tyron.multicode.core.syntax.LanguageParserRegistry;
import com.tyron.multicode.core.syntax.SyntaxExtractor;
import com.tyron.multicode.testFramework.TestLoggingExtension;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import javax.tools.ToolProvider;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static com.tyron.multicode.testFramework.TestRecords.builder;
import static com.tyron.multicode.testFramework.TestRecords.record;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@ExtendWith(TestLoggingExtension.class)
class JavaSyncEngineTest {

    private static final String SOURCE = ""
            + "class Greeter {\n"
            + "    String greet(String name) {\n"
            + "        return \"Hello, \" + name;\n"
            + "    }\n"
            + "}\n";

    @BeforeAll
    static void requireCompiler() {
        assumeTrue(ToolProvider.getSystemJavaCompiler() != null, "JDK compiler required");
    }

    private static Block firstOfKind(List<Block> blocks, BlockKind kind) {
        return blocks.stream().filter(b -> b.kind() == kind).findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind));
    }

    @Test
    void javaParserIsDiscoveredFromTheClassPath() {
        LanguageParserRegistry registry = LanguageParserRegistry.withInstalledParsers();

        assertThat(registry.find(Lang.JAVA).orElseThrow()).isInstanceOf(JavaLanguageParser.class);
    }

    @Test
    void blockIdsSurviveAnAppendedMethod() {
        SyntaxExtractor extractor = new SyntaxExtractor(LanguageParserRegistry.withInstalledParsers());
        String extended = SOURCE.replace("    }\n}\n", "    }\n\n    void extra() {}\n}\n");

        Block before = firstOfKind(extractor.extract(SOURCE, Lang.JAVA).orElseThrow().blocks(),
                BlockKind.FUNCTION_DEFINE);
        Block after = firstOfKind(extractor.extract(extended, Lang.JAVA).orElseThrow().blocks(),
                BlockKind.FUNCTION_DEFINE);

        assertThat(after.visualId()).isEqualTo(before.visualId());
    }

    @Test
    void visualEditsRoundTripThroughJavaSource() throws Exception {
        SyncEngine engine = new SyncEngine(Lang.JAVA, LanguageParserRegistry.withInstalledParsers(),
                new MetadataStore(), SyncSettings.defaults());

        engine.handle(SyncMessage.textChanged(SOURCE, Lang.JAVA));
        String methodId = firstOfKind(engine.state().blocks(), BlockKind.FUNCTION_DEFINE).visualId();

        SyncResult placed = engine.handle(SyncMessage.visualChanged(record(methodId, 120, 40)));

        assertThat(placed.code()).startsWith("// @VISUAL_META {\"id\":\"" + methodId + "\"");
        assertThat(placed.code()).endsWith(SOURCE);
        assertThat(placed.diagnostics().parsed()).isTrue();
        assertThat(placed.diagnostics().parseErrors()).isEqualTo(0);
        assertThat(placed.diagnostics().orphanedIds()).isEmpty();
        assertThat(engine.state().mapper().rangeOf(methodId).orElseThrow().substring(placed.code()))
                .startsWith("String greet(String name)");

        SyncResult tagged = engine.handle(SyncMessage.visualChanged(
                builder(methodId, 120, 40).tag("greeting").translation("java", "void hi() {}").build()));
        assertThat(tagged.conflicts()).hasSize(1);
        assertThat(tagged.record(methodId).orElseThrow().getTranslations()).isEmpty();

        String current = engine.state().code();
        int offset = current.indexOf("name;");
        assertThat(engine.state().mapper().idAt(offset)).hasValue(methodId);
    }
}
