package com.tyron.multicode.lang.java;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.TextRange;
import com.tyron.multicode.testFramework.TestLoggingExtension;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import javax.tools.ToolProvider;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@ExtendWith(TestLoggingExtension.class)
class JavaLanguageParserTest {

    private static final String SOURCE = ""
            + "package demo;\n"
            + "\n"
            + "class Counter {\n"
            + "    int total(int[] values, int limit) {\n"
            + "        int sum = 0;\n"
            + "        for (int v : values) {\n"
            + "            if (v > limit) {\n"
            + "                sum += v;\n"
            + "            }\n"
            + "        }\n"
            + "        System.out.println(\"done\");\n"
            + "        return sum + 1 > 2 ? sum : limit;\n"
            + "    }\n"
            + "}\n";

    private final JavaLanguageParser parser = new JavaLanguageParser();

    @BeforeAll
    static void requireCompiler() {
        assumeTrue(ToolProvider.getSystemJavaCompiler() != null, "JDK compiler required");
    }

    private record Visited(BlockKind kind, String rawKind, TextRange range, List<TextRange> anchors) {
    }

    private static List<Visited> walk(ParsedSource source) {
        List<Visited> visited = new ArrayList<>();
        source.walk((kind, rawKind, range, anchors) -> visited.add(new Visited(kind, rawKind, range, anchors)));
        return visited;
    }

    private static Visited first(List<Visited> nodes, BlockKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind));
    }

    @Test
    void normalizesJavaConstructs() {
        ParsedSource source = parser.parse(SOURCE, null).orElseThrow();

        assertThat(source.lang()).isEqualTo(Lang.JAVA);
        assertThat(source.errorCount()).isEqualTo(0);
        List<BlockKind> kinds = walk(source).stream().map(Visited::kind).toList();
        assertThat(kinds).containsAtLeast(
                BlockKind.CLASS_DEFINE,
                BlockKind.FUNCTION_DEFINE,
                BlockKind.VARIABLE_SET,
                BlockKind.LOOP,
                BlockKind.CONDITION,
                BlockKind.OP_GT,
                BlockKind.FUNCTION_CALL,
                BlockKind.LITERAL,
                BlockKind.RETURN,
                BlockKind.OP_ADD,
                BlockKind.OP_TERNARY,
                BlockKind.VARIABLE_GET,
                BlockKind.BLOCK,
                BlockKind.STATEMENT);
    }

    @Test
    void nodesComeInPreOrderWithSourceRanges() {
        List<Visited> nodes = walk(parser.parse(SOURCE, null).orElseThrow());

        Visited clazz = first(nodes, BlockKind.CLASS_DEFINE);
        Visited method = first(nodes, BlockKind.FUNCTION_DEFINE);
        assertThat(nodes.indexOf(clazz)).isLessThan(nodes.indexOf(method));
        assertThat(clazz.rawKind()).isEqualTo("class");
        assertThat(clazz.range().substring(SOURCE)).startsWith("class Counter");
        assertThat(clazz.range().contains(method.range())).isTrue();
        assertThat(first(nodes, BlockKind.RETURN).range().substring(SOURCE))
                .isEqualTo("return sum + 1 > 2 ? sum : limit;");
    }

    @Test
    void operatorsAndIdentifiersCarryAnchors() {
        List<Visited> nodes = walk(parser.parse(SOURCE, null).orElseThrow());

        Visited add = first(nodes, BlockKind.OP_ADD);
        assertThat(add.anchors()).hasSize(1);
        assertThat(add.anchors().get(0).substring(SOURCE)).isEqualTo("+");

        Visited greater = first(nodes, BlockKind.OP_GT);
        assertThat(greater.anchors().get(0).substring(SOURCE)).isEqualTo(">");

        Visited ternary = first(nodes, BlockKind.OP_TERNARY);
        assertThat(ternary.anchors().get(0).substring(SOURCE)).isEqualTo("?");

        Visited identifier = first(nodes, BlockKind.VARIABLE_GET);
        assertThat(identifier.anchors()).containsExactly(identifier.range());

        Visited sum = nodes.stream()
                .filter(n -> n.kind() == BlockKind.VARIABLE_SET && n.range().substring(SOURCE).startsWith("int sum"))
                .findFirst().orElseThrow();
        assertThat(sum.anchors().get(0).substring(SOURCE)).isEqualTo("sum");
    }

    @Test
    void syntaxErrorsStillProduceATree() {
        String broken = "class Broken {\n    void m() {\n        int x = ;\n    }\n}\n";

        ParsedSource source = parser.parse(broken, null).orElseThrow();

        assertThat(source.errorCount()).isGreaterThan(0);
        List<BlockKind> kinds = walk(source).stream().map(Visited::kind).toList();
        assertThat(kinds).contains(BlockKind.CLASS_DEFINE);
        assertThat(kinds).contains(BlockKind.FUNCTION_DEFINE);
    }

    @Test
    void identicalTextReusesTheTree() {
        ParsedSource first = parser.parse(SOURCE, null).orElseThrow();

        assertThat(parser.parse(SOURCE, first).orElseThrow()).isSameInstanceAs(first);
        assertThat(parser.parse(SOURCE + "\n", first).orElseThrow()).isNotSameInstanceAs(first);
    }
}
