package com.tyron.multicode.lang.treesitter.python;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.testFramework.TestLoggingExtension;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@ExtendWith(TestLoggingExtension.class)
class PythonLanguageParserTest {

    private final PythonLanguageParser parser = new PythonLanguageParser();

    @BeforeAll
    static void requireNativeParser() {
        assumeTrue(new PythonLanguageParser().parse("", null).isPresent(), "tree-sitter native library required");
    }

    private record Visited(BlockKind kind, String rawKind, String text, List<String> anchors) {
    }

    private List<Visited> walk(String code) {
        ParsedSource source = parser.parse(code, null).orElseThrow();
        List<Visited> visited = new ArrayList<>();
        source.walk((kind, rawKind, range, anchors) -> visited.add(new Visited(kind, rawKind,
                range.substring(code), anchors.stream().map(a -> a.substring(code)).toList())));
        return visited;
    }

    private static Visited first(List<Visited> nodes, BlockKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind));
    }

    @Test
    void normalizesFunctions() {
        List<Visited> nodes = walk("def inc(x):\n    return x + 1\n");

        assertThat(nodes.get(0).kind()).isEqualTo(BlockKind.MODULE);
        Visited function = first(nodes, BlockKind.FUNCTION_DEFINE);
        assertThat(function.text()).startsWith("def inc(x):");
        assertThat(function.anchors()).containsExactly("inc");
        assertThat(first(nodes, BlockKind.RETURN).text()).isEqualTo("return x + 1");
        assertThat(first(nodes, BlockKind.OP_ADD).anchors()).containsExactly("+");
    }

    @Test
    void conditionalExpressionIsATernary() {
        List<Visited> nodes = walk("y = a if ok else b\n");

        Visited assignment = first(nodes, BlockKind.VARIABLE_SET);
        assertThat(assignment.anchors()).containsExactly("y");
        Visited ternary = first(nodes, BlockKind.OP_TERNARY);
        assertThat(ternary.text()).isEqualTo("a if ok else b");
        assertThat(ternary.anchors()).containsExactly("if");
    }

    @Test
    void comparisonsAndBooleanOperators() {
        List<Visited> nodes = walk("ok = a < b and c\n");

        assertThat(first(nodes, BlockKind.OP_AND).anchors()).containsExactly("and");
        Visited less = first(nodes, BlockKind.OP_LT);
        assertThat(less.text()).isEqualTo("a < b");
        assertThat(less.anchors()).containsExactly("<");
    }

    @Test
    void callsAndLoops() {
        List<Visited> nodes = walk("for item in items:\n    print(item)\n");

        assertThat(first(nodes, BlockKind.LOOP).rawKind()).isEqualTo("for_statement");
        assertThat(first(nodes, BlockKind.FUNCTION_CALL).text()).isEqualTo("print(item)");
    }

    @Test
    void commentsProduceNoBlocks() {
        List<Visited> nodes = walk("# @VISUAL_META {\"id\":\"x\",\"x\":0,\"y\":0}\nx = 1\n");

        assertThat(nodes.stream().map(Visited::rawKind).toList()).doesNotContain("comment");
    }
}
