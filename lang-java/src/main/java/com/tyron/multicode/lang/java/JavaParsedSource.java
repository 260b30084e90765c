package com.tyron.multicode.lang.java;

import com.sun.source.tree.BinaryTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ConditionalExpressionTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreeScanner;
import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.NodeVisitor;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.TextRange;

import java.util.List;

/**
 * A javac syntax tree of one text snapshot. Only parsed, never attributed.
 */
final class JavaParsedSource implements ParsedSource {

    private final String text;
    private final CompilationUnitTree unit;
    private final SourcePositions positions;
    private final int errorCount;

    JavaParsedSource(String text, CompilationUnitTree unit, SourcePositions positions, int errorCount) {
        this.text = text;
        this.unit = unit;
        this.positions = positions;
        this.errorCount = errorCount;
    }

    @Override
    public Lang lang() {
        return Lang.JAVA;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int errorCount() {
        return errorCount;
    }

    @Override
    public void walk(NodeVisitor visitor) {
        new TreeScanner<Void, Void>() {
            @Override
            public Void scan(Tree tree, Void unused) {
                if (tree == null) {
                    return null;
                }
                long start = positions.getStartPosition(unit, tree);
                long end = positions.getEndPosition(unit, tree);
                if (start >= 0 && end > start && end <= text.length()) {
                    TextRange range = TextRange.of((int) start, (int) end);
                    BlockKind kind = JavaBlockKinds.of(tree.getKind());
                    visitor.visit(kind, JavaBlockKinds.rawName(tree.getKind()), range, anchors(tree, kind, range));
                }
                return super.scan(tree, unused);
            }
        }.scan(unit, null);
    }

    private List<TextRange> anchors(Tree tree, BlockKind kind, TextRange range) {
        if (tree instanceof BinaryTree binary && kind.operatorSymbol() != null) {
            return between(binary.getLeftOperand(), binary.getRightOperand(), kind.operatorSymbol());
        }
        if (tree instanceof ConditionalExpressionTree conditional) {
            return between(conditional.getCondition(), conditional.getTrueExpression(), "?");
        }
        if (kind == BlockKind.VARIABLE_GET) {
            return List.of(range);
        }
        if (tree instanceof VariableTree variable) {
            String name = variable.getName().toString();
            long typeEnd = variable.getType() == null ? -1 : positions.getEndPosition(unit, variable.getType());
            int from = (int) Math.max(range.start(), typeEnd);
            int at = text.indexOf(name, from);
            if (!name.isEmpty() && at >= 0 && at + name.length() <= range.end()) {
                return List.of(TextRange.of(at, at + name.length()));
            }
        }
        return List.of();
    }

    /**
     * Finds {@code symbol} in the source between two operands.
     */
    private List<TextRange> between(Tree left, Tree right, String symbol) {
        long from = positions.getEndPosition(unit, left);
        long to = positions.getStartPosition(unit, right);
        if (from < 0 || to < from || to > text.length()) {
            return List.of();
        }
        int at = text.indexOf(symbol, (int) from);
        if (at < 0 || at + symbol.length() > to) {
            return List.of();
        }
        return List.of(TextRange.of(at, at + symbol.length()));
    }
}
