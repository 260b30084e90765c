package com.tyron.multicode.lang.treesitter;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.NodeVisitor;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.model.TextRange;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.util.List;

/**
 * A tree-sitter concrete syntax tree of one text snapshot.
 *
 * Only named nodes are walked; anonymous tokens such as punctuation surface as anchors of the node they belong
 * to instead.
 */
final class TreeSitterParsedSource implements ParsedSource {

    private final Lang lang;
    private final String text;
    private final TSTree tree;
    private final NodeKinds kinds;
    private final Utf8Offsets offsets;
    private int errorCount = -1;

    TreeSitterParsedSource(Lang lang, String text, TSTree tree, NodeKinds kinds) {
        this.lang = lang;
        this.text = text;
        this.tree = tree;
        this.kinds = kinds;
        this.offsets = Utf8Offsets.of(text);
    }

    @Override
    public Lang lang() {
        return lang;
    }

    @Override
    public String text() {
        return text;
    }

    /**
     * @return the number of {@code ERROR} and missing nodes
     */
    @Override
    public synchronized int errorCount() {
        if (errorCount < 0) {
            TSNode root = tree.getRootNode();
            errorCount = root.hasError() ? countErrors(root) : 0;
        }
        return errorCount;
    }

    private static int countErrors(TSNode node) {
        int count = "ERROR".equals(node.getType()) || node.isMissing() ? 1 : 0;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                count += countErrors(child);
            }
        }
        return count;
    }

    @Override
    public void walk(NodeVisitor visitor) {
        visit(tree.getRootNode(), visitor);
    }

    private void visit(TSNode node, NodeVisitor visitor) {
        String type = node.getType();
        if (kinds.isSkipped(type)) {
            return;
        }
        TextRange range = range(node);
        if (!range.isEmpty()) {
            String operatorField = kinds.operatorField(type);
            if (operatorField != null) {
                TSNode operator = node.getChildByFieldName(operatorField);
                BlockKind kind = operator.isNull() ? BlockKind.OTHER : NodeKinds.operator(operator.getType());
                visitor.visit(kind, type, range, kind.isOperator() ? List.of(range(operator)) : List.of());
            } else {
                BlockKind kind = kinds.of(type);
                visitor.visit(kind, type, range, anchors(node, type, kind, range));
            }
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            visit(node.getNamedChild(i), visitor);
        }
    }

    private List<TextRange> anchors(TSNode node, String type, BlockKind kind, TextRange range) {
        if (kind == BlockKind.VARIABLE_GET) {
            return List.of(range);
        }
        String token = kinds.ternaryToken(type);
        if (token != null) {
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode child = node.getChild(i);
                if (!child.isNamed() && token.equals(child.getType())) {
                    return List.of(range(child));
                }
            }
            return List.of();
        }
        String nameField = kinds.nameField(type);
        if (nameField != null) {
            TSNode name = node.getChildByFieldName(nameField);
            if (!name.isNull() && !range(name).isEmpty()) {
                return List.of(range(name));
            }
        }
        return List.of();
    }

    private TextRange range(TSNode node) {
        int start = offsets.toChar(node.getStartByte());
        int end = offsets.toChar(node.getEndByte());
        return TextRange.of(start, Math.max(start, end));
    }
}
