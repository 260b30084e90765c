package com.tyron.multicode.lang.treesitter.python;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.lang.treesitter.NodeKinds;

final class PythonNodeKinds {

    static final NodeKinds KINDS = NodeKinds.builder()
            .kind(BlockKind.MODULE, "module")
            .kind(BlockKind.CLASS_DEFINE, "class_definition")
            .kind(BlockKind.FUNCTION_DEFINE, "function_definition", "lambda")
            .kind(BlockKind.FUNCTION_CALL, "call")
            .kind(BlockKind.RETURN, "return_statement")
            .kind(BlockKind.VARIABLE_GET, "identifier")
            .kind(BlockKind.VARIABLE_SET, "assignment", "augmented_assignment")
            .kind(BlockKind.CONDITION, "if_statement", "match_statement")
            .kind(BlockKind.LOOP, "for_statement", "while_statement")
            .kind(BlockKind.LITERAL, "integer", "float", "string", "true", "false", "none")
            .kind(BlockKind.BLOCK, "block")
            .kind(BlockKind.STATEMENT, "expression_statement")
            .operator("binary_operator", "operator")
            .operator("boolean_operator", "operator")
            .operator("comparison_operator", "operators")
            .ternary("conditional_expression", "if")
            .name("name", "function_definition", "class_definition")
            .name("left", "assignment", "augmented_assignment")
            .skip("comment")
            .build();

    private PythonNodeKinds() {
    }
}
