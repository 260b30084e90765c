package com.tyron.multicode.lang.treesitter.rust;

import com.tyron.multicode.api.language.BlockKind;
import com.tyron.multicode.lang.treesitter.NodeKinds;

final class RustNodeKinds {

    static final NodeKinds KINDS = NodeKinds.builder()
            .kind(BlockKind.MODULE, "source_file")
            .kind(BlockKind.CLASS_DEFINE, "struct_item", "enum_item", "union_item", "trait_item", "impl_item",
                    "mod_item")
            .kind(BlockKind.FUNCTION_DEFINE, "function_item", "function_signature_item", "closure_expression")
            .kind(BlockKind.FUNCTION_CALL, "call_expression", "macro_invocation")
            .kind(BlockKind.RETURN, "return_expression")
            .kind(BlockKind.VARIABLE_GET, "identifier")
            .kind(BlockKind.VARIABLE_SET, "let_declaration", "assignment_expression", "compound_assignment_expr")
            .kind(BlockKind.CONDITION, "if_expression", "match_expression")
            .kind(BlockKind.LOOP, "for_expression", "while_expression", "loop_expression")
            .kind(BlockKind.LITERAL, "integer_literal", "float_literal", "string_literal", "raw_string_literal",
                    "char_literal", "boolean_literal")
            .kind(BlockKind.BLOCK, "block")
            .kind(BlockKind.STATEMENT, "expression_statement")
            .operator("binary_expression", "operator")
            .name("name", "function_item", "function_signature_item", "struct_item", "enum_item", "union_item",
                    "trait_item", "mod_item")
            .name("pattern", "let_declaration")
            .name("left", "assignment_expression", "compound_assignment_expr")
            .skip("line_comment", "block_comment")
            .build();

    private RustNodeKinds() {
    }
}
