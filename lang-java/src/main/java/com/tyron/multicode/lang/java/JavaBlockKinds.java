package com.tyron.multicode.lang.java;

import com.sun.source.tree.Tree;
import com.tyron.multicode.api.language.BlockKind;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes javac tree kinds into {@link BlockKind}s.
 */
final class JavaBlockKinds {

    private static final Map<Tree.Kind, BlockKind> KINDS = new EnumMap<>(Tree.Kind.class);

    static {
        KINDS.put(Tree.Kind.COMPILATION_UNIT, BlockKind.MODULE);

        KINDS.put(Tree.Kind.CLASS, BlockKind.CLASS_DEFINE);
        KINDS.put(Tree.Kind.INTERFACE, BlockKind.CLASS_DEFINE);
        KINDS.put(Tree.Kind.ENUM, BlockKind.CLASS_DEFINE);
        KINDS.put(Tree.Kind.ANNOTATION_TYPE, BlockKind.CLASS_DEFINE);
        KINDS.put(Tree.Kind.RECORD, BlockKind.CLASS_DEFINE);

        KINDS.put(Tree.Kind.METHOD, BlockKind.FUNCTION_DEFINE);
        KINDS.put(Tree.Kind.LAMBDA_EXPRESSION, BlockKind.FUNCTION_DEFINE);
        KINDS.put(Tree.Kind.METHOD_INVOCATION, BlockKind.FUNCTION_CALL);
        KINDS.put(Tree.Kind.NEW_CLASS, BlockKind.FUNCTION_CALL);
        KINDS.put(Tree.Kind.RETURN, BlockKind.RETURN);

        KINDS.put(Tree.Kind.IDENTIFIER, BlockKind.VARIABLE_GET);
        KINDS.put(Tree.Kind.VARIABLE, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.ASSIGNMENT, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.PLUS_ASSIGNMENT, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.MINUS_ASSIGNMENT, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.MULTIPLY_ASSIGNMENT, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.DIVIDE_ASSIGNMENT, BlockKind.VARIABLE_SET);
        KINDS.put(Tree.Kind.REMAINDER_ASSIGNMENT, BlockKind.VARIABLE_SET);

        KINDS.put(Tree.Kind.IF, BlockKind.CONDITION);
        KINDS.put(Tree.Kind.SWITCH, BlockKind.CONDITION);
        KINDS.put(Tree.Kind.SWITCH_EXPRESSION, BlockKind.CONDITION);

        KINDS.put(Tree.Kind.FOR_LOOP, BlockKind.LOOP);
        KINDS.put(Tree.Kind.ENHANCED_FOR_LOOP, BlockKind.LOOP);
        KINDS.put(Tree.Kind.WHILE_LOOP, BlockKind.LOOP);
        KINDS.put(Tree.Kind.DO_WHILE_LOOP, BlockKind.LOOP);

        KINDS.put(Tree.Kind.INT_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.LONG_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.FLOAT_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.DOUBLE_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.BOOLEAN_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.CHAR_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.STRING_LITERAL, BlockKind.LITERAL);
        KINDS.put(Tree.Kind.NULL_LITERAL, BlockKind.LITERAL);

        KINDS.put(Tree.Kind.BLOCK, BlockKind.BLOCK);
        KINDS.put(Tree.Kind.EXPRESSION_STATEMENT, BlockKind.STATEMENT);

        KINDS.put(Tree.Kind.PLUS, BlockKind.OP_ADD);
        KINDS.put(Tree.Kind.MINUS, BlockKind.OP_SUB);
        KINDS.put(Tree.Kind.MULTIPLY, BlockKind.OP_MUL);
        KINDS.put(Tree.Kind.DIVIDE, BlockKind.OP_DIV);
        KINDS.put(Tree.Kind.REMAINDER, BlockKind.OP_MOD);
        KINDS.put(Tree.Kind.CONDITIONAL_AND, BlockKind.OP_AND);
        KINDS.put(Tree.Kind.CONDITIONAL_OR, BlockKind.OP_OR);
        KINDS.put(Tree.Kind.EQUAL_TO, BlockKind.OP_EQ);
        KINDS.put(Tree.Kind.NOT_EQUAL_TO, BlockKind.OP_NE);
        KINDS.put(Tree.Kind.GREATER_THAN, BlockKind.OP_GT);
        KINDS.put(Tree.Kind.GREATER_THAN_EQUAL, BlockKind.OP_GE);
        KINDS.put(Tree.Kind.LESS_THAN, BlockKind.OP_LT);
        KINDS.put(Tree.Kind.LESS_THAN_EQUAL, BlockKind.OP_LE);
        KINDS.put(Tree.Kind.CONDITIONAL_EXPRESSION, BlockKind.OP_TERNARY);

        KINDS.put(Tree.Kind.ERRONEOUS, BlockKind.ERROR);
    }

    private JavaBlockKinds() {
    }

    static BlockKind of(Tree.Kind kind) {
        return KINDS.getOrDefault(kind, BlockKind.OTHER);
    }

    static String rawName(Tree.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
