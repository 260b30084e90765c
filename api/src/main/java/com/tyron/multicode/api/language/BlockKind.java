package com.tyron.multicode.api.language;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of categories that grammar node kinds are normalized into.
 *
 * Each language parser maps its own node kinds onto these through a static table; anything it does not
 * care to distinguish becomes {@link #OTHER}.
 */
public enum BlockKind {
    MODULE("Module"),
    CLASS_DEFINE("Class/Define"),
    FUNCTION_DEFINE("Function/Define"),
    FUNCTION_CALL("Function/Call"),
    RETURN("Return"),
    VARIABLE_GET("Variable/Get"),
    VARIABLE_SET("Variable/Set"),
    CONDITION("Condition"),
    LOOP("Loop"),
    LITERAL("Literal"),
    BLOCK("Block"),
    STATEMENT("Statement"),
    OP_ADD("Op/+"),
    OP_SUB("Op/-"),
    OP_MUL("Op/*"),
    OP_DIV("Op//"),
    OP_MOD("Op/%"),
    OP_AND("Op/&&"),
    OP_OR("Op/||"),
    OP_EQ("Op/=="),
    OP_NE("Op/!="),
    OP_GT("Op/>"),
    OP_GE("Op/>="),
    OP_LT("Op/<"),
    OP_LE("Op/<="),
    OP_TERNARY("Op/Ternary"),
    ERROR("Error"),
    OTHER("Other");

    private static final Set<BlockKind> BINARY_OPERATORS = EnumSet.range(OP_ADD, OP_LE);

    private final String label;

    BlockKind(String label) {
        this.label = label;
    }

    /**
     * @return the category name shown by the visual view, e.g. {@code Function/Define} or {@code Op/+}
     */
    public String label() {
        return label;
    }

    public boolean isOperator() {
        return BINARY_OPERATORS.contains(this) || this == OP_TERNARY;
    }

    /**
     * @return the operator token for binary operators, {@code null} otherwise
     */
    public String operatorSymbol() {
        return BINARY_OPERATORS.contains(this) ? label.substring("Op/".length()) : null;
    }

    @Override
    public String toString() {
        return label;
    }
}
