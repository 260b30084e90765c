package com.tyron.multicode.lang.treesitter;

import com.tyron.multicode.api.language.BlockKind;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Static description of one grammar: which node types map to which {@link BlockKind}, where operator tokens
 * and names live, and which nodes are not code at all.
 */
public final class NodeKinds {

    private static final Map<String, BlockKind> OPERATORS = Map.ofEntries(
            Map.entry("+", BlockKind.OP_ADD),
            Map.entry("-", BlockKind.OP_SUB),
            Map.entry("*", BlockKind.OP_MUL),
            Map.entry("/", BlockKind.OP_DIV),
            Map.entry("%", BlockKind.OP_MOD),
            Map.entry("&&", BlockKind.OP_AND),
            Map.entry("and", BlockKind.OP_AND),
            Map.entry("||", BlockKind.OP_OR),
            Map.entry("or", BlockKind.OP_OR),
            Map.entry("==", BlockKind.OP_EQ),
            Map.entry("!=", BlockKind.OP_NE),
            Map.entry(">", BlockKind.OP_GT),
            Map.entry(">=", BlockKind.OP_GE),
            Map.entry("<", BlockKind.OP_LT),
            Map.entry("<=", BlockKind.OP_LE));

    private final Map<String, BlockKind> kinds;
    private final Map<String, String> operatorFields;
    private final Map<String, String> nameFields;
    private final Map<String, String> ternaryTokens;
    private final Set<String> skipped;

    private NodeKinds(Builder builder) {
        this.kinds = Map.copyOf(builder.kinds);
        this.operatorFields = Map.copyOf(builder.operatorFields);
        this.nameFields = Map.copyOf(builder.nameFields);
        this.ternaryTokens = Map.copyOf(builder.ternaryTokens);
        this.skipped = Set.copyOf(builder.skipped);
    }

    public static Builder builder() {
        return new Builder();
    }

    BlockKind of(String type) {
        return kinds.getOrDefault(type, BlockKind.OTHER);
    }

    static BlockKind operator(String token) {
        return OPERATORS.getOrDefault(token, BlockKind.OTHER);
    }

    /**
     * @return the field holding the operator token when {@code type} is an operator expression
     */
    @Nullable
    String operatorField(String type) {
        return operatorFields.get(type);
    }

    @Nullable
    String nameField(String type) {
        return nameFields.get(type);
    }

    @Nullable
    String ternaryToken(String type) {
        return ternaryTokens.get(type);
    }

    boolean isSkipped(String type) {
        return skipped.contains(type);
    }

    public static final class Builder {
        private final Map<String, BlockKind> kinds = new HashMap<>();
        private final Map<String, String> operatorFields = new HashMap<>();
        private final Map<String, String> nameFields = new HashMap<>();
        private final Map<String, String> ternaryTokens = new HashMap<>();
        private final Set<String> skipped = new HashSet<>();

        private Builder() {
            kinds.put("ERROR", BlockKind.ERROR);
        }

        public Builder kind(BlockKind kind, String... types) {
            for (String type : types) {
                kinds.put(type, kind);
            }
            return this;
        }

        /**
         * The node's kind comes from the token in {@code field}, e.g. {@code +} in a binary expression.
         */
        public Builder operator(String type, String field) {
            operatorFields.put(type, field);
            return this;
        }

        /**
         * The child in {@code field} names what the node defines or assigns and becomes its anchor.
         */
        public Builder name(String field, String... types) {
            for (String type : types) {
                nameFields.put(type, field);
            }
            return this;
        }

        public Builder ternary(String type, String token) {
            kinds.put(type, BlockKind.OP_TERNARY);
            ternaryTokens.put(type, token);
            return this;
        }

        /**
         * Nodes of these types, and everything below them, produce no blocks.
         */
        public Builder skip(String... types) {
            skipped.addAll(Set.of(types));
            return this;
        }

        public NodeKinds build() {
            return new NodeKinds(this);
        }
    }
}
