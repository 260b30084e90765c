package com.tyron.multicode.core.meta;

import com.fasterxml.jackson.databind.JsonNode;
import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * A filter over metadata records written as {@code field:value} terms.
 *
 * <pre>
 *     id:foo AND tags:bar
 *     tags:ui OR tags:net
 *     tags:ui origin:gen      (adjacent terms are joined with AND)
 *     parser                  (a bare word matches any field)
 * </pre>
 *
 * {@code OR} binds looser than {@code AND}; both keywords are case insensitive. A term matches when the named
 * field of the record's JSON form contains the value, case sensitively. For list fields any element may contain
 * it. An empty query matches every record.
 */
public final class MetadataQuery {

    private static final String ANY_FIELD = "*";
    private static final MetadataCodec CODEC = new MetadataCodec();

    private interface Expr {
        boolean test(JsonNode record);
    }

    private record And(List<Expr> terms) implements Expr {
        @Override
        public boolean test(JsonNode record) {
            return terms.stream().allMatch(term -> term.test(record));
        }

        @Override
        public String toString() {
            return terms.size() == 1 ? terms.get(0).toString() : "AND" + terms;
        }
    }

    private record Or(List<Expr> terms) implements Expr {
        @Override
        public boolean test(JsonNode record) {
            return terms.stream().anyMatch(term -> term.test(record));
        }

        @Override
        public String toString() {
            return "OR" + terms;
        }
    }

    private record Term(String field, String value) implements Expr {
        @Override
        public boolean test(JsonNode record) {
            if (ANY_FIELD.equals(field)) {
                return record.toString().contains(value);
            }
            JsonNode node = record.get(field);
            if (node == null || node.isNull()) {
                return false;
            }
            if (node.isTextual()) {
                return node.asText().contains(value);
            }
            if (node.isArray()) {
                for (JsonNode element : node) {
                    if (element.isTextual() && element.asText().contains(value)) {
                        return true;
                    }
                }
                return false;
            }
            return node.toString().contains(value);
        }

        @Override
        public String toString() {
            return field + ":" + value;
        }
    }

    private final String source;
    private final Expr root;

    private MetadataQuery(String source, Expr root) {
        this.source = source;
        this.root = root;
    }

    public static MetadataQuery parse(String query) {
        String[] tokens = query.trim().isEmpty() ? new String[0] : query.trim().split("\\s+");
        return new MetadataQuery(query, new Parser(tokens).parseOr());
    }

    public boolean matches(MetadataRecord record) {
        return root.test(CODEC.toTree(record));
    }

    /**
     * @return the matching records, in their original order
     */
    public List<MetadataRecord> filter(Collection<MetadataRecord> records) {
        List<MetadataRecord> matching = new ArrayList<>();
        for (MetadataRecord record : records) {
            if (matches(record)) {
                matching.add(record);
            }
        }
        return matching;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return root.toString();
    }

    private static final class Parser {
        private final String[] tokens;
        private int pos;

        Parser(String[] tokens) {
            this.tokens = tokens;
        }

        Expr parseOr() {
            List<Expr> alternatives = new ArrayList<>();
            alternatives.add(parseAnd());
            while (pos < tokens.length && isKeyword("OR")) {
                pos++;
                alternatives.add(parseAnd());
            }
            return alternatives.size() == 1 ? alternatives.get(0) : new Or(List.copyOf(alternatives));
        }

        private Expr parseAnd() {
            List<Expr> terms = new ArrayList<>();
            terms.add(parseTerm());
            while (pos < tokens.length && !isKeyword("OR")) {
                if (isKeyword("AND")) {
                    pos++;
                }
                terms.add(parseTerm());
            }
            return terms.size() == 1 ? terms.get(0) : new And(List.copyOf(terms));
        }

        private Expr parseTerm() {
            if (pos >= tokens.length) {
                // dangling operator or empty query
                return new And(List.of());
            }
            String token = tokens[pos++];
            int colon = token.indexOf(':');
            if (colon < 0) {
                return new Term(ANY_FIELD, token);
            }
            return new Term(token.substring(0, colon), token.substring(colon + 1));
        }

        private boolean isKeyword(String keyword) {
            return tokens[pos].toUpperCase(Locale.ROOT).equals(keyword);
        }
    }
}
