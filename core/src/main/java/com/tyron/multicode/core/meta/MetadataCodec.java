package com.tyron.multicode.core.meta;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tyron.multicode.api.meta.AiNote;
import com.tyron.multicode.api.meta.MetadataRecord;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts between {@link MetadataRecord} and the single-line JSON carried in metadata comments.
 */
public final class MetadataCodec {

    private static final Logger LOG = Logger.getLogger(MetadataCodec.class.getName());

    static final String ID = "id";
    static final String VERSION = "version";
    static final String X = "x";
    static final String Y = "y";
    static final String TAGS = "tags";
    static final String LINKS = "links";
    static final String ANCHORS = "anchors";
    static final String TESTS = "tests";
    static final String EXTENDS = "extends";
    static final String ORIGIN = "origin";
    static final String TRANSLATIONS = "translations";
    static final String AI = "ai";
    static final String AI_DESCRIPTION = "description";
    static final String AI_HINTS = "hints";
    static final String EXTRAS = "extras";
    static final String UPDATED_AT = "updated_at";

    private static final Set<String> KNOWN_FIELDS = Set.of(ID, VERSION, X, Y, TAGS, LINKS, ANCHORS, TESTS,
            EXTENDS, ORIGIN, TRANSLATIONS, AI, EXTRAS, UPDATED_AT);

    private final ObjectMapper mapper;

    public MetadataCodec() {
        this(new ObjectMapper());
    }

    public MetadataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses a payload. Unknown top-level fields are moved into {@code extras}; an explicit {@code extras}
     * entry wins over a folded field of the same name.
     *
     * @return empty when the payload is not JSON or does not have the expected shape
     */
    public Optional<MetadataRecord> decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOG.log(Level.FINE, "Skipping metadata payload that is not JSON: " + abbreviate(json), e);
            return Optional.empty();
        }
        try {
            return Optional.of(fromTree(root));
        } catch (MalformedPayloadException e) {
            LOG.fine("Skipping malformed metadata payload (" + e.getMessage() + "): " + abbreviate(json));
            return Optional.empty();
        }
    }

    /**
     * @return the record as compact single-line JSON
     */
    public String encode(MetadataRecord record) {
        try {
            return mapper.writeValueAsString(toTree(record));
        } catch (JsonProcessingException e) {
            // a tree made of plain nodes always serializes
            throw new IllegalStateException("Failed to serialize metadata " + record.getId(), e);
        }
    }

    ObjectNode toTree(MetadataRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(ID, record.getId());
        node.put(VERSION, record.getVersion());
        node.put(X, record.getX());
        node.put(Y, record.getY());
        putStrings(node, TAGS, record.getTags());
        putStrings(node, LINKS, record.getLinks());
        putStrings(node, ANCHORS, record.getAnchors());
        putStrings(node, TESTS, record.getTests());
        if (record.getExtends() != null) {
            node.put(EXTENDS, record.getExtends());
        }
        if (record.getOrigin() != null) {
            node.put(ORIGIN, record.getOrigin());
        }
        ObjectNode translations = node.putObject(TRANSLATIONS);
        record.getTranslations().forEach(translations::put);
        AiNote ai = record.getAi();
        if (ai != null) {
            ObjectNode aiNode = node.putObject(AI);
            if (ai.description() != null) {
                aiNode.put(AI_DESCRIPTION, ai.description());
            }
            putStrings(aiNode, AI_HINTS, ai.hints());
        }
        JsonNode extras = record.getExtras();
        if (extras != null) {
            node.set(EXTRAS, extras);
        }
        node.put(UPDATED_AT, record.getUpdatedAt().toString());
        return node;
    }

    private MetadataRecord fromTree(JsonNode root) throws MalformedPayloadException {
        if (!root.isObject()) {
            throw new MalformedPayloadException("payload is not an object");
        }
        JsonNode id = root.get(ID);
        if (id == null || !id.isTextual()) {
            throw new MalformedPayloadException("missing textual id");
        }
        MetadataRecord.Builder builder = MetadataRecord.builder(id.asText());

        JsonNode version = root.get(VERSION);
        if (version != null && !version.isNull()) {
            if (!version.canConvertToInt()) {
                throw new MalformedPayloadException("version is not an integer");
            }
            builder.version(Math.max(MetadataRecord.DEFAULT_VERSION, version.asInt()));
        }
        builder.position(requireNumber(root, X), requireNumber(root, Y));
        builder.tags(strings(root, TAGS));
        builder.links(strings(root, LINKS));
        builder.anchors(strings(root, ANCHORS));
        builder.tests(strings(root, TESTS));
        builder.extendsId(optionalText(root, EXTENDS));
        builder.origin(optionalText(root, ORIGIN));
        builder.translations(translations(root));
        builder.ai(ai(root.get(AI)));
        builder.extras(extras((ObjectNode) root));

        JsonNode updatedAt = root.get(UPDATED_AT);
        if (updatedAt != null && !updatedAt.isNull()) {
            if (!updatedAt.isTextual()) {
                throw new MalformedPayloadException("updated_at is not a string");
            }
            try {
                builder.updatedAt(Instant.parse(updatedAt.asText()));
            } catch (DateTimeParseException e) {
                throw new MalformedPayloadException("updated_at is not an ISO-8601 instant");
            }
        }
        return builder.build();
    }

    private JsonNode extras(ObjectNode root) {
        JsonNode explicit = root.get(EXTRAS);
        Map<String, JsonNode> unknown = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                unknown.put(field.getKey(), field.getValue());
            }
        }
        if (unknown.isEmpty()) {
            return explicit == null || explicit.isNull() ? null : explicit;
        }
        if (explicit == null || explicit.isNull()) {
            ObjectNode folded = mapper.createObjectNode();
            unknown.forEach(folded::set);
            return folded;
        }
        if (explicit.isObject()) {
            ObjectNode merged = mapper.createObjectNode();
            unknown.forEach(merged::set);
            merged.setAll((ObjectNode) explicit);
            return merged;
        }
        LOG.fine("Dropping unknown fields " + unknown.keySet() + ", extras is not an object");
        return explicit;
    }

    private static AiNote ai(JsonNode node) throws MalformedPayloadException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedPayloadException("ai is not an object");
        }
        return new AiNote(optionalText(node, AI_DESCRIPTION), strings(node, AI_HINTS));
    }

    private static Map<String, String> translations(JsonNode root) throws MalformedPayloadException {
        JsonNode node = root.get(TRANSLATIONS);
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw new MalformedPayloadException("translations is not an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new MalformedPayloadException("translation '" + field.getKey() + "' is not a string");
            }
            result.put(field.getKey(), field.getValue().asText());
        }
        return result;
    }

    private static List<String> strings(JsonNode parent, String field) throws MalformedPayloadException {
        JsonNode node = parent.get(field);
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new MalformedPayloadException(field + " is not an array");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MalformedPayloadException(field + " contains a non-string element");
            }
            result.add(element.asText());
        }
        return result;
    }

    private static String optionalText(JsonNode parent, String field) throws MalformedPayloadException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedPayloadException(field + " is not a string");
        }
        return node.asText();
    }

    private static double requireNumber(JsonNode root, String field) throws MalformedPayloadException {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw new MalformedPayloadException("missing numeric " + field);
        }
        return node.asDouble();
    }

    private static void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    private static String abbreviate(String json) {
        return json.length() <= 80 ? json : json.substring(0, 77) + "...";
    }

    private static final class MalformedPayloadException extends Exception {
        MalformedPayloadException(String message) {
            super(message);
        }
    }
}
