package com.tyron.multicode.api.meta;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The payload of an embedded {@code @VISUAL_META} comment.
 *
 * Binds a code block (by {@link #getId()}) to its position on the canvas and to auxiliary data. Instances are
 * immutable; use {@link #toBuilder()} to derive modified copies.
 *
 * List fields are kept in document order and may contain duplicates when read from text; duplicates are a
 * validation error for outgoing records.
 */
public final class MetadataRecord {

    public static final int DEFAULT_VERSION = 1;

    private final String id;
    private final int version;
    private final double x;
    private final double y;
    private final List<String> tags;
    private final List<String> links;
    private final List<String> anchors;
    private final List<String> tests;
    private final String extendsId;
    private final String origin;
    private final Map<String, String> translations;
    private final AiNote ai;
    private final JsonNode extras;
    private final Instant updatedAt;

    private MetadataRecord(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.version = b.version;
        this.x = b.x;
        this.y = b.y;
        this.tags = List.copyOf(b.tags);
        this.links = List.copyOf(b.links);
        this.anchors = List.copyOf(b.anchors);
        this.tests = List.copyOf(b.tests);
        this.extendsId = b.extendsId;
        this.origin = b.origin;
        this.translations = Collections.unmodifiableMap(new LinkedHashMap<>(b.translations));
        this.ai = b.ai;
        this.extras = b.extras == null ? null : b.extras.deepCopy();
        this.updatedAt = b.updatedAt == null ? Instant.EPOCH : b.updatedAt;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @NotNull
    public String getId() {
        return id;
    }

    public int getVersion() {
        return version;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getLinks() {
        return links;
    }

    public List<String> getAnchors() {
        return anchors;
    }

    public List<String> getTests() {
        return tests;
    }

    /**
     * @return id of the parent record this one inherits from
     */
    @Nullable
    public String getExtends() {
        return extendsId;
    }

    /**
     * @return back-reference to an external file this block came from
     */
    @Nullable
    public String getOrigin() {
        return origin;
    }

    /**
     * Language code to label, and language id to source snippet for code generation.
     */
    public Map<String, String> getTranslations() {
        return translations;
    }

    @Nullable
    public AiNote getAi() {
        return ai;
    }

    /**
     * @return a copy of the opaque extension payload
     */
    @Nullable
    public JsonNode getExtras() {
        return extras == null ? null : extras.deepCopy();
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public MetadataRecord withUpdatedAt(Instant instant) {
        return toBuilder().updatedAt(instant).build();
    }

    public MetadataRecord withVersion(int newVersion) {
        return toBuilder().version(newVersion).build();
    }

    /**
     * Compares every field except {@code updatedAt}.
     */
    public boolean sameContent(MetadataRecord other) {
        return other != null
                && id.equals(other.id)
                && version == other.version
                && Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && tags.equals(other.tags)
                && links.equals(other.links)
                && anchors.equals(other.anchors)
                && tests.equals(other.tests)
                && Objects.equals(extendsId, other.extendsId)
                && Objects.equals(origin, other.origin)
                && translations.equals(other.translations)
                && Objects.equals(ai, other.ai)
                && Objects.equals(extras, other.extras);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataRecord other)) return false;
        return sameContent(other) && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, x, y, tags, links, anchors, tests, extendsId, origin, translations, ai,
                extras, updatedAt);
    }

    @Override
    public String toString() {
        return "MetadataRecord{id='" + id + "', version=" + version + ", x=" + x + ", y=" + y
                + ", tags=" + tags + ", extends=" + extendsId + "}";
    }

    public static final class Builder {
        private String id;
        private int version = DEFAULT_VERSION;
        private double x;
        private double y;
        private final List<String> tags = new ArrayList<>();
        private final List<String> links = new ArrayList<>();
        private final List<String> anchors = new ArrayList<>();
        private final List<String> tests = new ArrayList<>();
        private String extendsId;
        private String origin;
        private final Map<String, String> translations = new LinkedHashMap<>();
        private AiNote ai;
        private JsonNode extras;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        private Builder(MetadataRecord r) {
            this.id = r.id;
            this.version = r.version;
            this.x = r.x;
            this.y = r.y;
            this.tags.addAll(r.tags);
            this.links.addAll(r.links);
            this.anchors.addAll(r.anchors);
            this.tests.addAll(r.tests);
            this.extendsId = r.extendsId;
            this.origin = r.origin;
            this.translations.putAll(r.translations);
            this.ai = r.ai;
            this.extras = r.extras;
            this.updatedAt = r.updatedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder position(double x, double y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder x(double x) {
            this.x = x;
            return this;
        }

        public Builder y(double y) {
            this.y = y;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder links(List<String> links) {
            this.links.clear();
            this.links.addAll(links);
            return this;
        }

        public Builder link(String link) {
            this.links.add(link);
            return this;
        }

        public Builder anchors(List<String> anchors) {
            this.anchors.clear();
            this.anchors.addAll(anchors);
            return this;
        }

        public Builder anchor(String anchor) {
            this.anchors.add(anchor);
            return this;
        }

        public Builder tests(List<String> tests) {
            this.tests.clear();
            this.tests.addAll(tests);
            return this;
        }

        public Builder test(String test) {
            this.tests.add(test);
            return this;
        }

        public Builder extendsId(@Nullable String parentId) {
            this.extendsId = parentId;
            return this;
        }

        public Builder origin(@Nullable String origin) {
            this.origin = origin;
            return this;
        }

        public Builder translations(Map<String, String> translations) {
            this.translations.clear();
            this.translations.putAll(translations);
            return this;
        }

        public Builder translation(String key, String value) {
            this.translations.put(key, value);
            return this;
        }

        public Builder ai(@Nullable AiNote ai) {
            this.ai = ai;
            return this;
        }

        public Builder extras(@Nullable JsonNode extras) {
            this.extras = extras;
            return this;
        }

        public Builder updatedAt(@Nullable Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public MetadataRecord build() {
            return new MetadataRecord(this);
        }
    }
}
