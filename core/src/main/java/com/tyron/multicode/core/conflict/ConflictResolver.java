package com.tyron.multicode.core.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tyron.multicode.api.meta.AiNote;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.sync.Conflict;
import com.tyron.multicode.api.sync.ConflictType;
import com.tyron.multicode.api.sync.Resolution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides between the text-side and the visual-side version of one record.
 *
 * <ul>
 *     <li>{@link ConflictType#STRUCTURAL}: translations, {@code extends} or origin differ. The text side wins,
 *     whatever the versions say.</li>
 *     <li>{@link ConflictType#MOVEMENT}: only the position differs. The visual side wins. If auxiliary
 *     fields differ too, the two sides are merged with the visual position.</li>
 *     <li>{@link ConflictType#META_COMMENT}: only auxiliary fields (tags, links, anchors, tests, ai, extras)
 *     differ. The two sides are merged.</li>
 * </ul>
 * The resulting version is the higher of the two.
 */
public final class ConflictResolver {

    private ConflictResolver() {
    }

    /**
     * @return empty when the two records agree on everything the resolver looks at
     */
    public static Optional<ConflictType> detect(MetadataRecord text, MetadataRecord visual) {
        if (structuralDiffers(text, visual)) {
            return Optional.of(ConflictType.STRUCTURAL);
        }
        if (moved(text, visual)) {
            return Optional.of(ConflictType.MOVEMENT);
        }
        if (auxiliaryDiffers(text, visual)) {
            return Optional.of(ConflictType.META_COMMENT);
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException if the ids differ or the records do not diverge at all
     */
    public static Resolved resolve(MetadataRecord text, MetadataRecord visual) {
        if (!text.getId().equals(visual.getId())) {
            throw new IllegalArgumentException("Cannot resolve records with different ids: '" + text.getId()
                    + "' and '" + visual.getId() + "'");
        }
        ConflictType type = detect(text, visual).orElseThrow(() ->
                new IllegalArgumentException("Records '" + text.getId() + "' do not conflict"));
        int version = Math.max(text.getVersion(), visual.getVersion());

        MetadataRecord record;
        Resolution resolution;
        switch (type) {
            case STRUCTURAL:
                record = text.withVersion(version);
                resolution = Resolution.TEXT;
                break;
            case MOVEMENT:
                if (auxiliaryDiffers(text, visual)) {
                    record = merge(text, visual, version);
                    resolution = Resolution.MERGE;
                } else {
                    record = visual.withVersion(version);
                    resolution = Resolution.VISUAL;
                }
                break;
            default:
                record = merge(text, visual, version);
                resolution = Resolution.MERGE;
                break;
        }
        return new Resolved(record, new Conflict(text.getId(), type, resolution));
    }

    private static boolean structuralDiffers(MetadataRecord a, MetadataRecord b) {
        return !a.getTranslations().equals(b.getTranslations())
                || !Objects.equals(a.getExtends(), b.getExtends())
                || !Objects.equals(a.getOrigin(), b.getOrigin());
    }

    private static boolean moved(MetadataRecord a, MetadataRecord b) {
        return Double.compare(a.getX(), b.getX()) != 0 || Double.compare(a.getY(), b.getY()) != 0;
    }

    private static boolean auxiliaryDiffers(MetadataRecord a, MetadataRecord b) {
        return !a.getTags().equals(b.getTags())
                || !a.getLinks().equals(b.getLinks())
                || !a.getAnchors().equals(b.getAnchors())
                || !a.getTests().equals(b.getTests())
                || !Objects.equals(a.getAi(), b.getAi())
                || !Objects.equals(a.getExtras(), b.getExtras());
    }

    private static MetadataRecord merge(MetadataRecord text, MetadataRecord visual, int version) {
        return text.toBuilder()
                .version(version)
                .position(visual.getX(), visual.getY())
                .tags(union(text.getTags(), visual.getTags()))
                .links(union(text.getLinks(), visual.getLinks()))
                .anchors(union(text.getAnchors(), visual.getAnchors()))
                .tests(union(text.getTests(), visual.getTests()))
                .ai(mergeAi(text.getAi(), visual.getAi()))
                .extras(mergeExtras(text.getExtras(), visual.getExtras()))
                .updatedAt(text.getUpdatedAt().isAfter(visual.getUpdatedAt())
                        ? text.getUpdatedAt() : visual.getUpdatedAt())
                .build();
    }

    private static AiNote mergeAi(AiNote text, AiNote visual) {
        if (text == null) return visual;
        if (visual == null) return text;
        String description = visual.hasDescription() ? visual.description() : text.description();
        return new AiNote(description, union(text.hints(), visual.hints()));
    }

    private static JsonNode mergeExtras(JsonNode text, JsonNode visual) {
        if (text instanceof ObjectNode textObject && visual instanceof ObjectNode visualObject) {
            ObjectNode merged = textObject.deepCopy();
            merged.setAll(visualObject);
            return merged;
        }
        return visual != null ? visual : text;
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> set = new LinkedHashSet<>(first);
        set.addAll(second);
        return new ArrayList<>(set);
    }
}
