package com.tyron.multicode.core.meta;

import com.google.common.collect.Lists;
import com.tyron.multicode.api.meta.AiNote;
import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Folds the {@code extends} chain of a record into a single effective record.
 *
 * Lists are unioned parent first. Scalars and translations of the child win, the parent only fills what the
 * child leaves empty. The version is the highest one seen along the chain. Cycles, missing parents and chains
 * deeper than {@link #MAX_DEPTH} stop the walk at the last reachable ancestor.
 */
public final class InheritanceResolver {

    public static final int MAX_DEPTH = 64;

    private static final Logger LOG = Logger.getLogger(InheritanceResolver.class.getName());

    private InheritanceResolver() {
    }

    public static MetadataRecord resolve(MetadataRecord record, Map<String, MetadataRecord> arena) {
        if (record.getExtends() == null) {
            return record;
        }
        List<MetadataRecord> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        chain.add(record);
        visited.add(record.getId());

        MetadataRecord current = record;
        while (current.getExtends() != null) {
            String parentId = current.getExtends();
            if (!visited.add(parentId)) {
                LOG.warning("Inheritance cycle through '" + parentId + "' while resolving '" + record.getId() + "'");
                break;
            }
            if (chain.size() > MAX_DEPTH) {
                LOG.warning("Inheritance chain of '" + record.getId() + "' exceeds " + MAX_DEPTH + " levels");
                break;
            }
            MetadataRecord parent = arena.get(parentId);
            if (parent == null) {
                LOG.fine("Parent '" + parentId + "' of '" + current.getId() + "' not found");
                break;
            }
            chain.add(parent);
            current = parent;
        }

        MetadataRecord merged = null;
        for (MetadataRecord next : Lists.reverse(chain)) {
            merged = merged == null ? next : merge(merged, next);
        }
        return merged;
    }

    static MetadataRecord merge(MetadataRecord parent, MetadataRecord child) {
        MetadataRecord.Builder builder = child.toBuilder()
                .version(Math.max(parent.getVersion(), child.getVersion()))
                .tags(union(parent.getTags(), child.getTags()))
                .links(union(parent.getLinks(), child.getLinks()))
                .anchors(union(parent.getAnchors(), child.getAnchors()));

        if (isBlank(child.getOrigin())) {
            builder.origin(parent.getOrigin());
        }

        Map<String, String> translations = new LinkedHashMap<>(child.getTranslations());
        parent.getTranslations().forEach(translations::putIfAbsent);
        builder.translations(translations);

        builder.ai(mergeAi(parent.getAi(), child.getAi()));
        if (child.getExtras() == null) {
            builder.extras(parent.getExtras());
        }
        return builder.build();
    }

    private static AiNote mergeAi(AiNote parent, AiNote child) {
        if (child == null) {
            return parent;
        }
        if (parent == null) {
            return child;
        }
        String description = child.hasDescription() ? child.description() : parent.description();
        return new AiNote(description, union(parent.hints(), child.hints()));
    }

    static List<String> union(List<String> first, List<String> second) {
        Set<String> set = new LinkedHashSet<>(first);
        set.addAll(second);
        return new ArrayList<>(set);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
