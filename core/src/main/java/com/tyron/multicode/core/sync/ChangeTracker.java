package com.tyron.multicode.core.sync;

import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.sync.IdChanges;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Computes which metadata ids a message added, removed or modified, and accumulates touched ids per side
 * until they are taken.
 */
public final class ChangeTracker {

    private final TreeSet<String> textChanged = new TreeSet<>();
    private final TreeSet<String> visualChanged = new TreeSet<>();

    public static IdChanges diff(Map<String, MetadataRecord> before, Map<String, MetadataRecord> after) {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        after.forEach((id, record) -> {
            MetadataRecord old = before.get(id);
            if (old == null) {
                added.add(id);
            } else if (!old.sameContent(record)) {
                modified.add(id);
            }
        });
        for (String id : before.keySet()) {
            if (!after.containsKey(id)) {
                removed.add(id);
            }
        }
        Collections.sort(added);
        Collections.sort(removed);
        Collections.sort(modified);
        return new IdChanges(added, removed, modified);
    }

    public void recordText(IdChanges changes) {
        addAll(textChanged, changes);
    }

    public void recordVisual(IdChanges changes) {
        addAll(visualChanged, changes);
    }

    /**
     * @return sorted ids touched by text changes since the last call, then forgets them
     */
    public List<String> takeTextChanges() {
        List<String> ids = new ArrayList<>(textChanged);
        textChanged.clear();
        return ids;
    }

    /**
     * @return sorted ids touched by visual changes since the last call, then forgets them
     */
    public List<String> takeVisualChanges() {
        List<String> ids = new ArrayList<>(visualChanged);
        visualChanged.clear();
        return ids;
    }

    public void clear() {
        textChanged.clear();
        visualChanged.clear();
    }

    private static void addAll(TreeSet<String> target, IdChanges changes) {
        target.addAll(changes.added());
        target.addAll(changes.removed());
        target.addAll(changes.modified());
    }
}
