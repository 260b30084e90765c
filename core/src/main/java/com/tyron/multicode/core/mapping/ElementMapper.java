package com.tyron.multicode.core.mapping;

import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.model.TextRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Joins the blocks of one parse with the metadata of the same text by id.
 *
 * Only blocks that some record describes get a range. Everything else is reported: records without a block
 * are orphaned, blocks without a record are unmapped. Immutable once built.
 */
public final class ElementMapper {

    private static final Logger LOG = Logger.getLogger(ElementMapper.class.getName());

    private final Map<String, TextRange> idToRange;
    private final List<Entry> ordered;
    private final List<String> orphanedIds;
    private final List<TextRange> unmappedBlocks;
    private final List<List<String>> overlapping;

    private ElementMapper(Map<String, TextRange> idToRange, List<String> orphanedIds, List<TextRange> unmappedBlocks) {
        this.idToRange = Collections.unmodifiableMap(idToRange);
        List<Entry> entries = new ArrayList<>(idToRange.size());
        idToRange.forEach((id, range) -> entries.add(new Entry(range, id)));
        entries.sort(Comparator.comparingInt((Entry e) -> e.range().start())
                .thenComparing(e -> -e.range().end()));
        this.ordered = List.copyOf(entries);
        this.orphanedIds = List.copyOf(orphanedIds);
        this.unmappedBlocks = List.copyOf(unmappedBlocks);
        this.overlapping = findOverlaps(this.ordered);
    }

    public static ElementMapper empty() {
        return new ElementMapper(new LinkedHashMap<>(), List.of(), List.of());
    }

    public static ElementMapper build(List<Block> blocks, Collection<MetadataRecord> records) {
        Map<String, Block> blockById = new LinkedHashMap<>();
        for (Block block : blocks) {
            blockById.putIfAbsent(block.visualId(), block);
        }

        Map<String, TextRange> idToRange = new LinkedHashMap<>();
        List<String> orphaned = new ArrayList<>();
        for (MetadataRecord record : records) {
            Block block = blockById.get(record.getId());
            if (block == null) {
                orphaned.add(record.getId());
            } else {
                idToRange.put(record.getId(), block.range());
            }
        }
        Collections.sort(orphaned);

        List<TextRange> unmapped = new ArrayList<>();
        for (Block block : blockById.values()) {
            if (!idToRange.containsKey(block.visualId())) {
                unmapped.add(block.range());
            }
        }
        unmapped.sort(Comparator.comparingInt(TextRange::start).thenComparingInt(TextRange::end));
        return new ElementMapper(idToRange, orphaned, unmapped);
    }

    public Optional<TextRange> rangeOf(String id) {
        return Optional.ofNullable(idToRange.get(id));
    }

    public Map<String, TextRange> idToRange() {
        return idToRange;
    }

    /**
     * @return the id whose range is the narrowest one containing {@code offset}
     */
    public Optional<String> idAt(int offset) {
        Entry best = null;
        for (Entry entry : ordered) {
            if (entry.range().start() > offset) {
                break;
            }
            if (entry.range().contains(offset)
                    && (best == null || entry.range().length() < best.range().length())) {
                best = entry;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.id());
    }

    /**
     * Like {@link #idAt(int)} with a zero-based line and column of {@code code}.
     */
    public Optional<String> idAtPosition(String code, int line, int column) {
        OptionalInt offset = offsetAt(code, line, column);
        return offset.isPresent() ? idAt(offset.getAsInt()) : Optional.empty();
    }

    /**
     * @return sorted ids of metadata records without a block
     */
    public List<String> orphanedIds() {
        return orphanedIds;
    }

    /**
     * @return ranges of every block no record describes, nested ones included
     */
    public List<TextRange> unmappedBlocks() {
        return unmappedBlocks;
    }

    /**
     * @return {@link #unmappedBlocks()} with overlapping and touching ranges merged
     */
    public List<TextRange> unmappedCode() {
        List<TextRange> merged = new ArrayList<>();
        for (TextRange range : unmappedBlocks) {
            if (!merged.isEmpty()) {
                TextRange last = merged.get(merged.size() - 1);
                if (range.start() <= last.end()) {
                    merged.set(merged.size() - 1, TextRange.of(last.start(), Math.max(last.end(), range.end())));
                    continue;
                }
            }
            merged.add(range);
        }
        return merged;
    }

    /**
     * @return pairs of mapped ids whose ranges cross, each pair ordered by start offset
     */
    public List<List<String>> overlapping() {
        return overlapping;
    }

    /**
     * Converts a zero-based line and column into an offset of {@code code}.
     *
     * @return empty when the line does not exist or the column runs past its end
     */
    public static OptionalInt offsetAt(String code, int line, int column) {
        if (line < 0 || column < 0) {
            return OptionalInt.empty();
        }
        int lineStart = 0;
        for (int i = 0; i < line; i++) {
            int nl = code.indexOf('\n', lineStart);
            if (nl < 0) {
                return OptionalInt.empty();
            }
            lineStart = nl + 1;
        }
        int lineEnd = code.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = code.length();
        }
        if (lineStart + column > lineEnd) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(lineStart + column);
    }

    private static List<List<String>> findOverlaps(List<Entry> ordered) {
        List<List<String>> pairs = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            Entry a = ordered.get(i);
            for (int j = i + 1; j < ordered.size(); j++) {
                Entry b = ordered.get(j);
                if (b.range().start() >= a.range().end()) {
                    break;
                }
                if (a.range().crosses(b.range())) {
                    pairs.add(List.of(a.id(), b.id()));
                }
            }
        }
        if (!pairs.isEmpty()) {
            LOG.warning("Mapped blocks overlap: " + pairs);
        }
        return List.copyOf(pairs);
    }

    private record Entry(TextRange range, String id) {
    }
}
