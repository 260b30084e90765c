package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.meta.ValidationError;
import com.tyron.multicode.api.model.TextRange;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads and writes {@code @VISUAL_META} comments embedded in source text.
 *
 * The store holds no per-text state and may be shared between threads. Duplicate detection uses a
 * {@link DuplicateTracker} created for each read.
 */
public class MetadataStore {

    public static final String MARKER = "@VISUAL_META";

    private static final Logger LOG = Logger.getLogger(MetadataStore.class.getName());

    private final MetadataCodec codec;
    private final Clock clock;

    public MetadataStore() {
        this(new MetadataCodec(), Clock.systemUTC());
    }

    public MetadataStore(Clock clock) {
        this(new MetadataCodec(), clock);
    }

    public MetadataStore(MetadataCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    public MetadataCodec getCodec() {
        return codec;
    }

    /**
     * @return the effective records of {@code text}, first occurrence wins for repeated ids
     */
    public List<MetadataRecord> readAll(String text) {
        return read(text).records();
    }

    /**
     * @return the effective records of {@code text} that {@code query} matches, in document order
     */
    public List<MetadataRecord> query(String text, MetadataQuery query) {
        return query.filter(readAll(text));
    }

    public ReadResult read(String text) {
        DuplicateTracker tracker = new DuplicateTracker();
        return read(text, tracker);
    }

    /**
     * Reads into the given tracker, then resolves inheritance against everything the tracker holds.
     */
    public ReadResult read(String text, DuplicateTracker tracker) {
        List<MetadataRecord> registered = new ArrayList<>();
        for (RawEntry entry : readRaw(text)) {
            if (tracker.register(entry.record())) {
                registered.add(entry.record());
            } else {
                LOG.warning("Duplicate metadata id '" + entry.record().getId() + "' at " + entry.comment().comment()
                        + ", keeping the first occurrence");
            }
        }
        List<MetadataRecord> resolved = new ArrayList<>(registered.size());
        for (MetadataRecord record : registered) {
            resolved.add(InheritanceResolver.resolve(record, tracker.records()));
        }
        return new ReadResult(resolved, tracker.duplicateIds());
    }

    /**
     * @return every decodable comment with its record exactly as written, duplicates included
     */
    public List<RawEntry> readRaw(String text) {
        List<RawEntry> entries = new ArrayList<>();
        for (MetadataComment comment : MetadataComments.find(text)) {
            codec.decode(comment.payload(text)).ifPresent(record -> entries.add(new RawEntry(comment, record)));
        }
        return entries;
    }

    public List<ValidationError> validate(MetadataRecord record) {
        return RecordValidator.validate(record);
    }

    /**
     * Writes {@code record} into {@code text}, stamping {@code updated_at} with the current time.
     *
     * Every comment carrying the same id is replaced in place and keeps its comment style. If there is none, a
     * new comment of {@code newCommentStyle} is inserted at the top of the text. With
     * {@code preserveFormatting} unset, the indentation and trailing blanks around a replaced comment are
     * dropped as well.
     *
     * @return the new text, or {@code text} unchanged if the record is invalid
     */
    @NotNull
    public String upsert(String text, MetadataRecord record, boolean preserveFormatting,
                         CommentStyle newCommentStyle) {
        List<ValidationError> errors = validate(record);
        if (!errors.isEmpty()) {
            LOG.severe("Refusing to write invalid metadata '" + record.getId() + "': " + errors);
            return text;
        }
        MetadataRecord stamped = record.withUpdatedAt(clock.instant());
        String json = codec.encode(stamped);

        List<RawEntry> matches = new ArrayList<>();
        for (RawEntry entry : readRaw(text)) {
            if (entry.record().getId().equals(record.getId())) {
                matches.add(entry);
            }
        }
        if (matches.isEmpty()) {
            return newCommentStyle.format(json) + "\n" + text;
        }

        StringBuilder out = new StringBuilder(text);
        for (int i = matches.size() - 1; i >= 0; i--) {
            MetadataComment comment = matches.get(i).comment();
            TextRange target = preserveFormatting ? comment.comment() : comment.replace();
            out.replace(target.start(), target.end(), comment.style().format(json));
        }
        return out.toString();
    }

    public String upsert(String text, MetadataRecord record, boolean preserveFormatting) {
        return upsert(text, record, preserveFormatting, CommentStyle.SLASH);
    }

    /**
     * Removes every metadata comment, including the line it occupied when nothing else is on it.
     */
    public String removeAll(String text) {
        return MetadataComments.strip(text).text();
    }

    /**
     * Renames every repeated occurrence of an id to {@code <id>-<n>}, with {@code n} the smallest number not
     * used by any other record. Only the JSON of the renamed comments changes.
     */
    public String fixAll(String text) {
        List<RawEntry> entries = readRaw(text);
        Set<String> taken = new HashSet<>();
        for (RawEntry entry : entries) {
            taken.add(entry.record().getId());
        }

        Set<String> seen = new HashSet<>();
        List<RawEntry> renamed = new ArrayList<>();
        List<String> newIds = new ArrayList<>();
        for (RawEntry entry : entries) {
            String id = entry.record().getId();
            if (seen.add(id)) {
                continue;
            }
            int n = 1;
            while (taken.contains(id + "-" + n)) {
                n++;
            }
            String newId = id + "-" + n;
            taken.add(newId);
            renamed.add(entry);
            newIds.add(newId);
        }
        if (renamed.isEmpty()) {
            return text;
        }

        StringBuilder out = new StringBuilder(text);
        for (int i = renamed.size() - 1; i >= 0; i--) {
            RawEntry entry = renamed.get(i);
            TextRange json = entry.comment().json();
            MetadataRecord fixed = entry.record().toBuilder().id(newIds.get(i)).build();
            out.replace(json.start(), json.end(), codec.encode(fixed));
            LOG.info("Renamed duplicate metadata '" + entry.record().getId() + "' to '" + newIds.get(i) + "'");
        }
        return out.toString();
    }

    /**
     * @return a complete comment for {@code record}, without touching its timestamp
     * @throws IllegalArgumentException if the record does not validate
     */
    public String render(MetadataRecord record, CommentStyle style) {
        List<ValidationError> errors = validate(record);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid metadata '" + record.getId() + "': " + errors);
        }
        return style.format(codec.encode(record));
    }

    /**
     * A decoded comment before inheritance is applied.
     */
    public record RawEntry(MetadataComment comment, MetadataRecord record) {
    }
}
