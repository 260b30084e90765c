package com.tyron.multicode.core.sync;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.meta.ValidationError;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.sync.Conflict;
import com.tyron.multicode.api.sync.ConflictType;
import com.tyron.multicode.api.sync.IdChanges;
import com.tyron.multicode.api.sync.SyncDiagnostics;
import com.tyron.multicode.api.sync.SyncException;
import com.tyron.multicode.api.sync.SyncMessage;
import com.tyron.multicode.api.sync.SyncResult;
import com.tyron.multicode.core.conflict.ConflictResolver;
import com.tyron.multicode.core.conflict.Resolved;
import com.tyron.multicode.core.generate.CodeGenerator;
import com.tyron.multicode.core.generate.GenerationException;
import com.tyron.multicode.core.mapping.ElementMapper;
import com.tyron.multicode.core.meta.CommentStyle;
import com.tyron.multicode.core.meta.MetadataComments;
import com.tyron.multicode.core.meta.MetadataStore;
import com.tyron.multicode.core.meta.ReadResult;
import com.tyron.multicode.core.syntax.Extraction;
import com.tyron.multicode.core.syntax.LanguageParserRegistry;
import com.tyron.multicode.core.syntax.SyntaxExtractor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Keeps one text document and its visual representation consistent.
 *
 * A {@link SyncMessage.TextChanged} replaces the code and rebuilds blocks, records and mappings from it. A
 * {@link SyncMessage.VisualChanged} writes one record into the code, resolving a conflict with the record
 * already in the text first, then rebuilds the same way. Either way the state is replaced as a whole, so a
 * failing message leaves the previous state untouched.
 *
 * Not thread safe. Use {@link com.tyron.multicode.core.sync.async.AsyncManager} to drive an engine from several
 * producers.
 */
public class SyncEngine {

    private static final Logger LOG = Logger.getLogger(SyncEngine.class.getName());

    private final SyntaxExtractor extractor;
    private final MetadataStore store;
    private final SyncSettings settings;
    private final ChangeTracker changeTracker = new ChangeTracker();

    private SyncState state;

    public SyncEngine(Lang lang) {
        this(lang, LanguageParserRegistry.withInstalledParsers(), new MetadataStore(), SyncSettings.loadDefaults());
    }

    public SyncEngine(Lang lang, LanguageParserRegistry registry, MetadataStore store, SyncSettings settings) {
        this.extractor = new SyntaxExtractor(registry);
        this.store = store;
        this.settings = settings;
        this.state = SyncState.empty(lang);
    }

    public SyncResult handle(SyncMessage message) throws SyncException {
        if (message instanceof SyncMessage.TextChanged text) {
            return onTextChanged(text);
        }
        if (message instanceof SyncMessage.VisualChanged visual) {
            return onVisualChanged(visual);
        }
        throw new SyncException("Unsupported message " + message);
    }

    private SyncResult onTextChanged(SyncMessage.TextChanged message) {
        String code = message.code();
        if (settings.isAutoFixDuplicates()) {
            code = store.fixAll(code);
        }
        SyncState previous = state;
        SyncState next = derive(code, message.lang());
        IdChanges changes = ChangeTracker.diff(previous.records(), next.records());
        changeTracker.recordText(changes);
        state = next;
        return toResult(next, List.of(), changes);
    }

    private SyncResult onVisualChanged(SyncMessage.VisualChanged message) throws SyncException {
        MetadataRecord incoming = message.record();
        if (incoming.getVersion() <= 0) {
            incoming = incoming.withVersion(MetadataRecord.DEFAULT_VERSION);
        }
        List<ValidationError> errors = store.validate(incoming);
        if (!errors.isEmpty()) {
            LOG.warning("Rejected visual change for '" + incoming.getId() + "': " + errors);
            throw new SyncException("Invalid metadata '" + incoming.getId() + "'", errors);
        }

        SyncState previous = state;
        MetadataRecord toWrite = incoming;
        List<Conflict> conflicts = List.of();
        MetadataRecord existing = previous.records().get(incoming.getId());
        if (existing != null) {
            Optional<ConflictType> type = ConflictResolver.detect(existing, incoming);
            if (type.isPresent()) {
                Resolved resolved = ConflictResolver.resolve(existing, incoming);
                toWrite = resolved.record();
                conflicts = List.of(resolved.conflict());
                LOG.fine("Resolved " + resolved.conflict());
            } else {
                toWrite = incoming.withVersion(Math.max(existing.getVersion(), incoming.getVersion()));
            }
        }

        String code = store.upsert(previous.code(), toWrite, settings.isPreserveMetaFormatting(),
                CommentStyle.forLang(previous.lang()));
        SyncState next = derive(code, previous.lang());
        IdChanges changes = ChangeTracker.diff(previous.records(), next.records());
        changeTracker.recordVisual(changes);
        state = next;
        return toResult(next, conflicts, changes);
    }

    private SyncState derive(String code, Lang lang) {
        ReadResult read = store.read(code);
        Map<String, MetadataRecord> records = new LinkedHashMap<>();
        for (MetadataRecord record : read.records()) {
            records.put(record.getId(), record);
        }

        Optional<Extraction> extraction = extractor.extract(code, lang, state.tree(), MetadataComments.strip(code));
        List<Block> blocks = extraction.map(Extraction::blocks).orElse(List.of());
        ElementMapper mapper = ElementMapper.build(blocks, records.values());
        SyncDiagnostics diagnostics = new SyncDiagnostics(
                extraction.isPresent(),
                extraction.map(e -> e.tree().errorCount()).orElse(0),
                mapper.orphanedIds(),
                mapper.unmappedCode(),
                read.duplicateIds(),
                mapper.overlapping());
        return new SyncState(code, lang, records, blocks, mapper, diagnostics,
                extraction.map(Extraction::tree).orElse(null));
    }

    private static SyncResult toResult(SyncState state, List<Conflict> conflicts, IdChanges changes) {
        return new SyncResult(state.code(), state.recordList(), conflicts, state.diagnostics(), changes);
    }

    /**
     * Regenerates code for the current records from their canvas positions.
     *
     * @throws GenerationException when a record has no block or carries metadata that cannot be written back
     */
    public String generateCode() throws GenerationException {
        CodeGenerator generator = new CodeGenerator(state.lang(), store, settings.isInsertMetadataOnGenerate());
        return generator.generate(state.recordList(), state.blocks(), settings.getIndentWidth(),
                settings.getIndentStyle());
    }

    public SyncState state() {
        return state;
    }

    /**
     * Drops the document and every accumulated change, keeping the language.
     */
    public void reset() {
        state = SyncState.empty(state.lang());
        changeTracker.clear();
    }

    public List<String> takeTextChanges() {
        return changeTracker.takeTextChanges();
    }

    public List<String> takeVisualChanges() {
        return changeTracker.takeVisualChanges();
    }

    public SyncSettings getSettings() {
        return settings;
    }

    public MetadataStore getStore() {
        return store;
    }
}
