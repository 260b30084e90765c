package com.tyron.multicode.core.sync;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.ParsedSource;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.api.sync.SyncDiagnostics;
import com.tyron.multicode.core.mapping.ElementMapper;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the engine knows about one text snapshot. Replaced as a whole after every processed message.
 *
 * @param records effective records by id in document order
 * @param tree    the parse of {@code code}, null when no parser handles {@code lang}
 */
public record SyncState(
        String code,
        Lang lang,
        Map<String, MetadataRecord> records,
        List<Block> blocks,
        ElementMapper mapper,
        SyncDiagnostics diagnostics,
        @Nullable ParsedSource tree
) {

    public SyncState {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        blocks = List.copyOf(blocks);
    }

    public static SyncState empty(Lang lang) {
        return new SyncState("", lang, Map.of(), List.of(), ElementMapper.empty(), SyncDiagnostics.empty(), null);
    }

    public List<MetadataRecord> recordList() {
        return new ArrayList<>(records.values());
    }
}
