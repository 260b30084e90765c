package com.tyron.multicode.api.sync;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.meta.MetadataRecord;

import java.util.Objects;

/**
 * A change reported by one of the two views.
 */
public interface SyncMessage {

    static SyncMessage textChanged(String code, Lang lang) {
        return new TextChanged(code, lang);
    }

    static SyncMessage visualChanged(MetadataRecord record) {
        return new VisualChanged(record);
    }

    /**
     * The text editor holds new source. The text is authoritative for itself.
     */
    record TextChanged(String code, Lang lang) implements SyncMessage {
        public TextChanged {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(lang, "lang");
        }
    }

    /**
     * The visual editor moved or edited one block.
     */
    record VisualChanged(MetadataRecord record) implements SyncMessage {
        public VisualChanged {
            Objects.requireNonNull(record, "record");
        }
    }
}
