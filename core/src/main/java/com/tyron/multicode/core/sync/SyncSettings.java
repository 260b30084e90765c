package com.tyron.multicode.core.sync;

import com.tyron.multicode.core.generate.IndentStyle;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tunables of the sync engine and the async manager. Immutable.
 *
 * Loaded from YAML:
 * <pre>
 * sync:
 *   debounceMillis: 50
 *   queueCapacity: 256
 *   preserveMetaFormatting: true
 *   autoFixDuplicates: false
 * generator:
 *   insertMetadata: true
 *   indentStyle: spaces
 *   indentWidth: 0
 * </pre>
 * Missing or unreadable keys keep their defaults.
 */
public final class SyncSettings {

    public static final String DEFAULT_RESOURCE = "multicode-sync.yaml";

    private static final Logger LOG = Logger.getLogger(SyncSettings.class.getName());

    private static final SyncSettings DEFAULTS = builder().build();

    private final Duration debounce;
    private final int queueCapacity;
    private final boolean preserveMetaFormatting;
    private final boolean autoFixDuplicates;
    private final boolean insertMetadataOnGenerate;
    private final IndentStyle indentStyle;
    private final int indentWidth;

    private SyncSettings(Builder b) {
        this.debounce = b.debounce;
        this.queueCapacity = b.queueCapacity;
        this.preserveMetaFormatting = b.preserveMetaFormatting;
        this.autoFixDuplicates = b.autoFixDuplicates;
        this.insertMetadataOnGenerate = b.insertMetadataOnGenerate;
        this.indentStyle = b.indentStyle;
        this.indentWidth = b.indentWidth;
    }

    public static SyncSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .debounce(debounce)
                .queueCapacity(queueCapacity)
                .preserveMetaFormatting(preserveMetaFormatting)
                .autoFixDuplicates(autoFixDuplicates)
                .insertMetadataOnGenerate(insertMetadataOnGenerate)
                .indentStyle(indentStyle)
                .indentWidth(indentWidth);
    }

    /**
     * Reads {@link #DEFAULT_RESOURCE} from the class path, falling back to the built-in defaults.
     */
    public static SyncSettings loadDefaults() {
        InputStream in = SyncSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            return DEFAULTS;
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to close " + DEFAULT_RESOURCE, e);
            return DEFAULTS;
        }
    }

    public static SyncSettings load(InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable sync settings", e);
            return DEFAULTS;
        }
        Builder builder = builder();
        if (!(doc instanceof Map<?, ?> map)) {
            return builder.build();
        }

        if (map.get("sync") instanceof Map<?, ?> sync) {
            Object debounce = sync.get("debounceMillis");
            if (debounce instanceof Number n && n.longValue() >= 0) {
                builder.debounce(Duration.ofMillis(n.longValue()));
            }
            Object capacity = sync.get("queueCapacity");
            if (capacity instanceof Number n && n.intValue() > 0) {
                builder.queueCapacity(n.intValue());
            }
            if (sync.get("preserveMetaFormatting") instanceof Boolean b) {
                builder.preserveMetaFormatting(b);
            }
            if (sync.get("autoFixDuplicates") instanceof Boolean b) {
                builder.autoFixDuplicates(b);
            }
        }

        if (map.get("generator") instanceof Map<?, ?> generator) {
            if (generator.get("insertMetadata") instanceof Boolean b) {
                builder.insertMetadataOnGenerate(b);
            }
            Object style = generator.get("indentStyle");
            if (style != null) {
                try {
                    builder.indentStyle(IndentStyle.valueOf(String.valueOf(style).trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    LOG.warning("Unknown indentStyle '" + style + "', keeping " + builder.indentStyle);
                }
            }
            Object width = generator.get("indentWidth");
            if (width instanceof Number n && n.intValue() >= 0) {
                builder.indentWidth(n.intValue());
            }
        }
        return builder.build();
    }

    /**
     * @return how long the async manager keeps collecting messages after the first one of a batch
     */
    public Duration getDebounce() {
        return debounce;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isPreserveMetaFormatting() {
        return preserveMetaFormatting;
    }

    /**
     * @return whether duplicate ids are renamed in the text before it is read
     */
    public boolean isAutoFixDuplicates() {
        return autoFixDuplicates;
    }

    public boolean isInsertMetadataOnGenerate() {
        return insertMetadataOnGenerate;
    }

    public IndentStyle getIndentStyle() {
        return indentStyle;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    @Override
    public String toString() {
        return "SyncSettings{debounce=" + debounce + ", queueCapacity=" + queueCapacity
                + ", preserveMetaFormatting=" + preserveMetaFormatting + ", autoFixDuplicates=" + autoFixDuplicates
                + ", insertMetadataOnGenerate=" + insertMetadataOnGenerate + ", indentStyle=" + indentStyle
                + ", indentWidth=" + indentWidth + "}";
    }

    public static final class Builder {
        private Duration debounce = Duration.ofMillis(50);
        private int queueCapacity = 256;
        private boolean preserveMetaFormatting = true;
        private boolean autoFixDuplicates;
        private boolean insertMetadataOnGenerate = true;
        private IndentStyle indentStyle = IndentStyle.SPACES;
        private int indentWidth;

        private Builder() {
        }

        public Builder debounce(Duration debounce) {
            if (debounce == null || debounce.isNegative()) {
                throw new IllegalArgumentException("debounce must be zero or positive");
            }
            this.debounce = debounce;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queueCapacity must be positive");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder preserveMetaFormatting(boolean preserveMetaFormatting) {
            this.preserveMetaFormatting = preserveMetaFormatting;
            return this;
        }

        public Builder autoFixDuplicates(boolean autoFixDuplicates) {
            this.autoFixDuplicates = autoFixDuplicates;
            return this;
        }

        public Builder insertMetadataOnGenerate(boolean insertMetadataOnGenerate) {
            this.insertMetadataOnGenerate = insertMetadataOnGenerate;
            return this;
        }

        public Builder indentStyle(IndentStyle indentStyle) {
            this.indentStyle = indentStyle == null ? IndentStyle.SPACES : indentStyle;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = Math.max(0, indentWidth);
            return this;
        }

        public SyncSettings build() {
            return new SyncSettings(this);
        }
    }
}
