package com.tyron.multicode.core.generate;

import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.meta.MetadataRecord;
import com.tyron.multicode.api.meta.ValidationError;
import com.tyron.multicode.api.model.Block;
import com.tyron.multicode.core.meta.CommentStyle;
import com.tyron.multicode.core.meta.MetadataStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emits source code from the visual state.
 *
 * Records are laid out top to bottom, then left to right, by canvas position. Each contributes its
 * translation for the target language followed by its metadata comment. The output depends only on the
 * inputs.
 */
public class CodeGenerator {

    private static final Comparator<MetadataRecord> CANVAS_ORDER =
            Comparator.comparingDouble(MetadataRecord::getY).thenComparingDouble(MetadataRecord::getX);

    private final Lang lang;
    private final MetadataStore store;
    private final boolean insertMetadata;
    private final CommentStyle commentStyle;

    public CodeGenerator(Lang lang, MetadataStore store, boolean insertMetadata) {
        this(lang, store, insertMetadata, CommentStyle.forLang(lang));
    }

    public CodeGenerator(Lang lang, MetadataStore store, boolean insertMetadata, CommentStyle commentStyle) {
        this.lang = lang;
        this.store = store;
        this.insertMetadata = insertMetadata;
        this.commentStyle = commentStyle;
    }

    /**
     * @param records the records to lay out
     * @param blocks  blocks of the current parse; every record must have one
     * @throws MissingBlocksException   listing every record id without a block. Nothing is generated then.
     * @throws InvalidMetadataException listing every record that does not validate, checked after blocks
     */
    public String generate(List<MetadataRecord> records, List<Block> blocks)
            throws MissingBlocksException, InvalidMetadataException {
        Set<String> blockIds = new HashSet<>();
        for (Block block : blocks) {
            blockIds.add(block.visualId());
        }
        List<String> missing = new ArrayList<>();
        for (MetadataRecord record : records) {
            if (!blockIds.contains(record.getId())) {
                missing.add(record.getId());
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingBlocksException(missing);
        }
        Map<String, List<ValidationError>> invalid = new LinkedHashMap<>();
        for (MetadataRecord record : records) {
            List<ValidationError> errors = store.validate(record);
            if (!errors.isEmpty()) {
                invalid.put(record.getId(), errors);
            }
        }
        if (!invalid.isEmpty()) {
            throw new InvalidMetadataException(invalid);
        }

        List<MetadataRecord> sorted = new ArrayList<>(records);
        sorted.sort(CANVAS_ORDER);

        StringBuilder out = new StringBuilder();
        for (MetadataRecord record : sorted) {
            String snippet = record.getTranslations().getOrDefault(lang.id(), "");
            out.append(snippet);
            if (!snippet.isEmpty() && !snippet.endsWith("\n")) {
                out.append('\n');
            }
            if (insertMetadata) {
                out.append(store.render(record, commentStyle)).append('\n');
            }
        }
        return out.toString();
    }

    public String generate(List<MetadataRecord> records, List<Block> blocks, int indentWidth, IndentStyle style)
            throws MissingBlocksException, InvalidMetadataException {
        return CodeFormatter.indent(generate(records, blocks), indentWidth, style);
    }
}
