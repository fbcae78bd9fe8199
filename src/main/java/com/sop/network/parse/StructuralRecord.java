package com.sop.network.parse;

import com.sop.network.core.model.LookupTable;
import com.sop.network.extract.ExtractedEntity;

import java.util.List;

/**
 * Everything the parser recognized in one document. Fields are never null.
 *
 * @param header      header fields
 * @param revisions   revision-history rows in document order
 * @param categories  categories in order of first occurrence
 * @param tables      lookup tables other than the revision history
 * @param references  distinct reference codes in the whole text, first sighting first
 * @param entities    distinct entities in the whole text
 * @param rawText     the input text
 */
public record StructuralRecord(DocumentHeader header, List<RevisionEntry> revisions,
                               List<CategorySection> categories, List<LookupTable> tables,
                               List<ReferenceMention> references, List<ExtractedEntity> entities,
                               String rawText) {

    public StructuralRecord {
        header = header != null ? header : DocumentHeader.empty();
        revisions = revisions != null ? List.copyOf(revisions) : List.of();
        categories = categories != null ? List.copyOf(categories) : List.of();
        tables = tables != null ? List.copyOf(tables) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
        rawText = rawText != null ? rawText : "";
    }
}
