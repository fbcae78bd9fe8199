package com.sop.network.parse;

import com.sop.network.extract.ExtractedEntity;

import java.util.List;

/**
 * An item nested inside a branch.
 *
 * @param kind       nested marker or labeled item
 * @param label      {@code YES}/{@code NO} for nested markers, the label text for labeled items
 * @param text       full text of the item
 * @param references reference codes found in the text
 * @param entities   entities found in the text
 */
public record SubConditionRecord(SubConditionKind kind, String label, String text,
                                 List<ReferenceMention> references, List<ExtractedEntity> entities) {

    public SubConditionRecord {
        references = references != null ? List.copyOf(references) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
