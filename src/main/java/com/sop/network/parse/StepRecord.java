package com.sop.network.parse;

import com.sop.network.extract.ExtractedEntity;

import java.util.List;

/**
 * A numbered step of a category.
 *
 * @param number     step number as written
 * @param leadText   text before the first branch marker, whitespace-collapsed
 * @param decision   whether the step is a question with outcomes
 * @param branches   outcomes in text order; empty for plain steps
 * @param notes      "Important Note" passages
 * @param references reference codes found in the lead text
 * @param entities   entities found in the lead text
 * @param rawExcerpt start of the raw step text
 */
public record StepRecord(int number, String leadText, boolean decision, List<BranchRecord> branches,
                         List<String> notes, List<ReferenceMention> references,
                         List<ExtractedEntity> entities, String rawExcerpt) {

    public StepRecord {
        branches = branches != null ? List.copyOf(branches) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
