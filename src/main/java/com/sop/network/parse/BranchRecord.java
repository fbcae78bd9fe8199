package com.sop.network.parse;

import com.sop.network.extract.ExtractedEntity;

import java.util.List;

/**
 * One Yes/No/Unsure outcome of a decision step.
 *
 * @param kind             marker kind
 * @param action           branch text before its first nested item
 * @param continueToStep   whether the action says to continue to the next step
 * @param proceedToSection section named by a "proceed to the X section" instruction, or null
 * @param subConditions    nested markers and labeled items, in text order
 * @param references       reference codes found in the action
 * @param entities         entities found in the action
 */
public record BranchRecord(BranchKind kind, String action, boolean continueToStep, String proceedToSection,
                           List<SubConditionRecord> subConditions, List<ReferenceMention> references,
                           List<ExtractedEntity> entities) {

    public BranchRecord {
        subConditions = subConditions != null ? List.copyOf(subConditions) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
