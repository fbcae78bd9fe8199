package com.sop.network.parse;

import java.util.List;

/**
 * A top-level category with its steps.
 *
 * @param name    heading text
 * @param rawText text under the heading, with the text of merged duplicates appended
 * @param steps   numbered steps in text order
 */
public record CategorySection(String name, String rawText, List<StepRecord> steps) {

    public CategorySection {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }
}
