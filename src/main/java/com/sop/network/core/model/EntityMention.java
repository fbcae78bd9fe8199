package com.sop.network.core.model;

/**
 * Where an entity was seen.
 *
 * @param section    category or table name, {@code document} for the whole-text sweep
 * @param stepNumber step number, or null when the mention is not tied to a step
 */
public record EntityMention(String section, Integer stepNumber) {

    public static final String DOCUMENT_SECTION = "document";

    public static EntityMention document() {
        return new EntityMention(DOCUMENT_SECTION, null);
    }
}
