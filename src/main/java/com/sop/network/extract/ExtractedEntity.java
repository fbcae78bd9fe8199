package com.sop.network.extract;

import com.sop.network.core.model.EntityType;

/**
 * One pattern hit in a piece of text.
 *
 * @param type            entity class
 * @param value           matched text
 * @param normalizedValue value after normalization, the identity key
 * @param offset          start offset of the value in the scanned text
 */
public record ExtractedEntity(EntityType type, String value, String normalizedValue, int offset) {

    public String entityId() {
        return type.entityId(normalizedValue);
    }
}
