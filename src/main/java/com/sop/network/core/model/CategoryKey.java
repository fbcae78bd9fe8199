package com.sop.network.core.model;

import java.util.Objects;

/**
 * Key of a category root. Native categories are keyed by name; categories
 * absorbed from a linked document are namespaced by its reference code,
 * rendered as {@code code/name}.
 *
 * @param referenceCode code of the linked document, or null for a native category
 * @param name          category name
 */
public record CategoryKey(String referenceCode, String name) {

    public static final String SEPARATOR = "/";

    public CategoryKey {
        Objects.requireNonNull(name, "name is required");
    }

    public static CategoryKey nativeCategory(String name) {
        return new CategoryKey(null, name);
    }

    public static CategoryKey linked(String referenceCode, String name) {
        return new CategoryKey(Objects.requireNonNull(referenceCode, "referenceCode is required"), name);
    }

    public boolean isNamespaced() {
        return referenceCode != null;
    }

    /**
     * Serialized key as it appears in {@code claim_type_roots}.
     */
    public String toKey() {
        return isNamespaced() ? referenceCode + SEPARATOR + name : name;
    }

    /**
     * Re-homes a category of a linked document under that document's code.
     * A category that is already namespaced keeps its full key as the name.
     */
    public CategoryKey namespacedUnder(String code) {
        return linked(code, toKey());
    }
}
