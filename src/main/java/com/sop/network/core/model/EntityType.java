package com.sop.network.core.model;

/**
 * Classes of domain identifiers picked out of procedure text.
 */
public enum EntityType {
    PROVIDER_ID("provider_id", "Provider ID"),
    TAX_ID("tin", "Tax Identification Number"),
    NPI("npi", "National Provider Identifier"),
    PEND_CODE("pend_code", "Pend Code"),
    PCA_CODE("pca_code", "PCA Code"),
    GROUP_NUMBER("group_number", "Group Number"),
    PROVIDER_NAME("provider_name", "Provider Name"),
    MESSAGE("ultra_blue_message", "Ultra Blue Message");

    private final String tag;
    private final String label;

    EntityType(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public String getTag() {
        return tag;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Deterministic entity id for a normalized value of this type.
     */
    public String entityId(String normalizedValue) {
        return tag + "_" + normalizedValue;
    }
}
