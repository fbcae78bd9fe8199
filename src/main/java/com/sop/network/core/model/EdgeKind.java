package com.sop.network.core.model;

/**
 * Kinds of directed relationships between nodes.
 * The tag is the serialized form and is relied on by external tools.
 */
public enum EdgeKind {
    SEQUENCE("sequence"),
    CONDITION_YES("condition_yes"),
    CONDITION_NO("condition_no"),
    CONDITION_UNSURE("condition_unsure"),
    NESTED_YES("nested_yes"),
    NESTED_NO("nested_no"),
    NESTED_CONDITION("nested_condition"),
    CONTAINS("contains"),
    REFERENCE("reference"),
    DEEP_LINK("deep_link"),
    PROCEED_TO_SECTION("proceed_to_section");

    private final String tag;

    EdgeKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Whether an edge of this kind is only taken when its condition label was answered.
     */
    public boolean isConditional() {
        return switch (this) {
            case CONDITION_YES, CONDITION_NO, CONDITION_UNSURE,
                    NESTED_YES, NESTED_NO, NESTED_CONDITION -> true;
            case SEQUENCE, CONTAINS, REFERENCE, DEEP_LINK, PROCEED_TO_SECTION -> false;
        };
    }
}
