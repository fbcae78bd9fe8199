package com.sop.network.core.model;

/**
 * Kinds of vertices in a {@link WorldNetwork}.
 * The tag is the serialized form and is relied on by external tools.
 */
public enum NodeKind {
    ROOT("root"),
    CATEGORY("claim_type"),
    DECISION("decision"),
    STEP("step"),
    BRANCH_YES("branch_yes"),
    BRANCH_NO("branch_no"),
    BRANCH_UNSURE("branch_unsure"),
    SUB_CONDITION("sub_condition"),
    ACTION("action"),
    REFERENCE("reference"),
    LINKED_ROOT("linked_root");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Whether nodes of this kind are a Yes/No/Unsure outcome of a decision.
     */
    public boolean isBranch() {
        return switch (this) {
            case BRANCH_YES, BRANCH_NO, BRANCH_UNSURE -> true;
            case ROOT, CATEGORY, DECISION, STEP, SUB_CONDITION, ACTION, REFERENCE, LINKED_ROOT -> false;
        };
    }
}
