package com.sop.network.core.model;

/**
 * Resolution state of a {@link ProcedureReference}.
 */
public enum ReferenceStatus {
    /**
     * Known but not attempted yet, or held back by the depth limit.
     */
    PENDING("pending"),

    /**
     * Resolution in progress. Any code met again in this state is skipped,
     * which breaks reference cycles.
     */
    RESOLVING("resolving"),

    RESOLVED("resolved"),

    /**
     * The locator had no document for the code.
     */
    NOT_FOUND("not_found"),

    /**
     * Fetching, parsing, building or merging the document failed.
     */
    ERROR("error");

    private final String tag;

    ReferenceStatus(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isTerminal() {
        return switch (this) {
            case RESOLVED, NOT_FOUND, ERROR -> true;
            case PENDING, RESOLVING -> false;
        };
    }

    /**
     * Whether moving from this status to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(ReferenceStatus next) {
        return switch (this) {
            case PENDING -> next == RESOLVING;
            case RESOLVING -> next.isTerminal();
            case RESOLVED, NOT_FOUND, ERROR -> false;
        };
    }
}
