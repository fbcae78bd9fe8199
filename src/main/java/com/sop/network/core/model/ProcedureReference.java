package com.sop.network.core.model;

import java.util.Objects;

/**
 * Placeholder for a link to another procedure document, keyed by its reference code.
 * A network holds exactly one reference per code. Status moves forward only:
 * {@code pending -> resolving -> resolved | not_found | error}.
 */
public class ProcedureReference {

    private final String code;
    private String title;
    private final String sourceContext;
    private final int depth;
    private ReferenceStatus status;
    private String errorMessage;
    private String linkedRootId;

    public ProcedureReference(String code, String title, String sourceContext, int depth) {
        this.code = Objects.requireNonNull(code, "code is required");
        this.title = title != null && !title.isBlank() ? title : null;
        this.sourceContext = sourceContext;
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
        this.depth = depth;
        this.status = ReferenceStatus.PENDING;
    }

    public String getCode() {
        return code;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Keeps the first title seen for this code.
     */
    public void offerTitle(String candidate) {
        if (title == null && candidate != null && !candidate.isBlank()) {
            title = candidate;
        }
    }

    public String getSourceContext() {
        return sourceContext;
    }

    /**
     * Number of document hops between the main document and the document
     * in which this code was first found.
     */
    public int getDepth() {
        return depth;
    }

    public ReferenceStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getLinkedRootId() {
        return linkedRootId;
    }

    public boolean isPending() {
        return status == ReferenceStatus.PENDING;
    }

    public boolean isResolved() {
        return status == ReferenceStatus.RESOLVED;
    }

    public void markResolving() {
        transitionTo(ReferenceStatus.RESOLVING);
    }

    public void markResolved(String linkedRootId) {
        Objects.requireNonNull(linkedRootId, "linkedRootId is required");
        transitionTo(ReferenceStatus.RESOLVED);
        this.linkedRootId = linkedRootId;
    }

    public void markNotFound() {
        transitionTo(ReferenceStatus.NOT_FOUND);
    }

    public void markError(String message) {
        transitionTo(ReferenceStatus.ERROR);
        this.errorMessage = message;
    }

    /**
     * Makes a failed reference eligible for another resolution pass.
     * Only {@code not_found} and {@code error} can be reopened, and only between passes.
     */
    public void reopen() {
        if (status != ReferenceStatus.NOT_FOUND && status != ReferenceStatus.ERROR) {
            throw new IllegalStateException("Cannot reopen reference " + code + " in status " + status);
        }
        status = ReferenceStatus.PENDING;
        errorMessage = null;
    }

    private void transitionTo(ReferenceStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for " + code + ": " + status + " -> " + next);
        }
        status = next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcedureReference that = (ProcedureReference) o;
        return Objects.equals(code, that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code);
    }

    @Override
    public String toString() {
        return "ProcedureReference{" +
                "code='" + code + '\'' +
                ", status=" + status +
                ", depth=" + depth +
                '}';
    }
}
