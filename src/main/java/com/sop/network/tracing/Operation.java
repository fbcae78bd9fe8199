package com.sop.network.tracing;

/**
 * Traced operations and the span names they are reported under.
 */
public enum Operation {
    BUILD("sop.build"),
    RESOLVE_ALL("sop.resolve_all"),
    RESOLVE_REFERENCE("sop.resolve_reference");

    private final String spanName;

    Operation(String spanName) {
        this.spanName = spanName;
    }

    public String getSpanName() {
        return spanName;
    }
}
