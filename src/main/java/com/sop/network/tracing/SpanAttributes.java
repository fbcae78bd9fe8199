package com.sop.network.tracing;

/**
 * Attribute keys set on spans.
 */
public final class SpanAttributes {

    public static final String DOCUMENT_KEY = "document.key";
    public static final String NETWORK_NODES = "network.nodes";
    public static final String NETWORK_REFERENCES = "network.references";
    public static final String MAX_DEPTH = "resolution.max_depth";
    public static final String REFERENCES_RESOLVED = "resolution.resolved";
    public static final String REFERENCES_SKIPPED = "resolution.skipped_by_timeout";
    public static final String REFERENCE_CODE = "reference.code";
    public static final String REFERENCE_DEPTH = "reference.depth";
    public static final String REFERENCE_OUTCOME = "reference.outcome";

    private SpanAttributes() {
    }
}
