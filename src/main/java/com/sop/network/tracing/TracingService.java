package com.sop.network.tracing;

import java.util.Map;

/**
 * Opens spans around building and resolution.
 * The default {@link NoOpTracingService} does nothing, so the library runs
 * without any tracing dependency on the classpath.
 */
public interface TracingService {

    Span startSpan(Operation operation, Map<String, String> attributes);

    default Span startBuild(String documentKey) {
        return startSpan(Operation.BUILD, Map.of(SpanAttributes.DOCUMENT_KEY, documentKey));
    }

    default Span startResolution(String documentKey) {
        return startSpan(Operation.RESOLVE_ALL, Map.of(SpanAttributes.DOCUMENT_KEY, documentKey));
    }

    default Span startReference(String code) {
        return startSpan(Operation.RESOLVE_REFERENCE, Map.of(SpanAttributes.REFERENCE_CODE, code));
    }
}
