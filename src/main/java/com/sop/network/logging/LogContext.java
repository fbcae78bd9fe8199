package com.sop.network.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC entries scoped to a try-with-resources block.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(passId, documentId)) {
 *     log.info("reference.resolved code={} depth={}", code, depth);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previous = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for parsing and building one document.
     */
    public static LogContext forDocument(String documentId) {
        return new LogContext()
                .with("documentId", documentId)
                .with("operation", "build");
    }

    /**
     * Context for one deep-link resolution pass over a network.
     */
    public static LogContext forResolution(String passId, String documentId) {
        return new LogContext()
                .with("passId", passId)
                .with("documentId", documentId)
                .with("operation", "resolve");
    }

    /**
     * Context for merging a referenced document into a network.
     */
    public static LogContext forMerge(String documentId, String referenceCode) {
        return new LogContext()
                .with("documentId", documentId)
                .with("referenceCode", referenceCode)
                .with("operation", "merge");
    }

    public static String newPassId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an entry. Closing the context restores the value the key had before.
     */
    public LogContext with(String key, String value) {
        keys.add(key);
        previous.add(MDC.get(key));
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String old = previous.get(i);
            if (old == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), old);
            }
        }
        keys.clear();
        previous.clear();
    }
}
