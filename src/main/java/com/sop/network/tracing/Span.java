package com.sop.network.tracing;

/**
 * A traced operation in flight. Closing the span ends it, so spans are opened
 * in try-with-resources blocks:
 *
 * <pre>
 * try (Span span = tracingService.startReference(code)) {
 *     span.setAttribute(SpanAttributes.REFERENCE_DEPTH, depth);
 *     ...
 *     span.succeed();
 * }
 * </pre>
 *
 * A span closed without {@link #succeed()} or {@link #fail(Throwable)} keeps
 * an unset status.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void succeed();

    /**
     * Records the cause and marks the operation failed.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
