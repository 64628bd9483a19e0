package com.device.registry.tracing;

/**
 * A unit of work in a distributed trace. Closing the span ends it, so spans are
 * used in try-with-resources blocks:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("sync.cycle", Map.of("sourceId", sourceId))) {
 *     span.setAttribute("observations", batch.size());
 *     ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
