package com.device.registry.tracing;

import java.util.Map;

/**
 * Distributed tracing integration used around sync cycles.
 * The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
