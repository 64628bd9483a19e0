package com.device.registry.sync;

/**
 * Thrown when a source adapter cannot deliver a batch this cycle. The cycle for that
 * source is skipped without registry writes and retried on the next tick.
 */
public class AdapterFetchException extends RuntimeException {

    private final String sourceId;

    public AdapterFetchException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public AdapterFetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
