package com.device.registry.lock;

/**
 * Thrown when a lock cannot be acquired within the configured timeout.
 * No registry write has happened when this is raised.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
