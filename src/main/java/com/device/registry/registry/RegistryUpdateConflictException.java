package com.device.registry.registry;

/**
 * Optimistic-concurrency failure: the device was changed by another writer after the
 * caller read it.
 */
public class RegistryUpdateConflictException extends RuntimeException {

    private final String deviceRef;
    private final long expectedVersion;
    private final long actualVersion;

    public RegistryUpdateConflictException(String deviceRef, long expectedVersion, long actualVersion) {
        super("Device " + deviceRef + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
        this.deviceRef = deviceRef;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getDeviceRef() {
        return deviceRef;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
