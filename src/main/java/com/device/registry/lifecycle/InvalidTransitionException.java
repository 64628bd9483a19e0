package com.device.registry.lifecycle;

import com.device.registry.core.model.DeviceStatus;

/**
 * Thrown when a requested status change is not in the {@link TransitionTable}.
 * The stored status is left unchanged.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String deviceRef;
    private final DeviceStatus from;
    private final DeviceStatus to;

    public InvalidTransitionException(String deviceRef, DeviceStatus from, DeviceStatus to) {
        super("Invalid transition for device " + deviceRef + ": " + from + " -> " + to
                + " (allowed: " + TransitionTable.allowedTargets(from) + ")");
        this.deviceRef = deviceRef;
        this.from = from;
        this.to = to;
    }

    public String getDeviceRef() {
        return deviceRef;
    }

    public DeviceStatus getFrom() {
        return from;
    }

    public DeviceStatus getTo() {
        return to;
    }
}
