package com.device.registry.lifecycle;

import com.device.registry.core.model.DeviceStatus;

/**
 * Outcome of a staleness check on one device.
 */
public record HealthCheckResult(
        String deviceRef,
        DeviceStatus previousStatus,
        DeviceStatus currentStatus
) {
    public boolean transitioned() {
        return previousStatus != currentStatus;
    }
}
