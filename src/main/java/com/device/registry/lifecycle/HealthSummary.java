package com.device.registry.lifecycle;

import com.device.registry.core.model.DeviceStatus;

import java.util.Map;

/**
 * Aggregate result of {@link LifecycleManager#bulkHealthCheck}.
 *
 * @param checked       devices examined
 * @param markedOffline devices moved to offline by this check
 * @param failed        devices whose check raised an error
 * @param byStatus      resulting status counts for the devices checked successfully
 */
public record HealthSummary(
        int checked,
        int markedOffline,
        int failed,
        Map<DeviceStatus, Integer> byStatus
) {
    public HealthSummary {
        byStatus = Map.copyOf(byStatus);
    }
}
