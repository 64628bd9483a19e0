package com.device.registry.event;

import com.device.registry.core.model.DeviceStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One change to one device during a sync cycle, for the broadcast layer.
 *
 * @param deviceRef     the device that changed
 * @param sourceId      the source whose cycle produced the change
 * @param oldStatus     status before the cycle touched the device, null if it was created
 * @param newStatus     status after the cycle
 * @param changedFields names of changed {@link com.device.registry.core.model.Device} fields
 * @param timestamp     when the event was produced
 */
public record DeviceEvent(
        String deviceRef,
        String sourceId,
        DeviceStatus oldStatus,
        DeviceStatus newStatus,
        Set<String> changedFields,
        Instant timestamp
) {
    public DeviceEvent {
        Objects.requireNonNull(deviceRef, "deviceRef is required");
        Objects.requireNonNull(newStatus, "newStatus is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        changedFields = changedFields != null ? Set.copyOf(changedFields) : Set.of();
    }

    public boolean isCreated() {
        return oldStatus == null;
    }

    public boolean isStatusChange() {
        return oldStatus != newStatus;
    }
}
