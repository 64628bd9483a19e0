package com.device.registry.lifecycle;

import com.device.registry.core.model.Device;
import com.device.registry.core.model.DeviceStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Age thresholds used to derive a {@link HealthState}.
 *
 * @param healthyWindow devices seen more recently than this are healthy
 * @param warningWindow devices seen more recently than this (but not healthy) are in warning
 */
public record HealthPolicy(Duration healthyWindow, Duration warningWindow) {

    public HealthPolicy {
        Objects.requireNonNull(healthyWindow, "healthyWindow is required");
        Objects.requireNonNull(warningWindow, "warningWindow is required");
        if (healthyWindow.isNegative() || healthyWindow.isZero()) {
            throw new IllegalArgumentException("healthyWindow must be positive");
        }
        if (warningWindow.compareTo(healthyWindow) < 0) {
            throw new IllegalArgumentException("warningWindow must not be shorter than healthyWindow");
        }
    }

    public static HealthPolicy defaults() {
        return new HealthPolicy(Duration.ofMinutes(5), Duration.ofMinutes(30));
    }

    public HealthState evaluate(Device device, Instant now) {
        DeviceStatus status = device.getStatus();
        if (status == DeviceStatus.OFFLINE) {
            return HealthState.OFFLINE;
        }
        if (status == DeviceStatus.MAINTENANCE) {
            return HealthState.MAINTENANCE;
        }
        if (status == DeviceStatus.RETIRED) {
            return HealthState.RETIRED;
        }
        if (device.getLastSeenAt() == null) {
            return HealthState.UNKNOWN;
        }
        Duration age = Duration.between(device.getLastSeenAt(), now);
        if (age.compareTo(healthyWindow) < 0) {
            return HealthState.HEALTHY;
        }
        if (age.compareTo(warningWindow) < 0) {
            return HealthState.WARNING;
        }
        return HealthState.STALE;
    }
}
