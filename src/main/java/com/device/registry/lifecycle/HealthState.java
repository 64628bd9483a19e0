package com.device.registry.lifecycle;

/**
 * Health derived on read from status and time since last observation. Never stored.
 */
public enum HealthState {
    HEALTHY,
    WARNING,
    STALE,
    UNKNOWN,
    OFFLINE,
    MAINTENANCE,
    RETIRED
}
