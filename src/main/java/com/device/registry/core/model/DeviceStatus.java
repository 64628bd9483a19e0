package com.device.registry.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a registered device.
 * The allowed transitions between these states are owned by
 * {@link com.device.registry.lifecycle.TransitionTable}.
 */
public enum DeviceStatus {
    /**
     * Found via a source poll, not yet configured.
     */
    DISCOVERED,

    /**
     * Being configured or registered.
     */
    PROVISIONING,

    /**
     * Fully operational and responding to polls.
     */
    ONLINE,

    /**
     * Functional but reporting warnings.
     */
    DEGRADED,

    /**
     * Not responding.
     */
    OFFLINE,

    /**
     * Administratively disabled.
     */
    MAINTENANCE,

    /**
     * Permanently decommissioned. Terminal.
     */
    RETIRED;

    private static final Set<DeviceStatus> ACTIVE = EnumSet.of(ONLINE, DEGRADED, PROVISIONING);
    private static final Set<DeviceStatus> OUT_OF_SERVICE = EnumSet.of(MAINTENANCE, RETIRED);

    /**
     * Returns true for states where the device is considered in use.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Returns true for states where the device is intentionally unavailable.
     */
    public boolean isOutOfService() {
        return OUT_OF_SERVICE.contains(this);
    }

    /**
     * Returns true if staleness may drive this state to {@link #OFFLINE}.
     */
    public boolean isHealthChecked() {
        return this == ONLINE || this == DEGRADED;
    }
}
