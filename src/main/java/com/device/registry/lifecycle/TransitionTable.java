package com.device.registry.lifecycle;

import com.device.registry.core.model.DeviceStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.device.registry.core.model.DeviceStatus.DEGRADED;
import static com.device.registry.core.model.DeviceStatus.DISCOVERED;
import static com.device.registry.core.model.DeviceStatus.MAINTENANCE;
import static com.device.registry.core.model.DeviceStatus.OFFLINE;
import static com.device.registry.core.model.DeviceStatus.ONLINE;
import static com.device.registry.core.model.DeviceStatus.PROVISIONING;
import static com.device.registry.core.model.DeviceStatus.RETIRED;

/**
 * Allowed lifecycle transitions. A status never transitions to itself, and
 * {@link DeviceStatus#RETIRED} is terminal.
 */
public final class TransitionTable {

    private static final Map<DeviceStatus, Set<DeviceStatus>> ALLOWED = new EnumMap<>(DeviceStatus.class);

    static {
        ALLOWED.put(DISCOVERED, EnumSet.of(PROVISIONING, OFFLINE, RETIRED));
        ALLOWED.put(PROVISIONING, EnumSet.of(ONLINE, OFFLINE, DISCOVERED));
        ALLOWED.put(ONLINE, EnumSet.of(DEGRADED, OFFLINE, MAINTENANCE));
        ALLOWED.put(DEGRADED, EnumSet.of(ONLINE, OFFLINE, MAINTENANCE));
        ALLOWED.put(OFFLINE, EnumSet.of(ONLINE, DEGRADED, MAINTENANCE, RETIRED));
        ALLOWED.put(MAINTENANCE, EnumSet.of(ONLINE, OFFLINE, RETIRED));
        ALLOWED.put(RETIRED, EnumSet.noneOf(DeviceStatus.class));
    }

    private TransitionTable() {
    }

    public static boolean isAllowed(DeviceStatus from, DeviceStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    public static Set<DeviceStatus> allowedTargets(DeviceStatus from) {
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    public static boolean isTerminal(DeviceStatus status) {
        return ALLOWED.get(status).isEmpty();
    }

    /**
     * Returns the hops that take a device from {@code from} to {@link DeviceStatus#ONLINE}
     * when it is seen by a poll. Empty when the device should not be promoted.
     *
     * @param recoverOffline whether an observed offline device comes back online
     */
    static List<DeviceStatus> promotionPath(DeviceStatus from, boolean recoverOffline) {
        return switch (from) {
            case DISCOVERED -> List.of(PROVISIONING, ONLINE);
            case PROVISIONING -> List.of(ONLINE);
            case OFFLINE -> recoverOffline ? List.of(ONLINE) : List.of();
            default -> List.of();
        };
    }
}
