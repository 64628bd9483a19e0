package com.device.registry.registry;

import com.device.registry.core.model.Device;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the registry's identity indexes.
 * Identity resolution depends on this view only, never on the write side.
 */
public interface DeviceLookup {

    Optional<Device> findBySerial(String serialNumber);

    Optional<Device> findByMac(String macAddress);

    /**
     * Returns the earliest-registered device at the given IP.
     */
    default Optional<Device> findByIp(String ip) {
        return findAllByIp(ip).stream().findFirst();
    }

    /**
     * Returns every device currently at the given IP, oldest first.
     * IP addresses are not unique in the registry.
     */
    List<Device> findAllByIp(String ip);

    Optional<Device> findByApiId(String sourceId, String apiDeviceId);
}
