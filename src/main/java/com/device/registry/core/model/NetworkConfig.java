package com.device.registry.core.model;

/**
 * Network settings reported for a device. Treated as an opaque value by the registry.
 *
 * @param subnetMask  subnet mask, may be null
 * @param gateway     default gateway, may be null
 * @param mode        addressing mode reported by the vendor (e.g. DHCP, STATIC), may be null
 * @param interfaceId vendor interface identifier, may be null
 */
public record NetworkConfig(String subnetMask, String gateway, String mode, String interfaceId) {

    private static final NetworkConfig EMPTY = new NetworkConfig(null, null, null, null);

    public static NetworkConfig empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return subnetMask == null && gateway == null && mode == null && interfaceId == null;
    }
}
