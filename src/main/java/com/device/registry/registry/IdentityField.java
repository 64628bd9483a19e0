package com.device.registry.registry;

/**
 * Identity fields that carry a uniqueness constraint in the registry.
 */
public enum IdentityField {
    SERIAL_NUMBER,
    MAC_ADDRESS,
    API_DEVICE_ID
}
