package com.device.registry.registry;

/**
 * Thrown when a device reference does not exist in the registry.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceRef;

    public DeviceNotFoundException(String deviceRef) {
        super("Device not found: " + deviceRef);
        this.deviceRef = deviceRef;
    }

    public String getDeviceRef() {
        return deviceRef;
    }
}
