package com.device.registry.registry;

/**
 * Thrown by the registry when a write would violate a uniqueness invariant.
 * Identity resolution normally prevents this; seeing it means two writers raced or a
 * classification was computed against a stale snapshot.
 */
public class IdentityCollisionException extends RuntimeException {

    private final IdentityField field;
    private final String value;
    private final String conflictingDeviceRef;

    public IdentityCollisionException(IdentityField field, String value, String conflictingDeviceRef) {
        super("Identity collision on " + field + " '" + value + "' with device " + conflictingDeviceRef);
        this.field = field;
        this.value = value;
        this.conflictingDeviceRef = conflictingDeviceRef;
    }

    public IdentityField getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    /**
     * The device that already holds the value.
     */
    public String getConflictingDeviceRef() {
        return conflictingDeviceRef;
    }
}
