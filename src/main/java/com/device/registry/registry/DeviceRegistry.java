package com.device.registry.registry;

import com.device.registry.core.model.Device;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The canonical device store. Owns every {@link Device} row and enforces the identity
 * invariants:
 * <ul>
 *   <li>at most one device per (sourceId, apiDeviceId)</li>
 *   <li>a present serial number is unique across all sources</li>
 *   <li>a present MAC address is unique across all sources</li>
 * </ul>
 * IP addresses are not unique.
 *
 * <p>All reads return copies. All writes go through {@link #create} or one of the
 * {@code update} methods, which serialize per device and re-validate uniqueness
 * atomically with the write.</p>
 */
public interface DeviceRegistry extends DeviceLookup {

    /**
     * Inserts a new device.
     *
     * @return the new device's reference
     * @throws IdentityCollisionException if an identity invariant would be violated
     */
    String create(Device device);

    /**
     * Gets a device by reference.
     *
     * @throws DeviceNotFoundException if no such device exists
     */
    Device get(String deviceRef);

    Optional<Device> find(String deviceRef);

    /**
     * Applies {@code mutator} to a working copy of the device and commits it.
     * Concurrent updates to the same device never interleave.
     *
     * @return the committed device
     * @throws DeviceNotFoundException    if no such device exists
     * @throws IdentityCollisionException if the mutation would violate an identity invariant
     */
    Device update(String deviceRef, Consumer<Device> mutator);

    /**
     * Like {@link #update(String, Consumer)}, but fails if the stored version no longer
     * equals {@code expectedVersion}.
     *
     * @throws RegistryUpdateConflictException if the device changed since it was read
     */
    Device update(String deviceRef, long expectedVersion, Consumer<Device> mutator);

    List<Device> findBySource(String sourceId);

    List<Device> findAll();

    int count();
}
