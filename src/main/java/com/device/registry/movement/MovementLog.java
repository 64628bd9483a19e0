package com.device.registry.movement;

import com.device.registry.api.Page;
import com.device.registry.api.PageRequest;

import java.util.List;

/**
 * Append-only log of device movements. Records are written by the sync orchestrator
 * and acknowledged by an external reviewer.
 */
public interface MovementLog {

    /**
     * Appends a movement record.
     */
    MovementRecord append(MovementRecord record);

    /**
     * Returns the record with the given id, or null if not found.
     */
    MovementRecord get(String movementId);

    /**
     * Unacknowledged movements, oldest first.
     */
    Page<MovementRecord> getUnacknowledged(PageRequest page);

    /**
     * All movements of one device, oldest first.
     */
    List<MovementRecord> findByDevice(String deviceRef);

    /**
     * Acknowledges a movement.
     *
     * @throws IllegalArgumentException if the id is unknown
     * @throws IllegalStateException    if it was already acknowledged
     */
    MovementRecord acknowledge(String movementId, String acknowledgedBy);

    long countUnacknowledged();
}
