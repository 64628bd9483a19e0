package com.device.registry.event;

import com.device.registry.review.ConflictEntry;

/**
 * Receives the outward event stream of the sync orchestrator.
 * Listener failures are logged by the caller and never interrupt a cycle.
 */
public interface DeviceEventListener {

    /**
     * Called once per changed device after a cycle's writes for that source are done.
     */
    void onDeviceChanged(DeviceEvent event);

    /**
     * Called when an observation was queued for human review.
     */
    default void onReviewNeeded(ConflictEntry entry) {
    }
}
