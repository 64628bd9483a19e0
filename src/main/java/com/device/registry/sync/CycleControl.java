package com.device.registry.sync;

/**
 * Cooperative cancellation flag for one sync cycle. The orchestrator checks it between
 * observations, so an observation that has started always finishes its writes.
 */
public class CycleControl {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
