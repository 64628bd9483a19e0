package com.device.registry.metrics;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.DeviceStatus;
import com.device.registry.resolution.ClassificationKind;

import java.time.Duration;

/**
 * Interface for recording registry and sync metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the registry works without
 * a meter registry configured.
 */
public interface MetricsService {

    void recordClassification(String sourceId, ClassificationKind kind);

    void recordTransition(DeviceStatus from, DeviceStatus to);

    void recordInvalidTransition(DeviceStatus from, DeviceStatus to);

    void incrementConflictQueued(ConflictKind kind);

    void incrementMovementRecorded(String sourceId);

    void incrementAdapterFailure(String sourceId);

    void incrementObservationFailure(String sourceId);

    void incrementUpdateRetry(String sourceId);

    void recordCycleDuration(String sourceId, boolean succeeded, Duration duration);

    void recordBatchSize(int size);
}
