package com.device.registry.metrics;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.DeviceStatus;
import com.device.registry.resolution.ClassificationKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordClassification(String sourceId, ClassificationKind kind) {
    }

    @Override
    public void recordTransition(DeviceStatus from, DeviceStatus to) {
    }

    @Override
    public void recordInvalidTransition(DeviceStatus from, DeviceStatus to) {
    }

    @Override
    public void incrementConflictQueued(ConflictKind kind) {
    }

    @Override
    public void incrementMovementRecorded(String sourceId) {
    }

    @Override
    public void incrementAdapterFailure(String sourceId) {
    }

    @Override
    public void incrementObservationFailure(String sourceId) {
    }

    @Override
    public void incrementUpdateRetry(String sourceId) {
    }

    @Override
    public void recordCycleDuration(String sourceId, boolean succeeded, Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
