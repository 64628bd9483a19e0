package com.device.registry.metrics;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.DeviceStatus;
import com.device.registry.resolution.ClassificationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code device.classification} - Counter (tags: sourceId, kind)</li>
 *   <li>{@code device.transition} - Counter (tags: from, to)</li>
 *   <li>{@code device.transition.rejected} - Counter (tags: from, to)</li>
 *   <li>{@code device.conflict.queued} - Counter (tag: kind)</li>
 *   <li>{@code device.movement.recorded} - Counter (tag: sourceId)</li>
 *   <li>{@code sync.adapter.failure} - Counter (tag: sourceId)</li>
 *   <li>{@code sync.observation.failure} - Counter (tag: sourceId)</li>
 *   <li>{@code sync.update.retry} - Counter (tag: sourceId)</li>
 *   <li>{@code sync.cycle.duration} - Timer (tags: sourceId, outcome)</li>
 *   <li>{@code sync.batch.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.batchSizeSummary = DistributionSummary.builder("sync.batch.size")
                .description("Number of observations returned per adapter fetch")
                .register(registry);
    }

    @Override
    public void recordClassification(String sourceId, ClassificationKind kind) {
        counter("device.classification", "Observations classified by the identity resolver",
                "sourceId", sourceId, "kind", kind.name()).increment();
    }

    @Override
    public void recordTransition(DeviceStatus from, DeviceStatus to) {
        counter("device.transition", "Lifecycle transitions committed",
                "from", from.name(), "to", to.name()).increment();
    }

    @Override
    public void recordInvalidTransition(DeviceStatus from, DeviceStatus to) {
        counter("device.transition.rejected", "Lifecycle transitions rejected by the transition table",
                "from", from.name(), "to", to.name()).increment();
    }

    @Override
    public void incrementConflictQueued(ConflictKind kind) {
        counter("device.conflict.queued", "Conflicts queued for review",
                "kind", kind.name()).increment();
    }

    @Override
    public void incrementMovementRecorded(String sourceId) {
        counter("device.movement.recorded", "Device IP movements recorded",
                "sourceId", sourceId).increment();
    }

    @Override
    public void incrementAdapterFailure(String sourceId) {
        counter("sync.adapter.failure", "Source adapter fetch failures",
                "sourceId", sourceId).increment();
    }

    @Override
    public void incrementObservationFailure(String sourceId) {
        counter("sync.observation.failure", "Observations skipped after a processing error",
                "sourceId", sourceId).increment();
    }

    @Override
    public void incrementUpdateRetry(String sourceId) {
        counter("sync.update.retry", "Registry writes retried after a concurrent update",
                "sourceId", sourceId).increment();
    }

    @Override
    public void recordCycleDuration(String sourceId, boolean succeeded, Duration duration) {
        String outcome = succeeded ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(sourceId + ":" + outcome, k ->
                Timer.builder("sync.cycle.duration")
                        .description("Duration of one sync cycle for a source")
                        .tag("sourceId", sourceId)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(":", tags);
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tags(tags)
                        .register(registry));
    }
}
