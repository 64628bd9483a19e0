package com.device.registry.sync;

import com.device.registry.cache.RecentMovementFilter;
import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Device;
import com.device.registry.core.model.Observation;
import com.device.registry.event.DeviceEvent;
import com.device.registry.event.DeviceEventListener;
import com.device.registry.lifecycle.HealthCheckResult;
import com.device.registry.lifecycle.InvalidTransitionException;
import com.device.registry.lifecycle.LifecycleManager;
import com.device.registry.logging.LogContext;
import com.device.registry.metrics.MetricsService;
import com.device.registry.metrics.NoOpMetricsService;
import com.device.registry.movement.MovementLog;
import com.device.registry.movement.MovementRecord;
import com.device.registry.registry.DeviceRegistry;
import com.device.registry.registry.IdentityCollisionException;
import com.device.registry.registry.RegistryUpdateConflictException;
import com.device.registry.resolution.Classification;
import com.device.registry.resolution.ClassificationKind;
import com.device.registry.resolution.IdentityResolver;
import com.device.registry.resolution.MatchKey;
import com.device.registry.review.ConflictEntry;
import com.device.registry.review.ConflictQueue;
import com.device.registry.tracing.NoOpTracingService;
import com.device.registry.tracing.Span;
import com.device.registry.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs sync cycles: fetches a batch from a source adapter, resolves each observation and
 * applies the outcome to the registry, the movement log and the conflict queue, then
 * sweeps the source's unseen devices for staleness and emits one event per changed device.
 *
 * <p>Observations of one batch are processed in order on the calling thread. Failures are
 * isolated per observation and per device. Registry writes use the version of the snapshot
 * the classification was computed against; a concurrent change triggers one re-resolution,
 * after which the observation is skipped.</p>
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private static final int MAX_ATTEMPTS = 2;

    private final DeviceRegistry registry;
    private final IdentityResolver resolver;
    private final LifecycleManager lifecycle;
    private final ConflictQueue conflictQueue;
    private final MovementLog movementLog;
    private final RecentMovementFilter movementFilter;
    private final SourceAdapterRegistry adapters;
    private final SyncOptions options;
    private final Clock clock;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final List<DeviceEventListener> listeners = new CopyOnWriteArrayList<>();

    private SyncOrchestrator(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.adapters = Objects.requireNonNull(builder.adapters, "adapters is required");
        this.conflictQueue = Objects.requireNonNull(builder.conflictQueue, "conflictQueue is required");
        this.movementLog = Objects.requireNonNull(builder.movementLog, "movementLog is required");
        this.options = builder.options != null ? builder.options : SyncOptions.defaults();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        this.resolver = builder.resolver != null ? builder.resolver : new IdentityResolver(registry);
        this.lifecycle = builder.lifecycle != null ? builder.lifecycle
                : new LifecycleManager(registry, clock, metrics, options.healthPolicy());
        this.movementFilter = builder.movementFilter != null ? builder.movementFilter
                : new RecentMovementFilter(options.getMovementSuppressionWindow());
        this.listeners.addAll(builder.listeners);
    }

    public void addListener(DeviceEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(DeviceEventListener listener) {
        listeners.remove(listener);
    }

    public SourceAdapterRegistry getAdapters() {
        return adapters;
    }

    public SyncCycleResult runCycle(String sourceId) {
        return runCycle(sourceId, new CycleControl());
    }

    /**
     * Runs one cycle for a source.
     *
     * @param control checked between observations; once cancelled, no further observation
     *                or sweep step starts
     * @throws IllegalArgumentException if no adapter is registered for the source
     */
    public SyncCycleResult runCycle(String sourceId, CycleControl control) {
        SourceAdapter adapter = adapters.get(sourceId);
        String cycleId = LogContext.generateCycleId();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        try (LogContext ignored = LogContext.forSyncCycle(cycleId, sourceId);
             Span span = tracing.startSpan("sync.cycle", Map.of("sourceId", sourceId, "cycleId", cycleId))) {

            Set<String> knownBefore = new LinkedHashSet<>();
            for (Device device : registry.findBySource(sourceId)) {
                knownBefore.add(device.getId());
            }

            List<Observation> batch;
            try {
                batch = adapter.fetchBatch(sourceId);
            } catch (RuntimeException e) {
                metrics.incrementAdapterFailure(sourceId);
                metrics.recordCycleDuration(sourceId, false, Duration.ofNanos(System.nanoTime() - startNanos));
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.warn("sync.fetch.failed sourceId={} error={}", sourceId, e.getMessage());
                return SyncCycleResult.fetchFailed(cycleId, sourceId, startedAt, clock.instant(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }

            metrics.recordBatchSize(batch.size());
            span.setAttribute("observations", batch.size());
            log.debug("sync.cycle.started sourceId={} observations={} knownDevices={}",
                    sourceId, batch.size(), knownBefore.size());

            CycleState state = new CycleState(sourceId);
            for (Observation observation : batch) {
                if (control.isCancelled()) {
                    state.cancelled = true;
                    break;
                }
                processIsolated(observation, state);
            }

            if (!state.cancelled) {
                sweepUnseen(knownBefore, state, control);
            }

            List<DeviceEvent> events = collectEvents(state);
            events.forEach(this::notifyDeviceChanged);

            SyncCycleResult result = state.toResult(cycleId, startedAt, clock.instant(), batch.size(), events);
            metrics.recordCycleDuration(sourceId, result.succeeded(), Duration.ofNanos(System.nanoTime() - startNanos));
            span.setAttribute("events", events.size());
            span.setStatus(result.failed() == 0 && !result.cancelled() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            log.info("sync.cycle.completed sourceId={} observations={} created={} duplicates={} moved={} "
                            + "conflicts={} movements={} markedOffline={} failed={} cancelled={} events={}",
                    sourceId, batch.size(), result.created(), result.duplicates(), result.moved(),
                    result.conflicts(), result.movements(), result.markedOffline(), result.failed(),
                    result.cancelled(), events.size());
            return result;
        }
    }

    private void processIsolated(Observation observation, CycleState state) {
        try {
            process(observation, state, 1);
        } catch (RuntimeException e) {
            state.failed++;
            metrics.incrementObservationFailure(state.sourceId);
            log.warn("sync.observation.failed sourceId={} apiDeviceId={} ip={} error={}",
                    observation.sourceId(), observation.apiDeviceId(), observation.ip(), e.getMessage(), e);
        }
    }

    private void process(Observation observation, CycleState state, int attempt) {
        Classification classification = resolver.resolve(observation);
        metrics.recordClassification(state.sourceId, classification.kind());

        switch (classification.kind()) {
            case NEW -> createDevice(observation, state, attempt);
            case DUPLICATE, MOVED -> applyMatch(observation, classification, state, attempt);
            case CONFLICT -> {
                state.conflicts++;
                queueConflict(observation, classification.existingRef(), classification.conflictKind(),
                        classification.reasoning(), classification);
            }
        }
    }

    private void createDevice(Observation observation, CycleState state, int attempt) {
        String deviceRef;
        try {
            deviceRef = registry.create(Device.fromObservation(observation).build());
        } catch (IdentityCollisionException e) {
            if (attempt < MAX_ATTEMPTS) {
                // another writer registered the device after we resolved
                metrics.incrementUpdateRetry(state.sourceId);
                process(observation, state, attempt + 1);
                return;
            }
            state.conflicts++;
            queueConflict(observation, e.getConflictingDeviceRef(), ConflictKind.CROSS_SOURCE_COLLISION,
                    e.getMessage(), null);
            return;
        }

        state.created++;
        state.touchCreated(deviceRef);
        log.info("device.created deviceRef={} sourceId={} apiDeviceId={} serial={} ip={}",
                deviceRef, observation.sourceId(), observation.apiDeviceId(),
                observation.serialNumber(), observation.ip());
        promote(deviceRef, "discovered by " + observation.sourceId(), state);
    }

    private void applyMatch(Observation observation, Classification classification, CycleState state, int attempt) {
        Device snapshot = classification.existing();
        String deviceRef = snapshot.getId();
        Device updated;
        try {
            updated = registry.update(deviceRef, snapshot.getVersion(),
                    device -> applyObservation(device, observation, classification));
        } catch (RegistryUpdateConflictException e) {
            if (attempt < MAX_ATTEMPTS) {
                metrics.incrementUpdateRetry(state.sourceId);
                log.debug("Device {} changed concurrently (expected version {}, found {}), re-resolving",
                        deviceRef, e.getExpectedVersion(), e.getActualVersion());
                process(observation, state, attempt + 1);
                return;
            }
            state.failed++;
            metrics.incrementObservationFailure(state.sourceId);
            log.warn("sync.update.skipped deviceRef={} apiDeviceId={} reason=concurrent-update",
                    deviceRef, observation.apiDeviceId());
            return;
        } catch (IdentityCollisionException e) {
            state.conflicts++;
            queueConflict(observation, e.getConflictingDeviceRef(), ConflictKind.CROSS_SOURCE_COLLISION,
                    e.getMessage(), classification);
            return;
        }

        state.touch(snapshot);
        if (classification.kind() == ClassificationKind.MOVED) {
            state.moved++;
            recordMovement(snapshot, updated, classification, state);
        } else {
            state.duplicates++;
        }

        try {
            lifecycle.checkHealth(deviceRef, options.getStaleAfter());
        } catch (RuntimeException e) {
            log.warn("Health check failed for device {}: {}", deviceRef, e.getMessage());
        }
        promote(deviceRef, "observed by " + observation.sourceId(), state);
    }

    /**
     * Copies what an observation may change onto a working copy. Identity is never
     * overwritten: only the IP of a moved device changes, a serial or MAC is filled in
     * only when the device has none, and the API id follows its source's re-enumeration.
     */
    private static void applyObservation(Device device, Observation observation, Classification classification) {
        if (device.getLastSeenAt() == null || observation.observedAt().isAfter(device.getLastSeenAt())) {
            device.setLastSeenAt(observation.observedAt());
        }
        if (observation.model() != null) {
            device.setModel(observation.model());
        }
        if (observation.name() != null) {
            device.setName(observation.name());
        }
        if (observation.firmwareVersion() != null) {
            device.setFirmwareVersion(observation.firmwareVersion());
        }
        if (!observation.networkConfig().isEmpty()) {
            device.setNetworkConfig(observation.networkConfig());
        }
        if (device.getSerialNumber() == null && observation.hasSerialNumber()) {
            device.setSerialNumber(observation.serialNumber());
        }
        if (device.getMacAddress() == null && observation.hasMacAddress()) {
            device.setMacAddress(observation.macAddress());
        }
        if (classification.kind() == ClassificationKind.MOVED) {
            device.setIp(classification.newIp());
        }
        if (rebindsApiId(device, observation, classification)) {
            device.setApiDeviceId(observation.apiDeviceId());
        }
    }

    // hardware-key matches within one source follow a re-enumerated API id
    private static boolean rebindsApiId(Device device, Observation observation, Classification classification) {
        MatchKey key = classification.matchedBy();
        return (key == MatchKey.SERIAL || key == MatchKey.MAC)
                && device.getSourceId().equals(observation.sourceId())
                && !device.getApiDeviceId().equals(observation.apiDeviceId());
    }

    private void recordMovement(Device before, Device after, Classification classification, CycleState state) {
        if (!movementFilter.tryAcquire(after.getId(), classification.oldIp(), classification.newIp())) {
            return;
        }
        MovementRecord record = movementLog.append(MovementRecord.builder()
                .deviceRef(after.getId())
                .oldIp(classification.oldIp())
                .newIp(classification.newIp())
                .oldLocationRef(before.getLocationRef())
                .newLocationRef(after.getLocationRef())
                .detectedAt(clock.instant())
                .detectedBy(options.getDetectedBy())
                .reason(classification.reasoning())
                .build());
        state.movements++;
        metrics.incrementMovementRecorded(state.sourceId);
        log.info("device.moved deviceRef={} oldIp={} newIp={} matchedBy={} movementId={}",
                after.getId(), record.getOldIp(), record.getNewIp(), classification.matchedBy(), record.getId());
    }

    private void promote(String deviceRef, String reason, CycleState state) {
        try {
            lifecycle.bringOnline(deviceRef, reason, options.isRecoverOffline());
        } catch (InvalidTransitionException e) {
            state.failed++;
            log.warn("sync.transition.rejected deviceRef={} from={} to={}", deviceRef, e.getFrom(), e.getTo());
        }
    }

    private void queueConflict(Observation observation, String matchedDeviceRef, ConflictKind kind,
                               String reasoning, Classification classification) {
        Optional<ConflictEntry> pending = conflictQueue.findPending(observation, kind);
        if (pending.isPresent()) {
            log.debug("Conflict already pending as {} for {}/{} at {}", pending.get().getId(),
                    observation.sourceId(), observation.apiDeviceId(), observation.ip());
            return;
        }

        Map<String, String> details = new LinkedHashMap<>();
        if (classification != null && classification.matchedBy() != null) {
            details.put("matchedBy", classification.matchedBy().name());
        }
        if (reasoning != null) {
            details.put("reasoning", reasoning);
        }

        ConflictEntry entry = conflictQueue.submit(ConflictEntry.builder()
                .observation(observation)
                .matchedDeviceRef(matchedDeviceRef)
                .conflictKind(kind)
                .details(details)
                .discoveredAt(clock.instant())
                .build());
        metrics.incrementConflictQueued(kind);
        log.info("conflict.queued entryId={} kind={} sourceId={} apiDeviceId={} ip={} matchedDeviceRef={}",
                entry.getId(), kind, observation.sourceId(), observation.apiDeviceId(),
                observation.ip(), matchedDeviceRef);
        notifyReviewNeeded(entry);
    }

    private void sweepUnseen(Set<String> knownBefore, CycleState state, CycleControl control) {
        for (String deviceRef : knownBefore) {
            if (state.seen.contains(deviceRef)) {
                continue;
            }
            if (control.isCancelled()) {
                state.cancelled = true;
                return;
            }
            try {
                Optional<Device> before = registry.find(deviceRef);
                if (before.isEmpty()) {
                    continue;
                }
                HealthCheckResult result = lifecycle.checkHealth(deviceRef, options.getStaleAfter());
                if (result.transitioned()) {
                    state.markedOffline++;
                    state.touch(before.get());
                }
            } catch (RuntimeException e) {
                state.failed++;
                log.warn("Health check failed for device {}: {}", deviceRef, e.getMessage());
            }
        }
    }

    private List<DeviceEvent> collectEvents(CycleState state) {
        List<DeviceEvent> events = new ArrayList<>();
        Instant now = clock.instant();
        for (Map.Entry<String, Device> touched : state.firstSnapshots.entrySet()) {
            Optional<Device> current = registry.find(touched.getKey());
            if (current.isEmpty()) {
                continue;
            }
            Device after = current.get();
            Device before = touched.getValue();
            if (before == null) {
                events.add(new DeviceEvent(after.getId(), state.sourceId, null, after.getStatus(),
                        createdFields(after), now));
                continue;
            }
            Set<String> changed = before.changedFields(after);
            if (before.getStatus() != after.getStatus() || Device.containsIdentityField(changed)) {
                events.add(new DeviceEvent(after.getId(), state.sourceId, before.getStatus(), after.getStatus(),
                        changed, now));
            }
        }
        return events;
    }

    private static Set<String> createdFields(Device device) {
        Set<String> fields = new LinkedHashSet<>();
        fields.add(Device.FIELD_IP);
        fields.add(Device.FIELD_API_DEVICE_ID);
        fields.add(Device.FIELD_SOURCE_ID);
        fields.add(Device.FIELD_STATUS);
        if (device.getSerialNumber() != null) {
            fields.add(Device.FIELD_SERIAL_NUMBER);
        }
        if (device.getMacAddress() != null) {
            fields.add(Device.FIELD_MAC_ADDRESS);
        }
        return fields;
    }

    private void notifyDeviceChanged(DeviceEvent event) {
        for (DeviceEventListener listener : listeners) {
            try {
                listener.onDeviceChanged(event);
            } catch (Exception e) {
                log.warn("Device event listener threw exception for device {}: {}",
                        event.deviceRef(), e.getMessage(), e);
            }
        }
    }

    private void notifyReviewNeeded(ConflictEntry entry) {
        for (DeviceEventListener listener : listeners) {
            try {
                listener.onReviewNeeded(entry);
            } catch (Exception e) {
                log.warn("Device event listener threw exception for conflict {}: {}",
                        entry.getId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Cycle-local bookkeeping. Only touched by the thread running the cycle.
     */
    private static final class CycleState {
        private final String sourceId;
        // deviceRef -> state before this cycle first changed it; null for devices created here
        private final Map<String, Device> firstSnapshots = new LinkedHashMap<>();
        private final Set<String> seen = new HashSet<>();
        private int created;
        private int duplicates;
        private int moved;
        private int conflicts;
        private int movements;
        private int markedOffline;
        private int failed;
        private boolean cancelled;

        private CycleState(String sourceId) {
            this.sourceId = sourceId;
        }

        void touch(Device before) {
            seen.add(before.getId());
            firstSnapshots.putIfAbsent(before.getId(), before);
        }

        void touchCreated(String deviceRef) {
            seen.add(deviceRef);
            firstSnapshots.putIfAbsent(deviceRef, null);
        }

        SyncCycleResult toResult(String cycleId, Instant startedAt, Instant finishedAt, int observations,
                                 List<DeviceEvent> events) {
            return new SyncCycleResult(cycleId, sourceId, startedAt, finishedAt, observations,
                    created, duplicates, moved, conflicts, movements, markedOffline, failed,
                    cancelled, events, null);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DeviceRegistry registry;
        private IdentityResolver resolver;
        private LifecycleManager lifecycle;
        private ConflictQueue conflictQueue;
        private MovementLog movementLog;
        private RecentMovementFilter movementFilter;
        private SourceAdapterRegistry adapters;
        private SyncOptions options;
        private Clock clock;
        private MetricsService metrics;
        private TracingService tracing;
        private final List<DeviceEventListener> listeners = new ArrayList<>();

        public Builder registry(DeviceRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Optional. Defaults to a resolver over the registry.
         */
        public Builder resolver(IdentityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Optional. Defaults to a manager over the registry using the options' health windows.
         */
        public Builder lifecycle(LifecycleManager lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder conflictQueue(ConflictQueue conflictQueue) {
            this.conflictQueue = conflictQueue;
            return this;
        }

        public Builder movementLog(MovementLog movementLog) {
            this.movementLog = movementLog;
            return this;
        }

        public Builder movementFilter(RecentMovementFilter movementFilter) {
            this.movementFilter = movementFilter;
            return this;
        }

        public Builder adapters(SourceAdapterRegistry adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsService(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracingService(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder listener(DeviceEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener is required"));
            return this;
        }

        public SyncOrchestrator build() {
            return new SyncOrchestrator(this);
        }
    }
}
