package com.device.registry.api;

import com.device.registry.cache.RecentMovementFilter;
import com.device.registry.event.DeviceEventListener;
import com.device.registry.lifecycle.LifecycleManager;
import com.device.registry.lock.DistributedLock;
import com.device.registry.lock.LocalDistributedLock;
import com.device.registry.metrics.MetricsService;
import com.device.registry.metrics.NoOpMetricsService;
import com.device.registry.movement.InMemoryMovementLog;
import com.device.registry.movement.MovementLog;
import com.device.registry.registry.DeviceRegistry;
import com.device.registry.registry.InMemoryDeviceRegistry;
import com.device.registry.resolution.IdentityResolver;
import com.device.registry.review.ConflictQueue;
import com.device.registry.review.InMemoryConflictQueue;
import com.device.registry.review.ReviewService;
import com.device.registry.sync.PollScheduler;
import com.device.registry.sync.SourceAdapter;
import com.device.registry.sync.SourceAdapterRegistry;
import com.device.registry.sync.SyncCycleResult;
import com.device.registry.sync.SyncOptions;
import com.device.registry.sync.SyncOrchestrator;
import com.device.registry.tracing.NoOpTracingService;
import com.device.registry.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point. Wires the registry, identity resolver, lifecycle manager, review
 * queues and sync orchestrator from a single builder.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (DeviceMonitor monitor = DeviceMonitor.builder()
 *         .adapter(new JsonPayloadSourceAdapter("shure", shureClient::fetchDevices))
 *         .adapter(new JsonPayloadSourceAdapter("sennheiser", sennheiserClient::fetchDevices))
 *         .listener(broadcaster)
 *         .build()) {
 *
 *     monitor.startPolling();
 *     ...
 *     monitor.getReviewService().pendingConflicts(PageRequest.first(50));
 * }
 * </pre>
 */
public class DeviceMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeviceMonitor.class);

    private final DeviceRegistry registry;
    private final IdentityResolver resolver;
    private final LifecycleManager lifecycleManager;
    private final ConflictQueue conflictQueue;
    private final MovementLog movementLog;
    private final ReviewService reviewService;
    private final SyncOrchestrator orchestrator;
    private final PollScheduler scheduler;
    private final SyncOptions options;

    private DeviceMonitor(Builder builder) {
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        DistributedLock lock = builder.distributedLock != null ? builder.distributedLock : new LocalDistributedLock();

        this.options = builder.options;
        this.registry = builder.registry != null ? builder.registry : new InMemoryDeviceRegistry(lock, clock);
        this.conflictQueue = builder.conflictQueue != null ? builder.conflictQueue : new InMemoryConflictQueue(clock);
        this.movementLog = builder.movementLog != null ? builder.movementLog : new InMemoryMovementLog(clock);
        this.resolver = new IdentityResolver(registry);
        this.lifecycleManager = new LifecycleManager(registry, clock, metrics, options.healthPolicy());
        this.reviewService = new ReviewService(conflictQueue, movementLog, registry);

        SourceAdapterRegistry.Builder adapters = SourceAdapterRegistry.builder();
        builder.adapters.forEach(adapters::register);

        SyncOrchestrator.Builder orchestratorBuilder = SyncOrchestrator.builder()
                .registry(registry)
                .resolver(resolver)
                .lifecycle(lifecycleManager)
                .conflictQueue(conflictQueue)
                .movementLog(movementLog)
                .movementFilter(builder.movementFilter != null ? builder.movementFilter
                        : new RecentMovementFilter(options.getMovementSuppressionWindow()))
                .adapters(adapters.build())
                .options(options)
                .clock(clock)
                .metricsService(metrics)
                .tracingService(tracing);
        builder.listeners.forEach(orchestratorBuilder::listener);
        this.orchestrator = orchestratorBuilder.build();
        this.scheduler = new PollScheduler(orchestrator, orchestrator.getAdapters().sourceIds(), options);

        log.info("DeviceMonitor initialized with sources {}", orchestrator.getAdapters().sourceIds());
    }

    /**
     * Runs one sync cycle for a source on the calling thread.
     */
    public SyncCycleResult sync(String sourceId) {
        return orchestrator.runCycle(sourceId);
    }

    /**
     * Runs one cycle for every source concurrently and waits for all of them.
     */
    public List<SyncCycleResult> syncAll() {
        return scheduler.pollOnce().join();
    }

    /**
     * Starts periodic polling of all sources at the configured interval.
     */
    public void startPolling() {
        scheduler.start();
    }

    public void addListener(DeviceEventListener listener) {
        orchestrator.addListener(listener);
    }

    public DeviceRegistry getRegistry() {
        return registry;
    }

    public IdentityResolver getResolver() {
        return resolver;
    }

    public LifecycleManager getLifecycleManager() {
        return lifecycleManager;
    }

    public ConflictQueue getConflictQueue() {
        return conflictQueue;
    }

    public MovementLog getMovementLog() {
        return movementLog;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public SyncOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SyncOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        scheduler.close();
        log.info("DeviceMonitor closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DeviceRegistry registry;
        private ConflictQueue conflictQueue;
        private MovementLog movementLog;
        private RecentMovementFilter movementFilter;
        private DistributedLock distributedLock;
        private SyncOptions options = SyncOptions.defaults();
        private Clock clock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private final List<SourceAdapter> adapters = new ArrayList<>();
        private final List<DeviceEventListener> listeners = new ArrayList<>();

        /**
         * Sets a custom registry. Defaults to {@link InMemoryDeviceRegistry}.
         */
        public Builder registry(DeviceRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets a custom conflict queue. Defaults to {@link InMemoryConflictQueue}.
         */
        public Builder conflictQueue(ConflictQueue conflictQueue) {
            this.conflictQueue = conflictQueue;
            return this;
        }

        /**
         * Sets a custom movement log. Defaults to {@link InMemoryMovementLog}.
         */
        public Builder movementLog(MovementLog movementLog) {
            this.movementLog = movementLog;
            return this;
        }

        public Builder movementFilter(RecentMovementFilter movementFilter) {
            this.movementFilter = movementFilter;
            return this;
        }

        /**
         * Sets the per-device lock used by the default registry.
         * Ignored when a custom registry is set.
         */
        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
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

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service. Defaults to {@link NoOpTracingService}.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Registers the adapter for one source.
         */
        public Builder adapter(SourceAdapter adapter) {
            this.adapters.add(adapter);
            return this;
        }

        public Builder listener(DeviceEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public DeviceMonitor build() {
            if (adapters.isEmpty()) {
                throw new IllegalStateException("At least one source adapter is required");
            }
            if (options == null) {
                throw new IllegalStateException("SyncOptions are required");
            }
            return new DeviceMonitor(this);
        }
    }
}
