package com.device.registry.lifecycle;

import com.device.registry.core.model.Device;
import com.device.registry.core.model.DeviceStatus;
import com.device.registry.logging.LogContext;
import com.device.registry.metrics.MetricsService;
import com.device.registry.metrics.NoOpMetricsService;
import com.device.registry.registry.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives devices through the lifecycle state machine.
 *
 * <p>Every status change goes through {@link DeviceRegistry#update}, so transitions on one
 * device are serialized with all other writes to it. A transition that is not in the
 * {@link TransitionTable} fails with {@link InvalidTransitionException} and commits nothing.</p>
 *
 * <p>Timestamps maintained on each transition:</p>
 * <ul>
 *   <li>entering {@code ONLINE} sets {@code lastOnlineAt}</li>
 *   <li>leaving {@code ONLINE} sets {@code lastOfflineAt} and adds the online span to
 *       {@code totalOnlineDuration}</li>
 *   <li>entering {@code OFFLINE} sets {@code lastOfflineAt}</li>
 * </ul>
 */
public class LifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    public static final String REASON = "reason";

    private final DeviceRegistry registry;
    private final Clock clock;
    private final MetricsService metrics;
    private final HealthPolicy healthPolicy;

    public LifecycleManager(DeviceRegistry registry, Clock clock) {
        this(registry, clock, new NoOpMetricsService(), HealthPolicy.defaults());
    }

    public LifecycleManager(DeviceRegistry registry, Clock clock, MetricsService metrics,
                            HealthPolicy healthPolicy) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.healthPolicy = Objects.requireNonNull(healthPolicy, "healthPolicy is required");
    }

    /**
     * Moves a device to {@code target}.
     *
     * @param metadata free-form context for the log line, typically a {@link #REASON}
     * @return the updated device
     * @throws InvalidTransitionException if the table does not allow the change
     */
    public Device transition(String deviceRef, DeviceStatus target, Map<String, String> metadata) {
        Objects.requireNonNull(target, "target is required");
        List<DeviceStatus[]> applied = new ArrayList<>();
        try (LogContext ignored = LogContext.forDevice(deviceRef, "transition")) {
            Device updated = registry.update(deviceRef, device ->
                    applied.add(apply(device, target, clock.instant())));
            DeviceStatus[] hop = applied.get(applied.size() - 1);
            metrics.recordTransition(hop[0], hop[1]);
            log.info("device.transition deviceRef={} from={} to={} metadata={}",
                    deviceRef, hop[0], hop[1], metadata != null ? metadata : Map.of());
            return updated;
        } catch (InvalidTransitionException e) {
            metrics.recordInvalidTransition(e.getFrom(), e.getTo());
            throw e;
        }
    }

    /**
     * Promotes a device that has just been observed. {@code DISCOVERED} walks through
     * {@code PROVISIONING} to {@code ONLINE} in a single update, {@code PROVISIONING} goes
     * straight to {@code ONLINE}, and {@code OFFLINE} recovers to {@code ONLINE} when
     * {@code recoverOffline} is set. Any other status is left alone.
     *
     * @return the device after promotion, or unchanged if no promotion applies
     */
    public Device bringOnline(String deviceRef, String reason, boolean recoverOffline) {
        Device current = registry.get(deviceRef);
        if (TransitionTable.promotionPath(current.getStatus(), recoverOffline).isEmpty()) {
            return current;
        }

        List<DeviceStatus[]> applied = new ArrayList<>();
        try (LogContext ignored = LogContext.forDevice(deviceRef, "bringOnline")) {
            Device updated = registry.update(deviceRef, device -> {
                applied.clear();
                Instant now = clock.instant();
                for (DeviceStatus hop : TransitionTable.promotionPath(device.getStatus(), recoverOffline)) {
                    applied.add(apply(device, hop, now));
                }
            });
            for (DeviceStatus[] hop : applied) {
                metrics.recordTransition(hop[0], hop[1]);
                log.info("device.transition deviceRef={} from={} to={} reason={}",
                        deviceRef, hop[0], hop[1], reason);
            }
            return updated;
        } catch (InvalidTransitionException e) {
            metrics.recordInvalidTransition(e.getFrom(), e.getTo());
            throw e;
        }
    }

    /**
     * Marks an {@code ONLINE} or {@code DEGRADED} device {@code OFFLINE} when it has not been
     * seen for longer than {@code staleAfter}. Devices in any other status, and devices that
     * were never seen, are not touched. The staleness test is repeated inside the update so
     * a concurrent observation wins over a stale read.
     */
    public HealthCheckResult checkHealth(String deviceRef, Duration staleAfter) {
        Objects.requireNonNull(staleAfter, "staleAfter is required");
        Device current = registry.get(deviceRef);
        if (!isStale(current, clock.instant(), staleAfter)) {
            return new HealthCheckResult(deviceRef, current.getStatus(), current.getStatus());
        }

        List<DeviceStatus[]> applied = new ArrayList<>();
        Device updated = registry.update(deviceRef, device -> {
            applied.clear();
            Instant now = clock.instant();
            if (isStale(device, now, staleAfter)) {
                applied.add(apply(device, DeviceStatus.OFFLINE, now));
            }
        });

        if (applied.isEmpty()) {
            return new HealthCheckResult(deviceRef, updated.getStatus(), updated.getStatus());
        }
        DeviceStatus[] hop = applied.get(0);
        metrics.recordTransition(hop[0], hop[1]);
        log.info("device.stale deviceRef={} from={} lastSeenAt={} staleAfter={}",
                deviceRef, hop[0], updated.getLastSeenAt(), staleAfter);
        return new HealthCheckResult(deviceRef, hop[0], hop[1]);
    }

    /**
     * Runs {@link #checkHealth} over a set of devices. A failure on one device is logged
     * and counted; it does not stop the others.
     */
    public HealthSummary bulkHealthCheck(Collection<String> deviceRefs, Duration staleAfter) {
        int checked = 0;
        int markedOffline = 0;
        int failed = 0;
        Map<DeviceStatus, Integer> byStatus = new EnumMap<>(DeviceStatus.class);

        for (String deviceRef : deviceRefs) {
            try {
                HealthCheckResult result = checkHealth(deviceRef, staleAfter);
                checked++;
                if (result.transitioned()) {
                    markedOffline++;
                }
                byStatus.merge(result.currentStatus(), 1, Integer::sum);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Health check failed for device {}: {}", deviceRef, e.getMessage());
            }
        }

        log.debug("health.check.completed checked={} markedOffline={} failed={}", checked, markedOffline, failed);
        return new HealthSummary(checked, markedOffline, failed, byStatus);
    }

    public Device markDegraded(String deviceRef, String reason) {
        return transition(deviceRef, DeviceStatus.DEGRADED, reasonOf(reason));
    }

    public Device markMaintenance(String deviceRef, String reason) {
        return transition(deviceRef, DeviceStatus.MAINTENANCE, reasonOf(reason));
    }

    public Device markOffline(String deviceRef, String reason) {
        return transition(deviceRef, DeviceStatus.OFFLINE, reasonOf(reason));
    }

    public Device retire(String deviceRef, String reason) {
        return transition(deviceRef, DeviceStatus.RETIRED, reasonOf(reason));
    }

    /**
     * Derives the current health of a device. Pure; nothing is written.
     */
    public HealthState healthOf(Device device) {
        return healthPolicy.evaluate(device, clock.instant());
    }

    /**
     * Applies one validated hop to a working copy and returns {@code {from, to}}.
     */
    private static DeviceStatus[] apply(Device device, DeviceStatus target, Instant now) {
        DeviceStatus from = device.getStatus();
        if (!TransitionTable.isAllowed(from, target)) {
            throw new InvalidTransitionException(device.getId(), from, target);
        }

        if (from == DeviceStatus.ONLINE) {
            device.setLastOfflineAt(now);
            if (device.getLastOnlineAt() != null && !now.isBefore(device.getLastOnlineAt())) {
                device.setTotalOnlineDuration(device.getTotalOnlineDuration()
                        .plus(Duration.between(device.getLastOnlineAt(), now)));
            }
        }
        if (target == DeviceStatus.ONLINE) {
            device.setLastOnlineAt(now);
        }
        if (target == DeviceStatus.OFFLINE) {
            device.setLastOfflineAt(now);
        }
        device.setStatus(target);
        return new DeviceStatus[]{from, target};
    }

    private static boolean isStale(Device device, Instant now, Duration staleAfter) {
        return device.getStatus().isHealthChecked()
                && device.getLastSeenAt() != null
                && Duration.between(device.getLastSeenAt(), now).compareTo(staleAfter) > 0;
    }

    private static Map<String, String> reasonOf(String reason) {
        return reason != null ? Map.of(REASON, reason) : Map.of();
    }
}
