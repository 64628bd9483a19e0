package com.device.registry.movement;

import com.device.registry.api.Page;
import com.device.registry.api.PageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link MovementLog}.
 */
public class InMemoryMovementLog implements MovementLog {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMovementLog.class);

    private static final Comparator<MovementRecord> OLDEST_FIRST =
            Comparator.comparing(MovementRecord::getDetectedAt).thenComparing(MovementRecord::getId);

    private final ConcurrentMap<String, MovementRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMovementLog() {
        this(Clock.systemUTC());
    }

    public InMemoryMovementLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public MovementRecord append(MovementRecord record) {
        if (records.putIfAbsent(record.getId(), record) != null) {
            throw new IllegalArgumentException("Movement already recorded: " + record.getId());
        }
        log.debug("Recorded movement {} for device {} ({} -> {})",
                record.getId(), record.getDeviceRef(), record.getOldIp(), record.getNewIp());
        return record;
    }

    @Override
    public MovementRecord get(String movementId) {
        return records.get(movementId);
    }

    @Override
    public Page<MovementRecord> getUnacknowledged(PageRequest page) {
        List<MovementRecord> pending = records.values().stream()
                .filter(r -> !r.isAcknowledged())
                .sorted(OLDEST_FIRST)
                .toList();
        return Page.of(pending, page);
    }

    @Override
    public List<MovementRecord> findByDevice(String deviceRef) {
        return records.values().stream()
                .filter(r -> r.getDeviceRef().equals(deviceRef))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public MovementRecord acknowledge(String movementId, String acknowledgedBy) {
        MovementRecord record = records.get(movementId);
        if (record == null) {
            throw new IllegalArgumentException("Movement not found: " + movementId);
        }
        record.acknowledge(acknowledgedBy, clock.instant());
        log.info("Movement {} acknowledged by {}", movementId, acknowledgedBy);
        return record;
    }

    @Override
    public long countUnacknowledged() {
        return records.values().stream().filter(r -> !r.isAcknowledged()).count();
    }
}
