package com.device.registry.review;

import com.device.registry.api.Page;
import com.device.registry.api.PageRequest;
import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link ConflictQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryConflictQueue implements ConflictQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConflictQueue.class);

    private static final Comparator<ConflictEntry> OLDEST_FIRST =
            Comparator.comparing(ConflictEntry::getDiscoveredAt).thenComparing(ConflictEntry::getId);

    private final ConcurrentMap<String, ConflictEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConflictQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryConflictQueue(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public ConflictEntry submit(ConflictEntry entry) {
        entries.put(entry.getId(), entry);
        log.debug("Submitted conflict {} (kind={}, source={}, apiDeviceId={}, matched={})",
                entry.getId(), entry.getConflictKind(), entry.getSourceId(),
                entry.getObservation().apiDeviceId(), entry.getMatchedDeviceRef());
        return entry;
    }

    @Override
    public ConflictEntry get(String entryId) {
        return entries.get(entryId);
    }

    @Override
    public Page<ConflictEntry> getPending(PageRequest page) {
        return Page.of(pending(e -> true), page);
    }

    @Override
    public Page<ConflictEntry> getPendingByKind(ConflictKind kind, PageRequest page) {
        return Page.of(pending(e -> e.getConflictKind() == kind), page);
    }

    @Override
    public Page<ConflictEntry> getPendingBySource(String sourceId, PageRequest page) {
        return Page.of(pending(e -> e.getSourceId().equals(sourceId)), page);
    }

    @Override
    public Optional<ConflictEntry> findPending(Observation observation, ConflictKind kind) {
        return pending(e -> e.sameConflictAs(observation, kind)).stream().findFirst();
    }

    @Override
    public void approve(String entryId, String reviewerId, String notes) {
        require(entryId).review(ConflictStatus.APPROVED, reviewerId, notes, clock.instant());
        log.info("Conflict {} approved by {}", entryId, reviewerId);
    }

    @Override
    public void reject(String entryId, String reviewerId, String notes) {
        require(entryId).review(ConflictStatus.REJECTED, reviewerId, notes, clock.instant());
        log.info("Conflict {} rejected by {}", entryId, reviewerId);
    }

    @Override
    public void markDuplicate(String entryId, String reviewerId, String notes) {
        require(entryId).review(ConflictStatus.DUPLICATE, reviewerId, notes, clock.instant());
        log.info("Conflict {} marked duplicate by {}", entryId, reviewerId);
    }

    @Override
    public void markImported(String entryId, String deviceRef, String reviewerId) {
        require(entryId).markImported(deviceRef, reviewerId, clock.instant());
        log.info("Conflict {} imported as device {} by {}", entryId, deviceRef, reviewerId);
    }

    @Override
    public long countPending() {
        return entries.values().stream().filter(ConflictEntry::isPending).count();
    }

    private List<ConflictEntry> pending(Predicate<ConflictEntry> filter) {
        return entries.values().stream()
                .filter(ConflictEntry::isPending)
                .filter(filter)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    private ConflictEntry require(String entryId) {
        ConflictEntry entry = entries.get(entryId);
        if (entry == null) {
            throw new IllegalArgumentException("Conflict not found: " + entryId);
        }
        return entry;
    }
}
