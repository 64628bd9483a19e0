package com.device.registry.review;

import com.device.registry.api.Page;
import com.device.registry.api.PageRequest;
import com.device.registry.core.model.Device;
import com.device.registry.logging.LogContext;
import com.device.registry.movement.MovementLog;
import com.device.registry.movement.MovementRecord;
import com.device.registry.registry.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reviewer actions on queued conflicts and recorded movements.
 *
 * <p>This is the only place a conflict leaves {@link ConflictStatus#PENDING}. Importing an
 * approved entry creates the device from the stored observation; the registry still
 * enforces its uniqueness rules, so an import that would collide fails and the entry
 * stays approved.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ConflictQueue conflictQueue;
    private final MovementLog movementLog;
    private final DeviceRegistry registry;

    public ReviewService(ConflictQueue conflictQueue, MovementLog movementLog, DeviceRegistry registry) {
        this.conflictQueue = Objects.requireNonNull(conflictQueue, "conflictQueue is required");
        this.movementLog = Objects.requireNonNull(movementLog, "movementLog is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    public void approve(String entryId, String reviewerId, String notes) {
        try (LogContext ignored = LogContext.forReview(entryId, "approve")) {
            conflictQueue.approve(entryId, reviewerId, notes);
            log.info("review.approved entryId={} reviewer={}", entryId, reviewerId);
        }
    }

    public void reject(String entryId, String reviewerId, String notes) {
        try (LogContext ignored = LogContext.forReview(entryId, "reject")) {
            conflictQueue.reject(entryId, reviewerId, notes);
            log.info("review.rejected entryId={} reviewer={}", entryId, reviewerId);
        }
    }

    public void markDuplicate(String entryId, String reviewerId, String notes) {
        try (LogContext ignored = LogContext.forReview(entryId, "markDuplicate")) {
            conflictQueue.markDuplicate(entryId, reviewerId, notes);
            log.info("review.duplicate entryId={} reviewer={}", entryId, reviewerId);
        }
    }

    /**
     * Creates a device from an approved entry and marks the entry imported.
     *
     * @return the reference of the created device
     * @throws IllegalArgumentException if the entry does not exist
     * @throws IllegalStateException    if the entry is not approved
     * @throws com.device.registry.registry.IdentityCollisionException if the device would
     *         violate a uniqueness rule
     */
    public String importApproved(String entryId, String reviewerId) {
        try (LogContext ignored = LogContext.forReview(entryId, "import")) {
            ConflictEntry entry = conflictQueue.get(entryId);
            if (entry == null) {
                throw new IllegalArgumentException("Conflict not found: " + entryId);
            }
            if (entry.getStatus() != ConflictStatus.APPROVED) {
                throw new IllegalStateException("Conflict " + entryId + " is not approved: " + entry.getStatus());
            }

            String deviceRef = registry.create(Device.fromObservation(entry.getObservation()).build());
            conflictQueue.markImported(entryId, deviceRef, reviewerId);
            log.info("review.imported entryId={} deviceRef={} reviewer={}", entryId, deviceRef, reviewerId);
            return deviceRef;
        }
    }

    public MovementRecord acknowledgeMovement(String movementId, String reviewerId) {
        try (LogContext ignored = LogContext.forReview(movementId, "acknowledgeMovement")) {
            MovementRecord record = movementLog.acknowledge(movementId, reviewerId);
            log.info("review.movement.acknowledged movementId={} deviceRef={} reviewer={}",
                    movementId, record.getDeviceRef(), reviewerId);
            return record;
        }
    }

    public Page<ConflictEntry> pendingConflicts(PageRequest page) {
        return conflictQueue.getPending(page);
    }

    public Page<MovementRecord> unacknowledgedMovements(PageRequest page) {
        return movementLog.getUnacknowledged(page);
    }
}
