package com.device.registry.review;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Observation;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An observation the registry could not absorb safely, held for human review.
 * The raw observation is kept as submitted; the registry is not touched until a reviewer
 * imports the entry.
 */
public class ConflictEntry {

    private final String id;
    private final Observation observation;
    private final String matchedDeviceRef;
    private final ConflictKind conflictKind;
    private final Map<String, String> details;
    private final Instant discoveredAt;
    private ConflictStatus status;
    private String reviewedBy;
    private Instant reviewedAt;
    private String notes;
    private String importedDeviceRef;

    private ConflictEntry(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.observation = Objects.requireNonNull(builder.observation, "observation is required");
        this.matchedDeviceRef = builder.matchedDeviceRef;
        this.conflictKind = Objects.requireNonNull(builder.conflictKind, "conflictKind is required");
        this.details = builder.details != null ? Map.copyOf(builder.details) : Map.of();
        this.discoveredAt = builder.discoveredAt != null ? builder.discoveredAt : Instant.now();
        this.status = ConflictStatus.PENDING;
        this.notes = builder.notes;
    }

    public String getId() {
        return id;
    }

    public Observation getObservation() {
        return observation;
    }

    public String getSourceId() {
        return observation.sourceId();
    }

    /**
     * The device the observation partially matched, or null if none was implicated.
     */
    public String getMatchedDeviceRef() {
        return matchedDeviceRef;
    }

    public ConflictKind getConflictKind() {
        return conflictKind;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    public synchronized ConflictStatus getStatus() {
        return status;
    }

    public synchronized String getReviewedBy() {
        return reviewedBy;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getNotes() {
        return notes;
    }

    /**
     * The device created when the entry was imported, or null.
     */
    public synchronized String getImportedDeviceRef() {
        return importedDeviceRef;
    }

    public boolean isPending() {
        return getStatus() == ConflictStatus.PENDING;
    }

    /**
     * Returns true if this entry is for the same observation key and conflict kind.
     */
    public boolean sameConflictAs(Observation other, ConflictKind kind) {
        return conflictKind == kind
                && observation.sourceId().equals(other.sourceId())
                && observation.apiDeviceId().equals(other.apiDeviceId())
                && observation.ip().equals(other.ip());
    }

    synchronized void review(ConflictStatus target, String reviewerId, String notes, Instant at) {
        if (!canMoveTo(target)) {
            throw new IllegalStateException("Conflict " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.reviewedBy = reviewerId;
        this.reviewedAt = at;
        if (notes != null) {
            this.notes = notes;
        }
    }

    synchronized void markImported(String deviceRef, String reviewerId, Instant at) {
        review(ConflictStatus.IMPORTED, reviewerId, null, at);
        this.importedDeviceRef = deviceRef;
    }

    private boolean canMoveTo(ConflictStatus target) {
        if (status == ConflictStatus.PENDING) {
            return target == ConflictStatus.APPROVED
                    || target == ConflictStatus.REJECTED
                    || target == ConflictStatus.DUPLICATE;
        }
        return status == ConflictStatus.APPROVED && target == ConflictStatus.IMPORTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ConflictEntry) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ConflictEntry{id='" + id + "', kind=" + conflictKind + ", source=" + observation.sourceId()
                + ", apiDeviceId=" + observation.apiDeviceId() + ", status=" + getStatus() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private Observation observation;
        private String matchedDeviceRef;
        private ConflictKind conflictKind;
        private Map<String, String> details;
        private Instant discoveredAt;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder observation(Observation observation) {
            this.observation = observation;
            return this;
        }

        public Builder matchedDeviceRef(String matchedDeviceRef) {
            this.matchedDeviceRef = matchedDeviceRef;
            return this;
        }

        public Builder conflictKind(ConflictKind conflictKind) {
            this.conflictKind = conflictKind;
            return this;
        }

        public Builder details(Map<String, String> details) {
            this.details = details;
            return this;
        }

        public Builder discoveredAt(Instant discoveredAt) {
            this.discoveredAt = discoveredAt;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ConflictEntry build() {
            return new ConflictEntry(this);
        }
    }
}
