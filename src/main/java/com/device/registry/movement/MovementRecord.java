package com.device.registry.movement;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A detected change of IP (and possibly location) for a known device.
 * Everything except the acknowledgment is fixed at creation; the acknowledgment is set
 * once by a reviewer through {@link MovementLog#acknowledge}.
 */
public class MovementRecord {

    private final String id;
    private final String deviceRef;
    private final String oldIp;
    private final String newIp;
    private final String oldLocationRef;
    private final String newLocationRef;
    private final Instant detectedAt;
    private final String detectedBy;
    private final String reason;
    private boolean acknowledged;
    private Instant acknowledgedAt;
    private String acknowledgedBy;

    private MovementRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.deviceRef = Objects.requireNonNull(builder.deviceRef, "deviceRef is required");
        this.oldIp = Objects.requireNonNull(builder.oldIp, "oldIp is required");
        this.newIp = Objects.requireNonNull(builder.newIp, "newIp is required");
        this.oldLocationRef = builder.oldLocationRef;
        this.newLocationRef = builder.newLocationRef;
        this.detectedAt = builder.detectedAt != null ? builder.detectedAt : Instant.now();
        this.detectedBy = builder.detectedBy;
        this.reason = builder.reason;
    }

    public String getId() {
        return id;
    }

    public String getDeviceRef() {
        return deviceRef;
    }

    public String getOldIp() {
        return oldIp;
    }

    public String getNewIp() {
        return newIp;
    }

    public String getOldLocationRef() {
        return oldLocationRef;
    }

    public String getNewLocationRef() {
        return newLocationRef;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getDetectedBy() {
        return detectedBy;
    }

    public String getReason() {
        return reason;
    }

    public synchronized boolean isAcknowledged() {
        return acknowledged;
    }

    public synchronized Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public synchronized String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    synchronized void acknowledge(String acknowledgedBy, Instant acknowledgedAt) {
        if (acknowledged) {
            throw new IllegalStateException("Movement " + id + " was already acknowledged by " + this.acknowledgedBy);
        }
        this.acknowledged = true;
        this.acknowledgedBy = Objects.requireNonNull(acknowledgedBy, "acknowledgedBy is required");
        this.acknowledgedAt = acknowledgedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((MovementRecord) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "MovementRecord{id='" + id + "', deviceRef='" + deviceRef + "', " + oldIp + " -> " + newIp
                + ", acknowledged=" + isAcknowledged() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String deviceRef;
        private String oldIp;
        private String newIp;
        private String oldLocationRef;
        private String newLocationRef;
        private Instant detectedAt;
        private String detectedBy;
        private String reason;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder deviceRef(String deviceRef) {
            this.deviceRef = deviceRef;
            return this;
        }

        public Builder oldIp(String oldIp) {
            this.oldIp = oldIp;
            return this;
        }

        public Builder newIp(String newIp) {
            this.newIp = newIp;
            return this;
        }

        public Builder oldLocationRef(String oldLocationRef) {
            this.oldLocationRef = oldLocationRef;
            return this;
        }

        public Builder newLocationRef(String newLocationRef) {
            this.newLocationRef = newLocationRef;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder detectedBy(String detectedBy) {
            this.detectedBy = detectedBy;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public MovementRecord build() {
            return new MovementRecord(this);
        }
    }
}
