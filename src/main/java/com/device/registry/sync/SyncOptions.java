package com.device.registry.sync;

import com.device.registry.lifecycle.HealthPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for sync cycles and the poll scheduler.
 */
public class SyncOptions {

    private static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(5);
    private static final Duration DEFAULT_HEALTHY_WINDOW = Duration.ofMinutes(5);
    private static final Duration DEFAULT_WARNING_WINDOW = Duration.ofMinutes(30);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CYCLE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_MOVEMENT_SUPPRESSION = Duration.ofMinutes(10);
    private static final int DEFAULT_WORKER_THREADS = 4;
    private static final String DEFAULT_DETECTED_BY = "sync";

    private final Duration staleAfter;
    private final Duration healthyWindow;
    private final Duration warningWindow;
    private final Duration pollInterval;
    private final Duration cycleTimeout;
    private final int workerThreads;
    private final boolean recoverOffline;
    private final Duration movementSuppressionWindow;
    private final String detectedBy;

    private SyncOptions(Builder builder) {
        this.staleAfter = builder.staleAfter;
        this.healthyWindow = builder.healthyWindow;
        this.warningWindow = builder.warningWindow;
        this.pollInterval = builder.pollInterval;
        this.cycleTimeout = builder.cycleTimeout;
        this.workerThreads = builder.workerThreads;
        this.recoverOffline = builder.recoverOffline;
        this.movementSuppressionWindow = builder.movementSuppressionWindow;
        this.detectedBy = builder.detectedBy;
    }

    /**
     * Time without an observation after which an online or degraded device goes offline.
     */
    public Duration getStaleAfter() {
        return staleAfter;
    }

    public Duration getHealthyWindow() {
        return healthyWindow;
    }

    public Duration getWarningWindow() {
        return warningWindow;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getCycleTimeout() {
        return cycleTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Whether an offline device that shows up in a batch is brought back online.
     */
    public boolean isRecoverOffline() {
        return recoverOffline;
    }

    public Duration getMovementSuppressionWindow() {
        return movementSuppressionWindow;
    }

    public String getDetectedBy() {
        return detectedBy;
    }

    public HealthPolicy healthPolicy() {
        return new HealthPolicy(healthyWindow, warningWindow);
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration staleAfter = DEFAULT_STALE_AFTER;
        private Duration healthyWindow = DEFAULT_HEALTHY_WINDOW;
        private Duration warningWindow = DEFAULT_WARNING_WINDOW;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration cycleTimeout = DEFAULT_CYCLE_TIMEOUT;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean recoverOffline = true;
        private Duration movementSuppressionWindow = DEFAULT_MOVEMENT_SUPPRESSION;
        private String detectedBy = DEFAULT_DETECTED_BY;

        public Builder staleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
            return this;
        }

        public Builder healthyWindow(Duration healthyWindow) {
            this.healthyWindow = healthyWindow;
            return this;
        }

        public Builder warningWindow(Duration warningWindow) {
            this.warningWindow = warningWindow;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder cycleTimeout(Duration cycleTimeout) {
            this.cycleTimeout = cycleTimeout;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder recoverOffline(boolean recoverOffline) {
            this.recoverOffline = recoverOffline;
            return this;
        }

        public Builder movementSuppressionWindow(Duration movementSuppressionWindow) {
            this.movementSuppressionWindow = movementSuppressionWindow;
            return this;
        }

        public Builder detectedBy(String detectedBy) {
            this.detectedBy = detectedBy;
            return this;
        }

        public SyncOptions build() {
            requirePositive(staleAfter, "staleAfter");
            requirePositive(pollInterval, "pollInterval");
            requirePositive(cycleTimeout, "cycleTimeout");
            Objects.requireNonNull(movementSuppressionWindow, "movementSuppressionWindow is required");
            if (movementSuppressionWindow.isNegative()) {
                throw new IllegalArgumentException("movementSuppressionWindow must not be negative");
            }
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be > 0");
            }
            if (detectedBy == null || detectedBy.isBlank()) {
                throw new IllegalArgumentException("detectedBy must not be blank");
            }
            // validates the window pair
            new HealthPolicy(healthyWindow, warningWindow);
            return new SyncOptions(this);
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
