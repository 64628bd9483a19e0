package com.device.registry.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Suppresses repeated movement records for the same device and IP pair.
 * A (device, oldIp, newIp) triple is accepted once per window; later occurrences inside
 * the window are rejected. A zero window disables suppression.
 */
public class RecentMovementFilter {
    private static final Logger log = LoggerFactory.getLogger(RecentMovementFilter.class);

    private static final long DEFAULT_MAX_SIZE = 50_000;

    private final Cache<MovementKey, Boolean> recent;
    private final boolean enabled;

    public RecentMovementFilter(Duration window) {
        this(window, DEFAULT_MAX_SIZE, Ticker.systemTicker());
    }

    public RecentMovementFilter(Duration window, long maxSize, Ticker ticker) {
        Objects.requireNonNull(window, "window is required");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.enabled = !window.isZero();
        this.recent = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(enabled ? window : Duration.ofNanos(1))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        log.debug("RecentMovementFilter initialized: window={}, maxSize={}", window, maxSize);
    }

    /**
     * Returns true if this movement has not been seen inside the window, and remembers it.
     */
    public boolean tryAcquire(String deviceRef, String oldIp, String newIp) {
        if (!enabled) {
            return true;
        }
        MovementKey key = new MovementKey(deviceRef, oldIp, newIp);
        boolean first = recent.asMap().putIfAbsent(key, Boolean.TRUE) == null;
        if (!first) {
            log.debug("Suppressed repeated movement for device {} ({} -> {})", deviceRef, oldIp, newIp);
        }
        return first;
    }

    public void invalidateAll() {
        recent.invalidateAll();
    }

    private record MovementKey(String deviceRef, String oldIp, String newIp) {
    }
}
