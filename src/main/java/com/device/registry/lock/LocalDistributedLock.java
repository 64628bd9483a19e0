package com.device.registry.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock with one {@link ReentrantLock} per device key. This is the default.
 *
 * <p>Each key's lock is reference counted by the threads holding or waiting for it and is
 * dropped once the count reaches zero, so the map only holds keys under contention rather
 * than every device the registry has ever written.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.references++;
            return held;
        });

        boolean acquired = false;
        try {
            acquired = keyLock.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(key,
                        "Device " + key + " stayed locked for more than " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while waiting for lock on " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
    }

    @Override
    public void unlock(String key) {
        KeyLock keyLock = locks.get(key);
        if (keyLock == null || !keyLock.lock.isHeldByCurrentThread()) {
            return;
        }
        keyLock.lock.unlock();
        release(key);
        log.trace("Lock released: {}", key);
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.references == 0 ? null : keyLock);
    }

    /**
     * Number of keys currently held or waited on.
     */
    int size() {
        return locks.size();
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int references;
    }
}
