package com.device.registry.lock;

/**
 * Lock that never blocks. Only safe when a single thread writes to the registry,
 * e.g. in single-source tests.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
    }
}
