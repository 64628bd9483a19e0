package com.device.registry.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("NoOpDistributedLock")
    class NoOpTests {

        @Test
        @DisplayName("Should always acquire and run the action")
        void testAlwaysAcquires() {
            NoOpDistributedLock lock = new NoOpDistributedLock();
            assertTrue(lock.tryLock("any-key"));
            assertEquals("done", lock.withLock("any-key", () -> "done"));
        }
    }

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should allow re-entrant locking from same thread")
        void testReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("device:1"));
            assertTrue(lock.tryLock("device:1"));
            lock.unlock("device:1");
            assertEquals(1, lock.size());
            lock.unlock("device:1");
            assertEquals(0, lock.size());
        }

        @Test
        @DisplayName("Should release the lock when the action throws")
        void testWithLockReleasesOnFailure() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(200));

            assertThrows(IllegalStateException.class, () -> lock.withLock("device:1", () -> {
                throw new IllegalStateException("boom");
            }));

            ExecutorService other = Executors.newSingleThreadExecutor();
            try {
                assertTrue(other.submit(() -> lock.tryLock("device:1")).get(2, TimeUnit.SECONDS));
            } finally {
                other.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should time out when another thread holds the key")
        void testTimeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(50));
            lock.tryLock("device:1");
            ExecutorService other = Executors.newSingleThreadExecutor();
            try {
                var future = other.submit(() -> lock.tryLock("device:1"));
                var thrown = assertThrows(ExecutionException.class,
                        () -> future.get(2, TimeUnit.SECONDS));
                LockAcquisitionException cause = assertInstanceOf(LockAcquisitionException.class, thrown.getCause());
                assertEquals("device:1", cause.getKey());
                assertEquals(1, lock.size());
            } finally {
                lock.unlock("device:1");
                other.shutdownNow();
            }
            assertEquals(0, lock.size());
        }

        @Test
        @DisplayName("Should serialize concurrent access to the same key")
        void testConcurrentBlocking() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(5000));
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            int threadCount = 5;
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            ExecutorService pool = Executors.newFixedThreadPool(threadCount);

            try {
                for (int i = 0; i < threadCount; i++) {
                    pool.execute(() -> {
                        try {
                            start.await();
                            lock.withLock("device:shared", () -> {
                                int current = concurrent.incrementAndGet();
                                maxConcurrent.updateAndGet(max -> Math.max(max, current));
                                try {
                                    Thread.sleep(20);
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                                return concurrent.decrementAndGet();
                            });
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, maxConcurrent.get());
            assertEquals(0, lock.size());
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            assertEquals(5000, LockConfig.defaults().timeoutMs());
        }

        @Test
        @DisplayName("Should reject non-positive timeout")
        void testInvalidTimeout() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0));
        }
    }
}
