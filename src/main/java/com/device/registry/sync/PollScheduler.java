package com.device.registry.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls each source on its own fixed-delay tick and runs the cycles on a bounded worker
 * pool, so sources are synced in parallel while one source's batch stays sequential.
 *
 * <p>A tick is skipped while the previous cycle for the same source is still running.
 * A cycle that exceeds the configured timeout is cancelled cooperatively: the observation
 * in progress completes and no further observation starts.</p>
 */
public class PollScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final SyncOrchestrator orchestrator;
    private final List<String> sourceIds;
    private final SyncOptions options;
    private final ExecutorService workers;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private volatile ScheduledExecutorService ticker;

    public PollScheduler(SyncOrchestrator orchestrator, Collection<String> sourceIds, SyncOptions options) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.sourceIds = List.copyOf(sourceIds);
        this.options = Objects.requireNonNull(options, "options is required");
        this.workers = Executors.newFixedThreadPool(options.getWorkerThreads(), namedThreads("device-sync-worker"));
    }

    /**
     * Starts periodic polling of every source. The first tick fires immediately.
     *
     * @throws IllegalStateException if polling was already started
     */
    public synchronized void start() {
        if (ticker != null) {
            throw new IllegalStateException("Polling already started");
        }
        ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("device-sync-ticker"));
        long intervalMs = options.getPollInterval().toMillis();
        for (String sourceId : sourceIds) {
            ticker.scheduleWithFixedDelay(() -> tick(sourceId), 0, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Polling started for {} sources every {}", sourceIds.size(), options.getPollInterval());
    }

    public boolean isStarted() {
        return ticker != null;
    }

    /**
     * Runs one cycle for every source now, concurrently. Sources whose previous cycle is
     * still running are left out of the result.
     */
    public CompletableFuture<List<SyncCycleResult>> pollOnce() {
        List<CompletableFuture<SyncCycleResult>> futures = new ArrayList<>();
        for (String sourceId : sourceIds) {
            CompletableFuture<SyncCycleResult> cycle = submit(sourceId);
            if (cycle != null) {
                futures.add(cycle);
            }
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private void tick(String sourceId) {
        try {
            submit(sourceId);
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            log.error("Failed to schedule sync cycle for {}: {}", sourceId, e.getMessage(), e);
        }
    }

    /**
     * Submits a cycle unless one is already running for the source.
     *
     * @return the cycle's result future, or null if the source is busy
     */
    CompletableFuture<SyncCycleResult> submit(String sourceId) {
        if (!running.add(sourceId)) {
            log.debug("Skipping sync tick for {}: previous cycle still running", sourceId);
            return null;
        }

        CycleControl control = new CycleControl();
        CompletableFuture<SyncCycleResult> cycle;
        try {
            cycle = CompletableFuture.supplyAsync(() -> orchestrator.runCycle(sourceId, control), workers);
        } catch (RuntimeException e) {
            running.remove(sourceId);
            throw e;
        }
        cycle.whenComplete((result, error) -> {
            running.remove(sourceId);
            if (error != null) {
                log.error("Sync cycle for {} failed: {}", sourceId, error.getMessage(), error);
            }
        });

        cycle.copy()
                .orTimeout(options.getCycleTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> {
                    if (error instanceof TimeoutException) {
                        control.cancel();
                        log.warn("Sync cycle for {} exceeded {}, cancelling", sourceId, options.getCycleTimeout());
                    }
                });
        return cycle;
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            shutdown(ticker);
        }
        shutdown(workers);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
