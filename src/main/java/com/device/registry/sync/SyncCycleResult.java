package com.device.registry.sync;

import com.device.registry.event.DeviceEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one sync cycle for one source.
 *
 * @param cycleId      correlation id, also present in the MDC while the cycle ran
 * @param sourceId     the polled source
 * @param startedAt    cycle start
 * @param finishedAt   cycle end
 * @param observations observations fetched
 * @param created      devices created
 * @param duplicates   observations matched to a device at the same IP
 * @param moved        observations matched to a device at a different IP
 * @param conflicts    observations held back as conflicts (including ones already pending)
 * @param movements    movement records written
 * @param markedOffline devices taken offline by the staleness sweep
 * @param failed       observations or devices skipped after an error
 * @param cancelled    whether the cycle stopped early
 * @param events       one event per changed device
 * @param error        fetch error message, or null
 */
public record SyncCycleResult(
        String cycleId,
        String sourceId,
        Instant startedAt,
        Instant finishedAt,
        int observations,
        int created,
        int duplicates,
        int moved,
        int conflicts,
        int movements,
        int markedOffline,
        int failed,
        boolean cancelled,
        List<DeviceEvent> events,
        String error
) {
    public SyncCycleResult {
        events = events != null ? List.copyOf(events) : List.of();
    }

    static SyncCycleResult fetchFailed(String cycleId, String sourceId, Instant startedAt, Instant finishedAt,
                                       String error) {
        return new SyncCycleResult(cycleId, sourceId, startedAt, finishedAt,
                0, 0, 0, 0, 0, 0, 0, 0, false, List.of(), error);
    }

    public boolean succeeded() {
        return error == null && !cancelled;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
