package com.device.registry.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through a context are removed
 * again when it is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSyncCycle(cycleId, "shure")) {
 *     log.info("sync.cycle.started observations={}", batch.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CYCLE_ID = "cycleId";
    public static final String SOURCE_ID = "sourceId";
    public static final String DEVICE_REF = "deviceRef";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one poll cycle of one source.
     */
    public static LogContext forSyncCycle(String cycleId, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put(CYCLE_ID, cycleId);
        ctx.put(SOURCE_ID, sourceId);
        ctx.put(OPERATION, "sync");
        return ctx;
    }

    /**
     * Context for a single-device operation such as a lifecycle transition.
     */
    public static LogContext forDevice(String deviceRef, String operation) {
        LogContext ctx = new LogContext();
        ctx.put(DEVICE_REF, deviceRef);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    /**
     * Context for a reviewer action on a conflict or movement.
     */
    public static LogContext forReview(String itemId, String action) {
        LogContext ctx = new LogContext();
        ctx.put("reviewItemId", itemId);
        ctx.put(OPERATION, action);
        return ctx;
    }

    public static String generateCycleId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
