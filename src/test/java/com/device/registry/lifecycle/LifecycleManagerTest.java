package com.device.registry.lifecycle;

import com.device.registry.MutableClock;
import com.device.registry.core.model.Device;
import com.device.registry.core.model.DeviceStatus;
import com.device.registry.metrics.MetricsService;
import com.device.registry.registry.DeviceNotFoundException;
import com.device.registry.registry.InMemoryDeviceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LifecycleManagerTest {

    private static final Duration STALE_AFTER = Duration.ofMinutes(15);

    private MutableClock clock;
    private InMemoryDeviceRegistry registry;
    private MetricsService metrics;
    private LifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T09:00:00Z");
        registry = new InMemoryDeviceRegistry(clock);
        metrics = mock(MetricsService.class);
        lifecycle = new LifecycleManager(registry, clock, metrics, HealthPolicy.defaults());
    }

    private String seed(String apiId, DeviceStatus status, Instant lastSeenAt) {
        return registry.create(Device.builder()
                .sourceId("shure").apiDeviceId(apiId).ip("10.0.0.5")
                .status(status).lastSeenAt(lastSeenAt).build());
    }

    @Nested
    @DisplayName("transition")
    class TransitionTests {

        @Test
        @DisplayName("Should apply an allowed transition and record it")
        void testAllowed() {
            String ref = seed("A1", DeviceStatus.ONLINE, clock.instant());

            Device updated = lifecycle.transition(ref, DeviceStatus.DEGRADED, Map.of(LifecycleManager.REASON, "rf"));

            assertEquals(DeviceStatus.DEGRADED, updated.getStatus());
            verify(metrics).recordTransition(DeviceStatus.ONLINE, DeviceStatus.DEGRADED);
        }

        @Test
        @DisplayName("Should reject a transition not in the table and leave status unchanged")
        void testInvalid() {
            String ref = seed("A1", DeviceStatus.DISCOVERED, null);

            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> lifecycle.transition(ref, DeviceStatus.ONLINE, Map.of()));

            assertEquals(ref, e.getDeviceRef());
            assertEquals(DeviceStatus.DISCOVERED, e.getFrom());
            assertEquals(DeviceStatus.ONLINE, e.getTo());
            Device stored = registry.get(ref);
            assertEquals(DeviceStatus.DISCOVERED, stored.getStatus());
            assertEquals(1, stored.getVersion());
            verify(metrics).recordInvalidTransition(DeviceStatus.DISCOVERED, DeviceStatus.ONLINE);
        }

        @Test
        @DisplayName("Retired devices cannot move")
        void testRetiredIsTerminal() {
            String ref = seed("A1", DeviceStatus.OFFLINE, null);
            lifecycle.retire(ref, "decommissioned");

            for (DeviceStatus target : DeviceStatus.values()) {
                assertThrows(InvalidTransitionException.class, () -> lifecycle.transition(ref, target, null));
            }
            assertEquals(DeviceStatus.RETIRED, registry.get(ref).getStatus());
        }

        @Test
        @DisplayName("Should reject a self transition")
        void testSelfTransition() {
            String ref = seed("A1", DeviceStatus.ONLINE, null);
            assertThrows(InvalidTransitionException.class,
                    () -> lifecycle.transition(ref, DeviceStatus.ONLINE, Map.of()));
        }

        @Test
        @DisplayName("Should fail for an unknown device")
        void testUnknownDevice() {
            assertThrows(DeviceNotFoundException.class,
                    () -> lifecycle.markOffline("missing", "gone"));
        }

        @Test
        @DisplayName("Convenience methods map to their targets")
        void testConvenienceMethods() {
            String ref = seed("A1", DeviceStatus.ONLINE, null);

            assertEquals(DeviceStatus.DEGRADED, lifecycle.markDegraded(ref, "rf").getStatus());
            assertEquals(DeviceStatus.MAINTENANCE, lifecycle.markMaintenance(ref, "battery swap").getStatus());
            assertEquals(DeviceStatus.OFFLINE, lifecycle.markOffline(ref, "unplugged").getStatus());
            assertEquals(DeviceStatus.RETIRED, lifecycle.retire(ref, "sold").getStatus());
        }
    }

    @Nested
    @DisplayName("timestamps")
    class TimestampTests {

        @Test
        @DisplayName("Entering online sets lastOnlineAt")
        void testLastOnlineAt() {
            String ref = seed("A1", DeviceStatus.OFFLINE, null);
            clock.advance(Duration.ofMinutes(3));

            Device updated = lifecycle.transition(ref, DeviceStatus.ONLINE, Map.of());

            assertEquals(clock.instant(), updated.getLastOnlineAt());
        }

        @Test
        @DisplayName("Leaving online sets lastOfflineAt and accumulates online time")
        void testLeavingOnline() {
            String ref = seed("A1", DeviceStatus.OFFLINE, null);
            lifecycle.transition(ref, DeviceStatus.ONLINE, Map.of());
            clock.advance(Duration.ofMinutes(10));
            lifecycle.transition(ref, DeviceStatus.DEGRADED, Map.of());

            Device afterFirstSpan = registry.get(ref);
            assertEquals(clock.instant(), afterFirstSpan.getLastOfflineAt());
            assertEquals(Duration.ofMinutes(10), afterFirstSpan.getTotalOnlineDuration());

            lifecycle.transition(ref, DeviceStatus.ONLINE, Map.of());
            clock.advance(Duration.ofMinutes(5));
            Device offline = lifecycle.markOffline(ref, "timeout");

            assertEquals(Duration.ofMinutes(15), offline.getTotalOnlineDuration());
            assertEquals(clock.instant(), offline.getLastOfflineAt());
        }

        @Test
        @DisplayName("Entering offline from a non-online state sets lastOfflineAt")
        void testEnteringOffline() {
            String ref = seed("A1", DeviceStatus.MAINTENANCE, null);
            clock.advance(Duration.ofMinutes(1));

            Device updated = lifecycle.markOffline(ref, "power");

            assertEquals(clock.instant(), updated.getLastOfflineAt());
            assertEquals(Duration.ZERO, updated.getTotalOnlineDuration());
        }
    }

    @Nested
    @DisplayName("bringOnline")
    class BringOnlineTests {

        @Test
        @DisplayName("Discovered devices go through provisioning to online")
        void testFromDiscovered() {
            String ref = seed("A1", DeviceStatus.DISCOVERED, clock.instant());

            Device updated = lifecycle.bringOnline(ref, "observed", true);

            assertEquals(DeviceStatus.ONLINE, updated.getStatus());
            assertEquals(2, updated.getVersion());
            verify(metrics).recordTransition(DeviceStatus.DISCOVERED, DeviceStatus.PROVISIONING);
            verify(metrics).recordTransition(DeviceStatus.PROVISIONING, DeviceStatus.ONLINE);
        }

        @Test
        @DisplayName("Offline devices recover only when enabled")
        void testOfflineRecovery() {
            String ref = seed("A1", DeviceStatus.OFFLINE, null);

            assertEquals(DeviceStatus.OFFLINE, lifecycle.bringOnline(ref, "observed", false).getStatus());
            assertEquals(DeviceStatus.ONLINE, lifecycle.bringOnline(ref, "observed", true).getStatus());
        }

        @Test
        @DisplayName("Maintenance and retired devices are left alone")
        void testNoPromotion() {
            String maintenance = seed("A1", DeviceStatus.MAINTENANCE, null);
            String retired = seed("A2", DeviceStatus.RETIRED, null);

            assertEquals(DeviceStatus.MAINTENANCE, lifecycle.bringOnline(maintenance, "observed", true).getStatus());
            assertEquals(DeviceStatus.RETIRED, lifecycle.bringOnline(retired, "observed", true).getStatus());
            assertEquals(1, registry.get(maintenance).getVersion());
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("checkHealth")
    class CheckHealthTests {

        @Test
        @DisplayName("Stale online device goes offline")
        void testStaleOnline() {
            String ref = seed("A1", DeviceStatus.ONLINE, clock.instant());
            clock.advance(STALE_AFTER.plusSeconds(1));

            HealthCheckResult result = lifecycle.checkHealth(ref, STALE_AFTER);

            assertTrue(result.transitioned());
            assertEquals(DeviceStatus.ONLINE, result.previousStatus());
            assertEquals(DeviceStatus.OFFLINE, result.currentStatus());
            assertEquals(clock.instant(), registry.get(ref).getLastOfflineAt());
        }

        @Test
        @DisplayName("Stale degraded device goes offline")
        void testStaleDegraded() {
            String ref = seed("A1", DeviceStatus.DEGRADED, clock.instant());
            clock.advance(Duration.ofHours(1));

            assertEquals(DeviceStatus.OFFLINE, lifecycle.checkHealth(ref, STALE_AFTER).currentStatus());
        }

        @Test
        @DisplayName("Exactly at the threshold is not stale")
        void testAtThreshold() {
            String ref = seed("A1", DeviceStatus.ONLINE, clock.instant());
            clock.advance(STALE_AFTER);

            assertFalse(lifecycle.checkHealth(ref, STALE_AFTER).transitioned());
        }

        @Test
        @DisplayName("Only online and degraded devices are health checked")
        void testOtherStatusesUntouched() {
            Instant longAgo = clock.instant();
            List<String> refs = List.of(
                    seed("A1", DeviceStatus.DISCOVERED, longAgo),
                    seed("A2", DeviceStatus.PROVISIONING, longAgo),
                    seed("A3", DeviceStatus.MAINTENANCE, longAgo),
                    seed("A4", DeviceStatus.OFFLINE, longAgo),
                    seed("A5", DeviceStatus.RETIRED, longAgo));
            clock.advance(Duration.ofDays(1));

            for (String ref : refs) {
                assertFalse(lifecycle.checkHealth(ref, STALE_AFTER).transitioned());
                assertEquals(1, registry.get(ref).getVersion());
            }
        }

        @Test
        @DisplayName("A device that was never seen is not marked offline")
        void testNeverSeen() {
            String ref = seed("A1", DeviceStatus.ONLINE, null);
            clock.advance(Duration.ofDays(1));

            assertFalse(lifecycle.checkHealth(ref, STALE_AFTER).transitioned());
        }

        @Test
        @DisplayName("Bulk check isolates failures and summarizes")
        void testBulk() {
            String stale = seed("A1", DeviceStatus.ONLINE, clock.instant());
            String fresh = seed("A2", DeviceStatus.ONLINE, null);
            clock.advance(Duration.ofHours(1));
            registry.update(fresh, d -> d.setLastSeenAt(clock.instant()));

            HealthSummary summary = lifecycle.bulkHealthCheck(List.of(stale, "missing", fresh), STALE_AFTER);

            assertEquals(2, summary.checked());
            assertEquals(1, summary.markedOffline());
            assertEquals(1, summary.failed());
            assertEquals(1, summary.byStatus().get(DeviceStatus.OFFLINE));
            assertEquals(1, summary.byStatus().get(DeviceStatus.ONLINE));
        }
    }

    @Test
    @DisplayName("Health is derived without writing")
    void testHealthOf() {
        String ref = seed("A1", DeviceStatus.ONLINE, clock.instant());
        clock.advance(Duration.ofMinutes(10));

        assertEquals(HealthState.WARNING, lifecycle.healthOf(registry.get(ref)));
        assertEquals(1, registry.get(ref).getVersion());
    }
}
