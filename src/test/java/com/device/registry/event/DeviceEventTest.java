package com.device.registry.event;

import com.device.registry.core.model.DeviceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeviceEventTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Test
    @DisplayName("Creation events have no previous status")
    void testCreated() {
        DeviceEvent event = new DeviceEvent("dev-1", "shure", null, DeviceStatus.ONLINE, null, NOW);

        assertTrue(event.isCreated());
        assertTrue(event.isStatusChange());
        assertTrue(event.changedFields().isEmpty());
    }

    @Test
    @DisplayName("Identity-only changes are not status changes")
    void testIdentityChange() {
        Set<String> fields = new HashSet<>(Set.of("ip"));
        DeviceEvent event = new DeviceEvent("dev-1", "shure", DeviceStatus.ONLINE, DeviceStatus.ONLINE, fields, NOW);
        fields.add("serialNumber");

        assertFalse(event.isCreated());
        assertFalse(event.isStatusChange());
        assertEquals(Set.of("ip"), event.changedFields());
        assertThrows(UnsupportedOperationException.class, () -> event.changedFields().add("mac"));
    }

    @Test
    @DisplayName("Should require a device ref, new status and timestamp")
    void testValidation() {
        assertThrows(NullPointerException.class,
                () -> new DeviceEvent(null, "shure", null, DeviceStatus.ONLINE, Set.of(), NOW));
        assertThrows(NullPointerException.class,
                () -> new DeviceEvent("dev-1", "shure", null, null, Set.of(), NOW));
        assertThrows(NullPointerException.class,
                () -> new DeviceEvent("dev-1", "shure", null, DeviceStatus.ONLINE, Set.of(), null));
    }
}
