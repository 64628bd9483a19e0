package com.device.registry.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeviceTest {

    private static Device sample() {
        return Device.builder()
                .serialNumber("SN1")
                .ip("10.0.0.5")
                .apiDeviceId("A1")
                .sourceId("shure")
                .model("ULXD4")
                .build();
    }

    @Test
    @DisplayName("Should default to DISCOVERED with generated id")
    void testDefaults() {
        Device device = sample();
        assertNotNull(device.getId());
        assertEquals(DeviceStatus.DISCOVERED, device.getStatus());
        assertTrue(device.getNetworkConfig().isEmpty());
        assertEquals(0, device.getVersion());
    }

    @Test
    @DisplayName("Should build from an observation")
    void testFromObservation() {
        Instant seen = Instant.parse("2024-03-01T10:00:00Z");
        Observation observation = Observation.builder()
                .serialNumber("SN1").ip("10.0.0.5").apiDeviceId("A1").sourceId("shure")
                .firmwareVersion("2.4.1").observedAt(seen).build();

        Device device = Device.fromObservation(observation).build();

        assertEquals("SN1", device.getSerialNumber());
        assertEquals("2.4.1", device.getFirmwareVersion());
        assertEquals(seen, device.getLastSeenAt());
        assertEquals(DeviceStatus.DISCOVERED, device.getStatus());
    }

    @Test
    @DisplayName("Copy should be independent of the original")
    void testCopyIsIndependent() {
        Device original = sample();
        Device copy = Device.builder(original).build();
        copy.setIp("10.0.0.9");

        assertEquals(original.getId(), copy.getId());
        assertEquals("10.0.0.5", original.getIp());
        assertEquals(original, copy);
    }

    @Test
    @DisplayName("Should report changed fields")
    void testChangedFields() {
        Device before = sample();
        Device after = Device.builder(before).build();
        after.setIp("10.0.0.9");
        after.setFirmwareVersion("3.0");

        Set<String> changed = before.changedFields(after);

        assertEquals(Set.of(Device.FIELD_IP, Device.FIELD_FIRMWARE_VERSION), changed);
        assertTrue(Device.containsIdentityField(changed));
        assertFalse(Device.containsIdentityField(Set.of(Device.FIELD_FIRMWARE_VERSION, Device.FIELD_NAME)));
    }

    @Test
    @DisplayName("Should normalize identity fields like observations do")
    void testIdentityNormalized() {
        Device device = Device.builder()
                .sourceId("shure").apiDeviceId("A1").ip(" 10.0.0.5 ")
                .serialNumber("   ").macAddress("00-1b-2c-3d-4e-5f")
                .build();

        assertNull(device.getSerialNumber());
        assertEquals("00:1B:2C:3D:4E:5F", device.getMacAddress());
        assertEquals("10.0.0.5", device.getIp());

        device.setMacAddress("garbage");
        assertNull(device.getMacAddress());
    }

    @ParameterizedTest
    @EnumSource(value = DeviceStatus.class, names = {"ONLINE", "DEGRADED", "PROVISIONING"})
    @DisplayName("Active statuses")
    void testActive(DeviceStatus status) {
        assertTrue(status.isActive());
    }

    @ParameterizedTest
    @EnumSource(value = DeviceStatus.class, names = {"DISCOVERED", "OFFLINE", "MAINTENANCE", "RETIRED"})
    @DisplayName("Inactive statuses")
    void testInactive(DeviceStatus status) {
        assertFalse(status.isActive());
    }

    @ParameterizedTest
    @EnumSource(value = DeviceStatus.class, names = {"MAINTENANCE", "RETIRED"})
    @DisplayName("Out-of-service statuses")
    void testOutOfService(DeviceStatus status) {
        assertTrue(status.isOutOfService());
        assertFalse(status.isActive());
    }

    @ParameterizedTest
    @EnumSource(value = DeviceStatus.class, names = {"MAINTENANCE", "RETIRED"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Statuses that are not out of service")
    void testInService(DeviceStatus status) {
        assertFalse(status.isOutOfService());
    }
}
