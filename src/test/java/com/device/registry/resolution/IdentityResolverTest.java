package com.device.registry.resolution;

import com.device.registry.MutableClock;
import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Device;
import com.device.registry.core.model.Observation;
import com.device.registry.registry.InMemoryDeviceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IdentityResolverTest {

    private MutableClock clock;
    private InMemoryDeviceRegistry registry;
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T09:00:00Z");
        registry = new InMemoryDeviceRegistry(clock);
        resolver = new IdentityResolver(registry);
    }

    private Observation.Builder observation(String sourceId, String apiId, String ip) {
        return Observation.builder()
                .sourceId(sourceId)
                .apiDeviceId(apiId)
                .ip(ip)
                .observedAt(clock.instant());
    }

    private String seed(String sourceId, String apiId, String ip, String serial, String mac) {
        String ref = registry.create(Device.builder()
                .sourceId(sourceId).apiDeviceId(apiId).ip(ip)
                .serialNumber(serial).macAddress(mac).build());
        clock.advance(Duration.ofSeconds(1));
        return ref;
    }

    @Test
    @DisplayName("Should classify an unknown device as new")
    void testNewDevice() {
        Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.5").serialNumber("SN1").build());

        assertTrue(result.isNew());
        assertNull(result.existingRef());
        assertNull(result.matchedBy());
    }

    @Nested
    @DisplayName("Serial and MAC matching")
    class HardwareKeyTests {

        @Test
        @DisplayName("Same serial and same IP is a duplicate")
        void testDuplicateBySerial() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.5").serialNumber("SN1").build());

            assertEquals(ClassificationKind.DUPLICATE, result.kind());
            assertEquals(MatchKey.SERIAL, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("Same serial at a new IP is a move")
        void testMovedBySerial() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.9").serialNumber("SN1").build());

            assertEquals(ClassificationKind.MOVED, result.kind());
            assertEquals(ref, result.existingRef());
            assertEquals("10.0.0.5", result.oldIp());
            assertEquals("10.0.0.9", result.newIp());
        }

        @Test
        @DisplayName("Serial wins over a different device at the observed IP")
        void testSerialBeatsIp() {
            String serialOwner = seed("shure", "A1", "10.0.0.5", "SN1", null);
            seed("shure", "A2", "10.0.0.9", "SN2", null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.9").serialNumber("SN1").build());

            assertEquals(ClassificationKind.MOVED, result.kind());
            assertEquals(serialOwner, result.existingRef());
        }

        @Test
        @DisplayName("Serial bound to another source binding is a cross-source collision")
        void testCrossSourceBySerial() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("sennheiser", "X1", "10.0.0.5").serialNumber("SN1").build());

            assertTrue(result.isConflict());
            assertEquals(ConflictKind.CROSS_SOURCE_COLLISION, result.conflictKind());
            assertEquals(ref, result.existingRef());
            assertEquals(MatchKey.SERIAL, result.matchedBy());
        }

        @Test
        @DisplayName("MAC is used when no serial is reported")
        void testMovedByMac() {
            String ref = seed("shure", "A1", "10.0.0.5", null, "00:1B:2C:3D:4E:5F");

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.7")
                    .macAddress("00-1b-2c-3d-4e-5f").build());

            assertEquals(ClassificationKind.MOVED, result.kind());
            assertEquals(MatchKey.MAC, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("MAC reported by another source is a cross-source collision")
        void testCrossSourceByMac() {
            String ref = seed("shure", "A1", "10.0.0.5", null, "00:1B:2C:3D:4E:5F");

            Classification result = resolver.resolve(observation("sennheiser", "X1", "10.0.0.5")
                    .macAddress("00:1B:2C:3D:4E:5F").build());

            assertEquals(ConflictKind.CROSS_SOURCE_COLLISION, result.conflictKind());
            assertEquals(MatchKey.MAC, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("Same source reporting a known MAC under a new API id is a duplicate")
        void testSameSourceNewApiIdByMac() {
            String ref = seed("shure", "A1", "10.0.0.5", null, "00:1B:2C:3D:4E:5F");

            Classification result = resolver.resolve(observation("shure", "A2", "10.0.0.5")
                    .macAddress("00:1B:2C:3D:4E:5F").build());

            assertEquals(ClassificationKind.DUPLICATE, result.kind());
            assertEquals(MatchKey.MAC, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("Same source reporting a known serial under a new API id at a new IP is a move")
        void testSameSourceNewApiIdMoved() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("shure", "A7", "10.0.0.9").serialNumber("SN1").build());

            assertEquals(ClassificationKind.MOVED, result.kind());
            assertEquals(ref, result.existingRef());
            assertEquals("10.0.0.9", result.newIp());
        }

        @Test
        @DisplayName("New API id already bound to another device of the source is a duplicate-api-id conflict")
        void testSameSourceNewApiIdTaken() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);
            seed("shure", "A2", "10.0.0.6", "SN2", null);

            Classification result = resolver.resolve(observation("shure", "A2", "10.0.0.5").serialNumber("SN1").build());

            assertEquals(ConflictKind.DUPLICATE_API_ID, result.conflictKind());
            assertEquals(MatchKey.SERIAL, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }
    }

    @Nested
    @DisplayName("IP matching")
    class IpTests {

        @Test
        @DisplayName("Matching IP with no disagreeing identity is a duplicate")
        void testIpDuplicate() {
            String ref = seed("shure", "A1", "10.0.0.5", null, null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.5").serialNumber("SN1").build());

            assertEquals(ClassificationKind.DUPLICATE, result.kind());
            assertEquals(MatchKey.IP, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("A different serial at the same IP is an IP conflict")
        void testIpConflict() {
            String ref = seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("shure", "A9", "10.0.0.5").serialNumber("SN2").build());

            assertEquals(ConflictKind.IP_CONFLICT, result.conflictKind());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("A different MAC at the same IP is an IP conflict")
        void testIpConflictByMac() {
            seed("shure", "A1", "10.0.0.5", null, "00:1B:2C:3D:4E:5F");

            Classification result = resolver.resolve(observation("shure", "A9", "10.0.0.5")
                    .macAddress("00:1B:2C:3D:4E:60").build());

            assertEquals(ConflictKind.IP_CONFLICT, result.conflictKind());
        }

        @Test
        @DisplayName("IP match while the binding points elsewhere is a duplicate API id")
        void testIpPointsElsewhere() {
            seed("shure", "A1", "10.0.0.5", null, null);
            String bound = seed("shure", "A2", "10.0.0.6", null, null);

            Classification result = resolver.resolve(observation("shure", "A2", "10.0.0.5").build());

            assertEquals(ConflictKind.DUPLICATE_API_ID, result.conflictKind());
            assertEquals(bound, result.existingRef());
        }

        @Test
        @DisplayName("Shared IP prefers the candidate with the same binding")
        void testSharedIpPrefersBinding() {
            seed("shure", "A1", "10.0.0.5", null, null);
            String second = seed("shure", "A2", "10.0.0.5", null, null);

            Classification result = resolver.resolve(observation("shure", "A2", "10.0.0.5").build());

            assertEquals(ClassificationKind.DUPLICATE, result.kind());
            assertEquals(second, result.existingRef());
        }
    }

    @Nested
    @DisplayName("API id matching")
    class ApiIdTests {

        @Test
        @DisplayName("Binding match at a new IP is a move")
        void testMovedByApiId() {
            String ref = seed("shure", "A1", "10.0.0.5", null, null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.8").build());

            assertEquals(ClassificationKind.MOVED, result.kind());
            assertEquals(MatchKey.API_ID, result.matchedBy());
            assertEquals(ref, result.existingRef());
        }

        @Test
        @DisplayName("Binding match with a disagreeing serial is a duplicate API id")
        void testApiIdConflict() {
            seed("shure", "A1", "10.0.0.5", "SN1", null);

            Classification result = resolver.resolve(observation("shure", "A1", "10.0.0.8").serialNumber("SN2").build());

            assertEquals(ConflictKind.DUPLICATE_API_ID, result.conflictKind());
            assertEquals(MatchKey.API_ID, result.matchedBy());
        }
    }

    @ParameterizedTest
    @CsvSource({
            "shure, A1, 10.0.0.5",
            "shure, A1, 10.0.0.99",
            "shure, B7, 10.0.0.5",
            "sennheiser, A1, 10.0.0.5",
            "sennheiser, Z3, 10.1.1.1"
    })
    @DisplayName("An observation whose serial is registered is never classified as new")
    void testSerialMatchNeverNew(String sourceId, String apiId, String ip) {
        seed("shure", "A1", "10.0.0.5", "SN1", null);

        Classification result = resolver.resolve(observation(sourceId, apiId, ip).serialNumber("SN1").build());

        assertFalse(result.isNew());
    }

    @Test
    @DisplayName("Resolver only reads from the lookup")
    void testReadOnly() {
        InMemoryDeviceRegistry spy = spy(registry);
        new IdentityResolver(spy).resolve(observation("shure", "A1", "10.0.0.5").build());

        verify(spy, never()).create(any());
        verify(spy, never()).update(anyString(), any());
    }

    @Test
    @DisplayName("Classification rejects inconsistent combinations")
    void testClassificationValidation() {
        Device device = Device.builder().sourceId("shure").apiDeviceId("A1").ip("10.0.0.5")
                .createdAt(Instant.EPOCH).build();

        assertThrows(IllegalArgumentException.class,
                () -> new Classification(ClassificationKind.DUPLICATE, null, null, null, null, MatchKey.IP, "x"));
        assertThrows(NullPointerException.class,
                () -> new Classification(ClassificationKind.CONFLICT, device, null, null, null, MatchKey.IP, "x"));
        assertThrows(IllegalArgumentException.class,
                () -> new Classification(ClassificationKind.NEW, null, null, null,
                        ConflictKind.IP_CONFLICT, null, "x"));
    }
}
