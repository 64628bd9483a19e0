package com.device.registry.core.model;

import com.device.registry.rules.IdentityNormalizer;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Canonical registry row for one physical device.
 *
 * <p>Serial, MAC and IP are normalized on every write, the same way {@link Observation}
 * normalizes them, so a blank serial or an unparseable MAC is stored as absent.</p>
 *
 * <p>Instances handed out by the registry are copies. Mutating one has no effect on the
 * registry; changes are applied through
 * {@link com.device.registry.registry.DeviceRegistry#update}.</p>
 */
public class Device {

    public static final String FIELD_SERIAL_NUMBER = "serialNumber";
    public static final String FIELD_MAC_ADDRESS = "macAddress";
    public static final String FIELD_IP = "ip";
    public static final String FIELD_API_DEVICE_ID = "apiDeviceId";
    public static final String FIELD_SOURCE_ID = "sourceId";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_MODEL = "model";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_FIRMWARE_VERSION = "firmwareVersion";
    public static final String FIELD_NETWORK_CONFIG = "networkConfig";
    public static final String FIELD_LOCATION_REF = "locationRef";

    private static final Set<String> IDENTITY_FIELDS = Set.of(
            FIELD_SERIAL_NUMBER, FIELD_MAC_ADDRESS, FIELD_IP, FIELD_API_DEVICE_ID, FIELD_SOURCE_ID);

    private final String id;
    private String serialNumber;
    private String macAddress;
    private String ip;
    private String apiDeviceId;
    private final String sourceId;
    private DeviceStatus status;
    private Instant lastSeenAt;
    private Instant lastOnlineAt;
    private Instant lastOfflineAt;
    private Duration totalOnlineDuration;
    private String model;
    private String name;
    private String firmwareVersion;
    private NetworkConfig networkConfig;
    private String locationRef;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Device(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.serialNumber = IdentityNormalizer.normalizeSerial(builder.serialNumber);
        this.macAddress = IdentityNormalizer.normalizeMac(builder.macAddress);
        this.ip = Objects.requireNonNull(IdentityNormalizer.normalizeIp(builder.ip), "ip is required");
        this.apiDeviceId = builder.apiDeviceId;
        this.sourceId = builder.sourceId;
        this.status = builder.status != null ? builder.status : DeviceStatus.DISCOVERED;
        this.lastSeenAt = builder.lastSeenAt;
        this.lastOnlineAt = builder.lastOnlineAt;
        this.lastOfflineAt = builder.lastOfflineAt;
        this.totalOnlineDuration = builder.totalOnlineDuration != null ? builder.totalOnlineDuration : Duration.ZERO;
        this.model = builder.model;
        this.name = builder.name;
        this.firmwareVersion = builder.firmwareVersion;
        this.networkConfig = builder.networkConfig != null ? builder.networkConfig : NetworkConfig.empty();
        this.locationRef = builder.locationRef;
        this.version = builder.version;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = IdentityNormalizer.normalizeSerial(serialNumber);
    }

    public String getMacAddress() {
        return macAddress;
    }

    public void setMacAddress(String macAddress) {
        this.macAddress = IdentityNormalizer.normalizeMac(macAddress);
    }

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = Objects.requireNonNull(IdentityNormalizer.normalizeIp(ip), "ip is required");
    }

    public String getApiDeviceId() {
        return apiDeviceId;
    }

    public void setApiDeviceId(String apiDeviceId) {
        this.apiDeviceId = Objects.requireNonNull(apiDeviceId, "apiDeviceId is required");
    }

    public String getSourceId() {
        return sourceId;
    }

    public DeviceStatus getStatus() {
        return status;
    }

    public void setStatus(DeviceStatus status) {
        this.status = Objects.requireNonNull(status, "status is required");
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public Instant getLastOnlineAt() {
        return lastOnlineAt;
    }

    public void setLastOnlineAt(Instant lastOnlineAt) {
        this.lastOnlineAt = lastOnlineAt;
    }

    public Instant getLastOfflineAt() {
        return lastOfflineAt;
    }

    public void setLastOfflineAt(Instant lastOfflineAt) {
        this.lastOfflineAt = lastOfflineAt;
    }

    public Duration getTotalOnlineDuration() {
        return totalOnlineDuration;
    }

    public void setTotalOnlineDuration(Duration totalOnlineDuration) {
        this.totalOnlineDuration = Objects.requireNonNull(totalOnlineDuration);
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFirmwareVersion() {
        return firmwareVersion;
    }

    public void setFirmwareVersion(String firmwareVersion) {
        this.firmwareVersion = firmwareVersion;
    }

    public NetworkConfig getNetworkConfig() {
        return networkConfig;
    }

    public void setNetworkConfig(NetworkConfig networkConfig) {
        this.networkConfig = networkConfig != null ? networkConfig : NetworkConfig.empty();
    }

    public String getLocationRef() {
        return locationRef;
    }

    public void setLocationRef(String locationRef) {
        this.locationRef = locationRef;
    }

    /**
     * Optimistic-concurrency version, incremented by the registry on every committed write.
     */
    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isOutOfService() {
        return status.isOutOfService();
    }

    /**
     * Names of the fields whose values differ between this device and {@code other}.
     * Timestamps and bookkeeping fields are not compared.
     */
    public Set<String> changedFields(Device other) {
        Set<String> changed = new LinkedHashSet<>();
        compare(changed, FIELD_SERIAL_NUMBER, serialNumber, other.serialNumber);
        compare(changed, FIELD_MAC_ADDRESS, macAddress, other.macAddress);
        compare(changed, FIELD_IP, ip, other.ip);
        compare(changed, FIELD_API_DEVICE_ID, apiDeviceId, other.apiDeviceId);
        compare(changed, FIELD_SOURCE_ID, sourceId, other.sourceId);
        compare(changed, FIELD_STATUS, status, other.status);
        compare(changed, FIELD_MODEL, model, other.model);
        compare(changed, FIELD_NAME, name, other.name);
        compare(changed, FIELD_FIRMWARE_VERSION, firmwareVersion, other.firmwareVersion);
        compare(changed, FIELD_NETWORK_CONFIG, networkConfig, other.networkConfig);
        compare(changed, FIELD_LOCATION_REF, locationRef, other.locationRef);
        return changed;
    }

    /**
     * Returns true if any of the given field names is an identity field.
     */
    public static boolean containsIdentityField(Set<String> fields) {
        for (String field : fields) {
            if (IDENTITY_FIELDS.contains(field)) {
                return true;
            }
        }
        return false;
    }

    private static void compare(Set<String> changed, String field, Object a, Object b) {
        if (!Objects.equals(a, b)) {
            changed.add(field);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Device device = (Device) o;
        return Objects.equals(id, device.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Device{" +
                "id='" + id + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", apiDeviceId='" + apiDeviceId + '\'' +
                ", serialNumber='" + serialNumber + '\'' +
                ", ip='" + ip + '\'' +
                ", status=" + status +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated from an observation. Status defaults to
     * {@link DeviceStatus#DISCOVERED} and {@code lastSeenAt} to the observation time.
     */
    public static Builder fromObservation(Observation observation) {
        return new Builder()
                .serialNumber(observation.serialNumber())
                .macAddress(observation.macAddress())
                .ip(observation.ip())
                .apiDeviceId(observation.apiDeviceId())
                .sourceId(observation.sourceId())
                .model(observation.model())
                .name(observation.name())
                .firmwareVersion(observation.firmwareVersion())
                .networkConfig(observation.networkConfig())
                .status(DeviceStatus.DISCOVERED)
                .lastSeenAt(observation.observedAt());
    }

    public static Builder builder(Device device) {
        return new Builder()
                .id(device.id)
                .serialNumber(device.serialNumber)
                .macAddress(device.macAddress)
                .ip(device.ip)
                .apiDeviceId(device.apiDeviceId)
                .sourceId(device.sourceId)
                .status(device.status)
                .lastSeenAt(device.lastSeenAt)
                .lastOnlineAt(device.lastOnlineAt)
                .lastOfflineAt(device.lastOfflineAt)
                .totalOnlineDuration(device.totalOnlineDuration)
                .model(device.model)
                .name(device.name)
                .firmwareVersion(device.firmwareVersion)
                .networkConfig(device.networkConfig)
                .locationRef(device.locationRef)
                .version(device.version)
                .createdAt(device.createdAt)
                .updatedAt(device.updatedAt);
    }

    public static class Builder {
        private String id;
        private String serialNumber;
        private String macAddress;
        private String ip;
        private String apiDeviceId;
        private String sourceId;
        private DeviceStatus status;
        private Instant lastSeenAt;
        private Instant lastOnlineAt;
        private Instant lastOfflineAt;
        private Duration totalOnlineDuration;
        private String model;
        private String name;
        private String firmwareVersion;
        private NetworkConfig networkConfig;
        private String locationRef;
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public Builder macAddress(String macAddress) {
            this.macAddress = macAddress;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder apiDeviceId(String apiDeviceId) {
            this.apiDeviceId = apiDeviceId;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder status(DeviceStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Builder lastOnlineAt(Instant lastOnlineAt) {
            this.lastOnlineAt = lastOnlineAt;
            return this;
        }

        public Builder lastOfflineAt(Instant lastOfflineAt) {
            this.lastOfflineAt = lastOfflineAt;
            return this;
        }

        public Builder totalOnlineDuration(Duration totalOnlineDuration) {
            this.totalOnlineDuration = totalOnlineDuration;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder firmwareVersion(String firmwareVersion) {
            this.firmwareVersion = firmwareVersion;
            return this;
        }

        public Builder networkConfig(NetworkConfig networkConfig) {
            this.networkConfig = networkConfig;
            return this;
        }

        public Builder locationRef(String locationRef) {
            this.locationRef = locationRef;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Device build() {
            Objects.requireNonNull(ip, "ip is required");
            Objects.requireNonNull(apiDeviceId, "apiDeviceId is required");
            Objects.requireNonNull(sourceId, "sourceId is required");
            return new Device(this);
        }
    }
}
