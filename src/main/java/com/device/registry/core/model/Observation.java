package com.device.registry.core.model;

import com.device.registry.rules.IdentityNormalizer;

import java.time.Instant;
import java.util.Objects;

/**
 * One reported snapshot of a physical device from one source, for one poll cycle.
 * Identity fields are normalized on construction so that lookups compare canonical values.
 *
 * @param serialNumber    hardware serial, null when the vendor does not report one
 * @param macAddress      normalized MAC address, null when absent or unparseable
 * @param ip              current IP address
 * @param apiDeviceId     vendor API identifier, unique only within {@code sourceId}
 * @param sourceId        the source that reported this observation
 * @param model           model code, may be null
 * @param name            display name from the vendor API, may be null
 * @param firmwareVersion firmware version, may be null
 * @param networkConfig   reported network settings, never null
 * @param observedAt      when the source saw the device
 */
public record Observation(
        String serialNumber,
        String macAddress,
        String ip,
        String apiDeviceId,
        String sourceId,
        String model,
        String name,
        String firmwareVersion,
        NetworkConfig networkConfig,
        Instant observedAt
) {
    public Observation {
        serialNumber = IdentityNormalizer.normalizeSerial(serialNumber);
        macAddress = IdentityNormalizer.normalizeMac(macAddress);
        ip = Objects.requireNonNull(IdentityNormalizer.normalizeIp(ip), "ip is required");
        Objects.requireNonNull(apiDeviceId, "apiDeviceId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        networkConfig = networkConfig != null ? networkConfig : NetworkConfig.empty();
        Objects.requireNonNull(observedAt, "observedAt is required");
    }

    public boolean hasSerialNumber() {
        return serialNumber != null;
    }

    public boolean hasMacAddress() {
        return macAddress != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String serialNumber;
        private String macAddress;
        private String ip;
        private String apiDeviceId;
        private String sourceId;
        private String model;
        private String name;
        private String firmwareVersion;
        private NetworkConfig networkConfig;
        private Instant observedAt;

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

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Observation build() {
            return new Observation(serialNumber, macAddress, ip, apiDeviceId, sourceId,
                    model, name, firmwareVersion, networkConfig, observedAt);
        }
    }
}
