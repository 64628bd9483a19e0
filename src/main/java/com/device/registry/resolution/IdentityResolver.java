package com.device.registry.resolution;

import com.device.registry.core.model.ConflictKind;
import com.device.registry.core.model.Device;
import com.device.registry.core.model.Observation;
import com.device.registry.registry.DeviceLookup;
import com.device.registry.rules.IdentityNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies an observation against the registry using a priority-ordered key strategy:
 * serial number, MAC address, IP address, then the source-scoped API device id.
 * The first key that matches decides.
 *
 * <p>Hardware-bound identifiers always win over the IP address, so a device that gets a new
 * DHCP lease is reported as moved rather than spawning a second row. A serial or MAC match
 * from the device's own source under a new API id is still a duplicate or move; the caller
 * rebinds the id. Only a match from a different source is a cross-source collision. Collisions that
 * cannot be settled from the observation alone are returned as conflicts for human
 * review.</p>
 *
 * <p>The resolver performs no writes. It only reads through {@link DeviceLookup}.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final DeviceLookup lookup;

    public IdentityResolver(DeviceLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup is required");
    }

    /**
     * Resolves an observation to a classification.
     *
     * @param observation the observation to classify
     * @return the classification, never null
     */
    public Classification resolve(Observation observation) {
        Objects.requireNonNull(observation, "observation is required");
        Classification result = doResolve(observation);
        log.debug("Resolved observation source={} apiDeviceId={} ip={} -> {} (matchedBy={}, device={})",
                observation.sourceId(), observation.apiDeviceId(), observation.ip(),
                result.kind(), result.matchedBy(), result.existingRef());
        return result;
    }

    private Classification doResolve(Observation observation) {
        if (observation.hasSerialNumber()) {
            Optional<Device> bySerial = lookup.findBySerial(observation.serialNumber());
            if (bySerial.isPresent()) {
                return matchByHardwareKey(observation, bySerial.get(), MatchKey.SERIAL);
            }
        }

        if (observation.hasMacAddress()) {
            Optional<Device> byMac = lookup.findByMac(observation.macAddress());
            if (byMac.isPresent()) {
                return matchByHardwareKey(observation, byMac.get(), MatchKey.MAC);
            }
        }

        List<Device> byIp = lookup.findAllByIp(observation.ip());
        if (!byIp.isEmpty()) {
            return matchByIp(observation, byIp);
        }

        Optional<Device> byApiId = lookup.findByApiId(observation.sourceId(), observation.apiDeviceId());
        if (byApiId.isPresent()) {
            return matchByApiId(observation, byApiId.get());
        }

        return Classification.newDevice();
    }

    private Classification matchByHardwareKey(Observation observation, Device device, MatchKey key) {
        String keyValue = key == MatchKey.SERIAL ? observation.serialNumber() : observation.macAddress();
        if (!device.getSourceId().equals(observation.sourceId())) {
            return Classification.conflict(device, ConflictKind.CROSS_SOURCE_COLLISION, key,
                    String.format("%s %s belongs to device %s from source %s, observed from %s as %s",
                            key, keyValue, device.getId(), device.getSourceId(),
                            observation.sourceId(), observation.apiDeviceId()));
        }
        if (device.getApiDeviceId().equals(observation.apiDeviceId())) {
            return duplicateOrMoved(observation, device, key, key + " " + keyValue);
        }

        // same source re-enumerated the device; the new id may only be taken over if it is free
        Optional<Device> holder = lookup.findByApiId(observation.sourceId(), observation.apiDeviceId());
        if (holder.isPresent()) {
            Device other = holder.get();
            return Classification.conflict(device, ConflictKind.DUPLICATE_API_ID, key,
                    String.format("%s %s belongs to device %s but %s/%s is bound to device %s",
                            key, keyValue, device.getId(),
                            observation.sourceId(), observation.apiDeviceId(), other.getId()));
        }
        return duplicateOrMoved(observation, device, key,
                key + " " + keyValue + " (api id " + device.getApiDeviceId() + " -> " + observation.apiDeviceId() + ")");
    }

    private Classification matchByIp(Observation observation, List<Device> candidates) {
        for (Device candidate : candidates) {
            if (strongerIdentityDisagrees(observation, candidate)) {
                return Classification.conflict(candidate, ConflictKind.IP_CONFLICT, MatchKey.IP,
                        String.format("IP %s is held by device %s (serial=%s, mac=%s), observed serial=%s mac=%s",
                                observation.ip(), candidate.getId(),
                                candidate.getSerialNumber(), candidate.getMacAddress(),
                                observation.serialNumber(), observation.macAddress()));
            }
        }

        Optional<Device> bound = lookup.findByApiId(observation.sourceId(), observation.apiDeviceId());
        if (bound.isPresent() && candidates.stream().noneMatch(c -> c.getId().equals(bound.get().getId()))) {
            Device other = bound.get();
            return Classification.conflict(other, ConflictKind.DUPLICATE_API_ID, MatchKey.IP,
                    String.format("IP %s points at device %s but %s/%s is bound to device %s at %s",
                            observation.ip(), candidates.get(0).getId(),
                            observation.sourceId(), observation.apiDeviceId(),
                            other.getId(), other.getIp()));
        }

        Device match = bound.orElse(candidates.get(0));
        return Classification.duplicate(match, MatchKey.IP,
                "IP " + observation.ip() + " matches device " + match.getId() + " with no disagreeing identity");
    }

    private Classification matchByApiId(Observation observation, Device device) {
        if (strongerIdentityDisagrees(observation, device)) {
            return Classification.conflict(device, ConflictKind.DUPLICATE_API_ID, MatchKey.API_ID,
                    String.format("%s/%s is bound to device %s (serial=%s, mac=%s), observed serial=%s mac=%s",
                            observation.sourceId(), observation.apiDeviceId(), device.getId(),
                            device.getSerialNumber(), device.getMacAddress(),
                            observation.serialNumber(), observation.macAddress()));
        }
        return duplicateOrMoved(observation, device, MatchKey.API_ID,
                "API id " + observation.sourceId() + "/" + observation.apiDeviceId());
    }

    private static Classification duplicateOrMoved(Observation observation, Device device, MatchKey key,
                                                   String matchedOn) {
        if (!observation.ip().equals(device.getIp())) {
            return Classification.moved(device, observation.ip(), key,
                    matchedOn + " matches device " + device.getId() + ", ip changed "
                            + device.getIp() + " -> " + observation.ip());
        }
        return Classification.duplicate(device, key, matchedOn + " matches device " + device.getId());
    }

    private static boolean strongerIdentityDisagrees(Observation observation, Device device) {
        return IdentityNormalizer.disagree(observation.serialNumber(), device.getSerialNumber())
                || IdentityNormalizer.disagree(observation.macAddress(), device.getMacAddress());
    }
}
