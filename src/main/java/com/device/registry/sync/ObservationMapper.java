package com.device.registry.sync;

import com.device.registry.core.model.NetworkConfig;
import com.device.registry.core.model.Observation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps vendor JSON device lists to observations.
 *
 * <p>Accepts a top-level array, or an object wrapping the array in {@code devices},
 * {@code items} or {@code data}. Each field is looked up under the aliases the vendor APIs
 * use, first on the device object and then in its {@code properties} object. Entries
 * without an IP or device id are skipped.</p>
 */
public class ObservationMapper {
    private static final Logger log = LoggerFactory.getLogger(ObservationMapper.class);

    private static final String[] WRAPPERS = {"devices", "items", "data"};
    private static final String[] SERIAL = {"serialNumber", "serial_number", "serial"};
    private static final String[] MAC = {"macAddress", "mac_address", "mac"};
    private static final String[] IP = {"ipAddress", "ip_address", "ip", "ipv4"};
    private static final String[] API_ID = {"id", "deviceId", "device_id", "apiDeviceId", "api_device_id"};
    private static final String[] MODEL = {"model", "modelName", "model_name"};
    private static final String[] NAME = {"name", "deviceName", "device_name"};
    private static final String[] FIRMWARE = {"firmwareVersion", "firmware_version", "firmware"};
    private static final String[] SUBNET = {"subnetMask", "subnet_mask", "subnet"};
    private static final String[] GATEWAY = {"gateway", "defaultGateway"};
    private static final String[] MODE = {"networkMode", "network_mode", "ipMode"};
    private static final String[] INTERFACE = {"interfaceId", "interface_id", "interface"};

    private final ObjectMapper objectMapper;

    public ObservationMapper() {
        this(new ObjectMapper());
    }

    public ObservationMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a raw payload.
     *
     * @throws AdapterFetchException if the payload is not valid JSON or has no device list
     */
    public List<Observation> map(String sourceId, String payload, Instant observedAt) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new AdapterFetchException(sourceId, "Malformed payload from " + sourceId + ": "
                    + e.getOriginalMessage(), e);
        }

        JsonNode devices = deviceArray(root);
        if (devices == null) {
            throw new AdapterFetchException(sourceId, "Payload from " + sourceId + " contains no device list");
        }

        List<Observation> observations = new ArrayList<>(devices.size());
        int skipped = 0;
        for (JsonNode node : devices) {
            Observation observation = toObservation(sourceId, node, observedAt);
            if (observation == null) {
                skipped++;
            } else {
                observations.add(observation);
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} device entries without ip or id from source {}", skipped, sourceId);
        }
        return observations;
    }

    private static JsonNode deviceArray(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String wrapper : WRAPPERS) {
                JsonNode candidate = root.get(wrapper);
                if (candidate != null && candidate.isArray()) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static Observation toObservation(String sourceId, JsonNode node, Instant observedAt) {
        if (!node.isObject()) {
            return null;
        }
        String ip = text(node, IP);
        String apiId = text(node, API_ID);
        if (ip == null || apiId == null) {
            return null;
        }
        return Observation.builder()
                .sourceId(sourceId)
                .apiDeviceId(apiId)
                .ip(ip)
                .serialNumber(text(node, SERIAL))
                .macAddress(text(node, MAC))
                .model(text(node, MODEL))
                .name(text(node, NAME))
                .firmwareVersion(text(node, FIRMWARE))
                .networkConfig(new NetworkConfig(
                        text(node, SUBNET), text(node, GATEWAY), text(node, MODE), text(node, INTERFACE)))
                .observedAt(observedAt)
                .build();
    }

    private static String text(JsonNode node, String[] aliases) {
        String value = firstText(node, aliases);
        if (value == null) {
            JsonNode properties = node.get("properties");
            if (properties != null && properties.isObject()) {
                value = firstText(properties, aliases);
            }
        }
        return value;
    }

    private static String firstText(JsonNode node, String[] aliases) {
        for (String alias : aliases) {
            JsonNode value = node.get(alias);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
