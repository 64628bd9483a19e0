package com.device.registry.registry;

import com.device.registry.core.model.Device;
import com.device.registry.lock.DistributedLock;
import com.device.registry.lock.LocalDistributedLock;
import com.device.registry.rules.IdentityNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link DeviceRegistry}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>Per-device writes are serialized with a {@link DistributedLock} keyed by device
 * reference. Index validation and the commit itself happen inside one short critical
 * section shared by all writers, so a uniqueness check can never be invalidated between
 * the check and the write.</p>
 */
public class InMemoryDeviceRegistry implements DeviceRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDeviceRegistry.class);

    private static final Comparator<Device> REGISTRATION_ORDER =
            Comparator.comparing(Device::getCreatedAt).thenComparing(Device::getId);

    private final ConcurrentMap<String, Device> rows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> serialIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> macIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> apiIdIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> ipIndex = new ConcurrentHashMap<>();
    private final Object indexMonitor = new Object();

    private final DistributedLock lock;
    private final Clock clock;

    public InMemoryDeviceRegistry() {
        this(new LocalDistributedLock(), Clock.systemUTC());
    }

    public InMemoryDeviceRegistry(Clock clock) {
        this(new LocalDistributedLock(), clock);
    }

    public InMemoryDeviceRegistry(DistributedLock lock, Clock clock) {
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public String create(Device device) {
        Objects.requireNonNull(device, "device is required");
        var now = clock.instant();
        Device stored = Device.builder(device)
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build();

        synchronized (indexMonitor) {
            if (rows.containsKey(stored.getId())) {
                throw new IllegalArgumentException("Device already exists: " + stored.getId());
            }
            validateUnique(stored, null);
            index(stored);
            rows.put(stored.getId(), stored);
        }

        log.debug("Created device {} (source={}, apiDeviceId={}, serial={}, ip={})",
                stored.getId(), stored.getSourceId(), stored.getApiDeviceId(),
                stored.getSerialNumber(), stored.getIp());
        return stored.getId();
    }

    @Override
    public Device get(String deviceRef) {
        return find(deviceRef).orElseThrow(() -> new DeviceNotFoundException(deviceRef));
    }

    @Override
    public Optional<Device> find(String deviceRef) {
        return Optional.ofNullable(rows.get(deviceRef)).map(InMemoryDeviceRegistry::copy);
    }

    @Override
    public Device update(String deviceRef, Consumer<Device> mutator) {
        return doUpdate(deviceRef, null, mutator);
    }

    @Override
    public Device update(String deviceRef, long expectedVersion, Consumer<Device> mutator) {
        return doUpdate(deviceRef, expectedVersion, mutator);
    }

    private Device doUpdate(String deviceRef, Long expectedVersion, Consumer<Device> mutator) {
        Objects.requireNonNull(mutator, "mutator is required");
        return lock.withLock(lockKey(deviceRef), () -> {
            Device current = rows.get(deviceRef);
            if (current == null) {
                throw new DeviceNotFoundException(deviceRef);
            }
            if (expectedVersion != null && current.getVersion() != expectedVersion) {
                throw new RegistryUpdateConflictException(deviceRef, expectedVersion, current.getVersion());
            }

            Device working = copy(current);
            mutator.accept(working);
            Device committed = Device.builder(working)
                    .version(current.getVersion() + 1)
                    .updatedAt(clock.instant())
                    .build();

            synchronized (indexMonitor) {
                validateUnique(committed, deviceRef);
                unindex(current);
                index(committed);
                rows.put(deviceRef, committed);
            }

            log.trace("Updated device {} to version {}", deviceRef, committed.getVersion());
            return copy(committed);
        });
    }

    @Override
    public Optional<Device> findBySerial(String serialNumber) {
        return lookup(serialIndex, IdentityNormalizer.normalizeSerial(serialNumber));
    }

    @Override
    public Optional<Device> findByMac(String macAddress) {
        return lookup(macIndex, IdentityNormalizer.normalizeMac(macAddress));
    }

    @Override
    public List<Device> findAllByIp(String ip) {
        if (ip == null) {
            return List.of();
        }
        Set<String> refs = ipIndex.getOrDefault(ip, Set.of());
        return refs.stream()
                .map(rows::get)
                .filter(Objects::nonNull)
                .sorted(REGISTRATION_ORDER)
                .map(InMemoryDeviceRegistry::copy)
                .toList();
    }

    @Override
    public Optional<Device> findByApiId(String sourceId, String apiDeviceId) {
        if (sourceId == null || apiDeviceId == null) {
            return Optional.empty();
        }
        return lookup(apiIdIndex, apiKey(sourceId, apiDeviceId));
    }

    @Override
    public List<Device> findBySource(String sourceId) {
        return rows.values().stream()
                .filter(d -> d.getSourceId().equals(sourceId))
                .sorted(REGISTRATION_ORDER)
                .map(InMemoryDeviceRegistry::copy)
                .toList();
    }

    @Override
    public List<Device> findAll() {
        return rows.values().stream()
                .sorted(REGISTRATION_ORDER)
                .map(InMemoryDeviceRegistry::copy)
                .toList();
    }

    @Override
    public int count() {
        return rows.size();
    }

    // Caller holds indexMonitor.
    private void validateUnique(Device candidate, String selfRef) {
        checkHolder(IdentityField.SERIAL_NUMBER, candidate.getSerialNumber(),
                serialIndex.get(nullSafe(candidate.getSerialNumber())), selfRef);
        checkHolder(IdentityField.MAC_ADDRESS, candidate.getMacAddress(),
                macIndex.get(nullSafe(candidate.getMacAddress())), selfRef);
        String apiKey = apiKey(candidate.getSourceId(), candidate.getApiDeviceId());
        checkHolder(IdentityField.API_DEVICE_ID, candidate.getSourceId() + "/" + candidate.getApiDeviceId(),
                apiIdIndex.get(apiKey), selfRef);
    }

    private static void checkHolder(IdentityField field, String value, String holder, String selfRef) {
        if (value != null && holder != null && !holder.equals(selfRef)) {
            throw new IdentityCollisionException(field, value, holder);
        }
    }

    // Caller holds indexMonitor.
    private void index(Device device) {
        String ref = device.getId();
        if (device.getSerialNumber() != null) {
            serialIndex.put(device.getSerialNumber(), ref);
        }
        if (device.getMacAddress() != null) {
            macIndex.put(device.getMacAddress(), ref);
        }
        apiIdIndex.put(apiKey(device.getSourceId(), device.getApiDeviceId()), ref);
        ipIndex.compute(device.getIp(), (ip, refs) -> {
            Set<String> updated = refs != null ? new LinkedHashSet<>(refs) : new LinkedHashSet<>();
            updated.add(ref);
            return Set.copyOf(updated);
        });
    }

    // Caller holds indexMonitor.
    private void unindex(Device device) {
        String ref = device.getId();
        if (device.getSerialNumber() != null) {
            serialIndex.remove(device.getSerialNumber(), ref);
        }
        if (device.getMacAddress() != null) {
            macIndex.remove(device.getMacAddress(), ref);
        }
        apiIdIndex.remove(apiKey(device.getSourceId(), device.getApiDeviceId()), ref);
        ipIndex.computeIfPresent(device.getIp(), (ip, refs) -> {
            Set<String> updated = new LinkedHashSet<>(refs);
            updated.remove(ref);
            return updated.isEmpty() ? null : Set.copyOf(updated);
        });
    }

    private Optional<Device> lookup(ConcurrentMap<String, String> index, String key) {
        if (key == null) {
            return Optional.empty();
        }
        String ref = index.get(key);
        return ref != null ? find(ref) : Optional.empty();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }

    private static String apiKey(String sourceId, String apiDeviceId) {
        return sourceId + '\u0000' + apiDeviceId;
    }

    private static String lockKey(String deviceRef) {
        return "device:" + deviceRef;
    }

    private static Device copy(Device device) {
        return Device.builder(device).build();
    }
}
