package com.questrail.flysight.internal.registry;

import com.questrail.flysight.api.DeviceRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * DeviceRegistry
 * =============================================================================
 * Candidate devices keyed by identifier, in first-sighting order.
 *
 * <p>At most one record exists per identifier. The bonded flag is not stored;
 * it is derived from the bond set whenever a snapshot is taken, so a record can
 * never disagree with the persisted bonds.</p>
 *
 * <p>Owned by the controller's execution context; not thread-safe.</p>
 */
public final class DeviceRegistry
{
    private final Map<String, DeviceRecord> records = new LinkedHashMap<>();
    private final Predicate<String> bonded;

    public DeviceRegistry(Predicate<String> bonded) {
        this.bonded = Objects.requireNonNull(bonded, "bonded");
    }

    public Optional<DeviceRecord> find(String deviceId) {
        return Optional.ofNullable(records.get(deviceId));
    }

    public boolean contains(String deviceId) {
        return records.containsKey(deviceId);
    }

    /**
     * Inserts or replaces the record for {@code record.id()}. Replacing keeps
     * the original insertion position.
     */
    public void put(DeviceRecord record) {
        records.put(record.id(), record);
    }

    /**
     * Applies {@code change} to the record for {@code deviceId}, if present.
     *
     * @return {@code true} if a record was updated
     */
    public boolean update(String deviceId, UnaryOperator<DeviceRecord> change) {
        DeviceRecord current = records.get(deviceId);
        if (current == null) {
            return false;
        }
        records.put(deviceId, change.apply(current));
        return true;
    }

    public Optional<DeviceRecord> remove(String deviceId) {
        return Optional.ofNullable(records.remove(deviceId));
    }

    /**
     * Immutable view of every record, bonded flags resolved.
     */
    public List<DeviceRecord> snapshot() {
        List<DeviceRecord> out = new ArrayList<>(records.size());
        for (DeviceRecord r : records.values()) {
            out.add(r.withBonded(bonded.test(r.id())));
        }
        return List.copyOf(out);
    }
}
