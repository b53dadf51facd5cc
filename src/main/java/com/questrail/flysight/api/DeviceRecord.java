package com.questrail.flysight.api;

import java.util.Objects;

/**
 * DeviceRecord
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one entry in the device registry.
 *
 * <p>Records are unique by {@link #id()} within a registry. The {@code bonded}
 * flag is derived from the bond set at the moment the snapshot is taken; it is
 * not an independent piece of state.</p>
 *
 * @param id        stable transport-level device identifier
 * @param name      display name (never {@code null})
 * @param rssi      last observed signal strength in dBm
 * @param connected whether a connection has been requested and not released
 * @param bonded    whether the identifier is in the bond set
 */
public record DeviceRecord(
        String id,
        String name,
        int rssi,
        boolean connected,
        boolean bonded
) {
    /**
     * Name used when an advertisement carries no local name.
     */
    public static final String UNNAMED = "Unnamed Device";

    public DeviceRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    public DeviceRecord withRssi(int newRssi) {
        return new DeviceRecord(id, name, newRssi, connected, bonded);
    }

    public DeviceRecord withName(String newName) {
        return new DeviceRecord(id, newName, rssi, connected, bonded);
    }

    public DeviceRecord withConnected(boolean newConnected) {
        return new DeviceRecord(id, name, rssi, newConnected, bonded);
    }

    public DeviceRecord withBonded(boolean newBonded) {
        return new DeviceRecord(id, name, rssi, connected, newBonded);
    }
}
