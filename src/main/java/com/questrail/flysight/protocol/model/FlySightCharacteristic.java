package com.questrail.flysight.protocol.model;

import java.util.Optional;
import java.util.UUID;

/**
 * FlySightCharacteristic
 * =============================================================================
 * The five GATT characteristics the client binds on a FlySight.
 *
 * <p>All identifiers share the vendor base {@code xxxxxxxx-8e22-4541-9d4c-21edae82ed19}
 * and differ only in their low 32 bits. The values must match the device
 * firmware exactly.</p>
 *
 * <h2>Channel roles</h2>
 * <ul>
 *   <li>{@link #CRS_RX}: write channel for directory, download, ack and
 *       cancel frames</li>
 *   <li>{@link #CRS_TX}: notify channel carrying directory entries and
 *       file data frames</li>
 *   <li>{@link #GNSS_PV}: positioning data; bound but not consumed</li>
 *   <li>{@link #START_CONTROL}: timing start/cancel commands</li>
 *   <li>{@link #START_RESULT}: timing result notifications</li>
 * </ul>
 */
public enum FlySightCharacteristic
{
    GNSS_PV(0x00000000L),
    CRS_TX(0x00000001L),
    CRS_RX(0x00000002L),
    START_CONTROL(0x00000003L),
    START_RESULT(0x00000004L);

    /**
     * Shared low 96 bits of every FlySight characteristic UUID.
     */
    private static final long BASE_MSB_LOW = 0x8e224541L;
    private static final long BASE_LSB = 0x9d4c21edae82ed19L;

    private final UUID uuid;

    FlySightCharacteristic(long shortId) {
        this.uuid = new UUID((shortId << 32) | BASE_MSB_LOW, BASE_LSB);
    }

    public UUID uuid() {
        return uuid;
    }

    /**
     * Resolves a discovered characteristic UUID to its role.
     */
    public static Optional<FlySightCharacteristic> fromUuid(UUID uuid) {
        for (FlySightCharacteristic c : values()) {
            if (c.uuid.equals(uuid)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
