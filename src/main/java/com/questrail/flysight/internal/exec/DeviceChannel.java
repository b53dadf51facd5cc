package com.questrail.flysight.internal.exec;

import com.questrail.flysight.protocol.model.FlySightCharacteristic;

/**
 * DeviceChannel
 * =============================================================================
 * Outbound port the three sub-protocols use to reach the connected device.
 *
 * <p>The controller implements this port on top of the transport and the
 * current characteristic bindings. Protocols never see device identifiers or
 * UUIDs; they address characteristics by role.</p>
 *
 * <p>All methods are called on the owning execution context.</p>
 */
public interface DeviceChannel
{
    /**
     * True when a device is connected and both the write channel and the
     * notify channel are bound.
     */
    boolean isReady();

    /**
     * True when a device is connected and {@code characteristic} is bound.
     */
    boolean isBound(FlySightCharacteristic characteristic);

    /**
     * Writes {@code payload}. Silently ignored when the characteristic is not
     * bound; callers check {@link #isBound} first when that matters.
     *
     * @param requireAck whether the write requests a transport-level response
     */
    void write(FlySightCharacteristic characteristic, byte[] payload, boolean requireAck);

    /**
     * Enables or disables notifications. Ignored when the characteristic is not
     * bound.
     */
    void setNotify(FlySightCharacteristic characteristic, boolean enabled);

    /**
     * True when notifications were last enabled on {@code characteristic} for
     * the current connection.
     */
    boolean isNotifying(FlySightCharacteristic characteristic);
}
