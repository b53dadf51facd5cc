package com.questrail.flysight.observability;

import java.time.Instant;

/**
 * Connection lifecycle milestone for one device.
 *
 * @param cause transport-reported error, or {@code null}
 */
public record FlySightTransportEvent(
    Instant timestamp,
    String deviceId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        SCAN_STARTED,
        CONNECT_REQUESTED,
        CONNECTED,
        CHANNELS_BOUND,
        DISCONNECT_REQUESTED,
        DISCONNECTED
    }
}
