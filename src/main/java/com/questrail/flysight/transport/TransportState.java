package com.questrail.flysight.transport;

/**
 * Adapter-level radio state reported by {@link GattTransportListener#onStateChanged}.
 */
public enum TransportState
{
    UNKNOWN,
    UNSUPPORTED,
    UNAUTHORIZED,
    POWERED_OFF,
    POWERED_ON
}
