package com.questrail.flysight.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the FlySight client.
 */
public record FlySightErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
