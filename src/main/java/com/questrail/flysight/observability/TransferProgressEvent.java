package com.questrail.flysight.observability;

import java.time.Instant;

/**
 * Download progress. {@code expectedBytes} is 0 when the size is unknown;
 * {@code progress} is always within {@code [0, 1]}.
 */
public record TransferProgressEvent(
    Instant timestamp,
    String filePath,
    long receivedBytes,
    long expectedBytes,
    double progress
) {
}
