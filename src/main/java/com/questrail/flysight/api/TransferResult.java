package com.questrail.flysight.api;

import java.util.Objects;

/**
 * TransferResult
 * -----------------------------------------------------------------------------
 * Outcome of a file download. Exactly one result is delivered per started
 * transfer, including transfers rejected at start.
 */
public sealed interface TransferResult
        permits TransferResult.Completed, TransferResult.Failed, TransferResult.Cancelled
{
    /**
     * The device signalled end-of-transfer; {@code data} holds every accepted
     * payload in sequence order.
     */
    record Completed(String filePath, byte[] data) implements TransferResult {
        public Completed {
            Objects.requireNonNull(filePath, "filePath");
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * The transfer was refused or aborted. {@code cause} may be {@code null}
     * when the failure was detected locally (e.g. not connected).
     */
    record Failed(String filePath, String reason, Throwable cause) implements TransferResult {
        public Failed {
            Objects.requireNonNull(filePath, "filePath");
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * The caller cancelled the transfer before it completed.
     */
    record Cancelled(String filePath) implements TransferResult {
        public Cancelled {
            Objects.requireNonNull(filePath, "filePath");
        }
    }

    String filePath();
}
