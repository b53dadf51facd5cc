package com.questrail.flysight.api;

import java.time.Instant;
import java.util.Objects;

/**
 * TimingResult
 * -----------------------------------------------------------------------------
 * Outcome of a start-timing exchange initiated with a callback.
 */
public sealed interface TimingResult
        permits TimingResult.Recorded, TimingResult.Cancelled, TimingResult.Rejected
{
    /**
     * The device reported the start time while counting.
     */
    record Recorded(Instant startTime) implements TimingResult {
        public Recorded {
            Objects.requireNonNull(startTime, "startTime");
        }
    }

    /**
     * The exchange was cancelled before a result was accepted.
     */
    record Cancelled() implements TimingResult {
    }

    /**
     * The command could not be sent, typically because the timing control
     * characteristic is not bound.
     */
    record Rejected(String reason) implements TimingResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
