package com.questrail.flysight.observability;

import com.questrail.flysight.api.TimingState;

import java.time.Instant;
import java.util.Optional;

/**
 * Timing state transition, carrying the last recorded start result.
 *
 * @param resultRecorded {@code true} when this transition was caused by the
 *                       device reporting a start result
 */
public record TimingStateChangedEvent(
    Instant timestamp,
    TimingState oldState,
    TimingState newState,
    Optional<Instant> lastResult,
    boolean resultRecorded
) {
}
