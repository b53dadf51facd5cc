package com.questrail.flysight.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every timer in the client.
 *
 * <p>Disappearance windows and receive timeouts are elapsed-time rules, so they
 * are computed from a monotonic tick and never from wall-clock instants.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between values are meaningful.
     */
    long nowNanos();
}
