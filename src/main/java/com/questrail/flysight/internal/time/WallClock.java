package com.questrail.flysight.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps only. Never used to decide
 * when a timer fires.
 */
public interface WallClock
{
    Instant now();
}
