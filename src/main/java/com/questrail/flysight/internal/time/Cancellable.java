package com.questrail.flysight.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled one-shot task (disappearance timers,
 * listing and transfer timeouts).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
