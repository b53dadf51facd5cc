package com.questrail.flysight.internal.registry;

import com.questrail.flysight.internal.time.Cancellable;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DisappearanceTimers
 * -----------------------------------------------------------------------------
 * One restartable timer per device identifier.
 *
 * <p>Arming a timer replaces any timer already running for the same device. A
 * timer that was replaced or cancelled after its task had already been queued
 * does not fire its expiry action.</p>
 *
 * <p>Owned by the controller's execution context; the scheduler must run tasks
 * on that same context.</p>
 */
public final class DisappearanceTimers
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration delay;

    private final Map<String, Timer> timers = new HashMap<>();

    public DisappearanceTimers(MonotonicScheduler scheduler, MonotonicClock clock, Duration delay) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    public void arm(String deviceId, Runnable onExpiry) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(onExpiry, "onExpiry");

        cancel(deviceId);
        Timer timer = new Timer(deviceId, onExpiry);
        timers.put(deviceId, timer);
        timer.handle = scheduler.scheduleAfter(delay, clock, timer);
    }

    public void cancel(String deviceId) {
        Timer timer = timers.remove(deviceId);
        if (timer != null && timer.handle != null) {
            timer.handle.cancel();
        }
    }

    private final class Timer implements Runnable
    {
        private final String deviceId;
        private final Runnable onExpiry;
        private Cancellable handle;

        private Timer(String deviceId, Runnable onExpiry) {
            this.deviceId = deviceId;
            this.onExpiry = onExpiry;
        }

        @Override
        public void run() {
            // Stale: replaced or cancelled after being queued.
            if (timers.get(deviceId) != this) {
                return;
            }
            timers.remove(deviceId);
            onExpiry.run();
        }
    }
}
