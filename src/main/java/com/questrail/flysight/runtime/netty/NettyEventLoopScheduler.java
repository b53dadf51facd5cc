package com.questrail.flysight.runtime.netty;

import com.questrail.flysight.internal.time.Cancellable;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.MonotonicScheduler;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventLoopScheduler
 * =============================================================================
 * Execution context and {@link MonotonicScheduler} on a single Netty
 * {@link EventLoop}.
 *
 * <p>An event loop runs submitted and scheduled tasks on one thread, in order,
 * which is exactly the serial context the controller requires: commands,
 * transport callbacks and timer expiries never overlap.</p>
 *
 * <p>Deadlines are converted to relative delays against the supplied
 * {@link MonotonicClock}, which must be the one callers compute deadlines
 * with. This class does not own the event loop; callers shut it down.</p>
 *
 * <p>Netty types do not leave this package.</p>
 */
public final class NettyEventLoopScheduler implements MonotonicScheduler, Executor
{
    private final EventLoop eventLoop;
    private final MonotonicClock clock;

    public NettyEventLoopScheduler(EventLoop eventLoop, MonotonicClock clock)
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void execute(Runnable task)
    {
        eventLoop.execute(Objects.requireNonNull(task, "task"));
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        // Past deadlines run as soon as possible.
        long delayNanos = Math.max(0L, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = eventLoop.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    /**
     * True when called from the event loop thread.
     */
    public boolean inContext()
    {
        return eventLoop.inEventLoop();
    }
}
