package com.questrail.flysight.internal.timing;

import com.questrail.flysight.api.TimingResult;
import com.questrail.flysight.api.TimingState;
import com.questrail.flysight.internal.exec.DeviceChannel;
import com.questrail.flysight.internal.time.WallClock;
import com.questrail.flysight.observability.FlySightObservabilitySink;
import com.questrail.flysight.observability.TimingStateChangedEvent;
import com.questrail.flysight.protocol.codec.FlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.FlySightFrameEncoder;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * TimingControlProtocol
 * =============================================================================
 * Start/cancel commands on the timing control characteristic and the
 * asynchronous start result on the timing result characteristic.
 *
 * <pre>
 *   IDLE --sendStart--> COUNTING --result--> IDLE
 *                       COUNTING --sendCancel--> IDLE
 * </pre>
 *
 * <p>Commands are written with acknowledgement and change state
 * unconditionally; a failed write is reported by the controller as an error
 * event. A result that arrives while idle is discarded.</p>
 *
 * <p>Not thread-safe: every method runs on the controller's execution context.
 * Snapshot accessors may be called from any thread.</p>
 */
public final class TimingControlProtocol
{
    private static final Logger log = LoggerFactory.getLogger(TimingControlProtocol.class);

    private final DeviceChannel channel;
    private final FlySightFrameDecoder decoder;
    private final FlySightFrameEncoder encoder;
    private final WallClock wallClock;
    private final FlySightObservabilitySink sink;

    private Consumer<TimingResult> pendingCompletion;

    private volatile TimingState state = TimingState.IDLE;
    private volatile Optional<Instant> lastResult = Optional.empty();

    public TimingControlProtocol(DeviceChannel channel,
                                 FlySightFrameDecoder decoder,
                                 FlySightFrameEncoder encoder,
                                 WallClock wallClock,
                                 FlySightObservabilitySink sink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Writes the start command and enters {@link TimingState#COUNTING}.
     *
     * @param completion resolved with the recorded start time, or as cancelled
     * @return {@code false} if the control characteristic is not bound
     */
    public boolean sendStart(Consumer<TimingResult> completion)
    {
        Objects.requireNonNull(completion, "completion");

        if (!channel.isBound(FlySightCharacteristic.START_CONTROL)) {
            log.warn("Start control characteristic not found");
            completion.accept(new TimingResult.Rejected("start control characteristic not bound"));
            return false;
        }

        channel.write(FlySightCharacteristic.START_CONTROL, encoder.startTiming(), true);

        // A previous start that never saw a result is superseded.
        resolvePending(new TimingResult.Cancelled());
        pendingCompletion = completion;
        transition(TimingState.COUNTING, false);
        return true;
    }

    /**
     * Writes the cancel command and returns to {@link TimingState#IDLE}.
     *
     * @return {@code false} if the control characteristic is not bound
     */
    public boolean sendCancel()
    {
        if (!channel.isBound(FlySightCharacteristic.START_CONTROL)) {
            log.warn("Start control characteristic not found");
            return false;
        }

        channel.write(FlySightCharacteristic.START_CONTROL, encoder.cancelTiming(), true);
        transition(TimingState.IDLE, false);
        resolvePending(new TimingResult.Cancelled());
        return true;
    }

    /**
     * Handles a value from the timing result characteristic.
     */
    public void onResult(byte[] value)
    {
        Optional<Instant> decoded = decoder.decodeTimingResult(value);
        if (decoded.isEmpty()) {
            log.debug("Discarding invalid start result ({} bytes)", value == null ? 0 : value.length);
            return;
        }
        if (state != TimingState.COUNTING) {
            log.debug("Discarding start result {} while idle", decoded.get());
            return;
        }

        lastResult = decoded;
        transition(TimingState.IDLE, true);
        resolvePending(new TimingResult.Recorded(decoded.get()));
    }

    private void transition(TimingState next, boolean resultRecorded)
    {
        TimingState previous = state;
        state = next;
        sink.onTimingStateChanged(new TimingStateChangedEvent(
                wallClock.now(),
                previous,
                next,
                lastResult,
                resultRecorded));
    }

    private void resolvePending(TimingResult result)
    {
        Consumer<TimingResult> completion = pendingCompletion;
        if (completion == null) {
            return;
        }
        pendingCompletion = null;
        completion.accept(result);
    }

    public TimingState state()
    {
        return state;
    }

    public Optional<Instant> lastResult()
    {
        return lastResult;
    }
}
