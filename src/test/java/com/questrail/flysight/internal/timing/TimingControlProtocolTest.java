package com.questrail.flysight.internal.timing;

import com.questrail.flysight.api.TimingResult;
import com.questrail.flysight.api.TimingState;
import com.questrail.flysight.internal.exec.RecordingDeviceChannel;
import com.questrail.flysight.observability.RecordingObservabilitySink;
import com.questrail.flysight.observability.TimingStateChangedEvent;
import com.questrail.flysight.protocol.codec.impl.DefaultFlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.impl.DefaultFlySightFrameEncoder;
import com.questrail.flysight.protocol.codec.impl.FlySightTestFrames;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimingControlProtocolTest {

    private static final Instant START = Instant.parse("2024-06-01T10:20:30.456Z");

    private final RecordingDeviceChannel channel = new RecordingDeviceChannel();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<TimingResult> results = new ArrayList<>();

    private TimingControlProtocol protocol;

    @BeforeEach
    void setUp() {
        protocol = new TimingControlProtocol(
                channel,
                new DefaultFlySightFrameDecoder(),
                new DefaultFlySightFrameEncoder(),
                () -> Instant.EPOCH,
                sink);
    }

    private static byte[] startResult() {
        return FlySightTestFrames.timingResult(2024, 6, 1, 10, 20, 30, 456);
    }

    @Test
    void startWritesCommandWithAckAndEntersCounting() {
        assertTrue(protocol.sendStart(results::add));

        RecordingDeviceChannel.Write write = channel.writes().get(0);
        assertEquals(FlySightCharacteristic.START_CONTROL, write.characteristic());
        assertArrayEquals(new byte[] { 0x00 }, write.payload());
        assertTrue(write.requireAck());
        assertEquals(TimingState.COUNTING, protocol.state());
        assertTrue(results.isEmpty());
    }

    @Test
    void resultWhileCountingIsRecorded() {
        protocol.sendStart(results::add);

        protocol.onResult(startResult());

        assertEquals(TimingState.IDLE, protocol.state());
        assertEquals(Optional.of(START), protocol.lastResult());
        assertEquals(List.of(new TimingResult.Recorded(START)), results);

        TimingStateChangedEvent last = sink.eventsOfType(TimingStateChangedEvent.class).get(1);
        assertEquals(TimingState.COUNTING, last.oldState());
        assertEquals(TimingState.IDLE, last.newState());
        assertTrue(last.resultRecorded());
        assertEquals(Optional.of(START), last.lastResult());
    }

    @Test
    void resultWhileIdleIsDiscarded() {
        protocol.onResult(startResult());

        assertEquals(TimingState.IDLE, protocol.state());
        assertEquals(Optional.empty(), protocol.lastResult());
        assertFalse(sink.hasEventOfType(TimingStateChangedEvent.class));
    }

    @Test
    void invalidResultIsDiscardedWhileCounting() {
        protocol.sendStart(results::add);

        protocol.onResult(new byte[] { 1, 2, 3 });
        protocol.onResult(FlySightTestFrames.timingResult(2024, 13, 1, 0, 0, 0, 0));

        assertEquals(TimingState.COUNTING, protocol.state());
        assertTrue(results.isEmpty());

        protocol.onResult(startResult());
        assertEquals(TimingState.IDLE, protocol.state());
    }

    @Test
    void cancelWritesCommandAndResolvesCancelled() {
        protocol.sendStart(results::add);
        channel.clear();

        assertTrue(protocol.sendCancel());

        assertArrayEquals(new byte[] { 0x01 }, channel.writesTo(FlySightCharacteristic.START_CONTROL).get(0));
        assertTrue(channel.writes().get(0).requireAck());
        assertEquals(TimingState.IDLE, protocol.state());
        assertEquals(List.of(new TimingResult.Cancelled()), results);

        TimingStateChangedEvent last = sink.eventsOfType(TimingStateChangedEvent.class).get(1);
        assertFalse(last.resultRecorded());
    }

    @Test
    void resultAfterCancelIsDiscarded() {
        protocol.sendStart(results::add);
        protocol.sendCancel();

        protocol.onResult(startResult());

        assertEquals(Optional.empty(), protocol.lastResult());
        assertEquals(1, results.size());
    }

    @Test
    void secondStartSupersedesPendingCallback() {
        List<TimingResult> second = new ArrayList<>();
        protocol.sendStart(results::add);

        protocol.sendStart(second::add);
        protocol.onResult(startResult());

        assertEquals(List.of(new TimingResult.Cancelled()), results);
        assertEquals(List.of(new TimingResult.Recorded(START)), second);
    }

    @Test
    void startWithoutControlCharacteristicIsRejected() {
        channel.unbind(FlySightCharacteristic.START_CONTROL);

        assertFalse(protocol.sendStart(results::add));

        assertInstanceOf(TimingResult.Rejected.class, results.get(0));
        assertTrue(channel.writes().isEmpty());
        assertEquals(TimingState.IDLE, protocol.state());
    }

    @Test
    void cancelWithoutControlCharacteristicIsRefused() {
        channel.unbind(FlySightCharacteristic.START_CONTROL);

        assertFalse(protocol.sendCancel());
        assertTrue(channel.writes().isEmpty());
    }
}
