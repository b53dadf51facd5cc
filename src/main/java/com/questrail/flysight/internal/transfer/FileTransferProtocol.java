package com.questrail.flysight.internal.transfer;

import com.questrail.flysight.api.TransferResult;
import com.questrail.flysight.internal.exec.DeviceChannel;
import com.questrail.flysight.internal.exec.FlySightTimingPolicy;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.MonotonicScheduler;
import com.questrail.flysight.internal.time.WallClock;
import com.questrail.flysight.observability.FlySightObservabilitySink;
import com.questrail.flysight.observability.TransferProgressEvent;
import com.questrail.flysight.protocol.codec.FlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.FlySightFrameEncoder;
import com.questrail.flysight.protocol.model.DataFrame;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * FileTransferProtocol
 * =============================================================================
 * Stop-and-wait download of one file at a time.
 *
 * <h2>Exchange</h2>
 * <ol>
 *   <li>Enable notifications on the notify channel and write the download
 *       request ({@code 0x02}, offset 0, stride 0, path).</li>
 *   <li>For each data frame whose sequence number is the expected one: keep the
 *       payload, advance the expected number (mod 256) and write
 *       {@code 0x12 seq}.</li>
 *   <li>A data frame with an empty payload ends the transfer; it is
 *       acknowledged like any other.</li>
 * </ol>
 *
 * <h2>Drop policy</h2>
 * Frames with any other sequence number are discarded without an
 * acknowledgement and without touching the session. There is no NACK and no
 * reorder buffer; the device retransmits unacknowledged frames.
 *
 * <h2>Completion</h2>
 * Every started transfer resolves its completion exactly once: completed,
 * failed (transport error, disconnection, optional receive timeout) or
 * cancelled. Notifications on the notify channel are disabled at that point.
 *
 * <p>Not thread-safe: every method runs on the controller's execution
 * context. Snapshot accessors may be called from any thread.</p>
 */
public final class FileTransferProtocol
{
    private static final Logger log = LoggerFactory.getLogger(FileTransferProtocol.class);

    private final DeviceChannel channel;
    private final FlySightFrameDecoder decoder;
    private final FlySightFrameEncoder encoder;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final FlySightTimingPolicy timingPolicy;
    private final FlySightObservabilitySink sink;

    private TransferSession session;

    private volatile boolean active;
    private volatile double progress;

    public FileTransferProtocol(DeviceChannel channel,
                                FlySightFrameDecoder decoder,
                                FlySightFrameEncoder encoder,
                                MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                WallClock wallClock,
                                FlySightTimingPolicy timingPolicy,
                                FlySightObservabilitySink sink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Starts downloading {@code filePath}.
     *
     * @param expectedSize size from the directory listing, or 0 if unknown
     * @return {@code false} if the download was refused; {@code completion}
     *         has then already received a {@link TransferResult.Failed}
     */
    public boolean start(String filePath, long expectedSize, Consumer<TransferResult> completion)
    {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(completion, "completion");

        if (session != null) {
            log.warn("Download of {} refused: {} is still in progress", filePath, session.filePath());
            completion.accept(new TransferResult.Failed(filePath, "a transfer is already in progress", null));
            return false;
        }
        if (!channel.isReady()) {
            log.warn("Download of {} refused: not connected", filePath);
            completion.accept(new TransferResult.Failed(filePath, "not connected", null));
            return false;
        }

        TransferSession s = new TransferSession(filePath, expectedSize, completion);
        session = s;
        active = true;
        progress = 0.0;
        publishProgress(s);

        log.info("Downloading {} ({} bytes expected)", filePath, s.expectedSize());
        channel.setNotify(FlySightCharacteristic.CRS_TX, true);
        channel.write(FlySightCharacteristic.CRS_RX, encoder.downloadRequest(filePath), false);
        armReceiveTimeout(s);
        return true;
    }

    /**
     * Offers a notify-channel value to the active session. Values that are not
     * data frames are ignored.
     */
    public void onNotification(byte[] value)
    {
        TransferSession s = session;
        if (s == null) {
            return;
        }

        Optional<DataFrame> decoded = decoder.decodeDataFrame(value);
        if (decoded.isEmpty()) {
            return;
        }
        DataFrame frame = decoded.get();

        if (!s.expects(frame.sequence())) {
            log.debug("Out of order packet: {} (expected {})", frame.sequence(), s.nextSequence());
            return;
        }

        if (!frame.isEndOfTransfer()) {
            s.append(frame.payload());
            progress = s.progress();
            publishProgress(s);
        }

        s.advance();
        channel.write(FlySightCharacteristic.CRS_RX, encoder.acknowledge(frame.sequence()), false);

        if (frame.isEndOfTransfer()) {
            log.info("Downloaded {} ({} bytes)", s.fileName(), s.receivedBytes());
            finish(s, new TransferResult.Completed(s.filePath(), s.data()));
        } else {
            armReceiveTimeout(s);
        }
    }

    /**
     * Tells the device to stop and resolves the active session as cancelled.
     */
    public void cancel()
    {
        channel.write(FlySightCharacteristic.CRS_RX, encoder.cancelTransfer(), false);

        TransferSession s = session;
        if (s != null) {
            log.info("Download of {} cancelled", s.filePath());
            finish(s, new TransferResult.Cancelled(s.filePath()));
        }
    }

    public void onTransportError(Throwable cause)
    {
        TransferSession s = session;
        if (s != null) {
            log.warn("Download of {} failed: {}", s.filePath(), String.valueOf(cause));
            finish(s, new TransferResult.Failed(s.filePath(), "transport error", cause));
        }
    }

    public void onDisconnected(Throwable cause)
    {
        TransferSession s = session;
        if (s != null) {
            log.warn("Download of {} failed: device disconnected", s.filePath());
            finish(s, new TransferResult.Failed(s.filePath(), "device disconnected", cause));
        }
    }

    private void armReceiveTimeout(TransferSession s)
    {
        if (!timingPolicy.transferTimeoutEnabled()) {
            return;
        }
        s.replaceReceiveTimeout(scheduler.scheduleAfter(
                timingPolicy.transferReceiveTimeout(),
                clock,
                () -> onReceiveTimeout(s)));
    }

    private void onReceiveTimeout(TransferSession s)
    {
        // Stale: the session already finished or was replaced.
        if (session != s) {
            return;
        }
        log.warn("Download of {} stalled: no data frame within {}", s.filePath(), timingPolicy.transferReceiveTimeout());
        finish(s, new TransferResult.Failed(s.filePath(),
                "no data frame within " + timingPolicy.transferReceiveTimeout(), null));
    }

    private void finish(TransferSession s, TransferResult result)
    {
        session = null;
        active = false;
        s.cancelReceiveTimeout();

        if (result instanceof TransferResult.Completed) {
            progress = 1.0;
            publishProgress(s);
        }

        channel.setNotify(FlySightCharacteristic.CRS_TX, false);
        s.completion().accept(result);
    }

    private void publishProgress(TransferSession s)
    {
        sink.onTransferProgress(new TransferProgressEvent(
                wallClock.now(),
                s.filePath(),
                s.receivedBytes(),
                s.expectedSize(),
                progress));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Last path component of a device path, used to look up its listed size.
     */
    public static String leafName(String filePath)
    {
        return TransferSession.leafName(filePath);
    }

    public boolean isActive()
    {
        return active;
    }

    /**
     * Progress of the active download, or the final value of the last one.
     */
    public double progress()
    {
        return progress;
    }
}
