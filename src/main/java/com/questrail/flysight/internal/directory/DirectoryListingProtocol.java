package com.questrail.flysight.internal.directory;

import com.questrail.flysight.api.DirectoryEntry;
import com.questrail.flysight.api.ListingResult;
import com.questrail.flysight.api.RemotePath;
import com.questrail.flysight.internal.exec.DeviceChannel;
import com.questrail.flysight.internal.exec.FlySightTimingPolicy;
import com.questrail.flysight.internal.time.Cancellable;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.MonotonicScheduler;
import com.questrail.flysight.internal.time.WallClock;
import com.questrail.flysight.observability.FlySightObservabilitySink;
import com.questrail.flysight.observability.ListingChangedEvent;
import com.questrail.flysight.protocol.codec.FlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.FlySightFrameEncoder;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * DirectoryListingProtocol
 * =============================================================================
 * Single-request, multi-response listing of one remote directory.
 *
 * <h2>Exchange</h2>
 * A request is {@code 0x05} followed by the UTF-8 wire path, written to the
 * write channel without acknowledgement. The device answers with one
 * notification per entry on the notify channel. There is no end-of-listing
 * marker.
 *
 * <h2>State</h2>
 * <ul>
 *   <li><b>awaiting</b>: a request is outstanding and no value has arrived yet.
 *       Cleared by the first inbound value (decodable or not), by a transport
 *       error, by the optional response timeout, or by disconnection.</li>
 *   <li><b>open</b>: notify-channel values are still offered to the entry
 *       decoder. Stays set after the awaiting flag clears, so late entries keep
 *       arriving, until a transfer starts or the link drops.</li>
 * </ul>
 *
 * <p>The listing is re-sorted after every insertion using
 * {@link DirectoryEntry#LISTING_ORDER}.</p>
 *
 * <p>Not thread-safe: every method runs on the controller's execution context.
 * Snapshot accessors may be called from any thread.</p>
 */
public final class DirectoryListingProtocol
{
    private static final Logger log = LoggerFactory.getLogger(DirectoryListingProtocol.class);

    private final DeviceChannel channel;
    private final FlySightFrameDecoder decoder;
    private final FlySightFrameEncoder encoder;
    private final BooleanSupplier transferActive;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final FlySightTimingPolicy timingPolicy;
    private final FlySightObservabilitySink sink;

    private final List<DirectoryEntry> entries = new ArrayList<>();
    private boolean open;
    private Consumer<ListingResult> pendingCompletion;

    // Stale guard for the response timeout.
    private long requestGeneration;
    private Cancellable responseTimeout;

    // Published snapshots
    private volatile RemotePath path = RemotePath.ROOT;
    private volatile boolean awaitingResponse;
    private volatile List<DirectoryEntry> entriesSnapshot = List.of();

    public DirectoryListingProtocol(DeviceChannel channel,
                                    FlySightFrameDecoder decoder,
                                    FlySightFrameEncoder encoder,
                                    BooleanSupplier transferActive,
                                    MonotonicClock clock,
                                    MonotonicScheduler scheduler,
                                    WallClock wallClock,
                                    FlySightTimingPolicy timingPolicy,
                                    FlySightObservabilitySink sink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.transferActive = Objects.requireNonNull(transferActive, "transferActive");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    /**
     * Appends {@code segment} to the working path and lists it.
     *
     * @return {@code false} if the request was rejected; {@code completion} has
     *         then already received a {@link ListingResult.Failed}
     */
    public boolean changeDirectory(String segment, Consumer<ListingResult> completion)
    {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(completion, "completion");

        String rejection = rejectionReason();
        if (rejection != null) {
            reject(completion, rejection);
            return false;
        }

        path = path.resolve(segment);
        issueRequest(completion);
        return true;
    }

    /**
     * Pops the last path segment and lists the parent. No-op at the root.
     */
    public boolean goUp(Consumer<ListingResult> completion)
    {
        Objects.requireNonNull(completion, "completion");

        String rejection = rejectionReason();
        if (rejection == null && path.isRoot()) {
            rejection = "already at root";
        }
        if (rejection != null) {
            reject(completion, rejection);
            return false;
        }

        path = path.parent();
        issueRequest(completion);
        return true;
    }

    /**
     * Re-lists the working path. Not subject to the awaiting guard; a completion
     * still pending from an earlier round is failed as superseded.
     */
    public boolean refresh(Consumer<ListingResult> completion)
    {
        Objects.requireNonNull(completion, "completion");

        if (!channel.isReady()) {
            reject(completion, "not connected");
            return false;
        }

        issueRequest(completion);
        return true;
    }

    private String rejectionReason()
    {
        if (awaitingResponse) {
            return "a listing request is already awaiting a response";
        }
        if (!channel.isReady()) {
            return "not connected";
        }
        if (transferActive.getAsBoolean()) {
            return "a file transfer is in progress";
        }
        return null;
    }

    private void reject(Consumer<ListingResult> completion, String reason)
    {
        log.debug("Listing request for {} rejected: {}", path, reason);
        completion.accept(new ListingResult.Failed(path, reason, null));
    }

    private void issueRequest(Consumer<ListingResult> completion)
    {
        resolvePending(new ListingResult.Failed(path, "superseded by a newer request", null));
        cancelResponseTimeout();

        entries.clear();
        open = true;
        awaitingResponse = true;
        pendingCompletion = completion;
        armResponseTimeout();
        publish();

        // A finished transfer turns notifications off.
        if (!channel.isNotifying(FlySightCharacteristic.CRS_TX)) {
            channel.setNotify(FlySightCharacteristic.CRS_TX, true);
        }

        log.debug("Getting directory {}", path);
        channel.write(FlySightCharacteristic.CRS_RX, encoder.directoryRequest(path), false);
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    /**
     * Offers a notify-channel value to the listing. Ignored while the listing is
     * closed.
     */
    public void onNotification(byte[] value)
    {
        if (!open) {
            return;
        }

        decoder.decodeDirectoryEntry(value).ifPresentOrElse(
                entry -> {
                    entries.add(entry);
                    entries.sort(DirectoryEntry.LISTING_ORDER);
                },
                () -> log.debug("Discarding {}-byte value that is not a directory entry",
                        value == null ? 0 : value.length));

        boolean responded = awaitingResponse;
        awaitingResponse = false;
        if (responded) {
            cancelResponseTimeout();
        }
        publish();
        if (responded) {
            resolvePending(new ListingResult.Responded(path, entries));
        }
    }

    /**
     * Aborts the outstanding request, if any.
     */
    public void onTransportError(Throwable cause)
    {
        if (!awaitingResponse) {
            return;
        }
        awaitingResponse = false;
        cancelResponseTimeout();
        publish();
        resolvePending(new ListingResult.Failed(path, "transport error", cause));
    }

    /**
     * Stops offering notify-channel values to the entry decoder. Called when a
     * transfer takes over the notify channel. A round still awaiting its first
     * value is failed, since no further value will reach it.
     */
    public void close()
    {
        open = false;
        if (!awaitingResponse) {
            return;
        }
        awaitingResponse = false;
        cancelResponseTimeout();
        publish();
        resolvePending(new ListingResult.Failed(path, "superseded by a file transfer", null));
    }

    /**
     * Link lost: back to the root with an empty, closed listing.
     */
    public void reset()
    {
        cancelResponseTimeout();
        RemotePath lost = path;
        entries.clear();
        open = false;
        awaitingResponse = false;
        path = RemotePath.ROOT;
        publish();
        resolvePending(new ListingResult.Failed(lost, "device disconnected", null));
    }

    // ---------------------------------------------------------------------
    // Response timeout
    // ---------------------------------------------------------------------

    private void armResponseTimeout()
    {
        long generation = ++requestGeneration;
        if (!timingPolicy.listingTimeoutEnabled()) {
            return;
        }
        responseTimeout = scheduler.scheduleAfter(
                timingPolicy.listingResponseTimeout(),
                clock,
                () -> onResponseTimeout(generation));
    }

    private void cancelResponseTimeout()
    {
        Cancellable prior = responseTimeout;
        if (prior != null) {
            prior.cancel();
            responseTimeout = null;
        }
    }

    private void onResponseTimeout(long generation)
    {
        if (generation != requestGeneration || !awaitingResponse) {
            return;
        }
        responseTimeout = null;
        awaitingResponse = false;
        log.warn("No response to listing of {} within {}", path, timingPolicy.listingResponseTimeout());
        publish();
        resolvePending(new ListingResult.Failed(path,
                "no response within " + timingPolicy.listingResponseTimeout(), null));
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Size of the entry named exactly {@code name} in the current listing.
     */
    public OptionalLong lookupSize(String name)
    {
        for (DirectoryEntry entry : entries) {
            if (entry.name().equals(name)) {
                return OptionalLong.of(entry.size());
            }
        }
        return OptionalLong.empty();
    }

    public RemotePath currentPath()
    {
        return path;
    }

    public List<DirectoryEntry> entries()
    {
        return entriesSnapshot;
    }

    public boolean isAwaitingResponse()
    {
        return awaitingResponse;
    }

    public boolean isOpen()
    {
        return open;
    }

    // ---------------------------------------------------------------------

    private void resolvePending(ListingResult result)
    {
        Consumer<ListingResult> completion = pendingCompletion;
        if (completion == null) {
            return;
        }
        pendingCompletion = null;
        completion.accept(result);
    }

    private void publish()
    {
        entriesSnapshot = List.copyOf(entries);
        sink.onListingChanged(new ListingChangedEvent(
                wallClock.now(),
                path,
                entriesSnapshot,
                awaitingResponse));
    }
}
