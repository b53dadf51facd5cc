package com.questrail.flysight.api;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * FlySightClient
 * -----------------------------------------------------------------------------
 * {@code FlySightClient} is the semantic façade for a single FlySight device
 * reached over Bluetooth Low Energy.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Maintaining the registry of candidate devices and the bond set</li>
 *   <li>Connecting to, and disconnecting from, one device at a time</li>
 *   <li>Browsing the device's file system one directory at a time</li>
 *   <li>Downloading a single file at a time</li>
 *   <li>Driving the start-timing exchange</li>
 * </ul>
 *
 * <h2>Asynchrony</h2>
 * Every command is fire-and-forget. Implementations marshal the call onto their
 * owning execution context and return immediately; results arrive later through
 * the supplied callbacks (invoked exactly once, on the owning context) and
 * through the observability sink.
 *
 * <h2>Queries</h2>
 * Query methods return immutable snapshots and may be called from any thread.
 * A snapshot reflects the state after the last fully processed event.
 */
public interface FlySightClient
{
    // ---------------------------------------------------------------------
    // Connection and bonding
    // ---------------------------------------------------------------------

    /**
     * Requests a connection. Connecting to a known device bonds it.
     */
    void connect(String deviceId);

    /**
     * Requests disconnection. Unbonded devices leave the registry immediately.
     */
    void disconnect(String deviceId);

    void bond(String deviceId);

    /**
     * Removes {@code deviceId} from the bond set. A disconnected record for the
     * device is removed from the registry at the same time.
     */
    void unbond(String deviceId);

    // ---------------------------------------------------------------------
    // Directory listing
    // ---------------------------------------------------------------------

    /**
     * Descends into {@code segment} and lists it. Ignored while a listing
     * request is still awaiting its first response.
     */
    default void changeDirectory(String segment) {
        changeDirectory(segment, result -> {});
    }

    void changeDirectory(String segment, Consumer<ListingResult> completion);

    /**
     * Moves to the parent directory and lists it. No-op at the root.
     */
    default void goUp() {
        goUp(result -> {});
    }

    void goUp(Consumer<ListingResult> completion);

    // ---------------------------------------------------------------------
    // File transfer
    // ---------------------------------------------------------------------

    /**
     * Downloads {@code filePath} (absolute device path). A second download
     * while one is active is rejected with {@link TransferResult.Failed}.
     */
    void downloadFile(String filePath, Consumer<TransferResult> completion);

    /**
     * Tells the device to stop sending and resolves the active download, if
     * any, with {@link TransferResult.Cancelled}.
     */
    void cancelDownload();

    // ---------------------------------------------------------------------
    // Start timing
    // ---------------------------------------------------------------------

    default void startTiming() {
        startTiming(result -> {});
    }

    void startTiming(Consumer<TimingResult> completion);

    void cancelTiming();

    // ---------------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------------

    /**
     * Registry snapshot in insertion order.
     */
    List<DeviceRecord> devices();

    /**
     * Registry snapshot, strongest signal first.
     */
    List<DeviceRecord> devicesBySignalStrength();

    Optional<String> connectedDevice();

    RemotePath currentPath();

    List<DirectoryEntry> directoryEntries();

    boolean isAwaitingResponse();

    /**
     * Progress of the active (or last) download in {@code [0, 1]}.
     */
    double downloadProgress();

    TimingState timingState();

    Optional<Instant> lastStartResult();
}
