package com.questrail.flysight.protocol;

import com.questrail.flysight.api.DeviceRecord;
import com.questrail.flysight.api.DirectoryEntry;
import com.questrail.flysight.api.FlySightClient;
import com.questrail.flysight.api.ListingResult;
import com.questrail.flysight.api.RemotePath;
import com.questrail.flysight.api.TimingResult;
import com.questrail.flysight.api.TimingState;
import com.questrail.flysight.api.TransferResult;
import com.questrail.flysight.bond.BondStore;
import com.questrail.flysight.config.FlySightRuntimeConfig;
import com.questrail.flysight.internal.directory.DirectoryListingProtocol;
import com.questrail.flysight.internal.exec.DeviceChannel;
import com.questrail.flysight.internal.registry.BondSet;
import com.questrail.flysight.internal.registry.DeviceRegistry;
import com.questrail.flysight.internal.registry.DisappearanceTimers;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.MonotonicScheduler;
import com.questrail.flysight.internal.time.WallClock;
import com.questrail.flysight.internal.timing.TimingControlProtocol;
import com.questrail.flysight.internal.transfer.FileTransferProtocol;
import com.questrail.flysight.observability.FlySightErrorEvent;
import com.questrail.flysight.observability.FlySightObservabilitySink;
import com.questrail.flysight.observability.FlySightTransportEvent;
import com.questrail.flysight.observability.RegistryChangedEvent;
import com.questrail.flysight.protocol.codec.FlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.FlySightFrameEncoder;
import com.questrail.flysight.protocol.codec.impl.DefaultFlySightFrameDecoder;
import com.questrail.flysight.protocol.codec.impl.DefaultFlySightFrameEncoder;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import com.questrail.flysight.transport.AdvertisementData;
import com.questrail.flysight.transport.GattTransport;
import com.questrail.flysight.transport.GattTransportListener;
import com.questrail.flysight.transport.TransportState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * FlySightController
 * =============================================================================
 * Connection and discovery controller, and the single owner of client state.
 *
 * <h2>Execution model</h2>
 * Every transport callback and every {@link FlySightClient} command is
 * marshaled onto one serial {@link Executor} (the <em>context</em>) before any
 * state is touched. The scheduler passed in must run its tasks on the same
 * context. Exceptions escaping a task are caught at the context boundary,
 * logged and published as {@link FlySightErrorEvent}s.
 *
 * <h2>Discovery policy</h2>
 * An advertisement qualifies if the device is bonded or if its manufacturer
 * data carries the configured company identifier. Unbonded, disconnected
 * records are pruned when they are not re-sighted within the disappearance
 * delay. Bonded records are never pruned by the timer.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>notify channel: directory listing (while open), then the active
 *       transfer</li>
 *   <li>timing result channel: timing control protocol</li>
 * </ul>
 *
 * <p>Once both the write channel and the notify channel are bound, the root
 * directory is listed, once per connection.</p>
 */
public final class FlySightController implements FlySightClient
{
    private static final Logger log = LoggerFactory.getLogger(FlySightController.class);

    private static final Comparator<DeviceRecord> STRONGEST_FIRST =
            Comparator.comparingInt(DeviceRecord::rssi).reversed();

    private final GattTransport transport;
    private final Executor context;
    private final WallClock wallClock;
    private final FlySightRuntimeConfig config;
    private final FlySightObservabilitySink sink;

    private final BondSet bonds;
    private final DeviceRegistry registry;
    private final DisappearanceTimers timers;

    private final SessionChannel channel = new SessionChannel();
    private final DirectoryListingProtocol directory;
    private final FileTransferProtocol transfer;
    private final TimingControlProtocol timing;

    private final GattTransportListener transportListener = new TransportCallbacks();

    // Session state (context only)
    private final Set<FlySightCharacteristic> bound = EnumSet.noneOf(FlySightCharacteristic.class);
    private final Set<FlySightCharacteristic> notifying = EnumSet.noneOf(FlySightCharacteristic.class);
    private boolean rootListingIssued;

    // Published snapshots
    private volatile String sessionDeviceId;
    private volatile List<DeviceRecord> devicesSnapshot = List.of();

    public FlySightController(GattTransport transport,
                              BondStore bondStore,
                              Executor context,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              WallClock wallClock,
                              FlySightRuntimeConfig config,
                              FlySightObservabilitySink sink)
    {
        this(transport, bondStore, context, clock, scheduler, wallClock, config, sink,
                new DefaultFlySightFrameDecoder(), new DefaultFlySightFrameEncoder());
    }

    public FlySightController(GattTransport transport,
                              BondStore bondStore,
                              Executor context,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              WallClock wallClock,
                              FlySightRuntimeConfig config,
                              FlySightObservabilitySink sink,
                              FlySightFrameDecoder decoder,
                              FlySightFrameEncoder encoder)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.context = Objects.requireNonNull(context, "context");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(bondStore, "bondStore");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");

        this.bonds = new BondSet(bondStore);
        this.registry = new DeviceRegistry(bonds::contains);
        this.timers = new DisappearanceTimers(scheduler, clock, config.timingPolicy().disappearanceDelay());

        this.transfer = new FileTransferProtocol(
                channel, decoder, encoder, clock, scheduler, wallClock, config.timingPolicy(), sink);
        this.directory = new DirectoryListingProtocol(
                channel, decoder, encoder, transfer::isActive, clock, scheduler, wallClock, config.timingPolicy(), sink);
        this.timing = new TimingControlProtocol(channel, decoder, encoder, wallClock, sink);
    }

    /**
     * Listener to register with the transport. Each callback only enqueues work
     * on the context and returns.
     */
    public GattTransportListener transportListener()
    {
        return transportListener;
    }

    // =====================================================================
    // FlySightClient commands
    // =====================================================================

    @Override
    public void connect(String deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        submit("connect", () -> handleConnect(deviceId));
    }

    @Override
    public void disconnect(String deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        submit("disconnect", () -> handleDisconnect(deviceId));
    }

    @Override
    public void bond(String deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        submit("bond", () -> {
            if (bonds.add(deviceId)) {
                log.info("Bonded {}", deviceId);
                timers.cancel(deviceId);
                publishRegistry();
            }
        });
    }

    @Override
    public void unbond(String deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        submit("unbond", () -> handleUnbond(deviceId));
    }

    @Override
    public void changeDirectory(String segment, Consumer<ListingResult> completion)
    {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(completion, "completion");
        submit("changeDirectory", () -> directory.changeDirectory(segment, completion));
    }

    @Override
    public void goUp(Consumer<ListingResult> completion)
    {
        Objects.requireNonNull(completion, "completion");
        submit("goUp", () -> directory.goUp(completion));
    }

    @Override
    public void downloadFile(String filePath, Consumer<TransferResult> completion)
    {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(completion, "completion");
        submit("downloadFile", () -> {
            long expected = directory.lookupSize(FileTransferProtocol.leafName(filePath)).orElse(0L);
            if (transfer.start(filePath, expected, completion)) {
                directory.close();
            }
        });
    }

    @Override
    public void cancelDownload()
    {
        submit("cancelDownload", transfer::cancel);
    }

    @Override
    public void startTiming(Consumer<TimingResult> completion)
    {
        Objects.requireNonNull(completion, "completion");
        submit("startTiming", () -> timing.sendStart(completion));
    }

    @Override
    public void cancelTiming()
    {
        submit("cancelTiming", timing::sendCancel);
    }

    // =====================================================================
    // FlySightClient snapshots
    // =====================================================================

    @Override
    public List<DeviceRecord> devices()
    {
        return devicesSnapshot;
    }

    @Override
    public List<DeviceRecord> devicesBySignalStrength()
    {
        List<DeviceRecord> sorted = new ArrayList<>(devicesSnapshot);
        sorted.sort(STRONGEST_FIRST);
        return List.copyOf(sorted);
    }

    @Override
    public Optional<String> connectedDevice()
    {
        return Optional.ofNullable(sessionDeviceId);
    }

    @Override
    public RemotePath currentPath()
    {
        return directory.currentPath();
    }

    @Override
    public List<DirectoryEntry> directoryEntries()
    {
        return directory.entries();
    }

    @Override
    public boolean isAwaitingResponse()
    {
        return directory.isAwaitingResponse();
    }

    @Override
    public double downloadProgress()
    {
        return transfer.progress();
    }

    @Override
    public TimingState timingState()
    {
        return timing.state();
    }

    @Override
    public Optional<Instant> lastStartResult()
    {
        return timing.lastResult();
    }

    // =====================================================================
    // Command handlers (context)
    // =====================================================================

    private void handleConnect(String deviceId)
    {
        String current = sessionDeviceId;
        if (current != null && !current.equals(deviceId)) {
            log.warn("Ignoring connect to {}: already connected to {}", deviceId, current);
            return;
        }

        log.info("Connecting to {}", deviceId);
        transport.connect(deviceId);
        publishTransportEvent(deviceId, FlySightTransportEvent.Kind.CONNECT_REQUESTED, null);

        if (!registry.contains(deviceId)) {
            return;
        }
        // A bond store failure must leave the record untouched.
        bonds.add(deviceId);
        registry.update(deviceId, r -> r.withConnected(true));
        timers.cancel(deviceId);
        publishRegistry();
    }

    private void handleDisconnect(String deviceId)
    {
        log.info("Disconnecting from {}", deviceId);
        transport.cancelConnection(deviceId);
        publishTransportEvent(deviceId, FlySightTransportEvent.Kind.DISCONNECT_REQUESTED, null);

        if (!registry.contains(deviceId)) {
            return;
        }
        if (bonds.contains(deviceId)) {
            registry.update(deviceId, r -> r.withConnected(false));
            armDisappearanceTimer(deviceId);
        } else {
            registry.remove(deviceId);
            timers.cancel(deviceId);
        }
        publishRegistry();
    }

    private void handleUnbond(String deviceId)
    {
        if (!bonds.remove(deviceId)) {
            return;
        }
        log.info("Unbonded {}", deviceId);

        registry.find(deviceId)
                .filter(r -> !r.connected())
                .ifPresent(r -> {
                    registry.remove(deviceId);
                    timers.cancel(deviceId);
                });
        publishRegistry();
    }

    // =====================================================================
    // Transport handlers (context)
    // =====================================================================

    private void handleStateChanged(TransportState state)
    {
        if (state != TransportState.POWERED_ON) {
            log.info("Bluetooth is not available ({})", state);
            return;
        }

        log.info("Bluetooth powered on; scanning");
        transport.scan(Set.of(), true);
        publishTransportEvent(null, FlySightTransportEvent.Kind.SCAN_STARTED, null);
    }

    private void handleDeviceDiscovered(String deviceId, String name, AdvertisementData advertisement, int rssi)
    {
        boolean bonded = bonds.contains(deviceId);
        if (!bonded && !carriesVendorId(advertisement)) {
            return;
        }

        Optional<DeviceRecord> existing = registry.find(deviceId);
        if (existing.isPresent()) {
            DeviceRecord updated = existing.get().withRssi(rssi);
            if (name != null && !name.isEmpty()) {
                updated = updated.withName(name);
            }
            registry.put(updated);
        } else {
            String displayName = (name == null || name.isEmpty()) ? DeviceRecord.UNNAMED : name;
            log.debug("Discovered {} ({}) at {} dBm", displayName, deviceId, rssi);
            registry.put(new DeviceRecord(deviceId, displayName, rssi, false, bonded));
        }

        armDisappearanceTimer(deviceId);
        publishRegistry();
    }

    private boolean carriesVendorId(AdvertisementData advertisement)
    {
        if (advertisement == null) {
            return false;
        }
        OptionalInt companyId = advertisement.companyId();
        return companyId.isPresent() && companyId.getAsInt() == config.manufacturerId();
    }

    private void handleConnected(String deviceId)
    {
        log.info("Connected to {}", deviceId);

        sessionDeviceId = deviceId;
        bound.clear();
        notifying.clear();
        rootListingIssued = false;

        if (!registry.update(deviceId, r -> r.withConnected(true))) {
            registry.put(new DeviceRecord(deviceId, DeviceRecord.UNNAMED, 0, true, bonds.contains(deviceId)));
        }
        timers.cancel(deviceId);
        publishRegistry();
        publishTransportEvent(deviceId, FlySightTransportEvent.Kind.CONNECTED, null);

        transport.discoverServices(deviceId);
    }

    private void handleDisconnected(String deviceId, Throwable error)
    {
        if (error != null) {
            log.warn("Disconnected from {}: {}", deviceId, error.toString());
        } else {
            log.info("Disconnected from {}", deviceId);
        }

        if (deviceId.equals(sessionDeviceId)) {
            sessionDeviceId = null;
            bound.clear();
            notifying.clear();
            rootListingIssued = false;

            transfer.onDisconnected(error);
            directory.reset();
        }

        if (registry.update(deviceId, r -> r.withConnected(false))) {
            armDisappearanceTimer(deviceId);
            publishRegistry();
        }
        publishTransportEvent(deviceId, FlySightTransportEvent.Kind.DISCONNECTED, error);
    }

    private void handleServicesDiscovered(String deviceId, List<UUID> services, Throwable error)
    {
        if (error != null) {
            reportError("Service discovery failed for " + deviceId, error);
            return;
        }
        if (!deviceId.equals(sessionDeviceId)) {
            return;
        }
        for (UUID service : services) {
            transport.discoverCharacteristics(deviceId, service);
        }
    }

    private void handleCharacteristicsDiscovered(String deviceId, UUID service, List<UUID> characteristics, Throwable error)
    {
        if (error != null) {
            reportError("Characteristic discovery failed for " + deviceId + " service " + service, error);
            return;
        }
        if (!deviceId.equals(sessionDeviceId)) {
            return;
        }

        for (UUID uuid : characteristics) {
            FlySightCharacteristic.fromUuid(uuid).ifPresent(this::bind);
        }

        if (!rootListingIssued
                && bound.contains(FlySightCharacteristic.CRS_RX)
                && bound.contains(FlySightCharacteristic.CRS_TX)) {
            rootListingIssued = true;
            publishTransportEvent(deviceId, FlySightTransportEvent.Kind.CHANNELS_BOUND, null);
            directory.refresh(result -> {});
        }
    }

    private void bind(FlySightCharacteristic characteristic)
    {
        if (!bound.add(characteristic)) {
            return;
        }
        log.debug("Bound {} on {}", characteristic, sessionDeviceId);

        switch (characteristic) {
            case CRS_TX, START_RESULT -> channel.setNotify(characteristic, true);
            case CRS_RX -> transport.read(sessionDeviceId, characteristic.uuid());
            default -> { }
        }
    }

    private void handleValueUpdated(String deviceId, UUID uuid, byte[] data, Throwable error)
    {
        if (!deviceId.equals(sessionDeviceId)) {
            return;
        }
        Optional<FlySightCharacteristic> role = FlySightCharacteristic.fromUuid(uuid);
        if (role.isEmpty()) {
            return;
        }
        FlySightCharacteristic characteristic = role.get();

        if (error != null || data == null) {
            Throwable cause = error != null ? error : new IllegalStateException("no value");
            reportError("Error reading " + characteristic, cause);
            directory.onTransportError(cause);
            if (characteristic == FlySightCharacteristic.CRS_TX) {
                transfer.onTransportError(cause);
            }
            return;
        }

        switch (characteristic) {
            case CRS_TX -> {
                directory.onNotification(data);
                transfer.onNotification(data);
            }
            case START_RESULT -> timing.onResult(data);
            default -> log.trace("Ignoring {}-byte value from {}", data.length, characteristic);
        }
    }

    private void handleValueWritten(String deviceId, UUID uuid, Throwable error)
    {
        if (error == null || !deviceId.equals(sessionDeviceId)) {
            return;
        }
        Optional<FlySightCharacteristic> role = FlySightCharacteristic.fromUuid(uuid);
        if (role.isEmpty()) {
            return;
        }

        switch (role.get()) {
            case CRS_RX -> {
                reportError("Write to " + FlySightCharacteristic.CRS_RX + " failed", error);
                directory.onTransportError(error);
                transfer.onTransportError(error);
            }
            case START_CONTROL -> reportError("Write to " + FlySightCharacteristic.START_CONTROL + " failed", error);
            default -> log.debug("Write to {} failed: {}", role.get(), error.toString());
        }
    }

    // =====================================================================
    // Registry helpers
    // =====================================================================

    private void armDisappearanceTimer(String deviceId)
    {
        if (bonds.contains(deviceId)) {
            return;
        }
        timers.arm(deviceId, () -> onDisappearanceTimeout(deviceId));
    }

    private void onDisappearanceTimeout(String deviceId)
    {
        Optional<DeviceRecord> current = registry.find(deviceId);
        if (current.isEmpty() || current.get().connected() || bonds.contains(deviceId)) {
            return;
        }
        log.debug("{} ({}) disappeared", current.get().name(), deviceId);
        registry.remove(deviceId);
        publishRegistry();
    }

    private void publishRegistry()
    {
        devicesSnapshot = registry.snapshot();
        sink.onRegistryChanged(new RegistryChangedEvent(wallClock.now(), devicesSnapshot));
    }

    private void publishTransportEvent(String deviceId, FlySightTransportEvent.Kind kind, Throwable cause)
    {
        sink.onTransportEvent(new FlySightTransportEvent(wallClock.now(), deviceId, kind, cause));
    }

    private void reportError(String message, Throwable cause)
    {
        log.warn("{}: {}", message, String.valueOf(cause));
        sink.onError(new FlySightErrorEvent(wallClock.now(), message, cause));
    }

    // =====================================================================
    // Context boundary
    // =====================================================================

    private void submit(String what, Runnable task)
    {
        try {
            context.execute(() -> runGuarded(what, task));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping {}: execution context is shut down", what);
        }
    }

    private void runGuarded(String what, Runnable task)
    {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Error while handling {}", what, e);
            sink.onError(new FlySightErrorEvent(wallClock.now(), "Error while handling " + what, e));
        }
    }

    /**
     * {@link DeviceChannel} over the session device and its current bindings.
     */
    private final class SessionChannel implements DeviceChannel
    {
        @Override
        public boolean isReady()
        {
            return sessionDeviceId != null
                    && bound.contains(FlySightCharacteristic.CRS_RX)
                    && bound.contains(FlySightCharacteristic.CRS_TX);
        }

        @Override
        public boolean isBound(FlySightCharacteristic characteristic)
        {
            return sessionDeviceId != null && bound.contains(characteristic);
        }

        @Override
        public void write(FlySightCharacteristic characteristic, byte[] payload, boolean requireAck)
        {
            if (!isBound(characteristic)) {
                log.debug("Dropping write to unbound {}", characteristic);
                return;
            }
            transport.write(sessionDeviceId, characteristic.uuid(), payload, requireAck);
        }

        @Override
        public void setNotify(FlySightCharacteristic characteristic, boolean enabled)
        {
            if (!isBound(characteristic)) {
                return;
            }
            transport.setNotify(sessionDeviceId, characteristic.uuid(), enabled);
            if (enabled) {
                notifying.add(characteristic);
            } else {
                notifying.remove(characteristic);
            }
        }

        @Override
        public boolean isNotifying(FlySightCharacteristic characteristic)
        {
            return notifying.contains(characteristic);
        }
    }

    /**
     * Marshals each transport callback onto the context.
     */
    private final class TransportCallbacks implements GattTransportListener
    {
        @Override
        public void onStateChanged(TransportState state)
        {
            submit("state change", () -> handleStateChanged(state));
        }

        @Override
        public void onDeviceDiscovered(String deviceId, String name, AdvertisementData advertisement, int rssi)
        {
            submit("advertisement", () -> handleDeviceDiscovered(deviceId, name, advertisement, rssi));
        }

        @Override
        public void onConnected(String deviceId)
        {
            submit("connection", () -> handleConnected(deviceId));
        }

        @Override
        public void onDisconnected(String deviceId, Throwable error)
        {
            submit("disconnection", () -> handleDisconnected(deviceId, error));
        }

        @Override
        public void onServicesDiscovered(String deviceId, List<UUID> services, Throwable error)
        {
            List<UUID> copy = services == null ? List.of() : List.copyOf(services);
            submit("service discovery", () -> handleServicesDiscovered(deviceId, copy, error));
        }

        @Override
        public void onCharacteristicsDiscovered(String deviceId, UUID service, List<UUID> characteristics, Throwable error)
        {
            List<UUID> copy = characteristics == null ? List.of() : List.copyOf(characteristics);
            submit("characteristic discovery", () -> handleCharacteristicsDiscovered(deviceId, service, copy, error));
        }

        @Override
        public void onValueUpdated(String deviceId, UUID characteristic, byte[] data, Throwable error)
        {
            byte[] copy = data == null ? null : data.clone();
            submit("value update", () -> handleValueUpdated(deviceId, characteristic, copy, error));
        }

        @Override
        public void onValueWritten(String deviceId, UUID characteristic, Throwable error)
        {
            submit("write completion", () -> handleValueWritten(deviceId, characteristic, error));
        }
    }
}
