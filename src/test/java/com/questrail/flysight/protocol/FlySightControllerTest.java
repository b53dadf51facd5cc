package com.questrail.flysight.protocol;

import com.questrail.flysight.api.DeviceRecord;
import com.questrail.flysight.api.ListingResult;
import com.questrail.flysight.api.RemotePath;
import com.questrail.flysight.api.TimingResult;
import com.questrail.flysight.api.TimingState;
import com.questrail.flysight.api.TransferResult;
import com.questrail.flysight.bond.BondStore;
import com.questrail.flysight.bond.BondStoreException;
import com.questrail.flysight.bond.InMemoryBondStore;
import com.questrail.flysight.config.FlySightRuntimeConfig;
import com.questrail.flysight.observability.FlySightErrorEvent;
import com.questrail.flysight.observability.FlySightTransportEvent;
import com.questrail.flysight.observability.RecordingObservabilitySink;
import com.questrail.flysight.protocol.codec.impl.DefaultFlySightFrameEncoder;
import com.questrail.flysight.protocol.codec.impl.FlySightTestFrames;
import com.questrail.flysight.protocol.model.FlySightCharacteristic;
import com.questrail.flysight.time.DeterministicScheduler;
import com.questrail.flysight.time.ManualMonotonicClock;
import com.questrail.flysight.transport.AdvertisementData;
import com.questrail.flysight.transport.FakeGattTransport;
import com.questrail.flysight.transport.GattTransportListener;
import com.questrail.flysight.transport.TransportState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FlySightControllerTest
 * -----------------------------------------------------------------------------
 * Drives the controller through the fake transport on a direct execution
 * context. Timers run only when the deterministic scheduler is pumped.
 */
class FlySightControllerTest {

    private static final String DEVICE = "AA:BB:CC:DD:EE:01";
    private static final String OTHER = "AA:BB:CC:DD:EE:02";
    private static final UUID SERVICE = UUID.fromString("00000000-cc7a-482a-984a-7f2ed5b3e58f");

    private static final AdvertisementData VENDOR_ADVERTISEMENT =
            AdvertisementData.withManufacturerData(new byte[] { (byte) 0xDB, 0x09, 0x01 });

    private final DefaultFlySightFrameEncoder encoder = new DefaultFlySightFrameEncoder();

    private FakeGattTransport transport;
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private BondStore bondStore;
    private FlySightController controller;
    private GattTransportListener listener;

    @BeforeEach
    void setUp() {
        create(new InMemoryBondStore());
    }

    private void create(BondStore store) {
        transport = new FakeGattTransport();
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        bondStore = store;
        controller = new FlySightController(
                transport,
                bondStore,
                Runnable::run,
                clock,
                scheduler,
                () -> Instant.EPOCH,
                FlySightRuntimeConfig.defaults(),
                sink);
        transport.setListener(controller.transportListener());
        listener = transport.listener();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void advertise(String id, String name, int rssi) {
        listener.onDeviceDiscovered(id, name, VENDOR_ADVERTISEMENT, rssi);
    }

    private void connectAndBind(String id) {
        listener.onConnected(id);
        listener.onServicesDiscovered(id, List.of(SERVICE), null);
        listener.onCharacteristicsDiscovered(id, SERVICE, allCharacteristics(), null);
    }

    private static List<UUID> allCharacteristics() {
        return Arrays.stream(FlySightCharacteristic.values())
                .map(FlySightCharacteristic::uuid)
                .collect(Collectors.toList());
    }

    private void notifyTx(byte[] value) {
        listener.onValueUpdated(DEVICE, FlySightCharacteristic.CRS_TX.uuid(), value, null);
    }

    private void advance(long millis) {
        clock.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    private Optional<DeviceRecord> record(String id) {
        return controller.devices().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    private List<byte[]> writesToRx() {
        return transport.writesTo(FlySightCharacteristic.CRS_RX.uuid());
    }

    // ---------------------------------------------------------------------
    // Scanning and registry
    // ---------------------------------------------------------------------

    @Test
    void poweredOnStartsUnfilteredScanWithDuplicates() {
        listener.onStateChanged(TransportState.POWERED_OFF);
        assertTrue(transport.scans().isEmpty());

        listener.onStateChanged(TransportState.POWERED_ON);

        assertEquals(List.of(new FakeGattTransport.Scan(Set.of(), true)), transport.scans());
    }

    @Test
    void vendorAdvertisementsAreAdded() {
        advertise(DEVICE, "FlySight", -60);
        listener.onDeviceDiscovered(OTHER, null, VENDOR_ADVERTISEMENT, -70);

        assertEquals(2, controller.devices().size());
        assertEquals("FlySight", record(DEVICE).orElseThrow().name());
        assertEquals(DeviceRecord.UNNAMED, record(OTHER).orElseThrow().name());
        assertFalse(record(DEVICE).orElseThrow().connected());
    }

    @Test
    void foreignOrShortManufacturerDataIsIgnored() {
        listener.onDeviceDiscovered(DEVICE, "Other", AdvertisementData.withManufacturerData(new byte[] { 0x4C, 0x00, 0x02 }), -60);
        listener.onDeviceDiscovered(OTHER, "Short", AdvertisementData.withManufacturerData(new byte[] { (byte) 0xDB, 0x09 }), -60);
        listener.onDeviceDiscovered("X", "None", AdvertisementData.EMPTY, -60);

        assertTrue(controller.devices().isEmpty());
    }

    @Test
    void bondedDeviceQualifiesWithoutManufacturerData() {
        create(new InMemoryBondStore(Set.of(DEVICE)));

        listener.onDeviceDiscovered(DEVICE, "Bonded", AdvertisementData.EMPTY, -80);

        DeviceRecord r = record(DEVICE).orElseThrow();
        assertTrue(r.bonded());
    }

    @Test
    void resightingUpdatesSignalAndKeepsNameWhenAbsent() {
        advertise(DEVICE, "FlySight", -70);
        advertise(DEVICE, null, -50);

        DeviceRecord r = record(DEVICE).orElseThrow();
        assertEquals(-50, r.rssi());
        assertEquals("FlySight", r.name());
        assertEquals(1, controller.devices().size());

        advertise(DEVICE, "Renamed", -55);
        assertEquals("Renamed", record(DEVICE).orElseThrow().name());
    }

    @Test
    void unbondedDeviceIsPrunedWhenNotResighted() {
        advertise(DEVICE, "FlySight", -60);

        advance(499);
        assertTrue(record(DEVICE).isPresent());

        advance(1);
        assertTrue(record(DEVICE).isEmpty());
    }

    @Test
    void resightingRestartsDisappearanceWindow() {
        advertise(DEVICE, "FlySight", -60);
        advance(400);
        advertise(DEVICE, "FlySight", -61);

        advance(400);
        assertTrue(record(DEVICE).isPresent());

        advance(100);
        assertTrue(record(DEVICE).isEmpty());
    }

    @Test
    void bondedDeviceIsNeverPruned() {
        create(new InMemoryBondStore(Set.of(DEVICE)));
        advertise(DEVICE, "FlySight", -60);

        advance(10_000);

        assertTrue(record(DEVICE).isPresent());
    }

    @Test
    void devicesBySignalStrengthSortsStrongestFirst() {
        advertise(DEVICE, "Weak", -90);
        advertise(OTHER, "Strong", -40);

        assertEquals(List.of(OTHER, DEVICE),
                controller.devicesBySignalStrength().stream().map(DeviceRecord::id).collect(Collectors.toList()));
        assertEquals(DEVICE, controller.devices().get(0).id());
    }

    // ---------------------------------------------------------------------
    // Connection and bonding
    // ---------------------------------------------------------------------

    @Test
    void connectingToKnownDeviceBondsIt() {
        advertise(DEVICE, "FlySight", -60);

        controller.connect(DEVICE);

        assertEquals(List.of(DEVICE), transport.connects());
        DeviceRecord r = record(DEVICE).orElseThrow();
        assertTrue(r.connected());
        assertTrue(r.bonded());
        assertEquals(Set.of(DEVICE), bondStore.loadIdentifiers());

        advance(10_000);
        assertTrue(record(DEVICE).isPresent());
    }

    @Test
    void failingBondStoreLeavesRecordDisconnected() {
        create(new BondStore() {
            @Override
            public Set<String> loadIdentifiers() {
                return Set.of();
            }

            @Override
            public void saveIdentifiers(Set<String> identifiers) {
                throw new BondStoreException("disk full", null);
            }
        });
        advertise(DEVICE, "FlySight", -60);

        controller.connect(DEVICE);

        DeviceRecord r = record(DEVICE).orElseThrow();
        assertFalse(r.connected());
        assertFalse(r.bonded());
        assertEquals(List.of(DEVICE), transport.connects());
        FlySightErrorEvent error = sink.eventsOfType(FlySightErrorEvent.class).get(0);
        assertInstanceOf(BondStoreException.class, error.cause());

        advance(500);
        assertTrue(record(DEVICE).isEmpty());
    }

    @Test
    void disconnectingUnbondedDeviceRemovesIt() {
        advertise(DEVICE, "FlySight", -60);

        controller.disconnect(DEVICE);

        assertEquals(List.of(DEVICE), transport.cancelledConnections());
        assertTrue(record(DEVICE).isEmpty());
    }

    @Test
    void disconnectingBondedDeviceKeepsIt() {
        advertise(DEVICE, "FlySight", -60);
        controller.connect(DEVICE);

        controller.disconnect(DEVICE);

        DeviceRecord r = record(DEVICE).orElseThrow();
        assertFalse(r.connected());
        assertTrue(r.bonded());
    }

    @Test
    void unbondRemovesDisconnectedRecordOnly() {
        advertise(DEVICE, "FlySight", -60);
        controller.connect(DEVICE);

        controller.unbond(DEVICE);
        DeviceRecord r = record(DEVICE).orElseThrow();
        assertFalse(r.bonded());

        controller.bond(DEVICE);
        controller.disconnect(DEVICE);
        controller.unbond(DEVICE);

        assertTrue(record(DEVICE).isEmpty());
        assertEquals(Set.of(), bondStore.loadIdentifiers());
    }

    @Test
    void connectToSecondDeviceIsIgnoredWhileConnected() {
        connectAndBind(DEVICE);

        controller.connect(OTHER);

        assertTrue(transport.connects().isEmpty());
        assertEquals(Optional.of(DEVICE), controller.connectedDevice());
    }

    @Test
    void unsolicitedConnectionCreatesUnnamedRecord() {
        listener.onConnected(OTHER);

        DeviceRecord r = record(OTHER).orElseThrow();
        assertEquals(DeviceRecord.UNNAMED, r.name());
        assertTrue(r.connected());
        assertFalse(r.bonded());
        assertEquals(List.of(OTHER), transport.serviceDiscoveries());

        listener.onDisconnected(OTHER, null);
        assertFalse(record(OTHER).orElseThrow().connected());

        advance(500);
        assertTrue(record(OTHER).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Characteristic binding
    // ---------------------------------------------------------------------

    @Test
    void bindingEnablesNotificationsAndListsRoot() {
        connectAndBind(DEVICE);

        assertEquals(Optional.of(DEVICE), controller.connectedDevice());
        assertEquals(List.of(SERVICE), transport.characteristicDiscoveries());

        Set<UUID> notified = transport.notifyChanges().stream()
                .filter(FakeGattTransport.NotifyChange::enabled)
                .map(FakeGattTransport.NotifyChange::characteristic)
                .collect(Collectors.toSet());
        assertEquals(Set.of(FlySightCharacteristic.CRS_TX.uuid(), FlySightCharacteristic.START_RESULT.uuid()), notified);
        assertEquals(List.of(FlySightCharacteristic.CRS_RX.uuid()), transport.reads());

        assertEquals(1, writesToRx().size());
        assertArrayEquals(encoder.directoryRequest(RemotePath.ROOT), writesToRx().get(0));
        assertTrue(controller.isAwaitingResponse());
        assertTrue(sink.getAllEvents().stream().anyMatch(e -> e instanceof FlySightTransportEvent t
                && t.kind() == FlySightTransportEvent.Kind.CHANNELS_BOUND));
    }

    @Test
    void rootIsListedOncePerConnection() {
        connectAndBind(DEVICE);
        listener.onCharacteristicsDiscovered(DEVICE, SERVICE, allCharacteristics(), null);

        assertEquals(1, writesToRx().size());
    }

    @Test
    void rootIsNotListedUntilBothChannelsAreBound() {
        listener.onConnected(DEVICE);
        listener.onCharacteristicsDiscovered(DEVICE, SERVICE, List.of(FlySightCharacteristic.CRS_TX.uuid()), null);
        assertTrue(writesToRx().isEmpty());

        listener.onCharacteristicsDiscovered(DEVICE, SERVICE, List.of(FlySightCharacteristic.CRS_RX.uuid()), null);
        assertEquals(1, writesToRx().size());
    }

    // ---------------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------------

    @Test
    void directoryEntriesAreRoutedToListing() {
        connectAndBind(DEVICE);

        notifyTx(FlySightTestFrames.file("B.CSV", 10));
        notifyTx(FlySightTestFrames.folder("00-LOGS"));

        assertFalse(controller.isAwaitingResponse());
        assertEquals(List.of("00-LOGS", "B.CSV"),
                controller.directoryEntries().stream().map(e -> e.name()).collect(Collectors.toList()));
    }

    @Test
    void valuesFromOtherDevicesAreIgnored() {
        connectAndBind(DEVICE);

        listener.onValueUpdated(OTHER, FlySightCharacteristic.CRS_TX.uuid(), FlySightTestFrames.file("X.CSV", 1), null);

        assertTrue(controller.directoryEntries().isEmpty());
        assertTrue(controller.isAwaitingResponse());
    }

    @Test
    void downloadUsesListedSizeAndAcknowledgesFrames() {
        connectAndBind(DEVICE);
        notifyTx(FlySightTestFrames.file("TRACK.CSV", 4));
        transport.clear();
        List<TransferResult> results = new ArrayList<>();

        controller.downloadFile("/TRACK.CSV", results::add);
        notifyTx(FlySightTestFrames.dataFrame(0, (byte) 1, (byte) 2));
        assertEquals(0.5, controller.downloadProgress());
        notifyTx(FlySightTestFrames.dataFrame(1, (byte) 3, (byte) 4));
        notifyTx(FlySightTestFrames.endOfTransfer(2));

        List<byte[]> writes = writesToRx();
        assertArrayEquals(encoder.downloadRequest("/TRACK.CSV"), writes.get(0));
        assertArrayEquals(encoder.acknowledge(0), writes.get(1));
        assertArrayEquals(encoder.acknowledge(2), writes.get(3));

        TransferResult.Completed completed = assertInstanceOf(TransferResult.Completed.class, results.get(0));
        assertArrayEquals(new byte[] { 1, 2, 3, 4 }, completed.data());
        assertEquals(1.0, controller.downloadProgress());
        assertEquals(1, controller.directoryEntries().size());

        FakeGattTransport.NotifyChange last = transport.notifyChanges().get(transport.notifyChanges().size() - 1);
        assertEquals(new FakeGattTransport.NotifyChange(DEVICE, FlySightCharacteristic.CRS_TX.uuid(), false), last);
    }

    @Test
    void listingAfterDownloadReenablesNotifications() {
        connectAndBind(DEVICE);
        notifyTx(FlySightTestFrames.folder("00-LOGS"));
        controller.downloadFile("/X.CSV", r -> {});
        notifyTx(FlySightTestFrames.endOfTransfer(0));
        transport.clear();

        controller.changeDirectory("00-LOGS");

        assertEquals(List.of(new FakeGattTransport.NotifyChange(DEVICE, FlySightCharacteristic.CRS_TX.uuid(), true)),
                transport.notifyChanges());
        assertEquals(RemotePath.ROOT.resolve("00-LOGS"), controller.currentPath());
    }

    @Test
    void downloadStartedBeforeListingResponseDoesNotBlockNavigation() {
        connectAndBind(DEVICE);
        assertTrue(controller.isAwaitingResponse());
        List<TransferResult> transfers = new ArrayList<>();

        controller.downloadFile("/X.CSV", transfers::add);
        assertFalse(controller.isAwaitingResponse());
        notifyTx(FlySightTestFrames.dataFrame(0, (byte) 1));
        notifyTx(FlySightTestFrames.endOfTransfer(1));
        assertInstanceOf(TransferResult.Completed.class, transfers.get(0));

        List<ListingResult> listings = new ArrayList<>();
        controller.changeDirectory("00-LOGS", listings::add);
        notifyTx(FlySightTestFrames.file("TRACK.CSV", 10));

        ListingResult.Responded responded = assertInstanceOf(ListingResult.Responded.class, listings.get(0));
        assertEquals(RemotePath.ROOT.resolve("00-LOGS"), responded.path());
        assertEquals(1, responded.entries().size());
    }

    @Test
    void listingIsRejectedDuringDownload() {
        connectAndBind(DEVICE);
        notifyTx(FlySightTestFrames.folder("00-LOGS"));
        controller.downloadFile("/X.CSV", r -> {});
        List<ListingResult> results = new ArrayList<>();

        controller.changeDirectory("00-LOGS", results::add);

        ListingResult.Failed failed = assertInstanceOf(ListingResult.Failed.class, results.get(0));
        assertEquals("a file transfer is in progress", failed.reason());
        assertEquals(RemotePath.ROOT, controller.currentPath());
    }

    @Test
    void disconnectionFailsTransferAndResetsListing() {
        connectAndBind(DEVICE);
        notifyTx(FlySightTestFrames.folder("00-LOGS"));
        controller.changeDirectory("00-LOGS");
        notifyTx(FlySightTestFrames.file("TRACK.CSV", 100));
        List<TransferResult> results = new ArrayList<>();
        controller.downloadFile("/00-LOGS/TRACK.CSV", results::add);

        listener.onDisconnected(DEVICE, null);

        TransferResult.Failed failed = assertInstanceOf(TransferResult.Failed.class, results.get(0));
        assertEquals("device disconnected", failed.reason());
        assertEquals(RemotePath.ROOT, controller.currentPath());
        assertTrue(controller.directoryEntries().isEmpty());
        assertEquals(Optional.empty(), controller.connectedDevice());
    }

    @Test
    void cancelDownloadWritesCancelFrame() {
        connectAndBind(DEVICE);
        List<TransferResult> results = new ArrayList<>();
        controller.downloadFile("/X.CSV", results::add);
        transport.clear();

        controller.cancelDownload();

        assertArrayEquals(encoder.cancelTransfer(), writesToRx().get(0));
        assertEquals(List.of(new TransferResult.Cancelled("/X.CSV")), results);
    }

    @Test
    void timingResultIsRoutedToTimingProtocol() {
        connectAndBind(DEVICE);
        List<TimingResult> results = new ArrayList<>();

        controller.startTiming(results::add);

        FakeGattTransport.Write write = transport.writes().get(transport.writes().size() - 1);
        assertEquals(FlySightCharacteristic.START_CONTROL.uuid(), write.characteristic());
        assertTrue(write.requireAck());
        assertEquals(TimingState.COUNTING, controller.timingState());

        listener.onValueUpdated(DEVICE, FlySightCharacteristic.START_RESULT.uuid(),
                FlySightTestFrames.timingResult(2024, 6, 1, 10, 20, 30, 456), null);

        Instant expected = Instant.parse("2024-06-01T10:20:30.456Z");
        assertEquals(List.of(new TimingResult.Recorded(expected)), results);
        assertEquals(Optional.of(expected), controller.lastStartResult());
        assertEquals(TimingState.IDLE, controller.timingState());
    }

    // ---------------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------------

    @Test
    void writeErrorOnWriteChannelFailsPendingListing() {
        connectAndBind(DEVICE);
        notifyTx(FlySightTestFrames.folder("00-LOGS"));
        List<ListingResult> results = new ArrayList<>();
        controller.changeDirectory("00-LOGS", results::add);

        listener.onValueWritten(DEVICE, FlySightCharacteristic.CRS_RX.uuid(), new RuntimeException("write failed"));

        ListingResult.Failed failed = assertInstanceOf(ListingResult.Failed.class, results.get(0));
        assertEquals("transport error", failed.reason());
        assertFalse(controller.isAwaitingResponse());
        assertTrue(sink.hasEventOfType(FlySightErrorEvent.class));
    }

    @Test
    void readErrorOnNotifyChannelFailsTransfer() {
        connectAndBind(DEVICE);
        List<TransferResult> results = new ArrayList<>();
        controller.downloadFile("/X.CSV", results::add);

        listener.onValueUpdated(DEVICE, FlySightCharacteristic.CRS_TX.uuid(), null, new RuntimeException("gatt"));

        TransferResult.Failed failed = assertInstanceOf(TransferResult.Failed.class, results.get(0));
        assertEquals("transport error", failed.reason());
        assertTrue(sink.hasEventOfType(FlySightErrorEvent.class));
    }

    @Test
    void exceptionFromCallbackIsPublishedAsError() {
        controller.changeDirectory("00-LOGS", result -> {
            throw new IllegalStateException("callback failed");
        });

        List<FlySightErrorEvent> errors = sink.eventsOfType(FlySightErrorEvent.class);
        assertEquals(1, errors.size());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());
    }
}
