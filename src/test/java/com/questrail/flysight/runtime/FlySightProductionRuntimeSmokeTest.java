package com.questrail.flysight.runtime;

import com.questrail.flysight.api.DeviceRecord;
import com.questrail.flysight.observability.RecordingObservabilitySink;
import com.questrail.flysight.observability.RegistryChangedEvent;
import com.questrail.flysight.transport.AdvertisementData;
import com.questrail.flysight.transport.FakeGattTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the production runtime around the fake transport and checks that
 * callbacks reach the controller through the event loop.
 */
class FlySightProductionRuntimeSmokeTest {

    @TempDir
    Path dir;

    @Test
    void advertisementReachesRegistryThroughEventLoop() throws InterruptedException {
        FakeGattTransport transport = new FakeGattTransport();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        CountDownLatch published = new CountDownLatch(1);
        AtomicReference<List<DeviceRecord>> snapshot = new AtomicReference<>();

        FlySightProductionRuntime runtime = FlySightProductionRuntime.builder()
                .withTransport(transport)
                .withBondFile(dir.resolve("bonds.json"))
                .withObservabilitySink(sink)
                .withRegistryCallback(devices -> {
                    snapshot.set(devices);
                    published.countDown();
                })
                .build();

        runtime.start();
        try {
            assertTrue(runtime.isRunning());
            assertTrue(transport.isStarted());

            transport.listener().onDeviceDiscovered("AA:BB:CC:DD:EE:01", "FlySight",
                    AdvertisementData.withManufacturerData(new byte[] { (byte) 0xDB, 0x09, 0x01 }), -55);

            assertTrue(published.await(2, TimeUnit.SECONDS));
            assertEquals("FlySight", snapshot.get().get(0).name());
            assertTrue(sink.hasEventOfType(RegistryChangedEvent.class));
            assertEquals(1, runtime.client().devices().size());
        } finally {
            runtime.stop();
        }

        assertFalse(runtime.isRunning());
        assertFalse(transport.isStarted());
    }

    @Test
    void buildRequiresTransport() {
        assertThrows(NullPointerException.class, () -> FlySightProductionRuntime.builder().build());
    }
}
