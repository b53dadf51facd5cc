package com.questrail.flysight.runtime;

import com.questrail.flysight.api.DeviceRecord;
import com.questrail.flysight.api.FlySightClient;
import com.questrail.flysight.bond.BondStore;
import com.questrail.flysight.bond.InMemoryBondStore;
import com.questrail.flysight.bond.JsonFileBondStore;
import com.questrail.flysight.config.FlySightRuntimeConfig;
import com.questrail.flysight.internal.exec.FlySightTimingPolicy;
import com.questrail.flysight.internal.time.MonotonicClock;
import com.questrail.flysight.internal.time.SystemMonotonicClock;
import com.questrail.flysight.internal.time.SystemWallClock;
import com.questrail.flysight.observability.FlySightErrorEvent;
import com.questrail.flysight.observability.FlySightObservabilitySink;
import com.questrail.flysight.observability.FlySightTransportEvent;
import com.questrail.flysight.observability.ListingChangedEvent;
import com.questrail.flysight.observability.NullObservabilitySink;
import com.questrail.flysight.observability.RegistryChangedEvent;
import com.questrail.flysight.observability.TimingStateChangedEvent;
import com.questrail.flysight.observability.TransferProgressEvent;
import com.questrail.flysight.protocol.FlySightController;
import com.questrail.flysight.runtime.netty.NettyEventLoopScheduler;
import com.questrail.flysight.transport.GattTransport;
import io.netty.channel.DefaultEventLoop;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * FlySightProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production FlySight client.
 *
 * <p>Owns one Netty event loop, which serves as both the controller's
 * execution context and its timer scheduler, and drives the transport
 * lifecycle.</p>
 *
 * <pre>
 *   FlySightProductionRuntime runtime = FlySightProductionRuntime.builder()
 *       .withTransport(transport)
 *       .withBondFile(Path.of("bonds.json"))
 *       .build();
 *   runtime.start();
 *   FlySightClient client = runtime.client();
 * </pre>
 */
public final class FlySightProductionRuntime
{
    private static final Logger log = LoggerFactory.getLogger(FlySightProductionRuntime.class);

    private static final long SHUTDOWN_QUIET_PERIOD_MILLIS = 0L;
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

    private final FlySightController controller;
    private final GattTransport transport;
    private final EventLoop eventLoop;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private FlySightProductionRuntime(FlySightController controller, GattTransport transport, EventLoop eventLoop)
    {
        this.controller = controller;
        this.transport = transport;
        this.eventLoop = eventLoop;
    }

    /**
     * Registers the controller with the transport and starts the transport.
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting FlySight client");
        transport.setListener(controller.transportListener());
        transport.start();
    }

    /**
     * Stops the transport and shuts the event loop down. Pending commands and
     * timers are discarded.
     */
    public void stop()
    {
        if (!started.compareAndSet(true, false)) {
            shutdownEventLoop();
            return;
        }
        log.info("Stopping FlySight client");
        try {
            transport.stop();
        } finally {
            shutdownEventLoop();
        }
    }

    private void shutdownEventLoop()
    {
        if (eventLoop.isShuttingDown()) {
            return;
        }
        boolean terminated = eventLoop
                .shutdownGracefully(SHUTDOWN_QUIET_PERIOD_MILLIS, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        if (!terminated) {
            log.warn("FlySight event loop did not terminate within {} ms", SHUTDOWN_TIMEOUT_MILLIS);
        }
    }

    public FlySightClient client()
    {
        return controller;
    }

    public boolean isRunning()
    {
        return started.get();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private GattTransport transport;
        private FlySightRuntimeConfig config = FlySightRuntimeConfig.defaults();
        private BondStore bondStore;
        private Path bondFile;
        private FlySightObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Consumer<List<DeviceRecord>> registryCallback;

        public Builder withTransport(GattTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withConfig(FlySightRuntimeConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withTimingPolicy(FlySightTimingPolicy policy)
        {
            this.config = new FlySightRuntimeConfig(policy, config.manufacturerId(), config.bondStoreKey());
            return this;
        }

        /**
         * Bond store to use. Takes precedence over {@link #withBondFile(Path)}.
         */
        public Builder withBondStore(BondStore bondStore)
        {
            this.bondStore = bondStore;
            return this;
        }

        /**
         * Persist bonds as JSON in {@code file}, under the configured key.
         */
        public Builder withBondFile(Path file)
        {
            this.bondFile = file;
            return this;
        }

        public Builder withObservabilitySink(FlySightObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Convenience hook invoked with every registry snapshot, on the event
         * loop thread.
         */
        public Builder withRegistryCallback(Consumer<List<DeviceRecord>> callback)
        {
            this.registryCallback = callback;
            return this;
        }

        public FlySightProductionRuntime build()
        {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Execution context and timers
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            EventLoop eventLoop = new DefaultEventLoop(new DefaultThreadFactory("flysight-client", true));
            NettyEventLoopScheduler scheduler = new NettyEventLoopScheduler(eventLoop, clock);

            // 2. Persistence
            BondStore store = bondStore;
            if (store == null) {
                store = bondFile != null
                        ? new JsonFileBondStore(bondFile, config.bondStoreKey())
                        : new InMemoryBondStore();
            }

            // 3. Observability: registry callback + configured sink
            FlySightObservabilitySink effectiveSink = observabilitySink;
            if (registryCallback != null) {
                FlySightObservabilitySink delegate = observabilitySink;
                Consumer<List<DeviceRecord>> callback = registryCallback;
                effectiveSink = new FlySightObservabilitySink() {
                    @Override
                    public void onRegistryChanged(RegistryChangedEvent event) {
                        delegate.onRegistryChanged(event);
                        callback.accept(event.devices());
                    }

                    @Override public void onListingChanged(ListingChangedEvent event) { delegate.onListingChanged(event); }
                    @Override public void onTransferProgress(TransferProgressEvent event) { delegate.onTransferProgress(event); }
                    @Override public void onTimingStateChanged(TimingStateChangedEvent event) { delegate.onTimingStateChanged(event); }
                    @Override public void onTransportEvent(FlySightTransportEvent event) { delegate.onTransportEvent(event); }
                    @Override public void onError(FlySightErrorEvent event) { delegate.onError(event); }
                };
            }

            // 4. Controller
            FlySightController controller = new FlySightController(
                    transport,
                    store,
                    scheduler,
                    clock,
                    scheduler,
                    SystemWallClock.INSTANCE,
                    config,
                    effectiveSink);

            return new FlySightProductionRuntime(controller, transport, eventLoop);
        }
    }
}
