package com.questrail.flysight.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of FlySightObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jFlySightObservabilitySink implements FlySightObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFlySightObservabilitySink.class);

    @Override
    public void onRegistryChanged(RegistryChangedEvent event) {
        log.debug("FlySight registry: {} device(s) {}", event.devices().size(), event.devices());
    }

    @Override
    public void onListingChanged(ListingChangedEvent event) {
        log.debug("Directory {}: {} entr{}{}",
            event.path(),
            event.entries().size(),
            event.entries().size() == 1 ? "y" : "ies",
            event.awaitingResponse() ? " (awaiting response)" : "");
    }

    @Override
    public void onTransferProgress(TransferProgressEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Download {}: {}/{} bytes ({})",
                event.filePath(),
                event.receivedBytes(),
                event.expectedBytes(),
                String.format("%.1f%%", event.progress() * 100.0));
        }
    }

    @Override
    public void onTimingStateChanged(TimingStateChangedEvent event) {
        if (event.resultRecorded()) {
            log.info("Start result recorded: {}", event.lastResult().orElseThrow());
        } else {
            log.info("Timing state: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onTransportEvent(FlySightTransportEvent event) {
        if (event.cause() != null) {
            log.warn("FlySight {} {}: {}", event.deviceId(), event.kind(), event.cause().toString());
        } else {
            log.info("FlySight {} {}", event.deviceId(), event.kind());
        }
    }

    @Override
    public void onError(FlySightErrorEvent event) {
        log.error("FlySight error: {}", event.message(), event.cause());
    }
}
