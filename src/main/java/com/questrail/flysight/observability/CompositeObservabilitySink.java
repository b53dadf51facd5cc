package com.questrail.flysight.observability;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans every event out to zero or more registered sinks, in registration
 * order. Sinks may be added and removed from any thread.
 */
public final class CompositeObservabilitySink implements FlySightObservabilitySink {
    private final List<FlySightObservabilitySink> sinks = new CopyOnWriteArrayList<>();

    public CompositeObservabilitySink() {}

    public CompositeObservabilitySink(List<? extends FlySightObservabilitySink> initial) {
        initial.forEach(this::add);
    }

    public void add(FlySightObservabilitySink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public boolean remove(FlySightObservabilitySink sink) {
        return sinks.remove(sink);
    }

    public int size() {
        return sinks.size();
    }

    @Override
    public void onRegistryChanged(RegistryChangedEvent event) {
        forEach(s -> s.onRegistryChanged(event));
    }

    @Override
    public void onListingChanged(ListingChangedEvent event) {
        forEach(s -> s.onListingChanged(event));
    }

    @Override
    public void onTransferProgress(TransferProgressEvent event) {
        forEach(s -> s.onTransferProgress(event));
    }

    @Override
    public void onTimingStateChanged(TimingStateChangedEvent event) {
        forEach(s -> s.onTimingStateChanged(event));
    }

    @Override
    public void onTransportEvent(FlySightTransportEvent event) {
        forEach(s -> s.onTransportEvent(event));
    }

    @Override
    public void onError(FlySightErrorEvent event) {
        forEach(s -> s.onError(event));
    }

    private void forEach(Consumer<FlySightObservabilitySink> action) {
        for (FlySightObservabilitySink sink : sinks) {
            action.accept(sink);
        }
    }
}
