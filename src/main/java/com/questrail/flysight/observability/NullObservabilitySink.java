package com.questrail.flysight.observability;

/**
 * No-op implementation of FlySightObservabilitySink.
 */
public final class NullObservabilitySink implements FlySightObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRegistryChanged(RegistryChangedEvent event) {}

    @Override
    public void onListingChanged(ListingChangedEvent event) {}

    @Override
    public void onTransferProgress(TransferProgressEvent event) {}

    @Override
    public void onTimingStateChanged(TimingStateChangedEvent event) {}

    @Override
    public void onTransportEvent(FlySightTransportEvent event) {}

    @Override
    public void onError(FlySightErrorEvent event) {}
}
