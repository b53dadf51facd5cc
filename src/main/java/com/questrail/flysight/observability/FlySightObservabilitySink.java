package com.questrail.flysight.observability;

/**
 * Main interface for observing FlySight client state.
 *
 * <p>This is the client's only push-style state propagation mechanism. UI
 * bindings, logging and metrics all attach here; the protocol core publishes
 * and never depends on what, if anything, is listening.</p>
 *
 * <p>Every callback is invoked on the client's owning execution context. Event
 * payloads are immutable snapshots. Implementations must return quickly and
 * must not call back into the client synchronously expecting the new state to
 * differ from the event.</p>
 */
public interface FlySightObservabilitySink {
    /**
     * Called after any change to the device registry (insert, removal, signal
     * strength, connection flag, bond flag).
     */
    void onRegistryChanged(RegistryChangedEvent event);

    /**
     * Called when the working path, the listing or the awaiting flag changes.
     */
    void onListingChanged(ListingChangedEvent event);

    /**
     * Called when a download starts, accepts a frame, or finishes.
     */
    void onTransferProgress(TransferProgressEvent event);

    /**
     * Called on every timing state transition and on every recorded result.
     */
    void onTimingStateChanged(TimingStateChangedEvent event);

    /**
     * Called for connection lifecycle milestones.
     */
    void onTransportEvent(FlySightTransportEvent event);

    /**
     * Called when an exchange fails or a callback throws.
     */
    void onError(FlySightErrorEvent event);
}
