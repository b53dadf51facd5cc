package com.questrail.flysight.transport;

import java.util.List;
import java.util.UUID;

/**
 * GattTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link GattTransport}.
 *
 * <p>Callbacks may arrive on any thread, including several threads
 * concurrently. Receivers must marshal each callback onto their own execution
 * context before touching state; implementations of this interface in the
 * client do exactly that and return immediately.</p>
 *
 * <p>An {@code error} argument is {@code null} on success.</p>
 */
public interface GattTransportListener
{
    void onStateChanged(TransportState state);

    /**
     * An advertisement was received.
     *
     * @param name advertised local name, or {@code null}
     * @param rssi received signal strength in dBm
     */
    void onDeviceDiscovered(String deviceId, String name, AdvertisementData advertisement, int rssi);

    void onConnected(String deviceId);

    /**
     * The link to {@code deviceId} is gone, either on request or unexpectedly.
     */
    void onDisconnected(String deviceId, Throwable error);

    void onServicesDiscovered(String deviceId, List<UUID> services, Throwable error);

    void onCharacteristicsDiscovered(String deviceId, UUID service, List<UUID> characteristics, Throwable error);

    /**
     * A notification arrived or a read completed.
     *
     * @param data the value; {@code null} when {@code error} is set
     */
    void onValueUpdated(String deviceId, UUID characteristic, byte[] data, Throwable error);

    /**
     * A write with response completed. Transports may also report failed
     * writes without response here.
     */
    void onValueWritten(String deviceId, UUID characteristic, Throwable error);
}
