package com.questrail.flysight.transport;

import java.util.Set;
import java.util.UUID;

/**
 * GattTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a BLE central (GATT client) stack.
 *
 * <p>This port is intentionally small. The client is responsible for:</p>
 * <ul>
 *   <li>deciding which advertisements matter</li>
 *   <li>binding characteristics by UUID</li>
 *   <li>turning notification bytes into protocol events</li>
 * </ul>
 *
 * <p>Every method is a request: it returns immediately and its outcome, if any,
 * is reported later through the {@link GattTransportListener}. Implementations
 * may be backed by a platform BLE stack, a bridge to another process, or a test
 * double.</p>
 *
 * <p>Devices are addressed by their stable identifier string, services and
 * characteristics by UUID.</p>
 */
public interface GattTransport
{
    /**
     * Register the listener that receives every transport callback.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(GattTransportListener listener);

    /**
     * Bring the adapter up. The listener is told the resulting radio state via
     * {@link GattTransportListener#onStateChanged(TransportState)}.
     */
    void start();

    /**
     * Stop scanning, drop connections and release adapter resources.
     */
    void stop();

    /**
     * Start scanning for advertisements.
     *
     * @param serviceFilter   service UUIDs to filter on; empty for no filter
     * @param allowDuplicates report every advertisement, not only the first
     *                        per device
     */
    void scan(Set<UUID> serviceFilter, boolean allowDuplicates);

    void connect(String deviceId);

    void cancelConnection(String deviceId);

    void discoverServices(String deviceId);

    void discoverCharacteristics(String deviceId, UUID service);

    /**
     * Write a characteristic value.
     *
     * @param requireAck {@code true} for write-with-response; the outcome is
     *                   then reported through
     *                   {@link GattTransportListener#onValueWritten}
     */
    void write(String deviceId, UUID characteristic, byte[] data, boolean requireAck);

    void setNotify(String deviceId, UUID characteristic, boolean enabled);

    /**
     * Read a characteristic value; the result arrives through
     * {@link GattTransportListener#onValueUpdated}.
     */
    void read(String deviceId, UUID characteristic);
}
