package com.questrail.flysight.transport;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * AdvertisementData
 * -----------------------------------------------------------------------------
 * The parts of an advertisement the client inspects.
 *
 * <p>{@code manufacturerData} is the raw manufacturer-specific data field, whose
 * first two bytes are the little-endian Bluetooth SIG company identifier. It is
 * {@code null} when the advertisement carries no such field.</p>
 */
public final class AdvertisementData
{
    /**
     * Company identifier plus at least one byte of vendor payload.
     */
    static final int MIN_MANUFACTURER_DATA_LENGTH = 3;

    public static final AdvertisementData EMPTY = new AdvertisementData(null);

    private final byte[] manufacturerData;

    public AdvertisementData(byte[] manufacturerData) {
        this.manufacturerData = manufacturerData == null ? null : manufacturerData.clone();
    }

    public static AdvertisementData withManufacturerData(byte[] manufacturerData) {
        return new AdvertisementData(manufacturerData);
    }

    public boolean hasManufacturerData() {
        return manufacturerData != null;
    }

    public byte[] manufacturerData() {
        return manufacturerData == null ? null : manufacturerData.clone();
    }

    /**
     * Company identifier from the first two manufacturer-data bytes, present
     * only when the field is long enough to carry a vendor payload.
     */
    public OptionalInt companyId() {
        if (manufacturerData == null || manufacturerData.length < MIN_MANUFACTURER_DATA_LENGTH) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((manufacturerData[0] & 0xFF) | ((manufacturerData[1] & 0xFF) << 8));
    }

    @Override
    public String toString() {
        return "AdvertisementData[manufacturerData=" + Arrays.toString(manufacturerData) + "]";
    }
}
