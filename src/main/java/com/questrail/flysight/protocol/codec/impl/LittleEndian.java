package com.questrail.flysight.protocol.codec.impl;

/**
 * LittleEndian
 * -----------------------------------------------------------------------------
 * Fixed-offset unsigned integer access for FlySight wire structures.
 *
 * <p>All multi-byte integers on the FlySight link are little-endian. Callers
 * validate the overall frame length before reading, so out-of-range offsets are
 * programming errors and surface as {@link ArrayIndexOutOfBoundsException}.</p>
 */
final class LittleEndian
{
    private LittleEndian() {}

    static int u8(byte[] data, int offset)
    {
        return data[offset] & 0xFF;
    }

    static int u16(byte[] data, int offset)
    {
        return (data[offset] & 0xFF)
                | ((data[offset + 1] & 0xFF) << 8);
    }

    static long u32(byte[] data, int offset)
    {
        return (data[offset] & 0xFFL)
                | ((data[offset + 1] & 0xFFL) << 8)
                | ((data[offset + 2] & 0xFFL) << 16)
                | ((data[offset + 3] & 0xFFL) << 24);
    }

    static void putU16(byte[] data, int offset, int value)
    {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >>> 8);
    }

    static void putU32(byte[] data, int offset, long value)
    {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >>> 8);
        data[offset + 2] = (byte) (value >>> 16);
        data[offset + 3] = (byte) (value >>> 24);
    }
}
