package com.questrail.flysight.protocol.codec.impl;

import com.questrail.flysight.api.DirectoryAttribute;
import com.questrail.flysight.api.DirectoryEntry;
import com.questrail.flysight.protocol.codec.FlySightFrameDecoder;
import com.questrail.flysight.protocol.model.DataFrame;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

/**
 * DefaultFlySightFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FlySightFrameDecoder}.
 *
 * <p><strong>Directory entry layout</strong> (24 bytes):</p>
 * <pre>
 *   [0..2)   reserved
 *   [2..6)   size      u32
 *   [6..8)   date      u16 (packed, see {@link PackedDateTime})
 *   [8..10)  time      u16 (packed)
 *   [10]     attrib    u8
 *   [11..24) name      13 bytes, NUL-padded UTF-8
 * </pre>
 *
 * <p><strong>Data frame layout</strong>: {@code 0x10}, sequence u8, payload.</p>
 *
 * <p><strong>Timing result layout</strong> (9 bytes): year u16, month, day,
 * hour, minute, second (u8 each), millisecond u16.</p>
 */
public final class DefaultFlySightFrameDecoder implements FlySightFrameDecoder
{
    public static final int DIRECTORY_ENTRY_LENGTH = 24;
    public static final int TIMING_RESULT_LENGTH = 9;
    public static final int DATA_FRAME_TAG = 0x10;

    static final int NAME_OFFSET = 11;
    static final int NAME_LENGTH = 13;

    @Override
    public Optional<DirectoryEntry> decodeDirectoryEntry(byte[] value)
    {
        if (value == null || value.length != DIRECTORY_ENTRY_LENGTH) {
            return Optional.empty();
        }

        try {
            final long size = LittleEndian.u32(value, 2);
            final int date = LittleEndian.u16(value, 6);
            final int time = LittleEndian.u16(value, 8);
            final int attrib = LittleEndian.u8(value, 10);
            final String name = FixedText.decode(value, NAME_OFFSET, NAME_LENGTH);

            final Instant modified = PackedDateTime.decode(date, time);

            return Optional.of(new DirectoryEntry(
                    name,
                    size,
                    modified,
                    DirectoryAttribute.fromBits(attrib)));
        }
        catch (MalformedFieldException e) {
            // Not a directory entry (or a corrupt one) → drop
            return Optional.empty();
        }
    }

    @Override
    public Optional<DataFrame> decodeDataFrame(byte[] value)
    {
        if (value == null || value.length < 2) {
            return Optional.empty();
        }
        if (LittleEndian.u8(value, 0) != DATA_FRAME_TAG) {
            return Optional.empty();
        }

        final int sequence = LittleEndian.u8(value, 1);
        final byte[] payload = Arrays.copyOfRange(value, 2, value.length);
        return Optional.of(new DataFrame(sequence, payload));
    }

    @Override
    public Optional<Instant> decodeTimingResult(byte[] value)
    {
        if (value == null || value.length != TIMING_RESULT_LENGTH) {
            return Optional.empty();
        }

        final int year = LittleEndian.u16(value, 0);
        final int month = LittleEndian.u8(value, 2);
        final int day = LittleEndian.u8(value, 3);
        final int hour = LittleEndian.u8(value, 4);
        final int minute = LittleEndian.u8(value, 5);
        final int second = LittleEndian.u8(value, 6);
        final int millis = LittleEndian.u16(value, 7);

        if (millis > 999) {
            return Optional.empty();
        }

        try {
            return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second, millis * 1_000_000)
                    .toInstant(ZoneOffset.UTC));
        }
        catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
