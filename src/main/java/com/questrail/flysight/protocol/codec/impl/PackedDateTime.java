package com.questrail.flysight.protocol.codec.impl;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * PackedDateTime
 * -----------------------------------------------------------------------------
 * 16-bit packed date and time words used by directory entries.
 *
 * <pre>
 *   date: bits 15..9 year - 1980 | bits 8..5 month | bits 4..0 day
 *   time: bits 15..11 hour       | bits 10..5 minute | bits 4..0 second / 2
 * </pre>
 *
 * <p>Values are interpreted as UTC. The bit fields can express values that are
 * not valid calendar dates (month 0, day 31 in April, hour 25, second 60...);
 * those are rejected rather than normalized.</p>
 */
final class PackedDateTime
{
    static final int EPOCH_YEAR = 1980;
    static final int MAX_YEAR = EPOCH_YEAR + 0x7F;

    private PackedDateTime() {}

    /**
     * Decodes a date word and a time word into an instant.
     *
     * @throws MalformedFieldException if the fields do not form a valid
     *         calendar date and time
     */
    static Instant decode(int date, int time) throws MalformedFieldException
    {
        final int year = ((date >>> 9) & 0x7F) + EPOCH_YEAR;
        final int month = (date >>> 5) & 0x0F;
        final int day = date & 0x1F;

        final int hour = (time >>> 11) & 0x1F;
        final int minute = (time >>> 5) & 0x3F;
        final int second = (time & 0x1F) * 2;

        try {
            return LocalDateTime.of(year, month, day, hour, minute, second)
                    .toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new MalformedFieldException(String.format(
                    "invalid packed date/time 0x%04X 0x%04X", date, time), e);
        }
    }

    static int packDate(int year, int month, int day)
    {
        if (year < EPOCH_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must be " + EPOCH_YEAR + ".." + MAX_YEAR + " (was " + year + ")");
        }
        return ((year - EPOCH_YEAR) << 9) | ((month & 0x0F) << 5) | (day & 0x1F);
    }

    /**
     * Packs a time of day; odd seconds are truncated to the 2-second grid.
     */
    static int packTime(int hour, int minute, int second)
    {
        return ((hour & 0x1F) << 11) | ((minute & 0x3F) << 5) | ((second / 2) & 0x1F);
    }

    static int packDate(LocalDateTime dateTime)
    {
        return packDate(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth());
    }

    static int packTime(LocalDateTime dateTime)
    {
        return packTime(dateTime.getHour(), dateTime.getMinute(), dateTime.getSecond());
    }
}
