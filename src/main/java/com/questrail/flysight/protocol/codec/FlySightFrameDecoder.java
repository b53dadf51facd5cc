package com.questrail.flysight.protocol.codec;

import com.questrail.flysight.api.DirectoryEntry;
import com.questrail.flysight.protocol.model.DataFrame;

import java.time.Instant;
import java.util.Optional;

/**
 * FlySightFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for inbound FlySight notifications.
 *
 * <p>Each method is given exactly one notification value and treats it as a
 * complete unit. The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the fixed layout (length, tag byte)</li>
 *   <li>Validating field contents (text, calendar values)</li>
 *   <li>Constructing the decoded value on success</li>
 * </ul>
 *
 * <p>The notify channel is shared between directory entries and file data, so
 * a value that does not decode is normal traffic, not a fault. Every method
 * therefore reports failure as {@link Optional#empty()} and never throws for
 * malformed input.</p>
 */
public interface FlySightFrameDecoder
{
    /**
     * Decodes a 24-byte directory entry record.
     *
     * @param value raw notification value
     * @return the entry, or empty if the length, name or packed date/time is
     *         invalid
     */
    Optional<DirectoryEntry> decodeDirectoryEntry(byte[] value);

    /**
     * Decodes a file data frame ({@code 0x10}, sequence, payload).
     *
     * @param value raw notification value
     * @return the frame, or empty if the value is not a data frame
     */
    Optional<DataFrame> decodeDataFrame(byte[] value);

    /**
     * Decodes the 9-byte timing result into a UTC instant with millisecond
     * precision.
     *
     * @param value raw notification value
     * @return the instant, or empty if the length or calendar fields are invalid
     */
    Optional<Instant> decodeTimingResult(byte[] value);
}
