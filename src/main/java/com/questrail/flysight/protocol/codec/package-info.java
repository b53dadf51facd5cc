/**
 * FlySight Codec
 * =============================================================================
 *
 * <p>Wire-level encoding and decoding of the values exchanged over the CRS
 * (write and notify) channels and the timing characteristics.</p>
 *
 * <pre>
 *   byte[] notification
 *        → FlySightFrameDecoder
 *            → DirectoryEntry | DataFrame | Instant
 *                → listing / transfer / timing protocol
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Codecs are stateless and never throw on malformed input; decoders
 *       return {@link java.util.Optional#empty()}.</li>
 *   <li>A notify-channel value is not self-describing. Deciding whether it is a
 *       directory entry or a data frame is the caller's job.</li>
 * </ul>
 */
package com.questrail.flysight.protocol.codec;
