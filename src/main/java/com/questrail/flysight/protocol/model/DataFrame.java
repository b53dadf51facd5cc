package com.questrail.flysight.protocol.model;

import java.util.Objects;

/**
 * A file data frame received on the notify channel.
 *
 * <p>An empty payload marks the end of the transfer.</p>
 *
 * @param sequence 8-bit sequence number (0..255)
 * @param payload  file bytes carried by this frame
 */
public record DataFrame(int sequence, byte[] payload)
{
    public DataFrame {
        Objects.requireNonNull(payload, "payload");
        if (sequence < 0 || sequence > 0xFF) {
            throw new IllegalArgumentException("sequence must be 0..255 (was " + sequence + ")");
        }
    }

    public boolean isEndOfTransfer() {
        return payload.length == 0;
    }
}
