package com.questrail.flysight.protocol.codec;

import com.questrail.flysight.api.RemotePath;

/**
 * FlySightFrameEncoder
 * -----------------------------------------------------------------------------
 * Builds the outbound command frames written to the device.
 *
 * <p>The encoder knows byte layouts only. Which characteristic a frame is
 * written to, and whether the write requires acknowledgement, is decided by the
 * protocol that issues it.</p>
 */
public interface FlySightFrameEncoder
{
    /**
     * {@code 0x05} followed by the UTF-8 wire path.
     */
    byte[] directoryRequest(RemotePath path);

    /**
     * {@code 0x02}, offset u32 (0), stride u32 (0), UTF-8 file path.
     */
    byte[] downloadRequest(String filePath);

    /**
     * {@code 0x12} followed by the acknowledged sequence number.
     */
    byte[] acknowledge(int sequence);

    /**
     * Single byte {@code 0xFF}.
     */
    byte[] cancelTransfer();

    /**
     * Single byte {@code 0x00}.
     */
    byte[] startTiming();

    /**
     * Single byte {@code 0x01}.
     */
    byte[] cancelTiming();
}
