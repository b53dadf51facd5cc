package com.questrail.flysight.protocol.codec.impl;

import com.questrail.flysight.api.RemotePath;
import com.questrail.flysight.protocol.codec.FlySightFrameEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultFlySightFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FlySightFrameEncoder}.
 *
 * <p>Opcodes:</p>
 * <ul>
 *   <li>{@code 0x02} download request (write channel)</li>
 *   <li>{@code 0x05} directory request (write channel)</li>
 *   <li>{@code 0x12} data frame acknowledgement (write channel)</li>
 *   <li>{@code 0xFF} cancel transfer (write channel)</li>
 *   <li>{@code 0x00} / {@code 0x01} start / cancel timing (timing control)</li>
 * </ul>
 */
public final class DefaultFlySightFrameEncoder implements FlySightFrameEncoder
{
    static final byte OP_DOWNLOAD = 0x02;
    static final byte OP_DIRECTORY = 0x05;
    static final byte OP_ACK = 0x12;
    static final byte OP_CANCEL_TRANSFER = (byte) 0xFF;
    static final byte OP_START_TIMING = 0x00;
    static final byte OP_CANCEL_TIMING = 0x01;

    @Override
    public byte[] directoryRequest(RemotePath path)
    {
        Objects.requireNonNull(path, "path");
        return prefixed(OP_DIRECTORY, path.toWirePath().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] downloadRequest(String filePath)
    {
        Objects.requireNonNull(filePath, "filePath");
        byte[] path = filePath.getBytes(StandardCharsets.UTF_8);

        // opcode + offset u32 + stride u32 + path; offset and stride are always zero
        byte[] frame = new byte[1 + 4 + 4 + path.length];
        frame[0] = OP_DOWNLOAD;
        LittleEndian.putU32(frame, 1, 0L);
        LittleEndian.putU32(frame, 5, 0L);
        System.arraycopy(path, 0, frame, 9, path.length);
        return frame;
    }

    @Override
    public byte[] acknowledge(int sequence)
    {
        if (sequence < 0 || sequence > 0xFF) {
            throw new IllegalArgumentException("sequence must be 0..255 (was " + sequence + ")");
        }
        return new byte[] { OP_ACK, (byte) sequence };
    }

    @Override
    public byte[] cancelTransfer()
    {
        return new byte[] { OP_CANCEL_TRANSFER };
    }

    @Override
    public byte[] startTiming()
    {
        return new byte[] { OP_START_TIMING };
    }

    @Override
    public byte[] cancelTiming()
    {
        return new byte[] { OP_CANCEL_TIMING };
    }

    private static byte[] prefixed(byte opcode, byte[] body)
    {
        byte[] frame = new byte[body.length + 1];
        frame[0] = opcode;
        System.arraycopy(body, 0, frame, 1, body.length);
        return frame;
    }
}
