package com.questrail.flysight.protocol.codec.impl;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * FixedText
 * -----------------------------------------------------------------------------
 * Fixed-width, NUL-padded UTF-8 text fields.
 *
 * <p>The field ends at the first NUL byte or at the field boundary, whichever
 * comes first. Malformed UTF-8 is rejected rather than replaced, and so is an
 * empty result.</p>
 */
final class FixedText
{
    private FixedText() {}

    static String decode(byte[] data, int offset, int length) throws MalformedFieldException
    {
        int end = offset;
        final int limit = offset + length;
        while (end < limit && data[end] != 0) {
            end++;
        }

        if (end == offset) {
            throw new MalformedFieldException("empty text field");
        }

        // A fresh decoder per call: CharsetDecoder is stateful.
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(data, offset, end - offset)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedFieldException("text field is not valid UTF-8", e);
        }
    }

    /**
     * Writes {@code text} as UTF-8 into a NUL-padded field.
     *
     * @throws IllegalArgumentException if the encoded text does not fit
     */
    static void encode(String text, byte[] data, int offset, int length)
    {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > length) {
            throw new IllegalArgumentException("text exceeds " + length + " bytes: " + text);
        }
        System.arraycopy(bytes, 0, data, offset, bytes.length);
        for (int i = offset + bytes.length; i < offset + length; i++) {
            data[i] = 0;
        }
    }
}
