package com.questrail.flysight.protocol.codec.impl;

/**
 * Raised by the codec helpers when a fixed-layout field does not hold a valid
 * value. Never escapes this package; decoders translate it into an empty
 * result.
 */
final class MalformedFieldException extends Exception
{
    MalformedFieldException(String message) {
        super(message);
    }

    MalformedFieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
