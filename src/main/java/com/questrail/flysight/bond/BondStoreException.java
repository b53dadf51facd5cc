package com.questrail.flysight.bond;

/**
 * Raised when the bond set cannot be read or written.
 */
public final class BondStoreException extends RuntimeException
{
    public BondStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
