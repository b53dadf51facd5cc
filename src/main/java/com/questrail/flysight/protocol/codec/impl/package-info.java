/**
 * Default codec implementation.
 *
 * <p>All multi-byte integers are little-endian. Dates and times in directory
 * entries use the packed 16-bit date and time words with a 1980 epoch and
 * 2-second resolution ({@link com.questrail.flysight.protocol.codec.impl.PackedDateTime}).
 * Names are fixed-width, NUL-padded UTF-8.</p>
 */
package com.questrail.flysight.protocol.codec.impl;
