package com.questrail.flysight.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * FlySightTimingPolicy
 * -----------------------------------------------------------------------------
 * Timer configuration for the client.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>disappearanceDelay</b>: how long an unbonded, disconnected device
 *       may go without being re-sighted before its registry record is
 *       removed.</li>
 *   <li><b>listingResponseTimeout</b>: how long a directory request may await
 *       its first response before the round is failed. {@link Duration#ZERO}
 *       disables the timeout.</li>
 *   <li><b>transferReceiveTimeout</b>: how long a download may go without an
 *       in-sequence data frame before it is failed. {@link Duration#ZERO}
 *       disables the timeout.</li>
 * </ul>
 *
 * <p>The device firmware defines no timeouts of its own. Both timeouts are
 * therefore disabled by default and a stalled exchange stays pending until the
 * caller cancels it or the link drops.</p>
 */
public record FlySightTimingPolicy(
        Duration disappearanceDelay,
        Duration listingResponseTimeout,
        Duration transferReceiveTimeout
) {
    public FlySightTimingPolicy {
        Objects.requireNonNull(disappearanceDelay, "disappearanceDelay");
        Objects.requireNonNull(listingResponseTimeout, "listingResponseTimeout");
        Objects.requireNonNull(transferReceiveTimeout, "transferReceiveTimeout");

        if (disappearanceDelay.isNegative()) {
            throw new IllegalArgumentException("disappearanceDelay must be non-negative");
        }
        if (listingResponseTimeout.isNegative()) {
            throw new IllegalArgumentException("listingResponseTimeout must be non-negative");
        }
        if (transferReceiveTimeout.isNegative()) {
            throw new IllegalArgumentException("transferReceiveTimeout must be non-negative");
        }
    }

    /**
     * Default policy: 500 ms disappearance window, no timeouts.
     */
    public static FlySightTimingPolicy defaults() {
        return new FlySightTimingPolicy(
                Duration.ofMillis(500),
                Duration.ZERO,
                Duration.ZERO
        );
    }

    public FlySightTimingPolicy withListingResponseTimeout(Duration timeout) {
        return new FlySightTimingPolicy(disappearanceDelay, timeout, transferReceiveTimeout);
    }

    public FlySightTimingPolicy withTransferReceiveTimeout(Duration timeout) {
        return new FlySightTimingPolicy(disappearanceDelay, listingResponseTimeout, timeout);
    }

    public boolean listingTimeoutEnabled() {
        return !listingResponseTimeout.isZero();
    }

    public boolean transferTimeoutEnabled() {
        return !transferReceiveTimeout.isZero();
    }
}
