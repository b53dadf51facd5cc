package com.questrail.flysight.config;

import com.questrail.flysight.bond.JsonFileBondStore;
import com.questrail.flysight.internal.exec.FlySightTimingPolicy;

import java.util.Objects;

/**
 * Aggregated configuration for the FlySight client runtime.
 *
 * @param manufacturerId Bluetooth SIG company identifier that marks an
 *                       advertisement as coming from a FlySight
 * @param bondStoreKey   member name under which a file-backed bond store keeps
 *                       the bonded identifiers
 */
public record FlySightRuntimeConfig(
    FlySightTimingPolicy timingPolicy,
    int manufacturerId,
    String bondStoreKey
) {
    /**
     * Company identifier carried in FlySight advertisements.
     */
    public static final int FLYSIGHT_MANUFACTURER_ID = 0x09DB;

    public FlySightRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(bondStoreKey, "bondStoreKey");
        if (bondStoreKey.isEmpty()) {
            throw new IllegalArgumentException("bondStoreKey must not be empty");
        }
        if (manufacturerId < 0 || manufacturerId > 0xFFFF) {
            throw new IllegalArgumentException("manufacturerId must be 0..0xFFFF (was " + manufacturerId + ")");
        }
    }

    public static FlySightRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FlySightTimingPolicy timingPolicy = FlySightTimingPolicy.defaults();
        private int manufacturerId = FLYSIGHT_MANUFACTURER_ID;
        private String bondStoreKey = JsonFileBondStore.DEFAULT_KEY;

        public Builder withTimingPolicy(FlySightTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withManufacturerId(int manufacturerId) {
            this.manufacturerId = manufacturerId;
            return this;
        }

        public Builder withBondStoreKey(String key) {
            this.bondStoreKey = key;
            return this;
        }

        public FlySightRuntimeConfig build() {
            return new FlySightRuntimeConfig(timingPolicy, manufacturerId, bondStoreKey);
        }
    }
}
