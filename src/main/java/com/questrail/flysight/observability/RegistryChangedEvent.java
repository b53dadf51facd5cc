package com.questrail.flysight.observability;

import com.questrail.flysight.api.DeviceRecord;

import java.time.Instant;
import java.util.List;

/**
 * Registry snapshot published after a registry mutation.
 */
public record RegistryChangedEvent(
    Instant timestamp,
    List<DeviceRecord> devices
) {
    public RegistryChangedEvent {
        devices = List.copyOf(devices);
    }
}
