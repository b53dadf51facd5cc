package com.questrail.flysight.observability;

import com.questrail.flysight.api.DirectoryEntry;
import com.questrail.flysight.api.RemotePath;

import java.time.Instant;
import java.util.List;

/**
 * Directory listing snapshot. {@code entries} is already in listing order.
 */
public record ListingChangedEvent(
    Instant timestamp,
    RemotePath path,
    List<DirectoryEntry> entries,
    boolean awaitingResponse
) {
    public ListingChangedEvent {
        entries = List.copyOf(entries);
    }
}
