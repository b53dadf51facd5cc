package com.questrail.flysight.api;

import java.util.List;
import java.util.Objects;

/**
 * ListingResult
 * -----------------------------------------------------------------------------
 * Outcome of one directory listing round, delivered when the round stops
 * being awaited.
 *
 * <p>The device does not send an end-of-listing marker. A round stops being
 * awaited after the first inbound value, so {@link Responded#entries()} holds
 * whatever had been decoded at that point; later entries keep arriving into the
 * live listing and are published through the observability sink.</p>
 */
public sealed interface ListingResult
        permits ListingResult.Responded, ListingResult.Failed
{
    record Responded(RemotePath path, List<DirectoryEntry> entries) implements ListingResult {
        public Responded {
            Objects.requireNonNull(path, "path");
            entries = List.copyOf(entries);
        }
    }

    record Failed(RemotePath path, String reason, Throwable cause) implements ListingResult {
        public Failed {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(reason, "reason");
        }
    }

    RemotePath path();
}
