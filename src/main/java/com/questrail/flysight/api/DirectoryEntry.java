package com.questrail.flysight.api;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * DirectoryEntry
 * -----------------------------------------------------------------------------
 * One entry of a remote directory listing, as decoded from a single
 * notification.
 *
 * @param name         entry name (non-empty)
 * @param size         size in bytes (unsigned 32-bit value)
 * @param lastModified last-modified time in UTC, 2-second resolution
 * @param attributes   attribute flags
 */
public record DirectoryEntry(
        String name,
        long size,
        Instant lastModified,
        Set<DirectoryAttribute> attributes
) {
    /**
     * Listing order: containers first, then case-insensitive name ascending.
     */
    public static final Comparator<DirectoryEntry> LISTING_ORDER =
            Comparator.comparing((DirectoryEntry e) -> !e.isContainer())
                    .thenComparing(e -> e.name().toLowerCase(Locale.ROOT));

    public DirectoryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lastModified, "lastModified");
        Objects.requireNonNull(attributes, "attributes");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if (size < 0 || size > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("size must be an unsigned 32-bit value (was " + size + ")");
        }
        attributes = attributes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(attributes));
    }

    /**
     * True if the directory attribute bit is set.
     */
    public boolean isContainer() {
        return attributes.contains(DirectoryAttribute.DIRECTORY);
    }

    /**
     * Compact five-letter attribute text, e.g. {@code "r---d"}.
     */
    public String attributeText() {
        return DirectoryAttribute.render(attributes);
    }
}
