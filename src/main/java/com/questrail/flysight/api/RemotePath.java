package com.questrail.flysight.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RemotePath
 * -----------------------------------------------------------------------------
 * Immutable working directory on the device, as an ordered list of segments.
 *
 * <p>The root is the empty list. The wire form is {@code "/"} followed by the
 * segments joined with {@code "/"}, so the root serializes to {@code "/"}.</p>
 */
public final class RemotePath
{
    public static final RemotePath ROOT = new RemotePath(List.of());

    private final List<String> segments;

    private RemotePath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static RemotePath of(List<String> segments) {
        Objects.requireNonNull(segments, "segments");
        return segments.isEmpty() ? ROOT : new RemotePath(segments);
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Returns this path with {@code segment} appended.
     */
    public RemotePath resolve(String segment) {
        Objects.requireNonNull(segment, "segment");
        List<String> next = new ArrayList<>(segments);
        next.add(segment);
        return new RemotePath(next);
    }

    /**
     * Returns this path without its last segment; the root is its own parent.
     */
    public RemotePath parent() {
        if (segments.isEmpty()) {
            return this;
        }
        return of(segments.subList(0, segments.size() - 1));
    }

    public String toWirePath() {
        return "/" + String.join("/", segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RemotePath that)) return false;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return toWirePath();
    }
}
