package com.questrail.flysight.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryEntryTest {

    private static final Instant MODIFIED = Instant.parse("2024-05-25T12:00:00Z");

    private static DirectoryEntry file(String name) {
        return new DirectoryEntry(name, 10, MODIFIED, Set.of());
    }

    private static DirectoryEntry folder(String name) {
        return new DirectoryEntry(name, 0, MODIFIED, EnumSet.of(DirectoryAttribute.DIRECTORY));
    }

    private static List<String> sortedNames(DirectoryEntry... entries) {
        List<DirectoryEntry> list = new ArrayList<>(List.of(entries));
        list.sort(DirectoryEntry.LISTING_ORDER);
        return list.stream().map(DirectoryEntry::name).collect(Collectors.toList());
    }

    @Test
    void containersSortBeforeFiles() {
        assertEquals(List.of("A", "a.txt", "b.txt"),
                sortedNames(file("b.txt"), folder("A"), file("a.txt")));
    }

    @Test
    void namesCompareCaseInsensitively() {
        assertEquals(List.of("alpha", "Beta", "gamma"),
                sortedNames(file("gamma"), file("Beta"), file("alpha")));
        assertEquals(List.of("logs", "Tracks", "config.txt"),
                sortedNames(file("config.txt"), folder("Tracks"), folder("logs")));
    }

    @Test
    void attributeTextRendersFixedPositions() {
        DirectoryEntry entry = new DirectoryEntry("X", 0, MODIFIED,
                EnumSet.of(DirectoryAttribute.READ_ONLY, DirectoryAttribute.SYSTEM, DirectoryAttribute.DIRECTORY));

        assertEquals("r-s-d", entry.attributeText());
        assertEquals("-----", file("plain").attributeText());
    }

    @Test
    void attributeBitsMapInOrder() {
        assertEquals(EnumSet.allOf(DirectoryAttribute.class), DirectoryAttribute.fromBits(0x1F));
        assertEquals(Set.of(DirectoryAttribute.HIDDEN, DirectoryAttribute.ARCHIVE), DirectoryAttribute.fromBits(0x0A));
        assertEquals(0x10, DirectoryAttribute.toBits(Set.of(DirectoryAttribute.DIRECTORY)));
        assertTrue(DirectoryAttribute.fromBits(0xE0).isEmpty());
    }

    @Test
    void rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> new DirectoryEntry("", 0, MODIFIED, Set.of()));
    }

    @Test
    void rejectsSizeOutsideUnsigned32BitRange() {
        assertThrows(IllegalArgumentException.class, () -> new DirectoryEntry("a", -1, MODIFIED, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new DirectoryEntry("a", 0x1_0000_0000L, MODIFIED, Set.of()));
    }

    @Test
    void attributesAreCopied() {
        EnumSet<DirectoryAttribute> attributes = EnumSet.of(DirectoryAttribute.ARCHIVE);
        DirectoryEntry entry = new DirectoryEntry("a", 0, MODIFIED, attributes);

        attributes.add(DirectoryAttribute.DIRECTORY);

        assertFalse(entry.isContainer());
        assertThrows(UnsupportedOperationException.class, () -> entry.attributes().add(DirectoryAttribute.HIDDEN));
    }
}
