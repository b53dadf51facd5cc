package com.questrail.flysight.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * DirectoryAttribute
 * -----------------------------------------------------------------------------
 * File attribute flags carried in the attribute byte of a directory entry.
 *
 * <p>The declaration order is the bit order on the wire: bit 0 is
 * {@link #READ_ONLY}, bit 4 is {@link #DIRECTORY}. Bits 5..7 are ignored.</p>
 */
public enum DirectoryAttribute
{
    READ_ONLY('r'),
    HIDDEN('h'),
    SYSTEM('s'),
    ARCHIVE('a'),
    DIRECTORY('d');

    private final char letter;

    DirectoryAttribute(char letter) {
        this.letter = letter;
    }

    /**
     * Single-letter label used in the compact attribute rendering.
     */
    public char letter() {
        return letter;
    }

    /**
     * Bit mask of this attribute within the attribute byte.
     */
    public int mask() {
        return 1 << ordinal();
    }

    /**
     * Maps an attribute byte to the set of flags it carries.
     *
     * @param bits attribute byte (only the low five bits are inspected)
     * @return unmodifiable set of attributes
     */
    public static Set<DirectoryAttribute> fromBits(int bits) {
        EnumSet<DirectoryAttribute> set = EnumSet.noneOf(DirectoryAttribute.class);
        for (DirectoryAttribute attribute : values()) {
            if ((bits & attribute.mask()) != 0) {
                set.add(attribute);
            }
        }
        return Collections.unmodifiableSet(set);
    }

    /**
     * Inverse of {@link #fromBits(int)}.
     */
    public static int toBits(Set<DirectoryAttribute> attributes) {
        int bits = 0;
        for (DirectoryAttribute attribute : attributes) {
            bits |= attribute.mask();
        }
        return bits;
    }

    /**
     * Renders the attributes as five characters in bit order, using the
     * attribute letter when set and {@code '-'} otherwise (e.g. {@code "----d"}).
     */
    public static String render(Set<DirectoryAttribute> attributes) {
        StringBuilder sb = new StringBuilder(values().length);
        for (DirectoryAttribute attribute : values()) {
            sb.append(attributes.contains(attribute) ? attribute.letter : '-');
        }
        return sb.toString();
    }
}
