package com.questrail.flysight.internal.registry;

import com.questrail.flysight.bond.BondStore;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * BondSet
 * -----------------------------------------------------------------------------
 * Working copy of the bonded identifiers, written through to a
 * {@link BondStore} on every change. The working copy changes only after the
 * store accepted the new set.
 *
 * <p>Owned by the controller's execution context; not thread-safe.</p>
 */
public final class BondSet
{
    private final BondStore store;
    private final Set<String> identifiers;

    public BondSet(BondStore store) {
        this.store = Objects.requireNonNull(store, "store");
        this.identifiers = new LinkedHashSet<>(store.loadIdentifiers());
    }

    public boolean contains(String deviceId) {
        return identifiers.contains(deviceId);
    }

    /**
     * @return {@code true} if the identifier was not already bonded
     */
    public boolean add(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId");
        if (identifiers.contains(deviceId)) {
            return false;
        }
        Set<String> next = new LinkedHashSet<>(identifiers);
        next.add(deviceId);
        store.saveIdentifiers(Set.copyOf(next));
        identifiers.add(deviceId);
        return true;
    }

    /**
     * @return {@code true} if the identifier was bonded
     */
    public boolean remove(String deviceId) {
        if (!identifiers.contains(deviceId)) {
            return false;
        }
        Set<String> next = new LinkedHashSet<>(identifiers);
        next.remove(deviceId);
        store.saveIdentifiers(Set.copyOf(next));
        identifiers.remove(deviceId);
        return true;
    }
}
