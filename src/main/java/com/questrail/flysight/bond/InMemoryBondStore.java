package com.questrail.flysight.bond;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-persistent {@link BondStore}; bonds last for the life of the process.
 */
public final class InMemoryBondStore implements BondStore
{
    private final AtomicReference<Set<String>> identifiers;

    public InMemoryBondStore() {
        this(Set.of());
    }

    public InMemoryBondStore(Collection<String> initial) {
        this.identifiers = new AtomicReference<>(Set.copyOf(initial));
    }

    @Override
    public Set<String> loadIdentifiers() {
        return identifiers.get();
    }

    @Override
    public void saveIdentifiers(Set<String> ids) {
        identifiers.set(Set.copyOf(ids));
    }
}
