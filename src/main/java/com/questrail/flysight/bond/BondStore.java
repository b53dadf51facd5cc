package com.questrail.flysight.bond;

import java.util.Set;

/**
 * BondStore
 * -----------------------------------------------------------------------------
 * Persistence port for the set of bonded device identifiers.
 *
 * <p>The set is small and rewritten as a whole on every change. Implementations
 * report storage failures with {@link BondStoreException}.</p>
 */
public interface BondStore
{
    /**
     * Returns the persisted identifiers, or an empty set when nothing has been
     * stored yet.
     */
    Set<String> loadIdentifiers();

    void saveIdentifiers(Set<String> identifiers);
}
