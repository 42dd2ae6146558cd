package io.herdguard.core.store;

import java.util.Set;

/**
 * Capacity-bounded key/value container used underneath a stampede-protected cache.
 *
 * <p>The store holds entries regardless of their freshness: deciding whether an
 * entry is fresh, stale or expired is the caller's job. Implementations may
 * evict entries at any time to honor their capacity bound, so callers must not
 * assume that an entry they inserted is still present later.</p>
 *
 * <p>All implementations must be thread-safe.</p>
 *
 * @param <K> the type of keys
 * @param <E> the type of stored entries
 *
 * @since 1.0.0
 */
public interface BoundedStore<K, E> {

    /**
     * Returns the entry stored for the key.
     *
     * @param key the key
     * @return the entry, or {@code null} if absent
     */
    E get(K key);

    /**
     * Stores the entry, replacing any previous entry for the key.
     *
     * @param key the key
     * @param entry the entry to store
     */
    void set(K key, E entry);

    /**
     * Returns true if an entry is stored for the key.
     * <p>Does not count as an access for eviction purposes.</p>
     *
     * @param key the key
     * @return true if present
     */
    boolean has(K key);

    /**
     * Removes the entry for the key.
     *
     * @param key the key
     * @return true if an entry was removed
     */
    boolean delete(K key);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Returns the current number of entries.
     *
     * @return entry count
     */
    int size();

    /**
     * Returns the capacity bound.
     *
     * @return maximum number of entries
     */
    int maxSize();

    /**
     * Returns a snapshot of the stored keys.
     *
     * @return a copy of the key set
     */
    Set<K> keys();
}
