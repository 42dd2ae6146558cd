package io.herdguard.core.cache;

import io.herdguard.core.stats.CacheStats;

import java.time.Duration;
import java.util.Set;
import java.util.function.Function;

/**
 * Core cache interface for HerdGuard.
 *
 * <p>All implementations are thread-safe and designed to sit in front of
 * rate-limited data sources that many threads read at once.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Cache<String, Quote> quotes = HerdGuard.cache(config -> config
 *     .name("quotes")
 *     .defaultTtl(Duration.ofSeconds(5))
 *     .maxSize(10_000));
 *
 * // Get or load
 * Quote quote = quotes.get("AAPL", marketData::latestQuote);
 *
 * // Custom TTL for this load
 * Quote slow = quotes.get("BRK.A", marketData::latestQuote, Duration.ofSeconds(30));
 *
 * // Direct write
 * quotes.set("MSFT", knownQuote);
 * }</pre>
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of cached values
 *
 * @since 1.0.0
 */
public interface Cache<K, V> {

    /**
     * Returns the value for the key, loading it with the default TTL if needed.
     *
     * @param key the key whose associated value is to be returned
     * @param loader the function to load the value on a miss
     * @return the cached, stale or freshly loaded value
     * @throws NullPointerException if key or loader is null
     * @see #get(Object, Function, Duration)
     */
    default V get(K key, Function<K, V> loader) {
        return get(key, loader, null);
    }

    /**
     * Returns the value for the key, loading it if needed.
     *
     * <p>A fresh entry is returned immediately. A stale entry still inside the
     * grace window is returned immediately as well, possibly triggering a
     * background refresh. Otherwise the caller waits for a load, shared with any
     * other caller loading the same key. A loader failure is rethrown unchanged.</p>
     *
     * @param key the key whose associated value is to be returned
     * @param loader the function to load the value on a miss
     * @param ttl TTL for a value loaded by this call, or null for the default TTL
     * @return the cached, stale or freshly loaded value
     * @throws NullPointerException if key or loader is null
     */
    V get(K key, Function<K, V> loader, Duration ttl);

    /**
     * Stores the value with the default TTL.
     *
     * @param key the key
     * @param value the value
     */
    default void set(K key, V value) {
        set(key, value, null);
    }

    /**
     * Stores the value as a fresh entry, replacing any previous entry.
     *
     * @param key the key
     * @param value the value, never null
     * @param ttl the TTL, or null for the default TTL
     */
    void set(K key, V value, Duration ttl);

    /**
     * Returns true if an entry exists for the key, fresh or not.
     * <p>Does not update statistics or access metadata.</p>
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
     * Alias for {@link #delete(Object)}, for invalidation after the source data changed.
     *
     * @param key the key
     * @return true if an entry was removed
     */
    default boolean invalidate(K key) {
        return delete(key);
    }

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Returns a snapshot of the cached keys, fresh or not.
     * @return the keys
     */
    Set<K> keys();

    /**
     * Returns the number of entries in this cache.
     * @return entry count
     */
    long size();

    /**
     * Returns a statistics snapshot.
     * @return cache statistics
     */
    CacheStats getStats();

    /**
     * Resets the statistics counters to zero.
     */
    void resetStats();

    /**
     * Returns the name of this cache, if configured.
     *
     * @return cache name, or "unnamed" if not set
     */
    default String name() {
        return "unnamed";
    }
}
