package io.herdguard.core;

import io.herdguard.core.cache.CacheConfig;
import io.herdguard.core.cache.CacheEntry;
import io.herdguard.core.cache.StampedeProtectedCache;
import io.herdguard.core.stats.CacheStatsReporter;
import io.herdguard.core.store.BoundedStore;

import java.util.function.Consumer;

/**
 * Main entry point for HerdGuard.
 *
 * <p>Creates stampede-protected caches and stats reporters. There is no global
 * cache instance: construct one cache per logical data set and pass it to the
 * components that read it.</p>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * // Position data: 30s fresh, served stale for up to 60s while refreshing
 * StampedeProtectedCache<String, List<Position>> positions = HerdGuard.cache(config -> config
 *     .name("positions")
 *     .defaultTtl(Duration.ofSeconds(30))
 *     .staleWhileRevalidateTtl(Duration.ofSeconds(60)));
 *
 * // Real-time quotes: short TTL, large key space
 * StampedeProtectedCache<String, Quote> quotes = HerdGuard.cache(config -> config
 *     .name("quotes")
 *     .defaultTtl(Duration.ofSeconds(5))
 *     .maxSize(10_000));
 *
 * // Log both every minute
 * CacheStatsReporter reporter = HerdGuard.statsReporter()
 *     .interval(Duration.ofMinutes(1))
 *     .build();
 * reporter.register(positions.name(), positions::getStats);
 * reporter.register(quotes.name(), quotes::getStats);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class HerdGuard {

    /** HerdGuard version */
    public static final String VERSION = "1.0.0-SNAPSHOT";

    private HerdGuard() {
        // Static utility class
    }

    /**
     * Creates a cache with the production defaults.
     *
     * @param <K> key type
     * @param <V> value type
     * @return a new cache
     * @see CacheConfig#defaults()
     */
    public static <K, V> StampedeProtectedCache<K, V> cache() {
        return new StampedeProtectedCache<>(CacheConfig.defaults());
    }

    /**
     * Creates a cache from a configuration.
     *
     * @param config the configuration
     * @param <K> key type
     * @param <V> value type
     * @return a new cache
     */
    public static <K, V> StampedeProtectedCache<K, V> cache(CacheConfig config) {
        return new StampedeProtectedCache<>(config);
    }

    /**
     * Creates a cache, customizing the defaults in place.
     *
     * @param customizer adjusts a builder pre-populated with the defaults
     * @param <K> key type
     * @param <V> value type
     * @return a new cache
     */
    public static <K, V> StampedeProtectedCache<K, V> cache(Consumer<CacheConfig.Builder> customizer) {
        CacheConfig.Builder builder = CacheConfig.builder();
        customizer.accept(builder);
        return new StampedeProtectedCache<>(builder.build());
    }

    /**
     * Creates a cache on top of a custom bounded store.
     *
     * @param config the configuration; its maxSize is informational, the store enforces its own bound
     * @param store the store holding the entries
     * @param <K> key type
     * @param <V> value type
     * @return a new cache
     */
    public static <K, V> StampedeProtectedCache<K, V> cache(CacheConfig config, BoundedStore<K, CacheEntry<V>> store) {
        return new StampedeProtectedCache<>(config, store);
    }

    /**
     * Creates a stats reporter builder.
     *
     * @return stats reporter builder
     */
    public static CacheStatsReporter.Builder statsReporter() {
        return CacheStatsReporter.builder();
    }
}
