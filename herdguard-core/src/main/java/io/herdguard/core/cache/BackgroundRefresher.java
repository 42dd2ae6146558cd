package io.herdguard.core.cache;

import io.herdguard.core.stats.StatsCollector;
import org.slf4j.Logger;

import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fire-and-forget reload of stale entries.
 *
 * <p>A refresh claims the entry's refreshing flag, registers a coalesced load on
 * the refresh executor and returns immediately. When the load settles the
 * outcome goes to the stats and the log, never to a caller, and the flag is
 * released whatever happened.</p>
 *
 * @param <K> the type of keys
 * @param <V> the type of cached values
 *
 * @since 1.0.0
 */
final class BackgroundRefresher<K, V> {

    private final String cacheName;
    private final RequestCoalescer<K, V> coalescer;
    private final Executor executor;
    private final StatsCollector stats;
    private final Logger log;

    BackgroundRefresher(String cacheName, RequestCoalescer<K, V> coalescer, Executor executor,
                        StatsCollector stats, Logger log) {
        this.cacheName = cacheName;
        this.coalescer = coalescer;
        this.executor = executor;
        this.stats = stats;
        this.log = log;
    }

    /**
     * Starts a background refresh of the stale entry unless one is already running.
     *
     * @param key the key to reload
     * @param entry the stale entry being served
     * @param loader the loader
     * @param writeBack stores the refreshed value
     * @return true if a refresh was started by this call
     */
    boolean refresh(K key, CacheEntry<V> entry, Function<K, V> loader, Consumer<V> writeBack) {
        if (!entry.tryMarkRefreshing()) {
            return false;
        }

        log.debug("[HERDGUARD] Cache '{}' background refresh scheduled: key={}", cacheName, key);
        try {
            coalescer.load(key, loader, writeBack, executor)
                    .whenComplete((value, error) -> {
                        try {
                            if (error == null) {
                                stats.recordBackgroundRefresh();
                                log.debug("[HERDGUARD] Cache '{}' background refresh completed: key={}",
                                        cacheName, key);
                            } else {
                                log.warn("[HERDGUARD] Cache '{}' background refresh failed: key={}",
                                        cacheName, key, LoadFailures.unwrap(error));
                            }
                        } finally {
                            entry.clearRefreshing();
                        }
                    });
        } catch (RuntimeException e) {
            entry.clearRefreshing();
            throw e;
        }
        return true;
    }
}
