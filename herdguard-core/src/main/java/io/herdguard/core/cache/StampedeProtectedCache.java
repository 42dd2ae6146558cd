package io.herdguard.core.cache;

import io.herdguard.core.stats.CacheStats;
import io.herdguard.core.stats.StatsCollector;
import io.herdguard.core.store.BoundedStore;
import io.herdguard.core.store.LruStore;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Cache that shields rate-limited data sources from request stampedes.
 *
 * <p>Three independent protections are combined on every {@link #get}:</p>
 * <ul>
 *   <li><b>Request coalescing</b> - concurrent loads of one key share a single loader call</li>
 *   <li><b>Stale-while-revalidate</b> - an expired value is served during a grace window
 *       while it is reloaded in the background</li>
 *   <li><b>Probabilistic early expiration</b> - freshness is checked against a jittered
 *       deadline, so entries written together do not expire together</li>
 * </ul>
 *
 * <pre>
 * get(key)
 *   ├─ entry fresh (now &lt; createdAt + ttl * jitter)        → HIT
 *   ├─ entry stale, in grace window, not refreshing        → STALE HIT (+ background refresh)
 *   └─ absent / past grace / refresh already running       → MISS: wait for coalesced load
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * StampedeProtectedCache<String, List<Position>> positions = new StampedeProtectedCache<>(
 *     CacheConfig.builder()
 *         .name("positions")
 *         .defaultTtl(Duration.ofSeconds(30))
 *         .staleWhileRevalidateTtl(Duration.ofSeconds(60))
 *         .build());
 *
 * List<Position> open = positions.get(accountId, brokerage::positions);
 * }</pre>
 *
 * <p>Refresh threads are daemon threads, so closing the cache is optional.</p>
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of cached values
 *
 * @since 1.0.0
 */
public class StampedeProtectedCache<K, V> implements Cache<K, V>, AutoCloseable {

    private static final Executor CALLER_RUNS = Runnable::run;

    private final CacheConfig config;
    private final BoundedStore<K, CacheEntry<V>> store;
    private final Clock clock;
    private final Logger log;
    private final JitterPolicy jitter;
    private final StatsCollector stats = new StatsCollector();
    private final RequestCoalescer<K, V> coalescer;
    private final BackgroundRefresher<K, V> refresher;
    private final ExecutorService ownedRefreshExecutor;

    /**
     * Creates a cache backed by an {@link LruStore} of {@code config.maxSize()} entries.
     *
     * @param config the configuration
     */
    public StampedeProtectedCache(CacheConfig config) {
        this(config, new LruStore<>(config.maxSize()));
    }

    /**
     * Creates a cache backed by the given store.
     *
     * @param config the configuration
     * @param store the bounded store holding the entries
     */
    public StampedeProtectedCache(CacheConfig config, BoundedStore<K, CacheEntry<V>> store) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = config.clock();
        this.log = config.logger();
        this.jitter = new JitterPolicy(config.minJitter(), config.maxJitter());
        this.coalescer = new RequestCoalescer<>(stats::recordCoalesced);

        if (!config.enableBackgroundRefresh()) {
            this.ownedRefreshExecutor = null;
            this.refresher = null;
        } else {
            Executor executor = config.refreshExecutor();
            if (executor == null) {
                this.ownedRefreshExecutor = newRefreshPool(config.name(), config.refreshThreads());
                executor = ownedRefreshExecutor;
            } else {
                this.ownedRefreshExecutor = null;
            }
            this.refresher = new BackgroundRefresher<>(config.name(), coalescer, executor, stats, log);
        }

        log.info("[HERDGUARD] Cache '{}' initialized - maxSize={}, defaultTtl={}, staleWhileRevalidateTtl={}, "
                        + "jitter=[{}, {}], backgroundRefresh={}",
                config.name(), store.maxSize(), config.defaultTtl(),
                config.staleWhileRevalidateTtl(), config.minJitter(), config.maxJitter(),
                config.enableBackgroundRefresh());
    }

    private static ExecutorService newRefreshPool(String cacheName, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "herdguard-refresh-" + cacheName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public V get(K key, Function<K, V> loader, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        Duration effectiveTtl = resolveTtl(ttl);
        stats.recordGet();
        Instant now = clock.instant();

        CacheEntry<V> cached = store.get(key);
        if (cached != null) {
            if (now.isBefore(jitter.jitteredExpiry(cached))) {
                cached.recordAccess(now);
                stats.recordHit();
                log.debug("[HERDGUARD] Cache '{}' hit (fresh): key={}, ageMs={}",
                        config.name(), key, ageMillis(cached, now));
                return cached.value();
            }

            Instant staleDeadline = JitterPolicy.plusSaturated(cached.createdAt(), config.staleWhileRevalidateTtl());
            if (now.isBefore(staleDeadline) && !cached.isRefreshing()) {
                cached.recordAccess(now);
                stats.recordStaleHit();
                log.debug("[HERDGUARD] Cache '{}' hit (stale-while-revalidate): key={}, ageMs={}, staleMs={}",
                        config.name(), key, ageMillis(cached, now),
                        Duration.between(cached.expiresAt(), now).toMillis());
                if (refresher != null && !refreshPoolShutDown()) {
                    refresher.refresh(key, cached, guardedLoader(loader, true), writeBack(key, effectiveTtl));
                }
                return cached.value();
            }
        }

        stats.recordMiss();
        log.debug("[HERDGUARD] Cache '{}' miss: key={}, hadCached={}", config.name(), key, cached != null);
        return await(coalescer.load(key, guardedLoader(loader, false), writeBack(key, effectiveTtl), CALLER_RUNS));
    }

    @Override
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Duration effectiveTtl = resolveTtl(ttl);
        store.set(key, new CacheEntry<>(value, clock.instant(), effectiveTtl));
        log.debug("[HERDGUARD] Cache '{}' set: key={}, ttl={}", config.name(), key, effectiveTtl);
    }

    @Override
    public boolean has(K key) {
        return store.has(key);
    }

    @Override
    public boolean delete(K key) {
        coalescer.detach(key);
        boolean deleted = store.delete(key);
        if (deleted) {
            log.debug("[HERDGUARD] Cache '{}' entry deleted: key={}", config.name(), key);
        }
        return deleted;
    }

    @Override
    public void clear() {
        int sizeBefore = store.size();
        coalescer.detachAll();
        store.clear();
        log.info("[HERDGUARD] Cache '{}' cleared - entriesRemoved={}", config.name(), sizeBefore);
    }

    @Override
    public Set<K> keys() {
        return store.keys();
    }

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public CacheStats getStats() {
        return stats.snapshot(store.size(), store.maxSize(), coalescer.activeCount());
    }

    @Override
    public void resetStats() {
        stats.reset();
    }

    @Override
    public String name() {
        return config.name();
    }

    /**
     * Returns the stored entry without counting an access or touching statistics.
     * <p>Meant for diagnostics, e.g. inspecting {@link CacheEntry#lastError()}.</p>
     *
     * @param key the key
     * @return the entry, or empty if absent
     */
    public Optional<CacheEntry<V>> peekEntry(K key) {
        return Optional.ofNullable(store.get(key));
    }

    /**
     * Returns the configuration of this cache.
     * @return configuration
     */
    public CacheConfig getConfig() {
        return config;
    }

    /**
     * Stops the refresh pool created by this cache. Refreshes already running
     * are given a few seconds to finish. An externally supplied executor is left
     * untouched.
     */
    @Override
    public void close() {
        if (ownedRefreshExecutor == null || ownedRefreshExecutor.isShutdown()) {
            return;
        }
        ownedRefreshExecutor.shutdown();
        try {
            if (!ownedRefreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedRefreshExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedRefreshExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[HERDGUARD] Cache '{}' closed", config.name());
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Wraps the caller's loader with failure accounting. A failure is counted once
     * per loader invocation, however many callers wait on it.
     */
    private Function<K, V> guardedLoader(Function<K, V> loader, boolean background) {
        return k -> {
            long start = System.nanoTime();
            log.debug("[HERDGUARD] Cache '{}' loading: key={}", config.name(), k);
            try {
                V value = loader.apply(k);
                log.debug("[HERDGUARD] Cache '{}' loaded: key={}, loadTimeMs={}",
                        config.name(), k, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
                return value;
            } catch (Throwable t) {
                stats.recordRefreshError();
                CacheEntry<V> cached = store.get(k);
                if (cached != null) {
                    cached.recordError(t);
                }
                if (!background) {
                    log.error("[HERDGUARD] Cache '{}' failed to load: key={}, loadTimeMs={}",
                            config.name(), k, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), t);
                }
                throw t;
            }
        };
    }

    private Consumer<V> writeBack(K key, Duration ttl) {
        return value -> {
            if (value == null) {
                log.debug("[HERDGUARD] Cache '{}' loader returned null, not cached: key={}", config.name(), key);
                return;
            }
            store.set(key, new CacheEntry<>(value, clock.instant(), ttl));
        };
    }

    private V await(CompletableFuture<V> load) {
        try {
            return load.join();
        } catch (CompletionException e) {
            throw LoadFailures.rethrow(e);
        }
    }

    /**
     * Once {@link #close()} has shut the owned pool down, stale hits are served
     * without scheduling a refresh the pool would reject.
     */
    private boolean refreshPoolShutDown() {
        return ownedRefreshExecutor != null && ownedRefreshExecutor.isShutdown();
    }

    private Duration resolveTtl(Duration ttl) {
        if (ttl == null) {
            return config.defaultTtl();
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return ttl;
    }

    private static long ageMillis(CacheEntry<?> entry, Instant now) {
        return Duration.between(entry.createdAt(), now).toMillis();
    }
}
