package io.herdguard.core.cache;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Immutable configuration for {@link StampedeProtectedCache} instances.
 *
 * <p>Defaults are applied once, here, and never at call sites. Invalid options
 * fail at construction.</p>
 *
 * <p>Use the builder pattern for fluent configuration:</p>
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .name("positions")
 *     .maxSize(1000)
 *     .defaultTtl(Duration.ofSeconds(30))
 *     .staleWhileRevalidateTtl(Duration.ofSeconds(60))
 *     .jitter(0.9, 1.1)
 *     .logger(LoggerFactory.getLogger("cache.positions"))
 *     .build();
 * }</pre>
 *
 * @param name cache name used in logs and stats reports
 * @param maxSize capacity bound of the underlying store
 * @param defaultTtl nominal TTL when get/set omit one
 * @param staleWhileRevalidateTtl grace window, measured from creation, in which stale values are served
 * @param minJitter lower TTL multiplier for probabilistic expiration
 * @param maxJitter upper TTL multiplier for probabilistic expiration
 * @param enableBackgroundRefresh whether stale hits trigger a background reload
 * @param refreshThreads size of the refresh pool the cache creates when no executor is supplied
 * @param refreshExecutor externally owned refresh executor, or null to let the cache create one
 * @param logger log sink
 * @param clock time source
 *
 * @since 1.0.0
 */
public record CacheConfig(
        String name,
        int maxSize,
        Duration defaultTtl,
        Duration staleWhileRevalidateTtl,
        double minJitter,
        double maxJitter,
        boolean enableBackgroundRefresh,
        int refreshThreads,
        Executor refreshExecutor,
        Logger logger,
        Clock clock
) {

    /** Default max size: 1000 entries. */
    public static final int DEFAULT_MAX_SIZE = 1000;

    /** Default TTL: 1 minute. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(1);

    /** Default jitter range: 90% to 110% of the TTL. */
    public static final double DEFAULT_MIN_JITTER = 0.9;
    public static final double DEFAULT_MAX_JITTER = 1.1;

    /** Default number of background refresh threads. */
    public static final int DEFAULT_REFRESH_THREADS = 4;

    public CacheConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        Objects.requireNonNull(logger, "logger must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (staleWhileRevalidateTtl == null) {
            staleWhileRevalidateTtl = defaultTtl.multipliedBy(2);
        }
        if (staleWhileRevalidateTtl.isNegative()) {
            throw new IllegalArgumentException("staleWhileRevalidateTtl must not be negative");
        }
        if (!(minJitter > 0)) {
            throw new IllegalArgumentException("minJitter must be positive");
        }
        if (!Double.isFinite(maxJitter)) {
            throw new IllegalArgumentException("maxJitter must be finite");
        }
        if (minJitter > maxJitter) {
            throw new IllegalArgumentException("minJitter must not exceed maxJitter");
        }
        if (refreshThreads <= 0) {
            throw new IllegalArgumentException("refreshThreads must be positive");
        }
    }

    /**
     * Creates a new builder for CacheConfig.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the production defaults: 1000 entries, 1 minute TTL, 2 minutes of
     * stale-while-revalidate grace, ±10% jitter, background refresh enabled.
     *
     * @return default configuration
     */
    public static CacheConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     * @return builder copy
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .name(name)
                .maxSize(maxSize)
                .defaultTtl(defaultTtl)
                .staleWhileRevalidateTtl(staleWhileRevalidateTtl)
                .jitter(minJitter, maxJitter)
                .enableBackgroundRefresh(enableBackgroundRefresh)
                .refreshThreads(refreshThreads)
                .logger(logger)
                .clock(clock);
        builder.refreshExecutor = refreshExecutor;
        return builder;
    }

    /**
     * Builder for CacheConfig.
     */
    public static class Builder {
        private String name = "stampede-cache";
        private int maxSize = DEFAULT_MAX_SIZE;
        private Duration defaultTtl = DEFAULT_TTL;
        private Duration staleWhileRevalidateTtl;
        private double minJitter = DEFAULT_MIN_JITTER;
        private double maxJitter = DEFAULT_MAX_JITTER;
        private boolean enableBackgroundRefresh = true;
        private int refreshThreads = DEFAULT_REFRESH_THREADS;
        private Executor refreshExecutor;
        private Logger logger = NOPLogger.NOP_LOGGER;
        private Clock clock = Clock.systemUTC();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("Max size must be positive");
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder defaultTtl(Duration ttl) {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("TTL must be positive");
            }
            this.defaultTtl = ttl;
            return this;
        }

        /**
         * Sets the stale-while-revalidate grace window.
         * <p>Defaults to twice the default TTL when not set.</p>
         */
        public Builder staleWhileRevalidateTtl(Duration ttl) {
            if (ttl == null || ttl.isNegative()) {
                throw new IllegalArgumentException("Stale-while-revalidate TTL must not be negative");
            }
            this.staleWhileRevalidateTtl = ttl;
            return this;
        }

        /**
         * Sets the TTL multiplier range. Use {@code jitter(1.0, 1.0)} to disable jitter.
         */
        public Builder jitter(double minJitter, double maxJitter) {
            if (!(minJitter > 0) || !Double.isFinite(maxJitter) || minJitter > maxJitter) {
                throw new IllegalArgumentException(
                        "Jitter range must satisfy 0 < min <= max, got [" + minJitter + ", " + maxJitter + "]");
            }
            this.minJitter = minJitter;
            this.maxJitter = maxJitter;
            return this;
        }

        public Builder enableBackgroundRefresh(boolean enabled) {
            this.enableBackgroundRefresh = enabled;
            return this;
        }

        public Builder refreshThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("Refresh threads must be positive");
            }
            this.refreshThreads = threads;
            return this;
        }

        /**
         * Runs background refreshes on the given executor instead of a pool owned
         * by the cache. The cache never shuts down an executor it did not create.
         */
        public Builder refreshExecutor(Executor executor) {
            if (executor == null) {
                throw new IllegalArgumentException("Refresh executor must not be null");
            }
            this.refreshExecutor = executor;
            return this;
        }

        public Builder logger(Logger logger) {
            if (logger == null) {
                throw new IllegalArgumentException("Logger must not be null");
            }
            this.logger = logger;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("Clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(name, maxSize, defaultTtl, staleWhileRevalidateTtl,
                    minJitter, maxJitter, enableBackgroundRefresh, refreshThreads,
                    refreshExecutor, logger, clock);
        }
    }
}
