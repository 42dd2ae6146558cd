package io.herdguard.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached value together with the bookkeeping used for freshness checks,
 * stale-while-revalidate and diagnostics.
 *
 * <p>The value and its timestamps are immutable. Access metadata, the refreshing
 * flag and the last load error are updated concurrently by readers and refresh
 * tasks and are therefore atomic.</p>
 *
 * <p>{@link #expiresAt()} is the nominal deadline. Jitter is applied when the
 * entry is read, see {@link JitterPolicy}.</p>
 *
 * @param <V> the type of the cached value
 *
 * @since 1.0.0
 */
public final class CacheEntry<V> {

    private final V value;
    private final Instant createdAt;
    private final Duration ttl;
    private final Instant expiresAt;

    private final AtomicLong accessCount = new AtomicLong();
    private volatile Instant lastAccessedAt;
    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private volatile Throwable lastError;

    /**
     * Creates a fresh entry.
     *
     * @param value the value, never null
     * @param createdAt insertion time
     * @param ttl nominal lifetime
     */
    public CacheEntry(V value, Instant createdAt, Duration ttl) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.expiresAt = JitterPolicy.plusSaturated(createdAt, ttl);
        this.lastAccessedAt = createdAt;
    }

    public V value() {
        return value;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration ttl() {
        return ttl;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public long accessCount() {
        return accessCount.get();
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    public boolean isRefreshing() {
        return refreshing.get();
    }

    /**
     * Returns the last load failure recorded for this key, if any.
     * @return last error, or null
     */
    public Throwable lastError() {
        return lastError;
    }

    /**
     * Records a read that observed this entry.
     *
     * @param now the read time
     */
    void recordAccess(Instant now) {
        accessCount.incrementAndGet();
        lastAccessedAt = now;
    }

    /**
     * Claims the refresh of this entry.
     *
     * @return true if the caller now owns the refresh, false if one is already running
     */
    boolean tryMarkRefreshing() {
        return refreshing.compareAndSet(false, true);
    }

    void clearRefreshing() {
        refreshing.set(false);
    }

    void recordError(Throwable error) {
        this.lastError = error;
    }

    @Override
    public String toString() {
        return "CacheEntry[createdAt=" + createdAt
                + ", ttl=" + ttl
                + ", accessCount=" + accessCount.get()
                + ", refreshing=" + refreshing.get()
                + (lastError != null ? ", lastError=" + lastError : "")
                + "]";
    }
}
