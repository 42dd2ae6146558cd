package io.herdguard.core.stats;

import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters behind {@link CacheStats}.
 *
 * <p>Each counter is an independent {@link LongAdder}, so a snapshot taken while
 * other threads are recording may be mid-update across counters; every
 * individual counter is exact.</p>
 *
 * @since 1.0.0
 */
public final class StatsCollector {

    private final LongAdder totalGets = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder staleHits = new LongAdder();
    private final LongAdder coalescedRequests = new LongAdder();
    private final LongAdder backgroundRefreshes = new LongAdder();
    private final LongAdder refreshErrors = new LongAdder();

    public void recordGet() {
        totalGets.increment();
    }

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordStaleHit() {
        staleHits.increment();
    }

    public void recordCoalesced() {
        coalescedRequests.increment();
    }

    public void recordBackgroundRefresh() {
        backgroundRefreshes.increment();
    }

    public void recordRefreshError() {
        refreshErrors.increment();
    }

    /**
     * Takes a snapshot of the counters together with the given gauges.
     *
     * @param size current entry count
     * @param maxSize capacity bound
     * @param activeRefreshes in-flight load count
     * @return immutable snapshot
     */
    public CacheStats snapshot(long size, long maxSize, long activeRefreshes) {
        return new CacheStats(
                totalGets.sum(),
                hits.sum(),
                misses.sum(),
                staleHits.sum(),
                coalescedRequests.sum(),
                backgroundRefreshes.sum(),
                refreshErrors.sum(),
                size,
                maxSize,
                activeRefreshes);
    }

    /**
     * Resets all counters to zero.
     */
    public void reset() {
        totalGets.reset();
        hits.reset();
        misses.reset();
        staleHits.reset();
        coalescedRequests.reset();
        backgroundRefreshes.reset();
        refreshErrors.reset();
    }
}
