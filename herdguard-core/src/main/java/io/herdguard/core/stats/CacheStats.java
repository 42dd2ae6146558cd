package io.herdguard.core.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a stampede-protected cache's statistics.
 *
 * <p>Counters are monotonic between resets and always satisfy
 * {@code hits + misses + staleHits == totalGets}. {@code size}, {@code maxSize}
 * and {@code activeRefreshes} describe the cache at snapshot time and are not
 * affected by resets.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheStats stats = cache.getStats();
 * if (stats.hitRatio() < 0.8) {
 *     log.warn("Low cache hit ratio: {}", stats);
 * }
 * }</pre>
 *
 * @param totalGets number of get calls
 * @param hits fresh hits served from the cache
 * @param misses gets that had to wait for a load
 * @param staleHits stale values served during the grace window
 * @param coalescedRequests loads that attached to an in-flight load instead of starting one
 * @param backgroundRefreshes successful background refreshes
 * @param refreshErrors failed loader invocations, foreground or background
 * @param size current number of entries
 * @param maxSize capacity bound
 * @param activeRefreshes loads currently in flight
 *
 * @since 1.0.0
 */
public record CacheStats(
        long totalGets,
        long hits,
        long misses,
        long staleHits,
        long coalescedRequests,
        long backgroundRefreshes,
        long refreshErrors,
        long size,
        long maxSize,
        long activeRefreshes
) {

    /**
     * Returns the fresh-hit ratio.
     * @return hits / totalGets, or 0.0 if no gets have been made
     */
    public double hitRatio() {
        return totalGets == 0 ? 0.0 : (double) hits / totalGets;
    }

    /**
     * Returns the fields as an ordered map, for structured logging and JSON export.
     * @return field name to value
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalGets", totalGets);
        map.put("hits", hits);
        map.put("misses", misses);
        map.put("staleHits", staleHits);
        map.put("hitRatio", hitRatio());
        map.put("size", size);
        map.put("maxSize", maxSize);
        map.put("activeRefreshes", activeRefreshes);
        map.put("coalescedRequests", coalescedRequests);
        map.put("backgroundRefreshes", backgroundRefreshes);
        map.put("refreshErrors", refreshErrors);
        return map;
    }

    @Override
    public String toString() {
        return String.format("CacheStats[gets=%d, hits=%d, misses=%d, staleHits=%d, coalesced=%d, "
                        + "refreshes=%d, refreshErrors=%d, size=%d/%d, active=%d, hitRatio=%.2f%%]",
                totalGets, hits, misses, staleHits, coalescedRequests, backgroundRefreshes,
                refreshErrors, size, maxSize, activeRefreshes, hitRatio() * 100);
    }
}
