package io.herdguard.core;

import io.herdguard.core.cache.CacheConfig;
import io.herdguard.core.cache.CacheEntry;
import io.herdguard.core.cache.StampedeProtectedCache;
import io.herdguard.core.stats.CacheStatsReporter;
import io.herdguard.core.store.LruStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the HerdGuard entry point, end to end with the default stack.
 *
 * @author Test Engineer
 */
@DisplayName("HerdGuard")
class HerdGuardTest {

    @Test
    @DisplayName("cache() should use the production defaults")
    void cacheShouldUseDefaults() {
        try (StampedeProtectedCache<String, Double> cache = HerdGuard.cache()) {
            assertThat(cache.getConfig()).isEqualTo(CacheConfig.defaults());
            assertThat(cache.name()).isEqualTo("stampede-cache");
            assertThat(cache.getStats().maxSize()).isEqualTo(1000);
        }
    }

    @Test
    @DisplayName("cache(customizer) should start from the defaults")
    void customizerShouldStartFromDefaults() {
        try (StampedeProtectedCache<String, Double> cache = HerdGuard.cache(config -> config
                .name("positions")
                .defaultTtl(Duration.ofSeconds(30)))) {
            CacheConfig config = cache.getConfig();

            assertThat(config.name()).isEqualTo("positions");
            assertThat(config.staleWhileRevalidateTtl()).isEqualTo(Duration.ofSeconds(60));
            assertThat(config.maxSize()).isEqualTo(CacheConfig.DEFAULT_MAX_SIZE);
        }
    }

    @Test
    @DisplayName("cache(config, store) should use the given store")
    void cacheShouldUseGivenStore() {
        LruStore<String, CacheEntry<Double>> store = new LruStore<>(2);

        try (StampedeProtectedCache<String, Double> cache = HerdGuard.cache(CacheConfig.defaults(), store)) {
            cache.set("AAPL", 150.0);

            assertThat(store.has("AAPL")).isTrue();
            assertThat(cache.getStats().maxSize()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("should refresh stale entries on the owned refresh pool")
    void shouldRefreshOnOwnedPool() throws InterruptedException {
        try (StampedeProtectedCache<String, Double> cache = HerdGuard.cache(config -> config
                .name("quotes")
                .defaultTtl(Duration.ofMillis(50))
                .staleWhileRevalidateTtl(Duration.ofSeconds(10))
                .jitter(1.0, 1.0))) {
            cache.set("AAPL", 150.0);
            Thread.sleep(80);

            assertThat(cache.get("AAPL", k -> 151.0)).isEqualTo(150.0);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (cache.getStats().backgroundRefreshes() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(cache.getStats().backgroundRefreshes()).isEqualTo(1);
            assertThat(cache.peekEntry("AAPL")).get()
                .extracting(CacheEntry::value)
                .isEqualTo(151.0);
        }
    }

    @Test
    @DisplayName("statsReporter() should report registered caches")
    void statsReporterShouldReportCaches() {
        try (StampedeProtectedCache<String, Double> cache = HerdGuard.cache(config -> config.name("quotes"));
             CacheStatsReporter reporter = HerdGuard.statsReporter().build()) {
            cache.get("AAPL", k -> 150.0);
            reporter.register(cache.name(), cache::getStats);

            assertThat(reporter.reportNow()).isEqualTo(1);
            assertThat(reporter.toJson(cache.name(), cache.getStats()))
                .contains("\"cache\":\"quotes\"")
                .contains("\"misses\":1");
        }
    }
}
