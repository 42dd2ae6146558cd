package io.herdguard.core.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Periodically logs the statistics of registered caches as JSON.
 *
 * <p>Each report pass writes one {@code info} line per cache, e.g.</p>
 * <pre>
 * [HERDGUARD] Cache stats {"cache":"quotes","totalGets":1200,"hits":1130,...}
 * </pre>
 *
 * <p>Reporting runs on a single daemon thread. A failing stats source is logged
 * and skipped; it never stops the schedule.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CacheStatsReporter reporter = CacheStatsReporter.builder()
 *     .interval(Duration.ofMinutes(1))
 *     .build();
 *
 * reporter.register(quotes.name(), quotes::getStats);
 * reporter.register(positions.name(), positions::getStats);
 *
 * // On shutdown
 * reporter.close();
 * }</pre>
 *
 * @since 1.0.0
 */
public class CacheStatsReporter implements AutoCloseable {

    private final Map<String, Supplier<CacheStats>> sources = new ConcurrentHashMap<>();
    private final Logger log;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> reportTask;

    private CacheStatsReporter(Builder builder) {
        this.log = builder.logger;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : createDefaultObjectMapper();

        if (builder.interval == null) {
            this.scheduler = null;
            this.reportTask = null;
            log.info("[HERDGUARD] Stats reporter started - manual reporting only");
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "herdguard-stats-reporter");
                t.setDaemon(true);
                return t;
            });
            long intervalMillis = builder.interval.toMillis();
            this.reportTask = scheduler.scheduleAtFixedRate(
                    this::periodicReport,
                    intervalMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            log.info("[HERDGUARD] Stats reporter started - interval={}s", builder.interval.toSeconds());
        }
    }

    /**
     * Creates a new builder.
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    private static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Registers a stats source under a cache name, replacing any previous source
     * with the same name.
     *
     * @param cacheName the cache name
     * @param source supplies the current snapshot
     */
    public void register(String cacheName, Supplier<CacheStats> source) {
        Objects.requireNonNull(cacheName, "cacheName must not be null");
        Objects.requireNonNull(source, "source must not be null");
        sources.put(cacheName, source);
        log.debug("[HERDGUARD] Stats source registered: {}", cacheName);
    }

    /**
     * Deregisters a stats source.
     *
     * @param cacheName the cache name
     * @return true if a source was removed
     */
    public boolean deregister(String cacheName) {
        boolean removed = sources.remove(cacheName) != null;
        if (removed) {
            log.debug("[HERDGUARD] Stats source deregistered: {}", cacheName);
        }
        return removed;
    }

    /**
     * Returns the number of registered sources.
     * @return source count
     */
    public int sourceCount() {
        return sources.size();
    }

    /**
     * Logs one report line per registered cache.
     *
     * @return number of caches reported
     */
    public int reportNow() {
        int reported = 0;
        for (Map.Entry<String, Supplier<CacheStats>> source : sources.entrySet()) {
            try {
                log.info("[HERDGUARD] Cache stats {}", toJson(source.getKey(), source.getValue().get()));
                reported++;
            } catch (Exception e) {
                log.warn("[HERDGUARD] Error reporting stats for {}: {}", source.getKey(), e.getMessage());
            }
        }
        return reported;
    }

    /**
     * Renders a snapshot as a single-line JSON object, with the cache name first.
     *
     * @param cacheName the cache name
     * @param stats the snapshot
     * @return JSON text
     */
    public String toJson(String cacheName, CacheStats stats) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("cache", cacheName);
        document.putAll(stats.asMap());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stats of cache " + cacheName, e);
        }
    }

    private void periodicReport() {
        if (!running.get()) return;
        try {
            reportNow();
        } catch (Exception e) {
            log.error("[HERDGUARD] Error in periodic stats report", e);
        }
    }

    /**
     * Returns true until {@link #close()} is called.
     * @return true if running
     */
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            if (reportTask != null) {
                reportTask.cancel(false);
            }
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            sources.clear();
            log.info("[HERDGUARD] Stats reporter stopped");
        }
    }

    /**
     * Builder for CacheStatsReporter.
     */
    public static class Builder {
        private Duration interval;
        private Logger logger = LoggerFactory.getLogger(CacheStatsReporter.class);
        private ObjectMapper objectMapper;

        /**
         * Sets the report interval, at millisecond resolution. Without an interval
         * only {@link #reportNow()} reports.
         */
        public Builder interval(Duration interval) {
            if (interval == null || interval.compareTo(Duration.ofMillis(1)) < 0) {
                throw new IllegalArgumentException("Report interval must be at least 1ms");
            }
            this.interval = interval;
            return this;
        }

        public Builder logger(Logger logger) {
            if (logger == null) {
                throw new IllegalArgumentException("Logger must not be null");
            }
            this.logger = logger;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public CacheStatsReporter build() {
            return new CacheStatsReporter(this);
        }
    }
}
