package io.herdguard.core.stats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CacheStatsReporter.
 *
 * @author Test Engineer
 */
@DisplayName("CacheStatsReporter")
@ExtendWith(MockitoExtension.class)
class CacheStatsReporterTest {

    private static final CacheStats SAMPLE = new CacheStats(10, 8, 1, 1, 3, 1, 0, 4, 100, 0);

    @Mock
    private Logger mockLogger;

    private CacheStatsReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = CacheStatsReporter.builder()
            .logger(mockLogger)
            .build();
    }

    @AfterEach
    void tearDown() {
        reporter.close();
    }

    // ========================================================================
    // JSON TESTS
    // ========================================================================

    @Nested
    @DisplayName("JSON Rendering")
    class JsonRendering {

        @Test
        @DisplayName("should render the cache name first followed by the counters")
        void shouldRenderNameFirst() throws Exception {
            String json = reporter.toJson("quotes", SAMPLE);

            JsonNode node = new ObjectMapper().readTree(json);
            Iterator<String> fields = node.fieldNames();
            assertThat(fields.next()).isEqualTo("cache");
            assertThat(node.get("cache").asText()).isEqualTo("quotes");
            assertThat(node.get("totalGets").asLong()).isEqualTo(10);
            assertThat(node.get("hitRatio").asDouble()).isEqualTo(0.8);
            assertThat(node.get("coalescedRequests").asLong()).isEqualTo(3);
            assertThat(node.get("maxSize").asLong()).isEqualTo(100);
        }

        @Test
        @DisplayName("should render a single line")
        void shouldRenderSingleLine() {
            assertThat(reporter.toJson("quotes", SAMPLE)).doesNotContain("\n");
        }
    }

    // ========================================================================
    // REPORTING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Reporting")
    class Reporting {

        @Test
        @DisplayName("should log one line per registered cache")
        void shouldLogOneLinePerCache() {
            reporter.register("quotes", () -> SAMPLE);
            reporter.register("positions", () -> SAMPLE);

            assertThat(reporter.reportNow()).isEqualTo(2);

            ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
            verify(mockLogger, times(2)).info(eq("[HERDGUARD] Cache stats {}"), json.capture());
            assertThat(json.getAllValues())
                .anySatisfy(line -> assertThat(line.toString()).contains("\"cache\":\"quotes\""))
                .anySatisfy(line -> assertThat(line.toString()).contains("\"cache\":\"positions\""));
        }

        @Test
        @DisplayName("should skip a failing source and report the rest")
        void shouldSkipFailingSource() {
            reporter.register("quotes", () -> SAMPLE);
            reporter.register("broken", () -> {
                throw new IllegalStateException("closed");
            });

            assertThat(reporter.reportNow()).isEqualTo(1);

            verify(mockLogger).warn(contains("Error reporting stats"), eq("broken"), eq("closed"));
        }

        @Test
        @DisplayName("should replace and deregister sources by name")
        void shouldReplaceAndDeregister() {
            reporter.register("quotes", () -> SAMPLE);
            reporter.register("quotes", () -> SAMPLE);

            assertThat(reporter.sourceCount()).isEqualTo(1);
            assertThat(reporter.deregister("quotes")).isTrue();
            assertThat(reporter.deregister("quotes")).isFalse();
            assertThat(reporter.reportNow()).isZero();
        }

        @Test
        @DisplayName("should report periodically")
        void shouldReportPeriodically() {
            try (CacheStatsReporter periodic = CacheStatsReporter.builder()
                    .logger(mockLogger)
                    .interval(Duration.ofMillis(20))
                    .build()) {
                periodic.register("quotes", () -> SAMPLE);

                verify(mockLogger, timeout(TimeUnit.SECONDS.toMillis(5)).atLeast(2))
                    .info(eq("[HERDGUARD] Cache stats {}"), any(Object.class));
            }
        }
    }

    // ========================================================================
    // LIFECYCLE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("close should stop reporting and drop sources")
        void closeShouldStop() {
            reporter.register("quotes", () -> SAMPLE);

            reporter.close();
            reporter.close();

            assertThat(reporter.isRunning()).isFalse();
            assertThat(reporter.sourceCount()).isZero();
            verify(mockLogger, times(1)).info("[HERDGUARD] Stats reporter stopped");
        }

        @Test
        @DisplayName("should reject intervals below one millisecond")
        void shouldRejectInvalidInterval() {
            assertThatThrownBy(() -> CacheStatsReporter.builder().interval(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CacheStatsReporter.builder().interval(Duration.ofNanos(500_000)))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CacheStatsReporter.builder().logger(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
