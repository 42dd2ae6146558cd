package io.herdguard.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JitterPolicy.
 *
 * @author Test Engineer
 */
@DisplayName("JitterPolicy")
class JitterPolicyTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T14:30:00Z");

    @Test
    @DisplayName("should map the random source onto the jitter range")
    void shouldMapRandomSourceOntoRange() {
        assertThat(new JitterPolicy(0.9, 1.1, () -> 0.0).nextFactor()).isEqualTo(0.9);
        assertThat(new JitterPolicy(0.9, 1.1, () -> 0.5).nextFactor()).isCloseTo(1.0, within(1e-9));

        JitterPolicy policy = new JitterPolicy(0.9, 1.1);
        assertThat(policy.minJitter()).isEqualTo(0.9);
        assertThat(policy.maxJitter()).isEqualTo(1.1);
    }

    @Test
    @DisplayName("should scale the entry's own TTL from its creation time")
    void shouldScaleTtlFromCreation() {
        JitterPolicy policy = new JitterPolicy(0.5, 1.5, () -> 0.0);

        Instant expiry = policy.jitteredExpiry(CREATED, Duration.ofSeconds(10));

        assertThat(expiry).isEqualTo(CREATED.plusSeconds(5));
    }

    @Test
    @DisplayName("should be deterministic when min equals max")
    void shouldBeDeterministicWithoutRange() {
        JitterPolicy policy = new JitterPolicy(1.0, 1.0);

        for (int i = 0; i < 100; i++) {
            assertThat(policy.jitteredExpiry(CREATED, Duration.ofMillis(100)))
                .isEqualTo(CREATED.plusMillis(100));
        }
    }

    @Test
    @DisplayName("should stay within bounds and vary between checks")
    void shouldStayWithinBoundsAndVary() {
        JitterPolicy policy = new JitterPolicy(0.9, 1.1);
        Duration ttl = Duration.ofSeconds(60);
        Set<Instant> seen = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            Instant expiry = policy.jitteredExpiry(CREATED, ttl);
            assertThat(expiry).isBetween(CREATED.plusMillis(53_999), CREATED.plusMillis(66_001));
            seen.add(expiry);
        }

        assertThat(seen).hasSizeGreaterThan(1);
    }

    @Test
    @DisplayName("should use the entry's TTL rather than a cache-wide TTL")
    void shouldUseEntryTtl() {
        JitterPolicy policy = new JitterPolicy(1.0, 1.0);
        CacheEntry<String> entry = new CacheEntry<>("v", CREATED, Duration.ofMillis(250));

        assertThat(policy.jitteredExpiry(entry)).isEqualTo(CREATED.plusMillis(250));
    }

    @Test
    @DisplayName("should reject invalid ranges")
    void shouldRejectInvalidRanges() {
        assertThatThrownBy(() -> new JitterPolicy(0.0, 1.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JitterPolicy(1.2, 1.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JitterPolicy(Double.NaN, 1.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JitterPolicy(0.9, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should handle TTLs beyond the nanosecond range")
    void shouldHandleHugeTtls() {
        JitterPolicy policy = new JitterPolicy(1.0, 1.0);
        Duration threeCenturies = Duration.ofDays(365L * 300);

        assertThat(policy.jitteredExpiry(CREATED, threeCenturies)).isEqualTo(CREATED.plus(threeCenturies));
        assertThat(policy.jitteredExpiry(CREATED, Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Instant.MAX);
    }

    @Test
    @DisplayName("should clamp deadlines past the end of time")
    void shouldClampDeadlines() {
        assertThat(JitterPolicy.plusSaturated(Instant.MAX.minusSeconds(10), Duration.ofSeconds(20)))
            .isEqualTo(Instant.MAX);
        assertThat(JitterPolicy.plusSaturated(CREATED, Duration.ofSeconds(20)))
            .isEqualTo(CREATED.plusSeconds(20));
    }
}
