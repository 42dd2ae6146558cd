package io.herdguard.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Probabilistic early expiration.
 *
 * <p>Scales an entry's nominal TTL by a factor drawn uniformly from
 * {@code [minJitter, maxJitter]}. A new factor is drawn on every freshness check,
 * so concurrent readers of the same entry see slightly different deadlines and
 * entries written at the same moment do not all expire at the same moment.</p>
 *
 * <pre>
 * jitteredExpiresAt = createdAt + ttl * uniform(minJitter, maxJitter)
 * </pre>
 *
 * @since 1.0.0
 */
public final class JitterPolicy {

    /** Largest whole-second TTL whose nanosecond count fits in a long. */
    private static final long NANO_SAFE_SECONDS = Long.MAX_VALUE / 1_000_000_000L;

    private final double minJitter;
    private final double maxJitter;
    private final DoubleSupplier uniform;

    /**
     * Creates a policy backed by {@link ThreadLocalRandom}.
     *
     * @param minJitter lower bound of the TTL multiplier
     * @param maxJitter upper bound of the TTL multiplier
     */
    public JitterPolicy(double minJitter, double maxJitter) {
        this(minJitter, maxJitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param uniform source of values in {@code [0, 1)}
     */
    JitterPolicy(double minJitter, double maxJitter, DoubleSupplier uniform) {
        if (!(minJitter > 0)) {
            throw new IllegalArgumentException("minJitter must be positive");
        }
        if (!Double.isFinite(maxJitter)) {
            throw new IllegalArgumentException("maxJitter must be finite");
        }
        if (minJitter > maxJitter) {
            throw new IllegalArgumentException("minJitter must not exceed maxJitter");
        }
        this.minJitter = minJitter;
        this.maxJitter = maxJitter;
        this.uniform = uniform;
    }

    /**
     * Draws a TTL multiplier in {@code [minJitter, maxJitter]}.
     * @return the multiplier
     */
    public double nextFactor() {
        return minJitter + uniform.getAsDouble() * (maxJitter - minJitter);
    }

    /**
     * Computes a jittered deadline for an entry created at {@code createdAt}.
     *
     * @param createdAt entry creation time
     * @param ttl nominal lifetime
     * @return the randomized expiration instant
     */
    public Instant jitteredExpiry(Instant createdAt, Duration ttl) {
        double factor = nextFactor();
        if (ttl.getSeconds() < NANO_SAFE_SECONDS) {
            // (long) saturates at Long.MAX_VALUE for factors above 1
            return plusSaturated(createdAt, Duration.ofNanos((long) (ttl.toNanos() * factor)));
        }
        return plusSaturated(createdAt, Duration.ofSeconds((long) (ttl.getSeconds() * factor)));
    }

    /**
     * Adds a non-negative amount, clamping to {@link Instant#MAX} instead of overflowing.
     *
     * @param base the start instant
     * @param amount the non-negative amount to add
     * @return {@code base + amount}, or {@link Instant#MAX} within a second of the representable limit
     */
    static Instant plusSaturated(Instant base, Duration amount) {
        // one second of headroom absorbs a nanosecond carry
        if (amount.getSeconds() >= Instant.MAX.getEpochSecond() - base.getEpochSecond() - 1) {
            return Instant.MAX;
        }
        return base.plus(amount);
    }

    /**
     * Computes a jittered deadline for the entry, using its own TTL.
     *
     * @param entry the cached entry
     * @return the randomized expiration instant
     */
    public Instant jitteredExpiry(CacheEntry<?> entry) {
        return jitteredExpiry(entry.createdAt(), entry.ttl());
    }

    public double minJitter() {
        return minJitter;
    }

    public double maxJitter() {
        return maxJitter;
    }
}
