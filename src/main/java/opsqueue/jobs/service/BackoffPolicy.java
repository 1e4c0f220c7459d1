package opsqueue.jobs.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential retry delay with upward jitter.
 *
 * <p>
 * {@code delay(n) = min(max, base * 2^(n-1) * (1 + 0.25 * r))} with
 * {@code r} uniform in [0, 1). The jitter only stretches a delay, and a
 * stretched delay never reaches the next step's unstretched one, so delays
 * are non-decreasing in the attempt number.
 */
public final class BackoffPolicy {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MAX = Duration.ofHours(1);

    private static final double JITTER_SPREAD = 0.25;

    private final long baseMillis;
    private final long maxMillis;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, DoubleSupplier random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base delay must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max delay must not be below base delay");
        }
        this.baseMillis = base.toMillis();
        this.maxMillis = max.toMillis();
        this.random = random;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_MAX, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay before the next attempt after {@code attempts} failed attempts.
     *
     * @param attempts attempts made so far, at least 1
     */
    public Duration delay(int attempts) {
        int n = Math.max(1, attempts);
        double r = Math.min(Math.max(random.getAsDouble(), 0.0), Math.nextDown(1.0));
        double raw = baseMillis * Math.pow(2, n - 1) * (1.0 + JITTER_SPREAD * r);
        long millis = (long) Math.min(maxMillis, Math.max(baseMillis, raw));
        return Duration.ofMillis(millis);
    }

    public Duration base() {
        return Duration.ofMillis(baseMillis);
    }

    public Duration max() {
        return Duration.ofMillis(maxMillis);
    }
}
