package io.chatsync.client;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay with an upper bound and optional jitter.
 *
 * <p>The delay before attempt {@code n} (1-based) is {@code initial * multiplier^(n-1)}, capped at
 * {@code max}. With jitter {@code j} the result is spread uniformly over {@code [d*(1-j), d*(1+j)]}
 * and capped again.
 */
public final class ReconnectBackoff {

    private final long initialMillis;
    private final double multiplier;
    private final long maxMillis;
    private final double jitter;
    private final DoubleSupplier random;

    public ReconnectBackoff(Duration initial, double multiplier, Duration max, double jitter) {
        this(initial, multiplier, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ReconnectBackoff(Duration initial, double multiplier, Duration max, double jitter, DoubleSupplier random) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(max, "max");
        if (initial.isNegative() || initial.isZero()) throw new IllegalArgumentException("initial delay must be positive");
        if (max.compareTo(initial) < 0) throw new IllegalArgumentException("max delay must not be below the initial delay");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be within [0, 1]");
        this.initialMillis = initial.toMillis();
        this.multiplier = multiplier;
        this.maxMillis = max.toMillis();
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static ReconnectBackoff fixed(Duration delay) {
        return new ReconnectBackoff(delay, 1.0, delay, 0.0);
    }

    /**
     * @param attempt 1-based attempt number
     * @return delay in milliseconds, never above the configured maximum
     */
    public long delayMillis(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be positive");
        double base = Math.min(maxMillis, initialMillis * Math.pow(multiplier, attempt - 1));
        if (jitter > 0.0) {
            base = base * (1.0 - jitter + 2.0 * jitter * random.getAsDouble());
        }
        return Math.max(0L, Math.min(maxMillis, Math.round(base)));
    }

    public Duration delay(int attempt) {
        return Duration.ofMillis(delayMillis(attempt));
    }
}
