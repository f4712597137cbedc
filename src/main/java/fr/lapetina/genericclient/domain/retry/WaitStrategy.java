package fr.lapetina.genericclient.domain.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes the delay between two attempts.
 *
 * Implementations must be thread-safe as one policy is shared by every
 * request of a client.
 */
@FunctionalInterface
public interface WaitStrategy {

    /**
     * Returns the delay to apply after the given attempt failed.
     *
     * @param attemptNumber Number of the attempt that just failed, starting at 1
     * @return Delay before the next attempt, never negative
     */
    Duration delay(int attemptNumber);

    /**
     * Same delay after every attempt.
     */
    static WaitStrategy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        return attemptNumber -> delay;
    }

    /**
     * {@code multiplier * 2^(n-1)}, clamped to {@code [min, max]}.
     */
    static WaitStrategy exponential(Duration multiplier, Duration min, Duration max) {
        Objects.requireNonNull(multiplier, "multiplier");
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        return attemptNumber -> clamp(exponentialMillis(multiplier, attemptNumber), min, max);
    }

    /**
     * Exponential with a one second multiplier and no upper bound worth mentioning.
     */
    static WaitStrategy exponential() {
        return exponential(Duration.ofSeconds(1), Duration.ZERO, Duration.ofDays(1));
    }

    /**
     * Uniformly random delay between zero and the exponential delay (full jitter).
     */
    static WaitStrategy randomExponential(Duration multiplier, Duration max) {
        Objects.requireNonNull(multiplier, "multiplier");
        Objects.requireNonNull(max, "max");
        return attemptNumber -> {
            long upper = Math.min(exponentialMillis(multiplier, attemptNumber), max.toMillis());
            return Duration.ofMillis(upper <= 0 ? 0 : ThreadLocalRandom.current().nextLong(upper + 1));
        };
    }

    /**
     * Exponential delay plus a uniformly random extra of at most {@code jitter}.
     */
    static WaitStrategy exponentialJitter(Duration multiplier, Duration max, Duration jitter) {
        Objects.requireNonNull(jitter, "jitter");
        WaitStrategy base = exponential(multiplier, Duration.ZERO, max);
        return attemptNumber -> {
            long extra = jitter.toMillis() <= 0 ? 0 : ThreadLocalRandom.current().nextLong(jitter.toMillis() + 1);
            return clamp(base.delay(attemptNumber).toMillis() + extra, Duration.ZERO, max);
        };
    }

    private static long exponentialMillis(Duration multiplier, int attemptNumber) {
        int exponent = Math.max(0, Math.min(attemptNumber - 1, 62));
        double millis = multiplier.toMillis() * Math.pow(2, exponent);
        return millis >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) millis;
    }

    private static Duration clamp(long millis, Duration min, Duration max) {
        long bounded = Math.max(min.toMillis(), Math.min(millis, max.toMillis()));
        return Duration.ofMillis(Math.max(0, bounded));
    }
}
