package fr.lapetina.genericclient.domain.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Wait and stop timing for a retry loop. Immutable and thread-safe.
 */
public record BackoffPolicy(WaitStrategy waitStrategy, StopStrategy stopStrategy) {

    public static final Duration DEFAULT_STOP_DELAY = Duration.ofSeconds(30);

    public BackoffPolicy {
        Objects.requireNonNull(waitStrategy, "Wait strategy is required");
        Objects.requireNonNull(stopStrategy, "Stop strategy is required");
    }

    /**
     * Exponential wait from one second, giving up after thirty seconds.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(WaitStrategy.exponential(), StopStrategy.afterDelay(DEFAULT_STOP_DELAY));
    }

    /**
     * Single attempt, never retried.
     */
    public static BackoffPolicy noRetry() {
        return new BackoffPolicy(WaitStrategy.fixed(Duration.ZERO), StopStrategy.afterAttempt(1));
    }

    public BackoffPolicy withWait(WaitStrategy newWait) {
        return new BackoffPolicy(newWait, stopStrategy);
    }

    public BackoffPolicy withStop(StopStrategy newStop) {
        return new BackoffPolicy(waitStrategy, newStop);
    }
}
