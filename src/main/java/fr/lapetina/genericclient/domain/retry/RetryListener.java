package fr.lapetina.genericclient.domain.retry;

import java.time.Duration;

/**
 * Callback for retry loop events, used for metrics.
 */
public interface RetryListener {

    RetryListener NO_OP = new RetryListener() {
    };

    default void onRetry(String operation, int attemptNumber, Duration delay, RetrySignal<?> signal) {
        // Default no-op
    }

    default void onExhausted(String operation, int attempts, RetrySignal<?> signal) {
        // Default no-op
    }
}
