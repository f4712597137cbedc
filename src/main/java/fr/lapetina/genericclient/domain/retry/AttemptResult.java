package fr.lapetina.genericclient.domain.retry;

import java.util.Objects;

/**
 * Result of a single attempt: finished, or failed in a way worth retrying.
 *
 * Attempts that fail in a non-retriable way complete their future exceptionally
 * instead of producing a result.
 *
 * @param <T> Result type of the retried operation
 */
public sealed interface AttemptResult<T> permits AttemptResult.Done, AttemptResult.Retry {

    static <T> AttemptResult<T> done(T value) {
        return new Done<>(value);
    }

    static <T> AttemptResult<T> retry(RetrySignal<T> signal) {
        return new Retry<>(signal);
    }

    record Done<T>(T value) implements AttemptResult<T> {
    }

    record Retry<T>(RetrySignal<T> signal) implements AttemptResult<T> {
        public Retry {
            Objects.requireNonNull(signal, "signal");
        }
    }
}
