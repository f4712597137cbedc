package fr.lapetina.genericclient.domain.retry;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of an attempt that failed in a retriable way.
 *
 * Carries what the caller gets if retries run out: either the offending value
 * (typically a response with a retriable status) or the offending error.
 * Exactly one of the two is set.
 *
 * @param <T> Result type of the retried operation
 */
public final class RetrySignal<T> {

    private final T value;
    private final Throwable error;

    private RetrySignal(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> RetrySignal<T> ofValue(T value) {
        return new RetrySignal<>(value, null);
    }

    public static <T> RetrySignal<T> ofError(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new RetrySignal<>(null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Turns the signal into the caller-visible outcome: the carried value,
     * or the carried error raised as is.
     */
    public CompletableFuture<T> surface() {
        return error != null ? CompletableFuture.failedFuture(error) : CompletableFuture.completedFuture(value);
    }

    @Override
    public String toString() {
        return error != null
                ? "RetrySignal{error=" + error.getClass().getSimpleName() + ": " + error.getMessage() + "}"
                : "RetrySignal{value=" + value + "}";
    }
}
