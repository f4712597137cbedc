package fr.lapetina.genericclient.domain.retry;

import fr.lapetina.genericclient.domain.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Drives an asynchronous attempt function under a {@link BackoffPolicy}.
 *
 * <ul>
 *   <li>{@link AttemptResult.Done} completes the loop with its value.</li>
 *   <li>{@link AttemptResult.Retry} waits, then runs the next attempt, unless the
 *       stop strategy says otherwise; the signal is then surfaced unchanged, so
 *       callers see the last attempt's verdict and never a synthetic timeout.</li>
 *   <li>An attempt future completing exceptionally ends the loop at once.</li>
 * </ul>
 *
 * Waits are scheduled on the given scheduler; no thread is blocked while waiting.
 * {@link #shutdown()} fails every execution still running or waiting, since
 * shutting the scheduler down drops the waits it holds.
 */
public final class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final BackoffPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final RetryListener listener;
    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public Retrier(BackoffPolicy policy, ScheduledExecutorService scheduler, RetryListener listener) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.listener = listener != null ? listener : RetryListener.NO_OP;
    }

    public Retrier(BackoffPolicy policy, ScheduledExecutorService scheduler) {
        this(policy, scheduler, RetryListener.NO_OP);
    }

    /**
     * Runs attempts until one is done, one fails outright, or the policy stops.
     *
     * @param operation Name used in log records
     * @param attempt   Produces the attempt for a given attempt number (1-based)
     * @param discarder Releases values carried by signals that get retried
     * @return The final value, or the final error
     */
    public <T> CompletableFuture<T> execute(
            String operation,
            IntFunction<CompletableFuture<AttemptResult<T>>> attempt,
            Consumer<? super T> discarder
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        CompletableFuture<T> result = new CompletableFuture<>();
        if (shutdown.get()) {
            result.completeExceptionally(closed(null));
            return result;
        }
        pending.add(result);
        result.whenComplete((value, error) -> pending.remove(result));
        // shutdown() may have drained the set before this execution was added
        if (shutdown.get()) {
            result.completeExceptionally(closed(null));
            return result;
        }
        runAttempt(operation, attempt, discarder, 1, System.nanoTime(), result);
        return result;
    }

    public <T> CompletableFuture<T> execute(String operation, IntFunction<CompletableFuture<AttemptResult<T>>> attempt) {
        return execute(operation, attempt, value -> { });
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    /**
     * Fails every execution that has not completed yet and refuses new ones.
     * Values produced later by in-flight attempts are released through their
     * discarder.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        int failed = 0;
        for (CompletableFuture<?> result : pending) {
            if (result.completeExceptionally(closed(null))) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Retrier shut down with pending executions: failed={}", failed);
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private <T> void runAttempt(
            String operation,
            IntFunction<CompletableFuture<AttemptResult<T>>> attempt,
            Consumer<? super T> discarder,
            int attemptNumber,
            long startNanos,
            CompletableFuture<T> result
    ) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<AttemptResult<T>> future;
        try {
            future = attempt.apply(attemptNumber);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        future.whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(ErrorKind.unwrap(error));
                return;
            }
            if (outcome == null) {
                result.completeExceptionally(new IllegalStateException("Attempt produced no result: " + operation));
                return;
            }
            if (outcome instanceof AttemptResult.Done<T> done) {
                complete(result, done.value(), discarder);
                return;
            }
            RetrySignal<T> signal = ((AttemptResult.Retry<T>) outcome).signal();
            if (result.isDone()) {
                signal.getValue().ifPresent(discarder);
                return;
            }
            onRetriable(operation, attempt, discarder, attemptNumber, startNanos, signal, result);
        });
    }

    private <T> void onRetriable(
            String operation,
            IntFunction<CompletableFuture<AttemptResult<T>>> attempt,
            Consumer<? super T> discarder,
            int attemptNumber,
            long startNanos,
            RetrySignal<T> signal,
            CompletableFuture<T> result
    ) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        if (policy.stopStrategy().shouldStop(attemptNumber, elapsed)) {
            log.warn("Retries exhausted: operation={}, attempts={}, elapsedMs={}, lastFailure={}",
                    operation, attemptNumber, elapsed.toMillis(), signal);
            listener.onExhausted(operation, attemptNumber, signal);
            signal.surface().whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    complete(result, value, discarder);
                }
            });
            return;
        }

        Duration delay = policy.waitStrategy().delay(attemptNumber);
        log.warn("Retrying: operation={}, attempt={}, delayMs={}, failure={}",
                operation, attemptNumber, delay.toMillis(), signal);
        listener.onRetry(operation, attemptNumber, delay, signal);
        signal.getValue().ifPresent(discarder);

        try {
            scheduler.schedule(
                    () -> runAttempt(operation, attempt, discarder, attemptNumber + 1, startNanos, result),
                    delay.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        } catch (RejectedExecutionException e) {
            log.warn("Retry scheduler unavailable, giving up: operation={}", operation);
            result.completeExceptionally(closed(e));
        }
    }

    private static <T> void complete(CompletableFuture<T> result, T value, Consumer<? super T> discarder) {
        if (!result.complete(value) && value != null) {
            discarder.accept(value);
        }
    }

    private static IllegalStateException closed(Throwable cause) {
        return new IllegalStateException("Client is closed", cause);
    }
}
