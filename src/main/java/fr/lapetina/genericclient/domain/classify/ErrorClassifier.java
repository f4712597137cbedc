package fr.lapetina.genericclient.domain.classify;

import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.RetrySignal;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an attempt outcome is worth retrying.
 *
 * Statuses are matched against the configured status patterns, errors against
 * the configured error kinds and exception types. Classification never retries
 * by itself: a retriable outcome becomes a {@link RetrySignal} carrying what the
 * caller should get once retries run out.
 */
public final class ErrorClassifier {

    private final Set<String> retryStatusPatterns;
    private final Set<ErrorKind> retryableErrorKinds;
    private final List<Class<? extends Throwable>> retryableExceptionTypes;

    public ErrorClassifier(
            Set<String> retryStatusPatterns,
            Set<ErrorKind> retryableErrorKinds,
            List<Class<? extends Throwable>> retryableExceptionTypes
    ) {
        this.retryStatusPatterns = Set.copyOf(StatusPatterns.normalize(retryStatusPatterns));
        this.retryableErrorKinds = retryableErrorKinds.isEmpty()
                ? EnumSet.noneOf(ErrorKind.class)
                : EnumSet.copyOf(retryableErrorKinds);
        this.retryableExceptionTypes = List.copyOf(retryableExceptionTypes);
    }

    public ErrorClassifier(Set<String> retryStatusPatterns, Set<ErrorKind> retryableErrorKinds) {
        this(retryStatusPatterns, retryableErrorKinds, List.of());
    }

    public boolean isRetriable(int status) {
        return StatusPatterns.matches(retryStatusPatterns, status);
    }

    public boolean isRetriable(Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        if (retryableErrorKinds.contains(ErrorKind.of(cause))) {
            return true;
        }
        for (Class<? extends Throwable> type : retryableExceptionTypes) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Classifies a response by its status.
     *
     * @return a signal carrying the response if its status is retriable
     */
    public <T> Optional<RetrySignal<T>> classify(T response, int status) {
        return isRetriable(status) ? Optional.of(RetrySignal.ofValue(response)) : Optional.empty();
    }

    /**
     * Classifies a thrown error.
     *
     * @return a signal carrying the unwrapped error if it is retriable
     */
    public <T> Optional<RetrySignal<T>> classify(Throwable error) {
        return isRetriable(error) ? Optional.of(RetrySignal.ofError(ErrorKind.unwrap(error))) : Optional.empty();
    }

    public Set<String> getRetryStatusPatterns() {
        return retryStatusPatterns;
    }

    public Set<ErrorKind> getRetryableErrorKinds() {
        return Set.copyOf(retryableErrorKinds);
    }
}
