package fr.lapetina.genericclient.domain.retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Decides when a retry loop gives up.
 */
@FunctionalInterface
public interface StopStrategy {

    /**
     * @param attemptNumber Number of attempts made so far, starting at 1
     * @param elapsed       Time since the first attempt started
     * @return true if no further attempt should be made
     */
    boolean shouldStop(int attemptNumber, Duration elapsed);

    /**
     * Stops once the elapsed time reaches the budget.
     */
    static StopStrategy afterDelay(Duration budget) {
        Objects.requireNonNull(budget, "budget");
        return (attemptNumber, elapsed) -> elapsed.compareTo(budget) >= 0;
    }

    /**
     * Stops once the given number of attempts has been made.
     */
    static StopStrategy afterAttempt(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        return (attemptNumber, elapsed) -> attemptNumber >= maxAttempts;
    }

    static StopStrategy never() {
        return (attemptNumber, elapsed) -> false;
    }

    /**
     * Stops as soon as any of the given strategies would.
     */
    static StopStrategy any(StopStrategy... strategies) {
        List<StopStrategy> all = List.of(strategies);
        return (attemptNumber, elapsed) -> all.stream().anyMatch(s -> s.shouldStop(attemptNumber, elapsed));
    }
}
