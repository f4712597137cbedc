/**
 * Backoff policies and the asynchronous retry driver.
 *
 * <p>An attempt reports either {@link fr.lapetina.genericclient.domain.retry.AttemptResult.Done}
 * or {@link fr.lapetina.genericclient.domain.retry.AttemptResult.Retry}. When the
 * {@link fr.lapetina.genericclient.domain.retry.StopStrategy} ends the loop, the last
 * {@link fr.lapetina.genericclient.domain.retry.RetrySignal} is surfaced as it is: a retriable
 * response is returned, a retriable error is raised.
 *
 * <h2>Wait Strategies</h2>
 * <ul>
 *   <li>{@code fixed} - Same delay before every retry</li>
 *   <li>{@code exponential} - {@code multiplier * 2^n}, bounded by min and max</li>
 *   <li>{@code random-exponential} - Uniform in {@code [0, exponential]}</li>
 *   <li>{@code exponential-jitter} - Exponential plus a random jitter</li>
 * </ul>
 */
package fr.lapetina.genericclient.domain.retry;
