/**
 * Client configuration.
 *
 * <p>Options come from two levels: a {@link fr.lapetina.genericclient.infrastructure.config.ClientTemplate}
 * declared by a client type and the arguments of one instance.
 * {@link fr.lapetina.genericclient.infrastructure.config.ConfigMerger} combines them into
 * {@link fr.lapetina.genericclient.infrastructure.config.ClientSettings}, rejecting ambiguous
 * combinations with a {@link fr.lapetina.genericclient.domain.exception.ConfigurationException}.
 *
 * <h2>Configuration Keys</h2>
 * <ul>
 *   <li>{@code retryStatusPatterns} - Status patterns that trigger a retry (default {@code 5xx})</li>
 *   <li>{@code retryableErrorKinds} - Error kinds that trigger a retry</li>
 *   <li>{@code retryOnConnectionError} - Adds connection errors and timeouts to the retriable kinds</li>
 *   <li>{@code timeout} - Per-attempt timeout, seconds or ISO-8601 (default 30s)</li>
 *   <li>{@code backoff} - Wait and stop strategies</li>
 * </ul>
 *
 * @see fr.lapetina.genericclient.infrastructure.config.ConfigLoader
 */
package fr.lapetina.genericclient.infrastructure.config;
