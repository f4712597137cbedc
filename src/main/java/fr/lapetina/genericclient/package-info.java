/**
 * Generic service client - retries, host discovery and domain error mapping on top of HTTP.
 *
 * <p>A {@link fr.lapetina.genericclient.ServiceClient} targets one backend service, either at an
 * explicit host or at a host looked up by service name and environment through a
 * {@link fr.lapetina.genericclient.infrastructure.resolver.ResolverService}.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ServiceClient client = ServiceClient.builder()
 *         .host("http://localhost:8080")
 *         .prefix("/api/v1")
 *         .config(Map.of("retryOnConnectionError", true))
 *         .build()
 *         .start()) {
 *
 *     client.registerError("not_found", NotFoundException::new);
 *
 *     JsonNode user = client.get("/users/1", RequestOptions.none(), ClientResponse::json).join();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Retries by status pattern ({@code 503}, {@code 50x}, {@code 5xx}) and by error kind</li>
 *   <li>Pluggable backoff (fixed, exponential, jittered) and stop strategies</li>
 *   <li>Single-flight host resolution cached for 60 minutes</li>
 *   <li>Mapping of {@code {"status":"error","cls":tag}} payloads to registered exceptions</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.genericclient.ServiceClient
 * @see fr.lapetina.genericclient.infrastructure.http.RequestDispatcher
 */
package fr.lapetina.genericclient;
