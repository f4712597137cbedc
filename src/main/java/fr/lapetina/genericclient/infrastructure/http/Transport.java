package fr.lapetina.genericclient.infrastructure.http;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP transport shared by every request of a client.
 *
 * Implementations must be safe for concurrent use. Connection-level failures
 * complete the future exceptionally, preferably with a
 * {@link fr.lapetina.genericclient.domain.exception.TransportException}.
 */
public interface Transport extends AutoCloseable {

    /**
     * Sends one request.
     *
     * @param method  HTTP method, upper case
     * @param uri     Absolute request URI
     * @param options Headers, body and timeout
     * @return The response; the caller must close it
     */
    CompletableFuture<ClientResponse> request(String method, URI uri, RequestOptions options);

    /**
     * Releases pooled connections and threads.
     */
    @Override
    void close();
}
