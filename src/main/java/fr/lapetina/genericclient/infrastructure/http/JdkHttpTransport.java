package fr.lapetina.genericclient.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genericclient.domain.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Transport} backed by {@code java.net.http.HttpClient}.
 *
 * Uses java.net.http for non-blocking I/O and its connection pool. The client
 * runs on a private executor, which is what {@link #close()} releases.
 */
public class JdkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JdkHttpTransport(Duration connectTimeout, Duration requestTimeout, ObjectMapper objectMapper) {
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper != null ? objectMapper : JsonSupport.defaultMapper();

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "generic-client-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .executor(executor)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public JdkHttpTransport(Duration requestTimeout) {
        this(requestTimeout, requestTimeout, null);
    }

    @Override
    public CompletableFuture<ClientResponse> request(String method, URI uri, RequestOptions options) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport is closed"));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(method, uri, options);
        } catch (IllegalArgumentException e) {
            log.error("Failed to build request: method={}, uri={}", method, uri, e);
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream())
                .handle((response, error) -> {
                    if (error != null) {
                        throw TransportException.wrap(method, uri.toString(), error);
                    }
                    return toClientResponse(method, uri, response);
                });
    }

    private HttpRequest buildHttpRequest(String method, URI uri, RequestOptions options) {
        HttpRequest.BodyPublisher publisher = options.body() != null
                ? HttpRequest.BodyPublishers.ofByteArray(options.body())
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .method(method, publisher)
                .timeout(options.timeout() != null ? options.timeout() : requestTimeout);

        options.headers().forEach(builder::header);
        return builder.build();
    }

    private ClientResponse toClientResponse(String method, URI uri, HttpResponse<InputStream> response) {
        return new ClientResponse(
                method,
                uri,
                response.statusCode(),
                response.headers().map(),
                response.body(),
                objectMapper
        );
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        // HttpClient has no close() before Java 21; stopping its executor releases its threads
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("HTTP transport closed");
    }
}
