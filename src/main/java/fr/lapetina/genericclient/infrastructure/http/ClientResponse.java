package fr.lapetina.genericclient.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Response of one request attempt.
 *
 * The body is streamed from the connection and buffered on first read, so it can
 * be read any number of times afterwards. The response holds a pooled connection
 * until {@link #close()} is called; close it on every path, read or not.
 */
public final class ClientResponse implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientResponse.class);

    private final String method;
    private final URI uri;
    private final int status;
    private final Map<String, List<String>> headers;
    private final InputStream bodyStream;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private byte[] buffered;

    public ClientResponse(
            String method,
            URI uri,
            int status,
            Map<String, List<String>> headers,
            InputStream bodyStream,
            ObjectMapper objectMapper
    ) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.status = status;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.bodyStream = bodyStream != null ? bodyStream : InputStream.nullInputStream();
        this.objectMapper = objectMapper != null ? objectMapper : JsonSupport.defaultMapper();
    }

    /**
     * In-memory response, mostly for transports that buffer and for tests.
     */
    public static ClientResponse of(String method, URI uri, int status, String body) {
        byte[] bytes = body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
        return new ClientResponse(method, uri, status, Map.of(), new ByteArrayInputStream(bytes), null);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public int status() {
        return status;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    /**
     * Raw body stream. Reading it directly bypasses buffering.
     */
    public InputStream bodyStream() {
        return bodyStream;
    }

    /**
     * Reads and buffers the whole body. Blocks until the body is received.
     *
     * @throws UncheckedIOException if reading fails
     * @throws IllegalStateException if the response was released unread
     */
    public synchronized byte[] bytes() {
        if (buffered == null) {
            if (closed.get()) {
                throw new IllegalStateException("Response body was released before being read: " + method + " " + uri);
            }
            try {
                buffered = bodyStream.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read response body: " + method + " " + uri, e);
            }
        }
        return buffered;
    }

    public String text() {
        return new String(bytes(), StandardCharsets.UTF_8);
    }

    /**
     * Decodes the body as a JSON tree.
     *
     * @throws UncheckedIOException if the body is not valid JSON
     */
    public JsonNode json() {
        try {
            return objectMapper.readTree(bytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Response body is not valid JSON: " + method + " " + uri, e);
        }
    }

    public <T> T json(Class<T> type) {
        try {
            return objectMapper.readValue(bytes(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode response body as " + type.getSimpleName(), e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the underlying connection. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                bodyStream.close();
            } catch (IOException e) {
                log.debug("Error releasing response: method={}, uri={}, error={}", method, uri, e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "ClientResponse{" + method + " " + uri + " -> " + status + '}';
    }
}
