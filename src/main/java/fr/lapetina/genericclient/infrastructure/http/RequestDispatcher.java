package fr.lapetina.genericclient.infrastructure.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genericclient.domain.classify.ErrorClassifier;
import fr.lapetina.genericclient.domain.exception.DomainException;
import fr.lapetina.genericclient.domain.exception.ErrorPayload;
import fr.lapetina.genericclient.domain.exception.ExceptionRegistry;
import fr.lapetina.genericclient.domain.exception.TransportException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.AttemptResult;
import fr.lapetina.genericclient.domain.retry.Retrier;
import fr.lapetina.genericclient.domain.retry.RetrySignal;
import fr.lapetina.genericclient.infrastructure.metrics.ClientMetrics;
import fr.lapetina.genericclient.infrastructure.resolver.HostResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Orchestrates one logical request.
 *
 * Each attempt resolves the host (cached), builds {@code host + prefix + path}
 * without touching slashes, sends through the {@link Transport} under the attempt
 * timeout and classifies the outcome:
 * <ul>
 *   <li>retriable status or error: retried by the {@link Retrier}</li>
 *   <li>2xx: returned</li>
 *   <li>other non-2xx with a registered {@code {"status":"error","cls":tag}} payload:
 *       raised as the mapped {@link DomainException}</li>
 *   <li>any other non-2xx: returned as is for the caller to inspect</li>
 * </ul>
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final HostResolver hostResolver;
    private final String prefix;
    private final Transport transport;
    private final ErrorClassifier classifier;
    private final ExceptionRegistry exceptionRegistry;
    private final Retrier retrier;
    private final Duration timeout;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final ClientMetrics metrics;

    private RequestDispatcher(Builder builder) {
        this.hostResolver = Objects.requireNonNull(builder.hostResolver, "hostResolver");
        this.prefix = builder.prefix != null ? builder.prefix : "";
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
        this.exceptionRegistry = Objects.requireNonNull(builder.exceptionRegistry, "exceptionRegistry");
        this.retrier = Objects.requireNonNull(builder.retrier, "retrier");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : JsonSupport.defaultMapper();
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Issues a request with retries.
     *
     * @param method  HTTP method
     * @param path    Path appended to the base URL as is
     * @param options Headers, query, body and timeout override
     * @return The final response, which the caller must close; or the final error
     */
    public CompletableFuture<ClientResponse> issue(String method, String path, RequestOptions options) {
        String verb = method.toUpperCase(Locale.ROOT);
        RequestOptions requestOptions = options != null ? options : RequestOptions.none();
        Instant startTime = Instant.now();

        return retrier.execute(
                        verb + " " + path,
                        attemptNumber -> attempt(verb, path, requestOptions, attemptNumber),
                        ClientResponse::close
                )
                .whenComplete((response, error) -> recordLatency(verb, response, error, startTime));
    }

    public String getPrefix() {
        return prefix;
    }

    private CompletableFuture<AttemptResult<ClientResponse>> attempt(
            String method,
            String path,
            RequestOptions options,
            int attemptNumber
    ) {
        return hostResolver.getHost()
                .thenCompose(host -> send(method, host + prefix + path, options, attemptNumber))
                .handle((response, error) -> error != null
                        ? onError(method, path, error)
                        : onResponse(method, response))
                .thenCompose(Function.identity());
    }

    private CompletableFuture<ClientResponse> send(String method, String url, RequestOptions options, int attemptNumber) {
        URI uri;
        try {
            uri = URI.create(options.applyQuery(url));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        Duration attemptTimeout = options.timeout() != null ? options.timeout() : timeout;
        log.info("Issuing request: method={}, url={}, attempt={}, timestamp={}",
                method, uri, attemptNumber, Instant.now());

        CompletableFuture<ClientResponse> call;
        try {
            call = transport.request(method, uri, options);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        // A response arriving after the attempt timed out has no reader left
        CompletableFuture<ClientResponse> timed = new CompletableFuture<>();
        call.whenComplete((response, error) -> {
            if (error != null) {
                timed.completeExceptionally(error);
            } else if (!timed.complete(response) && response != null) {
                log.debug("Releasing late response: method={}, uri={}, status={}",
                        method, uri, response.status());
                response.close();
            }
        });

        return timed
                .orTimeout(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        throw toTransportFailure(method, uri, error);
                    }
                    return response;
                });
    }

    private CompletableFuture<AttemptResult<ClientResponse>> onError(String method, String path, Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        Optional<RetrySignal<ClientResponse>> signal = classifier.classify(cause);
        if (signal.isPresent()) {
            recordAttempt(method, "retry");
            return CompletableFuture.completedFuture(AttemptResult.retry(signal.get()));
        }
        recordAttempt(method, "error");
        log.warn("Request failed: method={}, path={}, errorKind={}, error={}",
                method, path, ErrorKind.of(cause), cause.getMessage());
        return CompletableFuture.failedFuture(cause);
    }

    private CompletableFuture<AttemptResult<ClientResponse>> onResponse(String method, ClientResponse response) {
        Optional<RetrySignal<ClientResponse>> signal = classifier.classify(response, response.status());
        if (signal.isPresent()) {
            recordAttempt(method, "retry");
            return CompletableFuture.completedFuture(AttemptResult.retry(signal.get()));
        }
        if (response.isSuccess()) {
            recordAttempt(method, "success");
            return CompletableFuture.completedFuture(AttemptResult.done(response));
        }
        recordAttempt(method, "response");
        // Reading the body may block
        try {
            return CompletableFuture.supplyAsync(() -> mapErrorResponse(response), executor);
        } catch (RejectedExecutionException e) {
            response.close();
            return CompletableFuture.failedFuture(new IllegalStateException("Client is closed", e));
        }
    }

    private AttemptResult<ClientResponse> mapErrorResponse(ClientResponse response) {
        Optional<ErrorPayload> payload = decodeErrorPayload(response);
        if (payload.isPresent()) {
            Optional<DomainException> mapped;
            try {
                mapped = exceptionRegistry.resolve(payload.get());
            } catch (RuntimeException e) {
                response.close();
                log.warn("Error factory failed: uri={}, tag={}, error={}",
                        response.uri(), payload.get().tag(), e.toString());
                throw e;
            }
            if (mapped.isPresent()) {
                response.close();
                log.info("Mapped error response: method={}, uri={}, status={}, tag={}",
                        response.method(), response.uri(), response.status(), payload.get().tag());
                throw mapped.get();
            }
            log.debug("Unregistered error tag, returning raw response: uri={}, tag={}",
                    response.uri(), payload.get().tag());
        }
        return AttemptResult.done(response);
    }

    /**
     * Extracts {@code {"status": "error", "cls": tag}} from a non-2xx body.
     * Bodies that are not JSON, or not of that shape, yield nothing.
     */
    private Optional<ErrorPayload> decodeErrorPayload(ClientResponse response) {
        JsonNode node;
        try {
            node = objectMapper.readTree(response.bytes());
        } catch (IOException | UncheckedIOException e) {
            log.debug("Undecodable error body: uri={}, status={}, error={}",
                    response.uri(), response.status(), e.getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode status = node.get("status");
        JsonNode tag = node.get("cls");
        if (status == null || !"error".equals(status.asText()) || tag == null || !tag.isTextual()) {
            return Optional.empty();
        }
        JsonNode message = node.get("message");
        Map<String, Object> body = objectMapper.convertValue(node, MAP_TYPE);
        return Optional.of(new ErrorPayload(
                tag.asText(),
                response.status(),
                message != null && !message.isNull() ? message.asText() : null,
                body
        ));
    }

    private static RuntimeException toTransportFailure(String method, URI uri, Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        if (cause instanceof TimeoutException || cause instanceof IOException) {
            return TransportException.wrap(method, uri.toString(), cause);
        }
        return cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
    }

    private void recordAttempt(String method, String outcome) {
        if (metrics != null) {
            metrics.recordAttempt(method, outcome);
        }
    }

    private void recordLatency(String method, ClientResponse response, Throwable error, Instant startTime) {
        if (metrics == null) {
            return;
        }
        String status = response != null
                ? Integer.toString(response.status())
                : ErrorKind.of(error).name();
        metrics.recordLatency(method, status, Duration.between(startTime, Instant.now()));
    }

    public static final class Builder {
        private HostResolver hostResolver;
        private String prefix;
        private Transport transport;
        private ErrorClassifier classifier;
        private ExceptionRegistry exceptionRegistry;
        private Retrier retrier;
        private Duration timeout;
        private Executor executor;
        private ObjectMapper objectMapper;
        private ClientMetrics metrics;

        private Builder() {
        }

        public Builder hostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder exceptionRegistry(ExceptionRegistry exceptionRegistry) {
            this.exceptionRegistry = exceptionRegistry;
            return this;
        }

        public Builder retrier(Retrier retrier) {
            this.retrier = retrier;
            return this;
        }

        /**
         * Per-attempt timeout.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Executor for blocking work such as reading error bodies.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder metrics(ClientMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public RequestDispatcher build() {
            return new RequestDispatcher(this);
        }
    }
}
