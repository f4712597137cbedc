package fr.lapetina.genericclient;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.genericclient.domain.exception.ConfigurationException;
import fr.lapetina.genericclient.domain.exception.DomainException;
import fr.lapetina.genericclient.domain.exception.ErrorPayload;
import fr.lapetina.genericclient.domain.exception.ExceptionRegistry;
import fr.lapetina.genericclient.domain.model.ClientState;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.Retrier;
import fr.lapetina.genericclient.infrastructure.config.ClientConfig;
import fr.lapetina.genericclient.infrastructure.config.ClientSettings;
import fr.lapetina.genericclient.infrastructure.config.ClientTemplate;
import fr.lapetina.genericclient.infrastructure.config.ConfigMerger;
import fr.lapetina.genericclient.infrastructure.http.ClientResponse;
import fr.lapetina.genericclient.infrastructure.http.JdkHttpTransport;
import fr.lapetina.genericclient.infrastructure.http.JsonSupport;
import fr.lapetina.genericclient.infrastructure.http.RequestDispatcher;
import fr.lapetina.genericclient.infrastructure.http.RequestOptions;
import fr.lapetina.genericclient.infrastructure.http.Transport;
import fr.lapetina.genericclient.infrastructure.metrics.ClientMetrics;
import fr.lapetina.genericclient.infrastructure.resolver.HostResolver;
import fr.lapetina.genericclient.infrastructure.resolver.HostState;
import fr.lapetina.genericclient.infrastructure.resolver.ResolverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Client for one backend service, reached at a fixed host or at a host
 * discovered through a {@link ResolverService}.
 *
 * <p>Owns the configuration, the host resolver state and the transport. Verb
 * methods go through {@link RequestDispatcher}, which adds retries, host caching
 * and domain error mapping.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ServiceClient client = ServiceClient.builder()
 *         .env("staging")
 *         .serviceName("billing-api")
 *         .resolverService(resolver)
 *         .build()
 *         .start()) {
 *     String body = client.get("/invoices/42", RequestOptions.none(), ClientResponse::text).join();
 * }
 * }</pre>
 *
 * <p>Client types with fixed defaults extend this class and pass a
 * {@link ClientTemplate}:
 * <pre>{@code
 * public class BillingClient extends ServiceClient {
 *     private static final ClientTemplate TEMPLATE = ClientTemplate.builder()
 *             .serviceName("billing-api")
 *             .config(Map.of("retryStatusPatterns", List.of("5xx", "429")))
 *             .build();
 *
 *     public BillingClient(String env, ResolverService resolver) {
 *         super(ServiceClient.builder().template(TEMPLATE).env(env).resolverService(resolver));
 *     }
 * }
 * }</pre>
 */
public class ServiceClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceClient.class);

    private final ClientSettings settings;
    private final ExceptionRegistry exceptionRegistry;
    private final ClientMetrics metrics;
    private final boolean ownsMetrics;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Retrier retrier;
    private final Transport transport;
    private final HostResolver hostResolver;
    private final RequestDispatcher dispatcher;

    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.CONSTRUCTED);
    private CompletableFuture<ServiceClient> opening;

    protected ServiceClient(Builder builder) {
        try {
            this.settings = ConfigMerger.merge(
                    builder.template,
                    builder.env,
                    builder.serviceName,
                    builder.host,
                    builder.prefix,
                    builder.config
            );
            if (!settings.isStatic() && builder.resolverService == null) {
                throw new ConfigurationException("A resolver service is required in auto-resolve mode");
            }
        } catch (RuntimeException e) {
            closeQuietly(builder.transport);
            throw e;
        }

        ClientConfig config = settings.config();
        ObjectMapper objectMapper = builder.objectMapper != null ? builder.objectMapper : JsonSupport.defaultMapper();

        this.exceptionRegistry = builder.exceptionRegistry != null ? builder.exceptionRegistry : new ExceptionRegistry();
        this.ownsMetrics = builder.metrics == null;
        this.metrics = builder.metrics != null ? builder.metrics : new ClientMetrics();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("generic-client-retry"));
        this.workers = Executors.newCachedThreadPool(daemonThreads("generic-client-worker"));
        this.retrier = new Retrier(config.getBackoff(), scheduler, metrics);
        this.transport = builder.transport != null
                ? builder.transport
                : new JdkHttpTransport(config.getTimeout(), config.getTimeout(), objectMapper);

        try {
            HostState hostState = settings.isStatic()
                    ? new HostState.Static(settings.host())
                    : new HostState.Dynamic(settings.serviceName(), settings.env());

            this.hostResolver = new HostResolver(
                    hostState,
                    builder.resolverService,
                    workers,
                    builder.clock != null ? builder.clock : Clock.systemUTC(),
                    HostResolver.CACHE_TTL,
                    metrics
            );

            this.dispatcher = RequestDispatcher.builder()
                    .hostResolver(hostResolver)
                    .prefix(settings.prefix())
                    .transport(transport)
                    .classifier(config.toClassifier())
                    .exceptionRegistry(exceptionRegistry)
                    .retrier(retrier)
                    .timeout(config.getTimeout())
                    .executor(workers)
                    .objectMapper(objectMapper)
                    .metrics(metrics)
                    .build();
        } catch (RuntimeException e) {
            state.set(ClientState.CLOSED);
            releaseResources();
            throw e;
        }

        log.info("Client created: type={}, config={}", getClass().getSimpleName(), config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // Lifecycle

    /**
     * Resolves the host ahead of the first request.
     *
     * On failure the client is closed and the error propagated. Calling it again
     * returns the same outcome.
     */
    public synchronized CompletableFuture<ServiceClient> open() {
        if (opening != null) {
            return opening.copy();
        }
        if (!state.compareAndSet(ClientState.CONSTRUCTED, ClientState.OPENING)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Cannot open client in state " + state.get()));
        }

        log.info("Opening client: type={}", getClass().getSimpleName());
        opening = hostResolver.getHost().handle((host, error) -> {
            if (error != null) {
                Throwable cause = ErrorKind.unwrap(error);
                log.error("Failed to open client: type={}, error={}", getClass().getSimpleName(), cause.getMessage());
                close();
                throw cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
            }
            if (!state.compareAndSet(ClientState.OPENING, ClientState.READY)) {
                throw new IllegalStateException("Client closed while opening");
            }
            log.info("Client ready: type={}, host={}", getClass().getSimpleName(), host);
            return this;
        });
        return opening.copy();
    }

    /**
     * Blocking variant of {@link #open()}, for try-with-resources.
     */
    public ServiceClient start() {
        try {
            return open().join();
        } catch (CompletionException e) {
            Throwable cause = ErrorKind.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Releases the transport and worker threads. Idempotent, and safe to call
     * whether or not the client ever became ready.
     */
    @Override
    public void close() {
        ClientState previous = state.getAndSet(ClientState.CLOSED);
        if (previous == ClientState.CLOSED) {
            return;
        }
        log.info("Closing client: type={}, previousState={}", getClass().getSimpleName(), previous);
        releaseResources();
    }

    public ClientState getState() {
        return state.get();
    }

    // Host

    /**
     * Returns the host, resolving it if needed (cached for 60 minutes).
     */
    public CompletableFuture<String> getHost() {
        return hostResolver.getHost();
    }

    /**
     * Returns the host followed by the path prefix.
     */
    public CompletableFuture<String> getBaseUrl() {
        return hostResolver.getHost().thenApply(host -> host + settings.prefix());
    }

    // Requests

    /**
     * Issues a request. The response must be closed by the caller.
     */
    public CompletableFuture<ClientResponse> issue(String method, String path, RequestOptions options) {
        if (state.get() == ClientState.CLOSED) {
            return CompletableFuture.failedFuture(new IllegalStateException("Client is closed"));
        }
        return dispatcher.issue(method, path, options);
    }

    /**
     * Issues a request and hands the response to {@code handler}, releasing it
     * afterwards whether the handler returns or throws.
     */
    public <T> CompletableFuture<T> issue(
            String method,
            String path,
            RequestOptions options,
            Function<? super ClientResponse, ? extends T> handler
    ) {
        return issue(method, path, options).thenCompose(response -> {
            try {
                return CompletableFuture.supplyAsync(() -> {
                    try (response) {
                        return handler.apply(response);
                    }
                }, workers);
            } catch (RejectedExecutionException e) {
                response.close();
                return CompletableFuture.failedFuture(new IllegalStateException("Client is closed", e));
            }
        });
    }

    public CompletableFuture<ClientResponse> get(String path) {
        return issue("GET", path, RequestOptions.none());
    }

    public CompletableFuture<ClientResponse> get(String path, RequestOptions options) {
        return issue("GET", path, options);
    }

    public <T> CompletableFuture<T> get(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("GET", path, options, handler);
    }

    public CompletableFuture<ClientResponse> post(String path, RequestOptions options) {
        return issue("POST", path, options);
    }

    public <T> CompletableFuture<T> post(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("POST", path, options, handler);
    }

    public CompletableFuture<ClientResponse> put(String path, RequestOptions options) {
        return issue("PUT", path, options);
    }

    public <T> CompletableFuture<T> put(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("PUT", path, options, handler);
    }

    public CompletableFuture<ClientResponse> patch(String path, RequestOptions options) {
        return issue("PATCH", path, options);
    }

    public <T> CompletableFuture<T> patch(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("PATCH", path, options, handler);
    }

    public CompletableFuture<ClientResponse> delete(String path) {
        return issue("DELETE", path, RequestOptions.none());
    }

    public CompletableFuture<ClientResponse> delete(String path, RequestOptions options) {
        return issue("DELETE", path, options);
    }

    public <T> CompletableFuture<T> delete(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("DELETE", path, options, handler);
    }

    public CompletableFuture<ClientResponse> head(String path) {
        return issue("HEAD", path, RequestOptions.none());
    }

    public CompletableFuture<ClientResponse> head(String path, RequestOptions options) {
        return issue("HEAD", path, options);
    }

    public <T> CompletableFuture<T> head(String path, RequestOptions options, Function<? super ClientResponse, ? extends T> handler) {
        return issue("HEAD", path, options, handler);
    }

    // Error mapping

    /**
     * Maps an error payload tag to a domain exception.
     */
    public ServiceClient registerError(String tag, Function<ErrorPayload, ? extends DomainException> factory) {
        exceptionRegistry.register(tag, factory);
        return this;
    }

    public ExceptionRegistry getExceptionRegistry() {
        return exceptionRegistry;
    }

    public ClientSettings getSettings() {
        return settings;
    }

    public ClientMetrics getMetrics() {
        return metrics;
    }

    private void releaseResources() {
        // Fails requests waiting on a backoff before the scheduler drops their waits
        retrier.shutdown();

        closeQuietly(transport);

        // No waiting here: close() may run on a worker thread when open() fails
        scheduler.shutdownNow();
        workers.shutdown();

        if (ownsMetrics) {
            try {
                metrics.close();
            } catch (Exception e) {
                log.warn("Error closing metrics", e);
            }
        }
    }

    private static void closeQuietly(Transport transport) {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport", e);
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Construction arguments. Which combinations are valid is decided by
     * {@link ConfigMerger}.
     */
    public static class Builder {
        private ClientTemplate template = ClientTemplate.EMPTY;
        private String env;
        private String serviceName;
        private String host;
        private String prefix;
        private Object config;
        private Transport transport;
        private ResolverService resolverService;
        private ExceptionRegistry exceptionRegistry;
        private ClientMetrics metrics;
        private ObjectMapper objectMapper;
        private Clock clock;

        protected Builder() {
        }

        /**
         * Type-level defaults, see {@link ClientTemplate}.
         */
        public Builder template(ClientTemplate template) {
            this.template = template;
            return this;
        }

        /**
         * Discovery namespace.
         */
        public Builder env(String env) {
            this.env = env;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * Explicit host; disables discovery.
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Path prefix applied to every request.
         */
        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        /**
         * A {@code Map} of config options or a {@link ClientConfig}.
         */
        public Builder config(Object config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the default JDK transport. The client takes ownership and closes it,
         * including when construction fails.
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder resolverService(ResolverService resolverService) {
            this.resolverService = resolverService;
            return this;
        }

        public Builder exceptionRegistry(ExceptionRegistry exceptionRegistry) {
            this.exceptionRegistry = exceptionRegistry;
            return this;
        }

        public Builder metrics(ClientMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Clock used for host cache expiry.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ServiceClient build() {
            return new ServiceClient(this);
        }
    }
}
