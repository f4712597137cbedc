package fr.lapetina.genericclient.infrastructure.http;

import fr.lapetina.genericclient.domain.classify.ErrorClassifier;
import fr.lapetina.genericclient.domain.exception.DomainException;
import fr.lapetina.genericclient.domain.exception.ErrorPayload;
import fr.lapetina.genericclient.domain.exception.ExceptionRegistry;
import fr.lapetina.genericclient.domain.exception.TransportException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.BackoffPolicy;
import fr.lapetina.genericclient.domain.retry.Retrier;
import fr.lapetina.genericclient.domain.retry.StopStrategy;
import fr.lapetina.genericclient.domain.retry.WaitStrategy;
import fr.lapetina.genericclient.infrastructure.resolver.HostResolver;
import fr.lapetina.genericclient.infrastructure.resolver.HostState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestDispatcherTest {

    static class NotFoundException extends DomainException {
        NotFoundException(ErrorPayload payload) {
            super(payload);
        }
    }

    private ScheduledExecutorService scheduler;
    private ExecutorService executor;
    private StubTransport transport;
    private ExceptionRegistry registry;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        executor = Executors.newCachedThreadPool();
        transport = new StubTransport();
        registry = new ExceptionRegistry();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        executor.shutdownNow();
    }

    private RequestDispatcher dispatcher(String prefix, Set<ErrorKind> retryableKinds, int maxAttempts) {
        return RequestDispatcher.builder()
                .hostResolver(new HostResolver(new HostState.Static("http://api.local"), null, executor))
                .prefix(prefix)
                .transport(transport)
                .classifier(new ErrorClassifier(Set.of("5xx"), retryableKinds))
                .exceptionRegistry(registry)
                .retrier(new Retrier(
                        new BackoffPolicy(WaitStrategy.fixed(Duration.ofMillis(5)), StopStrategy.afterAttempt(maxAttempts)),
                        scheduler))
                .timeout(Duration.ofSeconds(2))
                .executor(executor)
                .build();
    }

    private RequestDispatcher dispatcher() {
        return dispatcher("", Set.of(ErrorKind.CONNECTION, ErrorKind.TIMEOUT), 3);
    }

    @Nested
    @DisplayName("URL building")
    class UrlTests {

        @Test
        @DisplayName("should concatenate host, prefix and path as is")
        void shouldConcatenateWithoutNormalizing() throws Exception {
            transport.reply(200, "{}");

            dispatcher("/v1/", Set.of(), 1).issue("get", "/items", RequestOptions.none()).get(5, TimeUnit.SECONDS).close();

            assertThat(transport.getRequests()).hasSize(1);
            assertThat(transport.getRequests().get(0).uri().toString()).isEqualTo("http://api.local/v1//items");
            assertThat(transport.getRequests().get(0).method()).isEqualTo("GET");
        }

        @Test
        @DisplayName("should append query parameters in order")
        void shouldAppendQuery() throws Exception {
            transport.reply(200, "{}");
            RequestOptions options = RequestOptions.builder()
                    .queryParam("page", 2)
                    .queryParam("q", "a b")
                    .build();

            dispatcher().issue("GET", "/search", options).get(5, TimeUnit.SECONDS).close();

            assertThat(transport.getRequests().get(0).uri().toString())
                    .isEqualTo("http://api.local/search?page=2&q=a+b");
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("should retry retriable statuses until success")
        void shouldRetryUntilSuccess() throws Exception {
            transport.reply(503, "busy").reply(502, "bad gateway").reply(200, "done");

            try (ClientResponse response = dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(200);
                assertThat(response.text()).isEqualTo("done");
            }
            assertThat(transport.getRequests()).hasSize(3);
            assertThat(transport.getResponses().get(0).isClosed()).isTrue();
            assertThat(transport.getResponses().get(1).isClosed()).isTrue();
        }

        @Test
        @DisplayName("should return the last retriable response once retries run out")
        void shouldReturnLastResponse() throws Exception {
            transport.reply(503, "busy");

            try (ClientResponse response = dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(503);
                assertThat(response.text()).isEqualTo("busy");
            }
            assertThat(transport.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("should retry connection errors when configured")
        void shouldRetryConnectionErrors() throws Exception {
            transport.fail(new ConnectException("refused")).reply(200, "ok");

            try (ClientResponse response = dispatcher().issue("POST", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(200);
            }
            assertThat(transport.getRequests()).hasSize(2);
        }

        @Test
        @DisplayName("should raise the last connection error once retries run out")
        void shouldRaiseLastConnectionError() {
            transport.fail(new ConnectException("refused"));

            assertThatThrownBy(() -> dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("refused");
            assertThat(transport.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("should not retry connection errors when not configured")
        void shouldNotRetryWhenDisabled() {
            transport.fail(new ConnectException("refused"));

            assertThatThrownBy(() -> dispatcher("", Set.of(), 3).issue("GET", "/x", RequestOptions.none())
                    .get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(TransportException.class);
            assertThat(transport.getRequests()).hasSize(1);
        }

        @Test
        @DisplayName("should time out hanging attempts")
        void shouldTimeOutHangingAttempts() {
            transport.hang();
            RequestOptions options = RequestOptions.builder().timeout(Duration.ofMillis(50)).build();

            assertThatThrownBy(() -> dispatcher().issue("GET", "/slow", options).get(5, TimeUnit.SECONDS))
                    .cause()
                    .isInstanceOfSatisfying(TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));
            assertThat(transport.getRequests()).hasSize(3);
        }

        @Test
        @DisplayName("should release a response arriving after the attempt timed out")
        void shouldReleaseLateResponse() throws Exception {
            CompletableFuture<ClientResponse> pending = new CompletableFuture<>();
            transport.defer(pending);
            RequestOptions options = RequestOptions.builder().timeout(Duration.ofMillis(50)).build();

            CompletableFuture<ClientResponse> result = dispatcher("", Set.of(), 1).issue("GET", "/slow", options);

            assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                    .cause()
                    .isInstanceOfSatisfying(TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));

            ClientResponse late = ClientResponse.of("GET", URI.create("http://api.local/slow"), 200, "too late");
            pending.complete(late);

            assertThat(late.isClosed()).isTrue();
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class ErrorMappingTests {

        @Test
        @DisplayName("should raise registered domain exceptions")
        void shouldRaiseRegisteredException() {
            registry.register("not_found", NotFoundException::new);
            transport.reply(404, "{\"status\":\"error\",\"cls\":\"not_found\",\"message\":\"no such item\"}");

            assertThatThrownBy(() -> dispatcher().issue("GET", "/items/9", RequestOptions.none()).get(5, TimeUnit.SECONDS))
                    .cause()
                    .isInstanceOfSatisfying(NotFoundException.class, e -> {
                        assertThat(e.getTag()).isEqualTo("not_found");
                        assertThat(e.getHttpStatus()).isEqualTo(404);
                        assertThat(e.getPayload().message()).isEqualTo("no such item");
                    });
            assertThat(transport.getRequests()).hasSize(1);
            assertThat(transport.getResponses().get(0).isClosed()).isTrue();
        }

        @Test
        @DisplayName("should release the response when the error factory fails")
        void shouldReleaseResponseWhenFactoryFails() {
            registry.register("broken", payload -> {
                throw new IllegalStateException("cannot build exception");
            });
            transport.reply(400, "{\"status\":\"error\",\"cls\":\"broken\"}");

            assertThatThrownBy(() -> dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS))
                    .cause()
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("cannot build exception");
            assertThat(transport.getResponses().get(0).isClosed()).isTrue();
        }

        @Test
        @DisplayName("should return raw response when the error factory returns null")
        void shouldReturnRawWhenFactoryReturnsNull() throws Exception {
            registry.register("unmapped", payload -> null);
            transport.reply(400, "{\"status\":\"error\",\"cls\":\"unmapped\"}");

            try (ClientResponse response = dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(400);
                assertThat(response.isClosed()).isFalse();
            }
        }

        @Test
        @DisplayName("should return raw response for unregistered tags")
        void shouldReturnRawForUnregisteredTag() throws Exception {
            transport.reply(409, "{\"status\":\"error\",\"cls\":\"conflict\"}");

            try (ClientResponse response = dispatcher().issue("PUT", "/items/9", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(409);
                assertThat(response.json().get("cls").asText()).isEqualTo("conflict");
            }
        }

        @Test
        @DisplayName("should return raw response for non-JSON bodies")
        void shouldReturnRawForNonJson() throws Exception {
            registry.register("not_found", NotFoundException::new);
            transport.reply(404, "<html>Not Found</html>");

            try (ClientResponse response = dispatcher().issue("GET", "/missing", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(404);
                assertThat(response.text()).isEqualTo("<html>Not Found</html>");
            }
        }

        @Test
        @DisplayName("should ignore payloads without error status")
        void shouldIgnoreNonErrorPayload() throws Exception {
            registry.register("not_found", NotFoundException::new);
            transport.reply(400, "{\"status\":\"ok\",\"cls\":\"not_found\"}");

            try (ClientResponse response = dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(400);
            }
        }

        @Test
        @DisplayName("should retry before mapping when the status is retriable")
        void shouldPreferRetryOverMapping() throws Exception {
            registry.register("unavailable");
            transport.reply(503, "{\"status\":\"error\",\"cls\":\"unavailable\"}").reply(200, "ok");

            try (ClientResponse response = dispatcher().issue("GET", "/x", RequestOptions.none()).get(5, TimeUnit.SECONDS)) {
                assertThat(response.status()).isEqualTo(200);
            }
        }
    }
}
