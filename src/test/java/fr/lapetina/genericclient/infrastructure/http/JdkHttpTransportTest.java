package fr.lapetina.genericclient.infrastructure.http;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.genericclient.domain.exception.TransportException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpTransportTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private JdkHttpTransport transport;
    private String baseUrl;
    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastHeader = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", exchange -> {
            lastMethod.set(exchange.getRequestMethod());
            lastHeader.set(exchange.getRequestHeaders().getFirst("X-Request-Id"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] response = "{\"echo\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(201, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        transport = new JdkHttpTransport(Duration.ofSeconds(2), Duration.ofSeconds(5), null);
    }

    @AfterEach
    void tearDown() {
        transport.close();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    @DisplayName("should send method, headers and body")
    void shouldSendRequest() throws Exception {
        RequestOptions options = RequestOptions.builder()
                .header("X-Request-Id", "req-1")
                .json(Map.of("name", "widget"))
                .build();

        try (ClientResponse response = transport.request("POST", URI.create(baseUrl + "/echo"), options)
                .get(5, TimeUnit.SECONDS)) {
            assertThat(response.status()).isEqualTo(201);
            assertThat(response.header("content-type")).contains("application/json");
            assertThat(response.json().get("echo").asBoolean()).isTrue();
        }
        assertThat(lastMethod.get()).isEqualTo("POST");
        assertThat(lastHeader.get()).isEqualTo("req-1");
        assertThat(lastBody.get()).isEqualTo("{\"name\":\"widget\"}");
    }

    @Test
    @DisplayName("should report connection failures as connection errors")
    void shouldReportConnectionFailure() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }

        assertThatThrownBy(() -> transport.request("GET", URI.create("http://127.0.0.1:" + unusedPort + "/x"),
                RequestOptions.none()).get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION));
    }

    @Test
    @DisplayName("should report request timeouts as timeouts")
    void shouldReportTimeout() {
        RequestOptions options = RequestOptions.builder().timeout(Duration.ofMillis(200)).build();

        assertThatThrownBy(() -> transport.request("GET", URI.create(baseUrl + "/slow"), options)
                .get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));
    }

    @Test
    @DisplayName("should refuse requests once closed")
    void shouldRefuseWhenClosed() {
        transport.close();
        transport.close();

        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(() -> transport.request("GET", URI.create(baseUrl + "/echo"), RequestOptions.none())
                .get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
