package fr.lapetina.genericclient.infrastructure.metrics;

import fr.lapetina.genericclient.domain.exception.TransportException;
import fr.lapetina.genericclient.domain.retry.RetrySignal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ClientMetricsTest {

    @Test
    @DisplayName("should count attempts by method and outcome")
    void shouldCountAttempts() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ClientMetrics metrics = new ClientMetrics(registry, "test");

        metrics.recordAttempt("GET", "success");
        metrics.recordAttempt("GET", "success");
        metrics.recordAttempt("GET", "retry");

        assertThat(registry.get("test_attempts_total").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_attempts_total").tag("outcome", "retry").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tag retries with the failure reason")
    void shouldTagRetryReason() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ClientMetrics metrics = new ClientMetrics(registry, "test");
        TransportException refused = TransportException.wrap("GET", "http://a", new ConnectException("refused"));

        metrics.onRetry("GET /x", 1, Duration.ofMillis(10), RetrySignal.ofError(refused));
        metrics.onRetry("GET /x", 2, Duration.ofMillis(20), RetrySignal.ofValue("503"));
        metrics.onExhausted("GET /x", 3, RetrySignal.ofValue("503"));

        assertThat(registry.get("test_retries_total").tag("reason", "CONNECTION").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_retries_total").tag("reason", "STATUS").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_retries_exhausted_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should leave a caller-owned registry open")
    void shouldNotCloseCallerRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ClientMetrics metrics = new ClientMetrics(registry, "test");

        metrics.close();

        assertThat(registry.isClosed()).isFalse();
        assertThat(metrics.scrape()).isEmpty();
    }

    @Test
    @DisplayName("should expose Prometheus output from its own registry")
    void shouldScrapePrometheus() {
        ClientMetrics metrics = new ClientMetrics();

        metrics.recordResolution(true);
        metrics.recordLatency("GET", "200", Duration.ofMillis(12));

        assertThat(metrics.scrape())
                .contains("generic_client_resolutions_total")
                .contains("generic_client_request_latency");
        metrics.close();
    }
}
