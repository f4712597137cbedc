package fr.lapetina.genericclient.infrastructure.metrics;

import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.domain.retry.RetryListener;
import fr.lapetina.genericclient.domain.retry.RetrySignal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client metrics using Micrometer.
 *
 * Provides:
 * - Attempt counters per method and outcome
 * - Request latency timers per method and status
 * - Retry and exhaustion counters
 * - Host resolution counters
 */
public final class ClientMetrics implements RetryListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientMetrics.class);

    private final MeterRegistry registry;
    private final String prefix;
    private final boolean ownsRegistry;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resolutionCounters = new ConcurrentHashMap<>();

    /**
     * Records into a caller-owned registry, which {@link #close()} leaves open.
     */
    public ClientMetrics(MeterRegistry registry, String prefix) {
        this(registry, prefix, false);
    }

    public ClientMetrics(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix, true);
    }

    public ClientMetrics() {
        this("generic_client");
    }

    private ClientMetrics(MeterRegistry registry, String prefix, boolean ownsRegistry) {
        this.registry = registry;
        this.prefix = prefix;
        this.ownsRegistry = ownsRegistry;
        log.debug("ClientMetrics initialized with prefix: {}", prefix);
    }

    /**
     * Counts one attempt by method and outcome ({@code success}, {@code response},
     * {@code retry}, {@code error}).
     */
    public void recordAttempt(String method, String outcome) {
        String key = method + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of request attempts")
                        .tag("method", method)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of a finished logical request, retries included.
     */
    public void recordLatency(String method, String status, Duration latency) {
        String key = method + ":" + status;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency including retries")
                        .tag("method", method)
                        .tag("status", status)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts one host resolution by outcome.
     */
    public void recordResolution(boolean success) {
        String outcome = success ? "success" : "failure";
        resolutionCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_resolutions_total")
                        .description("Total number of host resolutions")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    @Override
    public void onRetry(String operation, int attemptNumber, Duration delay, RetrySignal<?> signal) {
        retryCounter("_retries_total", "Total number of retries", signal).increment();
    }

    @Override
    public void onExhausted(String operation, int attempts, RetrySignal<?> signal) {
        retryCounter("_retries_exhausted_total", "Total number of requests that ran out of retries", signal).increment();
    }

    private Counter retryCounter(String suffix, String description, RetrySignal<?> signal) {
        String reason = signal.getError().map(e -> ErrorKind.of(e).name()).orElse("STATUS");
        return retryCounters.computeIfAbsent(suffix + ":" + reason, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tag("reason", reason)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (ownsRegistry) {
            registry.close();
        }
    }
}
