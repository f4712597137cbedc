package fr.lapetina.genericclient.infrastructure.resolver;

import fr.lapetina.genericclient.domain.exception.ResolutionException;
import fr.lapetina.genericclient.domain.model.ErrorKind;
import fr.lapetina.genericclient.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves and caches the host of one client.
 *
 * Static hosts are returned as is. Dynamic hosts are looked up through the
 * {@link ResolverService} and cached for {@link #CACHE_TTL}; expiry is checked
 * lazily on access. Concurrent callers needing a resolution share a single
 * in-flight lookup, so there is at most one outstanding resolver call per client.
 * A failed lookup reaches every waiter and caches nothing.
 *
 * Thread-safe via atomic references; no lock is held while resolving.
 */
public final class HostResolver {

    private static final Logger log = LoggerFactory.getLogger(HostResolver.class);

    public static final Duration CACHE_TTL = Duration.ofMinutes(60);

    private final HostState state;
    private final ResolverService resolverService;
    private final Executor executor;
    private final Clock clock;
    private final Duration cacheTtl;
    private final ClientMetrics metrics;

    private final AtomicReference<CachedHost> cached = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<String>> inFlight = new AtomicReference<>();
    private final AtomicInteger resolutionCount = new AtomicInteger(0);

    public HostResolver(
            HostState state,
            ResolverService resolverService,
            Executor executor,
            Clock clock,
            Duration cacheTtl,
            ClientMetrics metrics
    ) {
        this.state = Objects.requireNonNull(state, "state");
        this.resolverService = resolverService;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
        this.metrics = metrics;
        if (state instanceof HostState.Dynamic && resolverService == null) {
            throw new IllegalArgumentException("A resolver service is required in auto-resolve mode");
        }
    }

    public HostResolver(HostState state, ResolverService resolverService, Executor executor) {
        this(state, resolverService, executor, Clock.systemUTC(), CACHE_TTL, null);
    }

    /**
     * Returns the host, resolving it if needed.
     *
     * Each caller gets its own dependent future; cancelling it does not
     * affect other waiters or the shared lookup.
     */
    public CompletableFuture<String> getHost() {
        if (state instanceof HostState.Static staticHost) {
            return CompletableFuture.completedFuture(staticHost.host());
        }
        HostState.Dynamic dynamic = (HostState.Dynamic) state;

        while (true) {
            String fresh = freshCachedHost();
            if (fresh != null) {
                log.debug("Host cache hit: serviceName={}, host={}", dynamic.serviceName(), fresh);
                return CompletableFuture.completedFuture(fresh);
            }

            CompletableFuture<String> existing = inFlight.get();
            if (existing != null) {
                log.debug("Joining in-flight resolution: serviceName={}", dynamic.serviceName());
                return existing.copy();
            }

            CompletableFuture<String> mine = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, mine)) {
                // Another resolution may have landed between the cache check and the claim
                String landed = freshCachedHost();
                if (landed != null) {
                    inFlight.compareAndSet(mine, null);
                    mine.complete(landed);
                } else {
                    resolve(dynamic, mine);
                }
                return mine.copy();
            }
        }
    }

    /**
     * Drops the cached host; the next call resolves again.
     */
    public void invalidate() {
        if (cached.getAndSet(null) != null) {
            log.info("Host cache invalidated");
        }
    }

    public HostState getState() {
        return state;
    }

    public boolean isStatic() {
        return state instanceof HostState.Static;
    }

    /**
     * True while a lookup is outstanding.
     */
    public boolean isResolving() {
        return inFlight.get() != null;
    }

    /**
     * Number of resolver calls made so far.
     */
    public int getResolutionCount() {
        return resolutionCount.get();
    }

    private String freshCachedHost() {
        CachedHost entry = cached.get();
        if (entry == null) {
            return null;
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            return null;
        }
        return entry.host();
    }

    private void resolve(HostState.Dynamic dynamic, CompletableFuture<String> shared) {
        resolutionCount.incrementAndGet();
        log.info("Resolving host: serviceName={}, env={}", dynamic.serviceName(), dynamic.env());

        CompletableFuture<String> lookup;
        try {
            lookup = CompletableFuture.supplyAsync(() -> lookup(dynamic), executor);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }

        lookup.whenComplete((host, error) -> {
            if (error != null) {
                inFlight.compareAndSet(shared, null);
                ResolutionException failure = toResolutionException(dynamic, error);
                log.error("Host resolution failed: serviceName={}, env={}, error={}",
                        dynamic.serviceName(), dynamic.env(), failure.getMessage());
                recordResolution(false);
                shared.completeExceptionally(failure);
                return;
            }
            Instant expiresAt = clock.instant().plus(cacheTtl);
            cached.set(new CachedHost(host, expiresAt));
            inFlight.compareAndSet(shared, null);
            log.info("Resolved host: serviceName={}, env={}, host={}, expiresAt={}",
                    dynamic.serviceName(), dynamic.env(), host, expiresAt);
            recordResolution(true);
            shared.complete(host);
        });
    }

    private void recordResolution(boolean success) {
        if (metrics != null) {
            metrics.recordResolution(success);
        }
    }

    private String lookup(HostState.Dynamic dynamic) {
        try (ResolverService.ResolverSession session = resolverService.open(dynamic.env())) {
            String host = session.lookup(dynamic.serviceName());
            if (host == null || host.isBlank()) {
                throw new ResolutionException(dynamic.serviceName(), dynamic.env(),
                        "Unknown service '" + dynamic.serviceName() + "' in env '" + dynamic.env() + "'");
            }
            return host;
        } catch (ResolutionException e) {
            throw e;
        } catch (Exception e) {
            throw new ResolutionException(dynamic.serviceName(), dynamic.env(),
                    "Failed to resolve '" + dynamic.serviceName() + "' in env '" + dynamic.env() + "': " + e.getMessage(),
                    e);
        }
    }

    private static ResolutionException toResolutionException(HostState.Dynamic dynamic, Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        if (cause instanceof ResolutionException resolutionException) {
            return resolutionException;
        }
        return new ResolutionException(dynamic.serviceName(), dynamic.env(),
                "Failed to resolve '" + dynamic.serviceName() + "': " + cause.getMessage(), cause);
    }

    private record CachedHost(String host, Instant expiresAt) {
    }
}
