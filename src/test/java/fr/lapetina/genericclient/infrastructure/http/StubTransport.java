package fr.lapetina.genericclient.infrastructure.http;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Transport for tests. Replies are consumed in order; the last one is repeated
 * once the queue is down to a single entry.
 */
public class StubTransport implements Transport {

    public record SentRequest(String method, URI uri, RequestOptions options) {
    }

    private final Deque<Function<SentRequest, CompletableFuture<ClientResponse>>> replies = new ArrayDeque<>();
    private final List<SentRequest> requests = new CopyOnWriteArrayList<>();
    private final List<ClientResponse> responses = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();

    public synchronized StubTransport reply(int status, String body) {
        replies.add(request -> CompletableFuture.completedFuture(
                track(ClientResponse.of(request.method(), request.uri(), status, body))));
        return this;
    }

    public synchronized StubTransport fail(Throwable error) {
        replies.add(request -> CompletableFuture.failedFuture(error));
        return this;
    }

    /**
     * Never completes; the dispatcher's attempt timeout has to fire.
     */
    public synchronized StubTransport hang() {
        replies.add(request -> new CompletableFuture<>());
        return this;
    }

    /**
     * Replies with {@code pending}, which the test completes whenever it wants.
     */
    public synchronized StubTransport defer(CompletableFuture<ClientResponse> pending) {
        replies.add(request -> pending);
        return this;
    }

    @Override
    public CompletableFuture<ClientResponse> request(String method, URI uri, RequestOptions options) {
        SentRequest sent = new SentRequest(method, uri, options);
        requests.add(sent);
        Function<SentRequest, CompletableFuture<ClientResponse>> reply;
        synchronized (this) {
            if (replies.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalStateException("No reply configured"));
            }
            reply = replies.size() > 1 ? replies.poll() : replies.peek();
        }
        return reply.apply(sent);
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    public List<SentRequest> getRequests() {
        return requests;
    }

    public List<ClientResponse> getResponses() {
        return responses;
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    private ClientResponse track(ClientResponse response) {
        responses.add(response);
        return response;
    }
}
