package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable provider for tests.
 *
 * Scripted behaviours are consumed one per call, in order; once the script is empty every call
 * uses the default behaviour.
 */
public final class StubProviderAdapter implements ProviderAdapter {

    private final String name;
    private final Queue<Function<ProviderRequest, CompletableFuture<RawResponse>>> script = new ConcurrentLinkedQueue<>();
    private final List<ProviderRequest> requests = new CopyOnWriteArrayList<>();
    private final List<Long> callNanos = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile Function<ProviderRequest, CompletableFuture<RawResponse>> defaultBehaviour =
            request -> CompletableFuture.completedFuture(RawResponse.of("ok", TokenUsage.of(10, 5)));

    public StubProviderAdapter(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<RawResponse> send(ProviderRequest request) {
        requests.add(request);
        callNanos.add(System.nanoTime());
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);

        Function<ProviderRequest, CompletableFuture<RawResponse>> behaviour = script.poll();
        if (behaviour == null) {
            behaviour = defaultBehaviour;
        }

        CompletableFuture<RawResponse> response;
        try {
            response = behaviour.apply(request);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        response.whenComplete((r, e) -> inFlight.decrementAndGet());
        return response;
    }

    // Default behaviours

    public StubProviderAdapter alwaysReply(String text, TokenUsage usage) {
        this.defaultBehaviour = request -> CompletableFuture.completedFuture(RawResponse.of(text, usage));
        return this;
    }

    public StubProviderAdapter alwaysReplyAfter(Duration delay, String text, TokenUsage usage) {
        this.defaultBehaviour = request -> delayed(delay, RawResponse.of(text, usage));
        return this;
    }

    public StubProviderAdapter alwaysFail(RuntimeException error) {
        this.defaultBehaviour = request -> CompletableFuture.failedFuture(error);
        return this;
    }

    public StubProviderAdapter alwaysHang() {
        this.defaultBehaviour = request -> new CompletableFuture<>();
        return this;
    }

    public StubProviderAdapter behaviour(Function<ProviderRequest, CompletableFuture<RawResponse>> behaviour) {
        this.defaultBehaviour = behaviour;
        return this;
    }

    // Scripted behaviours

    public StubProviderAdapter thenReply(String text, TokenUsage usage) {
        script.add(request -> CompletableFuture.completedFuture(RawResponse.of(text, usage)));
        return this;
    }

    public StubProviderAdapter thenReplyWithCost(String text, TokenUsage usage, BigDecimal reportedCost) {
        script.add(request -> CompletableFuture.completedFuture(new RawResponse(text, usage, reportedCost)));
        return this;
    }

    public StubProviderAdapter thenFail(RuntimeException error) {
        script.add(request -> CompletableFuture.failedFuture(error));
        return this;
    }

    public StubProviderAdapter thenHang() {
        script.add(request -> new CompletableFuture<>());
        return this;
    }

    public static CompletableFuture<RawResponse> delayed(Duration delay, RawResponse response) {
        return CompletableFuture.supplyAsync(() -> response,
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    // Inspection

    public int getCallCount() {
        return requests.size();
    }

    public List<ProviderRequest> getRequests() {
        return List.copyOf(requests);
    }

    /**
     * {@link System#nanoTime()} of each call, in call order.
     */
    public List<Long> getCallNanos() {
        return List.copyOf(callNanos);
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
