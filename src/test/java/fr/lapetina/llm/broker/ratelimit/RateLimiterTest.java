package fr.lapetina.llm.broker.ratelimit;

import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.model.RateLimitPolicy;
import fr.lapetina.llm.broker.exception.CancelledException;
import fr.lapetina.llm.broker.exception.RateLimitTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.llm.broker.TestFutures.await;
import static fr.lapetina.llm.broker.TestFutures.failureOf;
import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private ScheduledExecutorService scheduler;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        rateLimiter = new RateLimiter(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static ModelSpec model(String name, RateLimitPolicy policy) {
        return ModelSpec.builder().name(name).rateLimit(policy).build();
    }

    @Test
    @DisplayName("should admit immediately when the model is unlimited")
    void shouldAdmitImmediatelyWhenUnlimited() {
        ModelSpec spec = model("free", RateLimitPolicy.unlimited());

        for (int i = 0; i < 100; i++) {
            assertThat(rateLimiter.acquire(spec)).isDone();
        }
        assertThat(rateLimiter.getState("free")).isEmpty();
    }

    @Test
    @DisplayName("should admit up to capacity then wait for the next window")
    void shouldWaitForNextWindowWhenFull() throws Exception {
        ModelSpec spec = model("small", RateLimitPolicy.of(2, Duration.ofMillis(300)));

        CompletableFuture<Permit> first = rateLimiter.acquire(spec);
        CompletableFuture<Permit> second = rateLimiter.acquire(spec);
        long start = System.nanoTime();
        CompletableFuture<Permit> third = rateLimiter.acquire(spec);

        assertThat(first).isDone();
        assertThat(second).isDone();
        assertThat(third).isNotDone();

        Permit permit = await(third);
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(permit.getModel()).isEqualTo("small");
        assertThat(waitedMs).isGreaterThanOrEqualTo(100);
    }

    @Test
    @DisplayName("should never admit more than capacity within a window under concurrency")
    void shouldNeverExceedCapacityUnderConcurrency() throws Exception {
        ModelSpec spec = model("contended", RateLimitPolicy.of(5, Duration.ofSeconds(30)));
        int callers = 40;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<CompletableFuture<Permit>> permits = new ArrayList<>();
        List<CompletableFuture<Void>> submitted = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                CompletableFuture<Permit> holder = new CompletableFuture<>();
                permits.add(holder);
                submitted.add(CompletableFuture.runAsync(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    rateLimiter.acquire(spec).whenComplete((p, e) -> {
                        if (e != null) {
                            holder.completeExceptionally(e);
                        } else {
                            holder.complete(p);
                        }
                    });
                }, pool));
            }
            go.countDown();
            CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
            Thread.sleep(100);

            long admitted = permits.stream().filter(CompletableFuture::isDone).count();
            assertThat(admitted).isEqualTo(5);
            assertThat(rateLimiter.getState("contended").orElseThrow().getUsedInWindow()).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("should return capacity when a permit is released")
    void shouldReturnCapacityOnRelease() throws Exception {
        ModelSpec spec = model("single", RateLimitPolicy.of(1, Duration.ofSeconds(30)));

        Permit permit = await(rateLimiter.acquire(spec));
        rateLimiter.release(permit);

        assertThat(permit.isReleased()).isTrue();
        assertThat(rateLimiter.acquire(spec)).isDone();
        assertThat(rateLimiter.acquire(spec)).isNotDone();
    }

    @Test
    @DisplayName("should release idempotently")
    void shouldReleaseIdempotently() throws Exception {
        ModelSpec spec = model("twice", RateLimitPolicy.of(3, Duration.ofSeconds(30)));

        Permit permit = await(rateLimiter.acquire(spec));
        rateLimiter.release(permit);
        rateLimiter.release(permit);
        rateLimiter.release(null);

        assertThat(rateLimiter.getState("twice").orElseThrow().getUsedInWindow()).isZero();
    }

    @Test
    @DisplayName("should fail with RateLimitTimeoutException once max wait elapses")
    void shouldTimeOutAfterMaxWait() throws Exception {
        ModelSpec spec = model("bounded", RateLimitPolicy.of(1, Duration.ofSeconds(30))
                .withMaxWait(Duration.ofMillis(50)));

        await(rateLimiter.acquire(spec));
        Throwable failure = failureOf(rateLimiter.acquire(spec));

        assertThat(failure).isInstanceOf(RateLimitTimeoutException.class);
        assertThat(((RateLimitTimeoutException) failure).getModel()).isEqualTo("bounded");
    }

    @Test
    @DisplayName("should fail with CancelledException when cancelled while waiting")
    void shouldFailWhenCancelledWhileWaiting() throws Exception {
        ModelSpec spec = model("cancelled", RateLimitPolicy.of(1, Duration.ofMillis(200)));
        CancellationToken token = new CancellationToken();

        await(rateLimiter.acquire(spec));
        CompletableFuture<Permit> waiting = rateLimiter.acquire(spec, token);
        token.cancel("batch aborted");

        assertThat(failureOf(waiting)).isInstanceOf(CancelledException.class)
                .hasMessageContaining("Cancelled");
    }
}
