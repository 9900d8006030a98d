package fr.lapetina.llm.broker.ratelimit;

import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.model.RateLimitPolicy;
import fr.lapetina.llm.broker.exception.CancelledException;
import fr.lapetina.llm.broker.exception.RateLimitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Per-model admission control.
 *
 * Callers receive a future that completes once the model's window has room. A caller that
 * finds the window full is re-attempted on the shared scheduler when the window rolls over,
 * so waiting never holds a thread. Admission is not strictly FIFO: no caller waits more than
 * one window beyond the moment capacity exists.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long MIN_RECHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public RateLimiter(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public CompletableFuture<Permit> acquire(ModelSpec spec) {
        return acquire(spec, CancellationToken.none());
    }

    /**
     * Reserves one unit of the model's capacity.
     *
     * <p>The future fails with {@link RateLimitTimeoutException} only when the policy defines a
     * maximum wait, and with {@link CancelledException} when the token is cancelled while waiting.
     */
    public CompletableFuture<Permit> acquire(ModelSpec spec, CancellationToken token) {
        RateLimitPolicy policy = spec.rateLimit();
        if (policy.isUnlimited()) {
            return CompletableFuture.completedFuture(Permit.unlimited(spec.name()));
        }

        RateLimitState state = states.computeIfAbsent(spec.name(),
                name -> new RateLimitState(name, policy, System.nanoTime()));
        long deadline = policy.getMaxWait()
                .map(wait -> System.nanoTime() + wait.toNanos())
                .orElse(Long.MAX_VALUE);

        CompletableFuture<Permit> future = new CompletableFuture<>();
        attempt(state, future, token, deadline);
        return future;
    }

    private void attempt(RateLimitState state, CompletableFuture<Permit> future, CancellationToken token, long deadline) {
        if (future.isDone()) {
            return;
        }
        if (token.isCancelled()) {
            future.completeExceptionally(new CancelledException(
                    "Cancelled while waiting for rate-limit capacity: model=" + state.getModel()));
            return;
        }

        long now = System.nanoTime();
        Permit permit = state.tryAcquire(now);
        if (permit != null) {
            if (!future.complete(permit)) {
                // caller gave up between the check and the grant
                state.release(permit);
            }
            return;
        }

        if (now >= deadline) {
            future.completeExceptionally(new RateLimitTimeoutException(
                    state.getModel(), state.getPolicy().getMaxWait().orElseThrow()));
            return;
        }

        long wait = Math.max(MIN_RECHECK_NANOS, state.nanosUntilNextWindow(now));
        if (deadline != Long.MAX_VALUE) {
            wait = Math.min(wait, Math.max(MIN_RECHECK_NANOS, deadline - now));
        }

        log.debug("Rate limit window full, waiting: model={}, usedInWindow={}/{}, waitMs={}",
                state.getModel(),
                state.getUsedInWindow(),
                state.getPolicy().requestsPerWindow(),
                TimeUnit.NANOSECONDS.toMillis(wait));

        try {
            scheduler.schedule(() -> attempt(state, future, token, deadline), wait, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new CancelledException(
                    "Scheduler shut down while waiting for rate-limit capacity: model=" + state.getModel()));
        }
    }

    /**
     * Returns capacity for a call that was never dispatched. Idempotent.
     */
    public void release(Permit permit) {
        if (permit == null || !permit.markReleased() || permit.getState() == null) {
            return;
        }
        boolean returned = permit.getState().release(permit);
        log.debug("Permit released: model={}, returnedToWindow={}", permit.getModel(), returned);
    }

    public Optional<RateLimitState> getState(String model) {
        return Optional.ofNullable(states.get(model));
    }
}
