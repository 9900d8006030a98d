package fr.lapetina.llm.broker.retry;

import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.routing.ModelRouter;
import fr.lapetina.llm.broker.exception.AttemptTimeoutException;
import fr.lapetina.llm.broker.exception.CancelledException;
import fr.lapetina.llm.broker.exception.ExhaustedRetriesException;
import fr.lapetina.llm.broker.exception.FatalProviderException;
import fr.lapetina.llm.broker.exception.LlmBrokerException;
import fr.lapetina.llm.broker.provider.ProviderAdapter;
import fr.lapetina.llm.broker.provider.ProviderException;
import fr.lapetina.llm.broker.provider.ProviderRequest;
import fr.lapetina.llm.broker.provider.RawResponse;
import fr.lapetina.llm.broker.ratelimit.Permit;
import fr.lapetina.llm.broker.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Drives one logical provider call through permit acquisition, dispatch, classification
 * and backoff until it succeeds or a terminal failure is reached.
 *
 * Never blocks a thread: permits, backoff delays and per-attempt timeouts are all
 * expressed as future completions on the shared scheduler.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ModelRouter router;
    private final RateLimiter rateLimiter;
    private final ScheduledExecutorService scheduler;

    public RetryExecutor(ModelRouter router, RateLimiter rateLimiter, ScheduledExecutorService scheduler) {
        this.router = router;
        this.rateLimiter = rateLimiter;
        this.scheduler = scheduler;
    }

    public CompletableFuture<AttemptResult> execute(ProviderRequest request, ModelSpec spec, RetryPolicy policy) {
        return execute(request, spec, policy, CancellationToken.none(), AttemptListener.NOOP);
    }

    /**
     * Runs the call. The returned future completes with the single successful response, or
     * fails with {@link FatalProviderException}, {@link ExhaustedRetriesException},
     * {@link AttemptTimeoutException}, a rate-limit timeout or {@link CancelledException}.
     */
    public CompletableFuture<AttemptResult> execute(
            ProviderRequest request,
            ModelSpec spec,
            RetryPolicy policy,
            CancellationToken token,
            AttemptListener listener
    ) {
        Execution execution = new Execution(request, spec, policy, token,
                listener != null ? listener : AttemptListener.NOOP);
        execution.start();
        return execution.result;
    }

    private final class Execution {
        private final ProviderRequest request;
        private final ModelSpec spec;
        private final RetryPolicy policy;
        private final CancellationToken token;
        private final AttemptListener listener;
        private final CompletableFuture<AttemptResult> result = new CompletableFuture<>();
        private final long startNanos = System.nanoTime();

        private ProviderAdapter adapter;

        // Attempts run strictly one after another, each stage happens-after the previous
        private int attempts;
        private int rateLimitedRetries;
        private volatile InvocationState state = InvocationState.PENDING;

        Execution(ProviderRequest request, ModelSpec spec, RetryPolicy policy,
                  CancellationToken token, AttemptListener listener) {
            this.request = request;
            this.spec = spec;
            this.policy = policy;
            this.token = token;
            this.listener = listener;
        }

        void start() {
            try {
                adapter = router.adapterFor(spec);
            } catch (LlmBrokerException e) {
                fail(e);
                return;
            }
            nextAttempt();
        }

        private void nextAttempt() {
            if (result.isDone()) {
                return;
            }
            if (token.isCancelled()) {
                cancel("before attempt " + (attempts + 1));
                return;
            }
            state = InvocationState.WAITING_FOR_PERMIT;
            rateLimiter.acquire(spec, token).whenComplete((permit, error) -> {
                if (error != null) {
                    fail(LlmBrokerException.unwrap(error));
                } else {
                    dispatch(permit);
                }
            });
        }

        private void dispatch(Permit permit) {
            if (result.isDone() || token.isCancelled()) {
                rateLimiter.release(permit);
                if (!result.isDone()) {
                    cancel("before dispatch");
                }
                return;
            }

            attempts++;
            state = InvocationState.IN_FLIGHT;
            ProviderRequest attemptRequest = request.withAttempt(attempts);
            long attemptStart = System.nanoTime();

            log.debug("Dispatching attempt: requestId={}, model={}, provider={}, attempt={}, timeoutMs={}",
                    request.requestId(),
                    spec.name(),
                    adapter.getName(),
                    attempts,
                    policy.attemptTimeout().toMillis());

            CompletableFuture<RawResponse> call;
            try {
                call = adapter.send(attemptRequest);
                if (call == null) {
                    call = CompletableFuture.failedFuture(
                            new IllegalStateException("Adapter returned no future: " + adapter.getName()));
                }
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }

            // Copy before applying the timeout so the adapter's own future is never completed by us
            call.thenApply(Function.identity())
                    .orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((response, error) -> onAttemptComplete(
                            attemptRequest, response, error, Duration.ofNanos(System.nanoTime() - attemptStart)));
        }

        private void onAttemptComplete(ProviderRequest attemptRequest, RawResponse response,
                                       Throwable error, Duration latency) {
            if (error == null) {
                state = InvocationState.SUCCEEDED;
                listener.onAttempt(attemptRequest, InvocationState.SUCCEEDED, null, latency);
                log.debug("Attempt succeeded: requestId={}, model={}, attempt={}, latencyMs={}",
                        request.requestId(), spec.name(), attempts, latency.toMillis());
                result.complete(new AttemptResult(response, attempts, Duration.ofNanos(System.nanoTime() - startNanos)));
                return;
            }

            Throwable cause = LlmBrokerException.unwrap(error);
            ErrorKind kind = policy.classifier().classify(cause);
            reportBillableFailure(attemptRequest, cause);

            switch (kind) {
                case FATAL -> {
                    state = InvocationState.FAILED;
                    listener.onAttempt(attemptRequest, InvocationState.FAILED, kind, latency);
                    log.warn("Fatal provider error: requestId={}, model={}, attempt={}, error={}",
                            request.requestId(), spec.name(), attempts, cause.getMessage());
                    fail(new FatalProviderException(spec.name(), attempts, cause.getMessage(), cause));
                }
                case RATE_LIMITED -> {
                    if (rateLimitedRetries >= policy.maxRateLimitedRetries()) {
                        listener.onAttempt(attemptRequest, InvocationState.FAILED, kind, latency);
                        fail(new ExhaustedRetriesException(spec.name(), attempts, cause));
                        return;
                    }
                    rateLimitedRetries++;
                    listener.onAttempt(attemptRequest, InvocationState.RETRYING, kind, latency);
                    Duration delay = policy.classifier().retryAfter(cause)
                            .orElseGet(() -> policy.delayForAttempt(rateLimitedRetries));
                    log.info("Provider rate limited, backing off: requestId={}, model={}, attempt={}, delayMs={}",
                            request.requestId(), spec.name(), attempts, delay.toMillis());
                    scheduleRetry(delay);
                }
                case RETRYABLE -> {
                    int counted = attempts - rateLimitedRetries;
                    if (counted >= policy.maxAttempts()) {
                        listener.onAttempt(attemptRequest, InvocationState.FAILED, kind, latency);
                        log.warn("Retries exhausted: requestId={}, model={}, attempts={}, error={}",
                                request.requestId(), spec.name(), attempts, cause.getMessage());
                        fail(cause instanceof TimeoutException
                                ? new AttemptTimeoutException(spec.name(), attempts, cause)
                                : new ExhaustedRetriesException(spec.name(), attempts, cause));
                        return;
                    }
                    listener.onAttempt(attemptRequest, InvocationState.RETRYING, kind, latency);
                    Duration delay = policy.delayForAttempt(counted);
                    log.info("Retryable provider error, backing off: requestId={}, model={}, attempt={}, delayMs={}, error={}",
                            request.requestId(), spec.name(), attempts, delay.toMillis(), cause.getMessage());
                    scheduleRetry(delay);
                }
            }
        }

        private void reportBillableFailure(ProviderRequest attemptRequest, Throwable cause) {
            if (!spec.chargeFailedAttempts() || !(cause instanceof ProviderException providerException)) {
                return;
            }
            providerException.getUsage().ifPresent(usage -> {
                try {
                    listener.onBillableFailure(attemptRequest, usage, null);
                } catch (RuntimeException e) {
                    log.error("Failed to record billable failure: requestId={}, model={}",
                            request.requestId(), spec.name(), e);
                }
            });
        }

        private void scheduleRetry(Duration delay) {
            state = InvocationState.RETRYING;
            try {
                scheduler.schedule(this::nextAttempt, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                fail(new CancelledException("Scheduler shut down before retry: requestId=" + request.requestId()));
            }
        }

        private void cancel(String where) {
            state = InvocationState.CANCELLED;
            log.info("Invocation cancelled: requestId={}, model={}, at={}, reason={}",
                    request.requestId(), spec.name(), where, token.getReason());
            result.completeExceptionally(new CancelledException(
                    "Cancelled " + where + ": " + token.getReason()));
        }

        private void fail(Throwable error) {
            state = error instanceof CancelledException ? InvocationState.CANCELLED : InvocationState.FAILED;
            log.debug("Execution ended: requestId={}, model={}, state={}, attempts={}, error={}",
                    request.requestId(), spec.name(), state, attempts, error.getMessage());
            result.completeExceptionally(error);
        }
    }
}
