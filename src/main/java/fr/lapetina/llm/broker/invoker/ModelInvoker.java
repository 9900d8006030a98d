package fr.lapetina.llm.broker.invoker;

import fr.lapetina.llm.broker.cost.BudgetScope;
import fr.lapetina.llm.broker.cost.BudgetStack;
import fr.lapetina.llm.broker.cost.CostEstimator;
import fr.lapetina.llm.broker.cost.CostTracker;
import fr.lapetina.llm.broker.cost.Reservation;
import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.event.UsageRecorder;
import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.InvocationResult;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.model.TokenUsage;
import fr.lapetina.llm.broker.exception.CancelledException;
import fr.lapetina.llm.broker.exception.LlmBrokerException;
import fr.lapetina.llm.broker.parsing.OutputSchema;
import fr.lapetina.llm.broker.parsing.ParsedOutput;
import fr.lapetina.llm.broker.parsing.StructuredOutputParser;
import fr.lapetina.llm.broker.provider.ProviderRequest;
import fr.lapetina.llm.broker.retry.AttemptListener;
import fr.lapetina.llm.broker.retry.RetryExecutor;
import fr.lapetina.llm.broker.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs one logical request end to end: budget reservation, rate-limited retrying dispatch,
 * cost reconciliation and, when the request carries a schema, structured decoding with
 * correction calls.
 *
 * Returned futures complete exceptionally with the broker exception itself, never with a
 * {@link CompletionException} wrapper.
 */
public final class ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(ModelInvoker.class);

    private final RetryExecutor retryExecutor;
    private final CostTracker costTracker;
    private final CostEstimator costEstimator;
    private final StructuredOutputParser parser;
    private final RetryPolicy retryPolicy;
    private final UsageRecorder recorder;
    private final ConcurrentMap<String, CompletableFuture<Void>> unpricedTurns = new ConcurrentHashMap<>();

    public ModelInvoker(
            RetryExecutor retryExecutor,
            CostTracker costTracker,
            CostEstimator costEstimator,
            StructuredOutputParser parser,
            RetryPolicy retryPolicy,
            UsageRecorder recorder
    ) {
        this.retryExecutor = retryExecutor;
        this.costTracker = costTracker;
        this.costEstimator = costEstimator;
        this.parser = parser;
        this.retryPolicy = retryPolicy;
        this.recorder = recorder != null ? recorder : UsageRecorder.NOOP;
    }

    public CompletableFuture<InvocationResult> invoke(InvocationRequest request, BudgetStack stack) {
        return invoke(request, stack, CancellationToken.none());
    }

    /**
     * Invokes the request against the budgets of {@code stack}.
     *
     * <p>A per-request cost ceiling becomes a child budget of the stack for the duration of the
     * call, correction calls included.
     */
    public CompletableFuture<InvocationResult> invoke(InvocationRequest request, BudgetStack stack,
                                                      CancellationToken token) {
        long startNanos = System.nanoTime();
        CompletableFuture<InvocationResult> result = new CompletableFuture<>();

        BudgetScope ceilingScope = null;
        CompletableFuture<InvocationResult> pipeline;
        try {
            BudgetStack effective = stack;
            if (request.costCeiling() != null) {
                ceilingScope = costTracker.withRequestBudget(request.requestId(), request.costCeiling(), stack);
                effective = ceilingScope.stack();
            }
            BudgetStack budgets = effective;
            pipeline = invokeRaw(request, budgets, token)
                    .thenCompose(raw -> request.isStructured()
                            ? parseStructured(request, raw, request.schema(), budgets, token)
                            : CompletableFuture.completedFuture(raw));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }

        BudgetScope scope = ceilingScope;
        pipeline.whenComplete((invocation, error) -> {
            if (scope != null) {
                scope.close();
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            if (error != null) {
                Throwable cause = LlmBrokerException.unwrap(error);
                InvocationState outcome = cause instanceof CancelledException
                        ? InvocationState.CANCELLED
                        : InvocationState.FAILED;
                log.warn("Invocation failed: requestId={}, model={}, outcome={}, error={}",
                        request.requestId(), request.model().name(), outcome, cause.getMessage());
                recorder.onInvocationFailed(request.requestId(), request.model().name(), outcome, cause, latency);
                result.completeExceptionally(cause);
                return;
            }
            InvocationResult completed = invocation.toBuilder().latency(latency).build();
            log.info("Invocation completed: requestId={}, model={}, attempts={}, parseAttempts={}, cost={}, latencyMs={}",
                    completed.requestId(),
                    completed.model(),
                    completed.attempts(),
                    completed.parseAttempts(),
                    completed.cost().toPlainString(),
                    latency.toMillis());
            recorder.onInvocationSucceeded(completed.requestId(), completed.model(), completed.attempts(),
                    completed.usage(), completed.cost(), latency);
            result.complete(completed);
        });
        return result;
    }

    /**
     * One provider call: reserve, dispatch with retries, settle. No decoding.
     */
    private CompletableFuture<InvocationResult> invokeRaw(InvocationRequest request, BudgetStack stack,
                                                          CancellationToken token) {
        if (stack.isLimited() && costEstimator.isUnpriced(request)) {
            return dispatchInTurn(request, stack, token);
        }
        return dispatch(request, stack, token);
    }

    /**
     * Under a ceiling, calls to a model whose cost is still unknown run one at a time, each
     * estimated once the previous one has been billed.
     */
    private CompletableFuture<InvocationResult> dispatchInTurn(InvocationRequest request, BudgetStack stack,
                                                                CancellationToken token) {
        String model = request.model().name();
        CompletableFuture<Void> turn = new CompletableFuture<>();
        CompletableFuture<Void> previous = unpricedTurns.put(model, turn);
        if (previous != null) {
            log.debug("Waiting for unpriced call to settle: requestId={}, model={}", request.requestId(), model);
        }
        CompletableFuture<Void> ready = previous != null ? previous : CompletableFuture.completedFuture(null);
        return ready.thenCompose(ignored -> dispatch(request, stack, token))
                .whenComplete((invocation, error) -> {
                    unpricedTurns.remove(model, turn);
                    turn.complete(null);
                });
    }

    private CompletableFuture<InvocationResult> dispatch(InvocationRequest request, BudgetStack stack,
                                                         CancellationToken token) {
        ModelSpec spec = request.model();
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(new CancelledException(
                    "Cancelled before dispatch: requestId=" + request.requestId() + ", reason=" + token.getReason()));
        }

        BigDecimal estimate = costEstimator.estimate(request);
        Reservation reservation;
        try {
            reservation = costTracker.reserve(estimate, stack);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("Invoking model: requestId={}, model={}, estimate={}, budget={}",
                request.requestId(), spec.name(), estimate.toPlainString(), stack.innermost().getPath());

        BillingListener listener = new BillingListener(request, stack);
        return retryExecutor.execute(ProviderRequest.from(request), spec, retryPolicy, token, listener)
                .handle((attempt, error) -> {
                    if (error != null) {
                        reservation.release();
                        Throwable cause = LlmBrokerException.unwrap(error);
                        BigDecimal failedCost = listener.billedCost();
                        if (cause instanceof CancelledException cancelled && failedCost.signum() > 0) {
                            cause = new CancelledException(cancelled.getMessage(),
                                    cancelled.getBilledCost().add(failedCost));
                        }
                        throw new CompletionException(cause);
                    }

                    TokenUsage usage = attempt.response().usage();
                    BigDecimal cost = spec.pricing().cost(usage, attempt.response().reportedCost());
                    Optional<String> violation = reservation.settle(cost);
                    costEstimator.observe(spec, cost);
                    recorder.onCharge(request.requestId(), spec.name(), usage, cost, stack.innermost().getPath());
                    violation.ifPresent(message -> log.warn(
                            "Ceiling exceeded at reconciliation: requestId={}, model={}, cost={}, estimate={}, violation={}",
                            request.requestId(), spec.name(), cost.toPlainString(), estimate.toPlainString(), message));

                    BigDecimal billed = cost.add(listener.billedCost());
                    TokenUsage billedUsage = (usage != null ? usage : TokenUsage.ZERO).plus(listener.billedUsage());
                    if (token.isCancelled()) {
                        throw new CompletionException(new CancelledException(
                                "Cancelled after provider response: requestId=" + request.requestId()
                                        + ", reason=" + token.getReason(), billed));
                    }

                    return InvocationResult.builder()
                            .requestId(request.requestId())
                            .model(spec.name())
                            .text(attempt.response().text())
                            .usage(billedUsage)
                            .cost(billed)
                            .latency(attempt.latency())
                            .attempts(attempt.attempts())
                            .ceilingViolation(violation.or(listener::violation).orElse(null))
                            .build();
                });
    }

    private <T> CompletableFuture<InvocationResult> parseStructured(
            InvocationRequest request,
            InvocationResult first,
            OutputSchema<T> schema,
            BudgetStack stack,
            CancellationToken token
    ) {
        return parser.parse(request, first.text(), schema, correction -> invokeRaw(correction, stack, token))
                .thenApply(parsed -> merge(first, parsed));
    }

    private static InvocationResult merge(InvocationResult first, ParsedOutput<?> parsed) {
        TokenUsage usage = first.usage();
        BigDecimal cost = first.cost();
        int attempts = first.attempts();
        String violation = first.ceilingViolation();
        for (InvocationResult correction : parsed.corrections()) {
            usage = usage.plus(correction.usage());
            cost = cost.add(correction.cost());
            attempts += correction.attempts();
            if (violation == null) {
                violation = correction.ceilingViolation();
            }
        }
        return first.toBuilder()
                .text(parsed.rawText())
                .parsed(parsed.value())
                .usage(usage)
                .cost(cost)
                .attempts(attempts)
                .parseAttempts(parsed.attempts())
                .ceilingViolation(violation)
                .build();
    }

    /**
     * Forwards attempt telemetry and charges failed attempts the provider billed.
     */
    private final class BillingListener implements AttemptListener {
        private final InvocationRequest request;
        private final BudgetStack stack;
        private BigDecimal billedCost = BigDecimal.ZERO;
        private TokenUsage billedUsage = TokenUsage.ZERO;
        private String violation;

        BillingListener(InvocationRequest request, BudgetStack stack) {
            this.request = request;
            this.stack = stack;
        }

        @Override
        public void onAttempt(ProviderRequest attempt, InvocationState outcome, ErrorKind kind, Duration latency) {
            recorder.onAttempt(request.requestId(), request.model().name(), attempt.attempt(), outcome, kind, latency);
        }

        @Override
        public void onBillableFailure(ProviderRequest attempt, TokenUsage usage, BigDecimal reportedCost) {
            ModelSpec spec = request.model();
            BigDecimal cost = spec.pricing().cost(usage, reportedCost);
            Optional<String> exceeded = costTracker.record(cost, stack);
            costEstimator.observe(spec, cost);
            synchronized (this) {
                billedCost = billedCost.add(cost);
                billedUsage = billedUsage.plus(usage != null ? usage : TokenUsage.ZERO);
                if (violation == null) {
                    violation = exceeded.orElse(null);
                }
            }
            recorder.onCharge(request.requestId(), spec.name(), usage, cost, stack.innermost().getPath());
            log.info("Failed attempt charged: requestId={}, model={}, attempt={}, cost={}",
                    request.requestId(), spec.name(), attempt.attempt(), cost.toPlainString());
            exceeded.ifPresent(message -> log.warn("Ceiling exceeded by failed attempt: requestId={}, violation={}",
                    request.requestId(), message));
        }

        synchronized BigDecimal billedCost() {
            return billedCost;
        }

        synchronized TokenUsage billedUsage() {
            return billedUsage;
        }

        synchronized Optional<String> violation() {
            return Optional.ofNullable(violation);
        }
    }
}
