package fr.lapetina.llm.broker.batch;

import fr.lapetina.llm.broker.cost.BudgetStack;
import fr.lapetina.llm.broker.cost.CostTracker;
import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.InvocationResult;
import fr.lapetina.llm.broker.exception.BudgetExceededException;
import fr.lapetina.llm.broker.exception.CancelledException;
import fr.lapetina.llm.broker.exception.FatalProviderException;
import fr.lapetina.llm.broker.exception.LlmBrokerException;
import fr.lapetina.llm.broker.invoker.ModelInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

/**
 * Bounded-concurrency fan-out returning one outcome per input, in input order.
 *
 * Up to {@code concurrencyLimit} lanes each pull the next unstarted index when their previous
 * item completes. Continuations hop through the executor so a run of synchronously completing
 * items never grows the stack.
 */
public final class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final ModelInvoker invoker;
    private final CostTracker costTracker;
    private final Executor executor;

    public BatchScheduler(ModelInvoker invoker, CostTracker costTracker, Executor executor) {
        this.invoker = invoker;
        this.costTracker = costTracker;
        this.executor = executor;
    }

    /**
     * Invokes every request against {@code stack}.
     */
    public CompletableFuture<List<BatchOutcome<InvocationResult>>> runAll(
            List<InvocationRequest> requests,
            BatchOptions options,
            BudgetStack stack
    ) {
        BatchOptions effective = options != null ? options : BatchOptions.defaults();
        boolean refund = effective.discardedCostPolicy() == DiscardedCostPolicy.REFUND;
        return run(requests, effective,
                (request, token) -> invoker.invoke(request, stack, token)
                        .whenComplete((result, error) -> {
                            if (refund && error != null
                                    && LlmBrokerException.unwrap(error) instanceof CancelledException cancelled
                                    && cancelled.getBilledCost().signum() > 0) {
                                refundDiscarded(request.requestId(), cancelled.getBilledCost(), stack);
                            }
                        }),
                (request, discarded) -> {
                    if (refund && discarded.cost().signum() > 0) {
                        refundDiscarded(request.requestId(), discarded.cost(), stack);
                    }
                });
    }

    /**
     * Runs {@code task} for every item. The returned future never fails: each item's error is
     * captured in its {@link BatchOutcome}.
     */
    public <T, R> CompletableFuture<List<BatchOutcome<R>>> run(
            List<T> items,
            BatchOptions options,
            BiFunction<T, CancellationToken, CompletableFuture<R>> task
    ) {
        return run(items, options, task, (item, discarded) -> {
        });
    }

    private <T, R> CompletableFuture<List<BatchOutcome<R>>> run(
            List<T> items,
            BatchOptions options,
            BiFunction<T, CancellationToken, CompletableFuture<R>> task,
            BiConsumer<T, R> onDiscarded
    ) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(task, "task");
        BatchRun<T, R> batch = new BatchRun<>(List.copyOf(items),
                options != null ? options : BatchOptions.defaults(), task, onDiscarded);
        return batch.start();
    }

    private void refundDiscarded(String requestId, BigDecimal billed, BudgetStack stack) {
        costTracker.refund(billed, stack);
        log.info("Discarded result refunded: requestId={}, amount={}", requestId, billed.toPlainString());
    }

    private final class BatchRun<T, R> {
        private final List<T> items;
        private final BatchOptions options;
        private final BiFunction<T, CancellationToken, CompletableFuture<R>> task;
        private final BiConsumer<T, R> onDiscarded;
        private final CancellationToken token = new CancellationToken();
        private final AtomicInteger nextIndex = new AtomicInteger();
        private final AtomicInteger remaining;
        private final AtomicReferenceArray<BatchOutcome<R>> outcomes;
        private final CompletableFuture<List<BatchOutcome<R>>> result = new CompletableFuture<>();

        BatchRun(List<T> items, BatchOptions options,
                 BiFunction<T, CancellationToken, CompletableFuture<R>> task, BiConsumer<T, R> onDiscarded) {
            this.items = items;
            this.options = options;
            this.task = task;
            this.onDiscarded = onDiscarded;
            this.remaining = new AtomicInteger(items.size());
            this.outcomes = new AtomicReferenceArray<>(items.size());
        }

        CompletableFuture<List<BatchOutcome<R>>> start() {
            log.info("Batch started: items={}, concurrencyLimit={}, failFast={}",
                    items.size(), options.concurrencyLimit(), options.failFast());
            if (items.isEmpty()) {
                result.complete(List.of());
                return result;
            }
            int lanes = Math.min(options.concurrencyLimit(), items.size());
            for (int lane = 0; lane < lanes; lane++) {
                runNext();
            }
            return result;
        }

        private void runNext() {
            while (true) {
                int index = nextIndex.getAndIncrement();
                if (index >= items.size()) {
                    return;
                }

                if (token.isCancelled()) {
                    finish(index, BatchOutcome.failure(index, new CancelledException(
                            "Batch cancelled before item " + index + " started: " + token.getReason())));
                    continue;
                }

                CompletableFuture<R> call;
                try {
                    call = task.apply(items.get(index), token);
                } catch (RuntimeException e) {
                    call = CompletableFuture.failedFuture(e);
                }
                call.whenComplete((value, error) -> hop(() -> {
                    onItemComplete(index, value, error);
                    runNext();
                }));
                return;
            }
        }

        private void hop(Runnable continuation) {
            try {
                executor.execute(continuation);
            } catch (RejectedExecutionException e) {
                log.debug("Executor rejected batch continuation, running inline");
                continuation.run();
            }
        }

        private void onItemComplete(int index, R value, Throwable error) {
            if (error == null) {
                if (token.isCancelled()) {
                    onDiscarded.accept(items.get(index), value);
                    finish(index, BatchOutcome.failure(index, new CancelledException(
                            "Result of item " + index + " discarded after cancellation: " + token.getReason())));
                } else {
                    finish(index, BatchOutcome.success(index, value));
                }
                return;
            }
            Throwable cause = LlmBrokerException.unwrap(error);
            if (options.failFast()
                    && (cause instanceof FatalProviderException || cause instanceof BudgetExceededException)
                    && token.cancel("item " + index + " failed: " + cause.getMessage())) {
                log.warn("Batch fail-fast triggered: index={}, error={}", index, cause.getMessage());
            }
            finish(index, BatchOutcome.failure(index, cause));
        }

        private void finish(int index, BatchOutcome<R> outcome) {
            outcomes.set(index, outcome);
            if (remaining.decrementAndGet() == 0) {
                List<BatchOutcome<R>> ordered = new ArrayList<>(items.size());
                int failures = 0;
                for (int i = 0; i < items.size(); i++) {
                    BatchOutcome<R> slot = outcomes.get(i);
                    ordered.add(slot);
                    if (!slot.isSuccess()) {
                        failures++;
                    }
                }
                log.info("Batch completed: items={}, failures={}, cancelled={}",
                        items.size(), failures, token.isCancelled());
                result.complete(List.copyOf(ordered));
            }
        }
    }
}
