package fr.lapetina.llm.broker;

import fr.lapetina.llm.broker.batch.BatchOptions;
import fr.lapetina.llm.broker.batch.BatchOutcome;
import fr.lapetina.llm.broker.batch.BatchScheduler;
import fr.lapetina.llm.broker.cost.BudgetReportListener;
import fr.lapetina.llm.broker.cost.BudgetScope;
import fr.lapetina.llm.broker.cost.BudgetStack;
import fr.lapetina.llm.broker.cost.CostTracker;
import fr.lapetina.llm.broker.domain.model.CancellationToken;
import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.InvocationResult;
import fr.lapetina.llm.broker.domain.model.ModelCapability;
import fr.lapetina.llm.broker.domain.routing.ModelRouter;
import fr.lapetina.llm.broker.exception.UnknownModelException;
import fr.lapetina.llm.broker.invoker.ModelInvoker;
import fr.lapetina.llm.broker.parsing.OutputSchema;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing entry point: resolve a model, invoke it (plain or structured), fan out
 * batches and open budget scopes.
 *
 * <p>Calls without an explicit {@link BudgetStack} are charged to the process-wide root budget.
 */
public final class LlmBroker {

    private final ModelRouter router;
    private final ModelInvoker invoker;
    private final BatchScheduler batchScheduler;
    private final CostTracker costTracker;
    private final BatchOptions defaultBatchOptions;

    public LlmBroker(
            ModelRouter router,
            ModelInvoker invoker,
            BatchScheduler batchScheduler,
            CostTracker costTracker,
            BatchOptions defaultBatchOptions
    ) {
        this.router = router;
        this.invoker = invoker;
        this.batchScheduler = batchScheduler;
        this.costTracker = costTracker;
        this.defaultBatchOptions = defaultBatchOptions != null ? defaultBatchOptions : BatchOptions.defaults();
    }

    /**
     * Starts a request for a model name or alias.
     */
    public InvocationRequest.Builder request(String modelOrAlias) {
        return InvocationRequest.builder().model(router.resolve(modelOrAlias));
    }

    public CompletableFuture<InvocationResult> invoke(String modelOrAlias, String prompt) {
        return invoke(request(modelOrAlias).prompt(prompt).build(), costTracker.rootStack());
    }

    public CompletableFuture<InvocationResult> invoke(InvocationRequest request) {
        return invoke(request, costTracker.rootStack());
    }

    public CompletableFuture<InvocationResult> invoke(InvocationRequest request, BudgetStack stack) {
        return invoker.invoke(request, stack);
    }

    public CompletableFuture<InvocationResult> invoke(InvocationRequest request, BudgetStack stack,
                                                      CancellationToken token) {
        return invoker.invoke(request, stack, token);
    }

    /**
     * Invokes the request and decodes its output into the schema's type; read the value with
     * {@link InvocationResult#parsedAs(Class)}.
     *
     * @throws UnknownModelException if the model does not offer structured output
     */
    public <T> CompletableFuture<InvocationResult> invokeStructured(InvocationRequest request, OutputSchema<T> schema,
                                                                    BudgetStack stack) {
        router.resolve(request.model().name(), ModelCapability.STRUCTURED_OUTPUT);
        return invoker.invoke(request.toBuilder().schema(schema).build(), stack);
    }

    public <T> CompletableFuture<InvocationResult> invokeStructured(InvocationRequest request, OutputSchema<T> schema) {
        return invokeStructured(request, schema, costTracker.rootStack());
    }

    public CompletableFuture<List<BatchOutcome<InvocationResult>>> runAll(List<InvocationRequest> requests,
                                                                          BatchOptions options,
                                                                          BudgetStack stack) {
        return batchScheduler.runAll(requests, options, stack);
    }

    /**
     * Runs the batch with the configured default options.
     */
    public CompletableFuture<List<BatchOutcome<InvocationResult>>> runAll(List<InvocationRequest> requests,
                                                                          BudgetStack stack) {
        return batchScheduler.runAll(requests, defaultBatchOptions, stack);
    }

    public BudgetScope openBudget(String name, BigDecimal ceiling) {
        return costTracker.withBudget(name, ceiling);
    }

    public BudgetScope openBudget(String name, BigDecimal ceiling, BudgetStack parent) {
        return costTracker.withBudget(name, ceiling, parent);
    }

    public void addBudgetListener(BudgetReportListener listener) {
        costTracker.addListener(listener);
    }

    /**
     * Spent per open budget path.
     */
    public Map<String, BigDecimal> costSnapshot() {
        return costTracker.snapshot();
    }

    public ModelRouter getRouter() {
        return router;
    }

    public BatchScheduler getBatchScheduler() {
        return batchScheduler;
    }

    public BatchOptions getDefaultBatchOptions() {
        return defaultBatchOptions;
    }
}
