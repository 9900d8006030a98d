package fr.lapetina.llm.broker.batch;

/**
 * What happens to the billed cost of results discarded after a fail-fast cancellation.
 */
public enum DiscardedCostPolicy {
    /** The cost stays on the budgets: the provider billed it */
    RETAIN,

    /** The cost is refunded from the budget totals */
    REFUND
}
