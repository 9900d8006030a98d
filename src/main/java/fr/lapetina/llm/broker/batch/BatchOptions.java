package fr.lapetina.llm.broker.batch;

/**
 * Batch execution settings.
 *
 * @param concurrencyLimit maximum items in flight at once
 * @param failFast         cancel the remaining items on the first fatal or budget failure
 */
public record BatchOptions(int concurrencyLimit, boolean failFast, DiscardedCostPolicy discardedCostPolicy) {

    public static final int DEFAULT_CONCURRENCY_LIMIT = 8;

    public BatchOptions {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        }
        discardedCostPolicy = discardedCostPolicy != null ? discardedCostPolicy : DiscardedCostPolicy.RETAIN;
    }

    public static BatchOptions defaults() {
        return new BatchOptions(DEFAULT_CONCURRENCY_LIMIT, false, DiscardedCostPolicy.RETAIN);
    }

    public static BatchOptions of(int concurrencyLimit) {
        return new BatchOptions(concurrencyLimit, false, DiscardedCostPolicy.RETAIN);
    }

    public BatchOptions withFailFast(boolean failFast) {
        return new BatchOptions(concurrencyLimit, failFast, discardedCostPolicy);
    }

    public BatchOptions withDiscardedCostPolicy(DiscardedCostPolicy policy) {
        return new BatchOptions(concurrencyLimit, failFast, policy);
    }
}
