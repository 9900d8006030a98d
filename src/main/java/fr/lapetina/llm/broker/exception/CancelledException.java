package fr.lapetina.llm.broker.exception;

import java.math.BigDecimal;

/**
 * Cooperative cancellation was observed at a suspend point.
 *
 * <p>{@link #getBilledCost()} is non-zero when the provider had already answered and
 * billed the call before its result was discarded.
 */
public final class CancelledException extends LlmBrokerException {

    private final BigDecimal billedCost;

    public CancelledException(String message) {
        this(message, BigDecimal.ZERO);
    }

    public CancelledException(String message, BigDecimal billedCost) {
        super(message);
        this.billedCost = billedCost != null ? billedCost : BigDecimal.ZERO;
    }

    public BigDecimal getBilledCost() {
        return billedCost;
    }
}
