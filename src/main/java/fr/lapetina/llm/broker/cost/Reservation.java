package fr.lapetina.llm.broker.cost;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A strict speculative charge taken before dispatch, reconciled once the actual cost is known.
 * Exactly one of {@link #settle(BigDecimal)} or {@link #release()} takes effect.
 */
public final class Reservation {

    private final CostTracker tracker;
    private final BudgetStack stack;
    private final BigDecimal amount;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    Reservation(CostTracker tracker, BudgetStack stack, BigDecimal amount) {
        this.tracker = tracker;
        this.stack = stack;
        this.amount = amount;
    }

    /**
     * Replaces the reserved amount by the actual one. A shortfall is refunded; an excess is
     * charged even when it breaches a ceiling, since the provider already billed it.
     *
     * @return a violation message when the excess pushed a budget over its ceiling
     */
    public Optional<String> settle(BigDecimal actual) {
        if (!finished.compareAndSet(false, true)) {
            return Optional.empty();
        }
        BigDecimal delta = actual.subtract(amount);
        if (delta.signum() < 0) {
            tracker.refund(delta.negate(), stack);
            return Optional.empty();
        }
        if (delta.signum() == 0) {
            return Optional.empty();
        }
        return tracker.record(delta, stack);
    }

    /**
     * Refunds the whole reservation; the call was never billed.
     */
    public void release() {
        if (finished.compareAndSet(false, true) && amount.signum() > 0) {
            tracker.refund(amount, stack);
        }
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public boolean isFinished() {
        return finished.get();
    }
}
