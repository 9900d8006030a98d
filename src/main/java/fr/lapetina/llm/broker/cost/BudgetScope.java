package fr.lapetina.llm.broker.cost;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Open budget scope. Use with try-with-resources; closing freezes the budget and publishes its
 * {@link BudgetReport}, on normal or exceptional exit. Closing twice is a no-op.
 */
public final class BudgetScope implements AutoCloseable {

    private final CostTracker tracker;
    private final BudgetStack stack;
    private final AtomicReference<BudgetReport> report = new AtomicReference<>();

    BudgetScope(CostTracker tracker, BudgetStack stack) {
        this.tracker = tracker;
        this.stack = stack;
    }

    /**
     * The chain to pass to invocations made inside this scope.
     */
    public BudgetStack stack() {
        return stack;
    }

    public CostBudget budget() {
        return stack.innermost();
    }

    public String name() {
        return stack.innermost().getName();
    }

    public BigDecimal spent() {
        return stack.innermost().getSpent();
    }

    public boolean isClosed() {
        return report.get() != null;
    }

    /**
     * @return the final report, or null while the scope is open
     */
    public BudgetReport getReport() {
        return report.get();
    }

    @Override
    public void close() {
        if (report.get() != null) {
            return;
        }
        BudgetReport closed = tracker.close(stack.innermost());
        if (closed != null) {
            report.compareAndSet(null, closed);
        }
    }
}
