package fr.lapetina.llm.broker.cost;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable chain of budgets from an innermost scope up to the process-wide root.
 * Passed explicitly to every invocation; every charge applies to each budget in the chain.
 */
public final class BudgetStack {

    private final CostBudget innermost;
    private final List<CostBudget> rootFirst;

    BudgetStack(CostBudget innermost) {
        this.innermost = Objects.requireNonNull(innermost, "innermost");
        List<CostBudget> chain = new ArrayList<>();
        for (CostBudget budget = innermost; budget != null; budget = budget.getParent()) {
            chain.add(budget);
        }
        Collections.reverse(chain);
        this.rootFirst = List.copyOf(chain);
    }

    public CostBudget innermost() {
        return innermost;
    }

    /**
     * Budgets ordered from the root down to the innermost scope. Locks are taken in this order.
     */
    public List<CostBudget> rootFirst() {
        return rootFirst;
    }

    /**
     * Whether any budget of the chain has a ceiling.
     */
    public boolean isLimited() {
        for (CostBudget budget : rootFirst) {
            if (budget.isLimited()) {
                return true;
            }
        }
        return false;
    }

    public int depth() {
        return rootFirst.size();
    }

    @Override
    public String toString() {
        return "BudgetStack{" + innermost.getPath() + '}';
    }
}
