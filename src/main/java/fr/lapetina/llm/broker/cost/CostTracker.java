package fr.lapetina.llm.broker.cost;

import fr.lapetina.llm.broker.domain.event.UsageRecorder;
import fr.lapetina.llm.broker.exception.BudgetExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scoped, nested cost accounting with hard-stop ceilings.
 *
 * A charge applies to every budget of a {@link BudgetStack}. Strict charges lock the limited
 * budgets of the stack in root-first order, check every ceiling, then apply to all of them,
 * so a rejected charge changes no total. There is no global lock: unrelated scopes only meet
 * on the root, which is lock-free unless a global ceiling is configured.
 */
public final class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    public static final String ROOT_NAME = "global";

    private final CostBudget root;
    private final BudgetStack rootStack;
    private final UsageRecorder recorder;
    private final List<BudgetReportListener> listeners = new CopyOnWriteArrayList<>();

    public CostTracker() {
        this(null, UsageRecorder.NOOP);
    }

    public CostTracker(BigDecimal globalCeiling) {
        this(globalCeiling, UsageRecorder.NOOP);
    }

    public CostTracker(BigDecimal globalCeiling, UsageRecorder recorder) {
        checkCeiling(globalCeiling);
        this.root = new CostBudget(ROOT_NAME, globalCeiling, null);
        this.rootStack = new BudgetStack(root);
        this.recorder = recorder != null ? recorder : UsageRecorder.NOOP;
        log.info("CostTracker created: globalCeiling={}",
                globalCeiling != null ? globalCeiling.toPlainString() : "unlimited");
    }

    /**
     * Stack holding only the process-wide root budget.
     */
    public BudgetStack rootStack() {
        return rootStack;
    }

    public CostBudget getRoot() {
        return root;
    }

    public void addListener(BudgetReportListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Opens a budget scope directly under the process-wide root.
     *
     * @param ceiling maximum spend, or null for an unlimited (tracking-only) scope
     */
    public BudgetScope withBudget(String name, BigDecimal ceiling) {
        return withBudget(name, ceiling, rootStack);
    }

    /**
     * Opens a budget scope nested inside the innermost budget of {@code parent}.
     */
    public BudgetScope withBudget(String name, BigDecimal ceiling, BudgetStack parent) {
        return open(name, ceiling, parent, false);
    }

    /**
     * Opens the budget of a single request's own ceiling, named {@code request:<id>}. Once closed
     * it is detached from its parent, whose total already holds its spend.
     */
    public BudgetScope withRequestBudget(String requestId, BigDecimal ceiling, BudgetStack parent) {
        return open("request:" + requestId, ceiling, parent, true);
    }

    private BudgetScope open(String name, BigDecimal ceiling, BudgetStack parent, boolean ephemeral) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Budget name is required");
        }
        checkCeiling(ceiling);
        CostBudget outer = Objects.requireNonNull(parent, "parent").innermost();
        if (outer.isFrozen()) {
            throw new IllegalStateException("Cannot open budget '" + name + "' inside closed budget '"
                    + outer.getPath() + "'");
        }
        CostBudget budget = new CostBudget(name, ceiling, outer, ephemeral);
        outer.getChildren().add(budget);

        log.debug("Budget opened: path={}, ceiling={}",
                budget.getPath(), ceiling != null ? ceiling.toPlainString() : "unlimited");
        return new BudgetScope(this, new BudgetStack(budget));
    }

    /**
     * Strict charge: applied to every budget of the stack, or to none.
     *
     * @throws BudgetExceededException naming the first budget (root first) that would breach its ceiling
     * @throws IllegalStateException   if a budget of the stack is closed
     */
    public void charge(BigDecimal amount, BudgetStack stack) {
        checkAmount(amount);
        apply(amount, stack, true);
    }

    /**
     * Strict speculative charge, reconciled later through the returned {@link Reservation}.
     */
    public Reservation reserve(BigDecimal amount, BudgetStack stack) {
        checkAmount(amount);
        apply(amount, stack, true);
        return new Reservation(this, stack, amount);
    }

    /**
     * Forced charge for spend the provider already billed. Never rejected; closed budgets of the
     * stack are skipped and the amount lands on the still-open ones.
     *
     * @return a violation message when a budget ends above its ceiling
     */
    public Optional<String> record(BigDecimal amount, BudgetStack stack) {
        checkAmount(amount);
        return apply(amount, stack, false);
    }

    /**
     * Lowers the totals of every open budget of the stack.
     */
    public void refund(BigDecimal amount, BudgetStack stack) {
        checkAmount(amount);
        if (amount.signum() == 0) {
            return;
        }
        List<CostBudget> locked = lockLimited(stack);
        try {
            for (CostBudget budget : stack.rootFirst()) {
                if (!budget.isFrozen()) {
                    budget.add(amount.negate());
                }
            }
        } finally {
            unlock(locked);
        }
        log.debug("Refund applied: budget={}, amount={}", stack.innermost().getPath(), amount.toPlainString());
    }

    /**
     * Spent per path for every open budget, the root included.
     */
    public Map<String, BigDecimal> snapshot() {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        collect(root, totals, true);
        return totals;
    }

    BudgetReport close(CostBudget budget) {
        if (budget.isRoot()) {
            throw new IllegalStateException("The root budget cannot be closed");
        }
        budget.lock().lock();
        try {
            if (budget.isFrozen()) {
                return null;
            }
            budget.freeze();
        } finally {
            budget.lock().unlock();
        }

        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        collect(budget, totals, false);
        BudgetReport report = new BudgetReport(budget.getPath(), budget.getCeiling(), budget.getSpent(), totals);

        if (budget.getParent().isRoot() || budget.isEphemeral()) {
            // the parent may outlive any number of these, don't keep them reachable
            budget.getParent().getChildren().remove(budget);
        }

        log.info("Budget closed: name={}, spent={}, ceiling={}, scopes={}",
                report.name(),
                report.spent().toPlainString(),
                report.ceiling() != null ? report.ceiling().toPlainString() : "unlimited",
                totals.size());

        for (BudgetReportListener listener : listeners) {
            try {
                listener.onBudgetClosed(report);
            } catch (RuntimeException e) {
                log.error("Budget report listener failed: name={}", report.name(), e);
            }
        }
        recorder.onBudgetClosed(report.name(), report.spent(), report.ceiling());
        return report;
    }

    private Optional<String> apply(BigDecimal amount, BudgetStack stack, boolean strict) {
        Objects.requireNonNull(stack, "stack");
        if (amount.signum() == 0) {
            if (strict) {
                checkOpen(stack);
            }
            return Optional.empty();
        }

        List<CostBudget> locked = lockLimited(stack);
        try {
            if (strict) {
                checkOpen(stack);
                for (CostBudget budget : stack.rootFirst()) {
                    if (!budget.fits(amount)) {
                        log.warn("Charge rejected: budget={}, spent={}, requested={}, ceiling={}",
                                budget.getPath(),
                                budget.getSpent().toPlainString(),
                                amount.toPlainString(),
                                budget.getCeiling().toPlainString());
                        throw new BudgetExceededException(budget.getPath(), budget.getCeiling(),
                                budget.getSpent(), amount);
                    }
                }
            }

            String violation = null;
            for (CostBudget budget : stack.rootFirst()) {
                if (budget.isFrozen()) {
                    log.warn("Late charge skipped closed budget: budget={}, amount={}",
                            budget.getPath(), amount.toPlainString());
                    continue;
                }
                budget.add(amount);
                if (violation == null && budget.isOverCeiling()) {
                    violation = "Budget '" + budget.getPath() + "' over ceiling: spent="
                            + budget.getSpent().toPlainString()
                            + ", ceiling=" + budget.getCeiling().toPlainString();
                }
            }

            log.debug("Charge applied: budget={}, amount={}, strict={}",
                    stack.innermost().getPath(), amount.toPlainString(), strict);
            return Optional.ofNullable(violation);
        } finally {
            unlock(locked);
        }
    }

    private static void checkOpen(BudgetStack stack) {
        for (CostBudget budget : stack.rootFirst()) {
            if (budget.isFrozen()) {
                throw new IllegalStateException("Budget '" + budget.getPath() + "' is closed");
            }
        }
    }

    private static List<CostBudget> lockLimited(BudgetStack stack) {
        List<CostBudget> locked = new ArrayList<>(stack.depth());
        for (CostBudget budget : stack.rootFirst()) {
            if (budget.isLimited()) {
                budget.lock().lock();
                locked.add(budget);
            }
        }
        return locked;
    }

    private static void unlock(List<CostBudget> locked) {
        for (int i = locked.size() - 1; i >= 0; i--) {
            locked.get(i).lock().unlock();
        }
    }

    private static void collect(CostBudget budget, Map<String, BigDecimal> totals, boolean openOnly) {
        if (openOnly && budget.isFrozen()) {
            return;
        }
        totals.merge(budget.getPath(), budget.getSpent(), BigDecimal::add);
        for (CostBudget child : budget.getChildren()) {
            collect(child, totals, openOnly);
        }
    }

    private static void checkAmount(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount.toPlainString());
        }
    }

    private static void checkCeiling(BigDecimal ceiling) {
        if (ceiling != null && ceiling.signum() < 0) {
            throw new IllegalArgumentException("Ceiling must be non-negative: " + ceiling.toPlainString());
        }
    }
}
