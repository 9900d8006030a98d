package fr.lapetina.llm.broker.cost;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One named accounting scope with an optional ceiling.
 *
 * Budgets with a ceiling are mutated only while holding their own lock, so the check and the
 * update of a strict charge are atomic. Unlimited budgets are never checked and are updated
 * lock-free. Only {@link CostTracker} mutates budgets.
 */
public final class CostBudget {

    private final String name;
    private final String path;
    private final BigDecimal ceiling;
    private final CostBudget parent;
    private final boolean ephemeral;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<BigDecimal> spent = new AtomicReference<>(BigDecimal.ZERO);
    private final List<CostBudget> children = new CopyOnWriteArrayList<>();
    private volatile boolean frozen;

    CostBudget(String name, BigDecimal ceiling, CostBudget parent) {
        this(name, ceiling, parent, false);
    }

    CostBudget(String name, BigDecimal ceiling, CostBudget parent, boolean ephemeral) {
        this.name = name;
        this.ceiling = ceiling;
        this.parent = parent;
        this.ephemeral = ephemeral;
        this.path = parent == null || parent.isRoot() ? name : parent.path + "/" + name;
    }

    public String getName() {
        return name;
    }

    /**
     * Slash-separated names from the outermost user scope down to this one.
     */
    public String getPath() {
        return path;
    }

    /**
     * @return the ceiling, or null when unlimited
     */
    public BigDecimal getCeiling() {
        return ceiling;
    }

    public CostBudget getParent() {
        return parent;
    }

    public BigDecimal getSpent() {
        return spent.get();
    }

    /**
     * Ceiling minus spent, or null when unlimited.
     */
    public BigDecimal getRemaining() {
        return ceiling == null ? null : ceiling.subtract(spent.get());
    }

    public boolean isLimited() {
        return ceiling != null;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Whether this budget only lives for one request and leaves the tree when closed.
     */
    public boolean isEphemeral() {
        return ephemeral;
    }

    public boolean isRoot() {
        return parent == null;
    }

    List<CostBudget> getChildren() {
        return children;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Whether adding the amount keeps this budget within its ceiling. Caller holds the lock.
     */
    boolean fits(BigDecimal amount) {
        return ceiling == null || spent.get().add(amount).compareTo(ceiling) <= 0;
    }

    boolean isOverCeiling() {
        return ceiling != null && spent.get().compareTo(ceiling) > 0;
    }

    /**
     * Adds a (possibly negative) amount. Limited budgets require the caller to hold the lock.
     */
    void add(BigDecimal amount) {
        spent.accumulateAndGet(amount, BigDecimal::add);
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return "CostBudget{" +
                "path='" + path + '\'' +
                ", spent=" + spent.get().toPlainString() +
                ", ceiling=" + (ceiling != null ? ceiling.toPlainString() : "unlimited") +
                ", frozen=" + frozen +
                '}';
    }
}
