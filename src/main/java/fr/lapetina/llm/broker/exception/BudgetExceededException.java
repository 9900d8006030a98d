package fr.lapetina.llm.broker.exception;

import java.math.BigDecimal;

/**
 * A charge would have pushed a budget over its ceiling. No total was changed and the
 * call was not dispatched.
 */
public final class BudgetExceededException extends LlmBrokerException {

    private final String budgetName;
    private final BigDecimal ceiling;
    private final BigDecimal spent;
    private final BigDecimal requested;

    public BudgetExceededException(String budgetName, BigDecimal ceiling, BigDecimal spent, BigDecimal requested) {
        super("Budget '" + budgetName + "' exceeded: spent=" + spent.toPlainString()
                + ", requested=" + requested.toPlainString()
                + ", ceiling=" + ceiling.toPlainString());
        this.budgetName = budgetName;
        this.ceiling = ceiling;
        this.spent = spent;
        this.requested = requested;
    }

    public String getBudgetName() {
        return budgetName;
    }

    public BigDecimal getCeiling() {
        return ceiling;
    }

    public BigDecimal getSpent() {
        return spent;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
