package fr.lapetina.llm.broker.cost;

/**
 * Receives the report of every budget scope when it closes.
 */
@FunctionalInterface
public interface BudgetReportListener {

    void onBudgetClosed(BudgetReport report);
}
