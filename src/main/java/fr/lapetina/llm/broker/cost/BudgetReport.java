package fr.lapetina.llm.broker.cost;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Final totals of a closed budget scope.
 *
 * @param totals spent per budget path, for the closed scope and all its descendants
 */
public record BudgetReport(String name, BigDecimal ceiling, BigDecimal spent, Map<String, BigDecimal> totals) {

    public BudgetReport {
        totals = Map.copyOf(totals);
    }

    public boolean exceededCeiling() {
        return ceiling != null && spent.compareTo(ceiling) > 0;
    }
}
