/**
 * Scoped cost accounting.
 *
 * <h2>Budgets</h2>
 * Scopes nest under a process-wide root. Every charge is attributed to the scope and all of its
 * ancestors. A strict charge that would push any of them over its ceiling is rejected before the
 * provider call, and no total changes.
 *
 * <h2>Reservations</h2>
 * The invoker reserves an estimate before dispatch and settles it with the billed cost. An excess
 * discovered at settlement is applied anyway and reported as a ceiling violation.
 *
 * <h2>Reports</h2>
 * Closing a {@link fr.lapetina.llm.broker.cost.BudgetScope} freezes it and publishes a
 * {@link fr.lapetina.llm.broker.cost.BudgetReport} keyed by budget path ({@code outer/inner}).
 */
package fr.lapetina.llm.broker.cost;
