/**
 * Error taxonomy surfaced by the broker.
 *
 * <ul>
 *   <li>{@link fr.lapetina.llm.broker.exception.FatalProviderException} - rejected outright, never retried</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.ExhaustedRetriesException} - retryable failures, attempts used up</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.AttemptTimeoutException} - the final attempt timed out</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.RateLimitTimeoutException} - waited past the configured maximum for capacity</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.BudgetExceededException} - would breach a ceiling, never dispatched</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.ParseExhaustedException} - structured decode failed after corrections</li>
 *   <li>{@link fr.lapetina.llm.broker.exception.CancelledException} - cooperative cancellation observed</li>
 * </ul>
 */
package fr.lapetina.llm.broker.exception;
