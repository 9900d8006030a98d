/**
 * Ordered, bounded-concurrency batch execution.
 *
 * <h2>Failure modes</h2>
 * <ul>
 *   <li>Default - failures are per slot, the rest of the batch keeps running</li>
 *   <li>Fail-fast - a fatal provider error or a budget rejection cancels the shared token; items
 *       not started yet and results arriving afterwards become CancelledException outcomes</li>
 * </ul>
 */
package fr.lapetina.llm.broker.batch;
