/**
 * Domain model classes shared across the broker.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.ModelSpec} - Immutable model identity, pricing and rate policy</li>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.InvocationRequest} - Immutable request to be brokered</li>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.InvocationResult} - Immutable result of a successful request</li>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.Pricing} - Exact decimal pricing</li>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.ErrorKind} - Classification of failed attempts</li>
 *   <li>{@link fr.lapetina.llm.broker.domain.model.CancellationToken} - Cooperative cancellation flag</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records in this package are immutable. {@code CancellationToken} uses an
 * {@code AtomicReference} and may be shared freely.
 */
package fr.lapetina.llm.broker.domain.model;
