/**
 * Bounded, classified retry around a single provider call.
 *
 * <h2>Classification</h2>
 * <ul>
 *   <li>FATAL - fail at once, no further attempts</li>
 *   <li>RATE_LIMITED - wait for the provider's hint (or backoff) and retry; not counted against maxAttempts</li>
 *   <li>RETRYABLE - exponential backoff with jitter until maxAttempts</li>
 * </ul>
 *
 * <h2>Timeouts</h2>
 * Each attempt gets its own timeout. A timed-out attempt is retryable; if it was the last
 * allowed attempt the call fails with AttemptTimeoutException.
 */
package fr.lapetina.llm.broker.retry;
