/**
 * Per-model rate limiting.
 *
 * <p>{@link fr.lapetina.llm.broker.ratelimit.RateLimiter} hands out
 * {@link fr.lapetina.llm.broker.ratelimit.Permit}s from a fixed-window
 * {@link fr.lapetina.llm.broker.ratelimit.RateLimitState} per model. State updates use
 * compare-and-set; there is no lock shared between models.
 */
package fr.lapetina.llm.broker.ratelimit;
