package fr.lapetina.llm.broker.retry;

import fr.lapetina.llm.broker.provider.RawResponse;

import java.time.Duration;

/**
 * The single successful provider response of a retry execution.
 *
 * @param attempts total dispatched attempts, including discarded failures
 * @param latency  wall-clock time from the first permit request to the response
 */
public record AttemptResult(RawResponse response, int attempts, Duration latency) {
}
