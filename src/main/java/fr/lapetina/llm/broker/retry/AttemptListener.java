package fr.lapetina.llm.broker.retry;

import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;
import fr.lapetina.llm.broker.provider.ProviderRequest;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Callbacks from a single retry execution. Invoked on whichever thread completed the attempt.
 */
public interface AttemptListener {

    AttemptListener NOOP = new AttemptListener() {
    };

    /**
     * Called once per dispatched attempt.
     *
     * @param outcome SUCCEEDED, RETRYING (will be retried) or FAILED
     * @param kind    classification of the failure, null on success
     */
    default void onAttempt(ProviderRequest request, InvocationState outcome, ErrorKind kind, Duration latency) {
    }

    /**
     * Called when a failed attempt was processed and billed by the provider.
     */
    default void onBillableFailure(ProviderRequest request, TokenUsage usage, BigDecimal reportedCost) {
    }
}
