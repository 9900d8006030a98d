package fr.lapetina.llm.broker.domain.event;

import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Sink for broker telemetry. Implementations must be thread-safe and must not block:
 * callbacks run on whichever thread completed the corresponding stage.
 */
public interface UsageRecorder {

    UsageRecorder NOOP = new UsageRecorder() {
    };

    default void onAttempt(String requestId, String model, int attempt,
                           InvocationState outcome, ErrorKind errorKind, Duration latency) {
    }

    default void onCharge(String requestId, String model, TokenUsage usage, BigDecimal cost, String budget) {
    }

    default void onInvocationSucceeded(String requestId, String model, int attempts,
                                       TokenUsage usage, BigDecimal cost, Duration latency) {
    }

    default void onInvocationFailed(String requestId, String model, InvocationState outcome,
                                    Throwable error, Duration latency) {
    }

    default void onBudgetClosed(String budget, BigDecimal spent, BigDecimal ceiling) {
    }
}
