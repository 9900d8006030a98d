package fr.lapetina.llm.broker.exception;

import java.time.Duration;

/**
 * Waited longer than the model's configured maximum for rate-limit capacity.
 */
public final class RateLimitTimeoutException extends LlmBrokerException {

    private final String model;
    private final Duration maxWait;

    public RateLimitTimeoutException(String model, Duration maxWait) {
        super("No rate-limit capacity for model " + model + " within " + maxWait.toMillis() + "ms");
        this.model = model;
        this.maxWait = maxWait;
    }

    public String getModel() {
        return model;
    }

    public Duration getMaxWait() {
        return maxWait;
    }
}
