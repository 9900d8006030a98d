package fr.lapetina.llm.broker.exception;

/**
 * Every allowed attempt failed with a retryable classification.
 */
public class ExhaustedRetriesException extends LlmBrokerException {

    private final String model;
    private final int attempts;

    public ExhaustedRetriesException(String model, int attempts, Throwable lastCause) {
        this("Gave up on model " + model + " after " + attempts + " attempts", model, attempts, lastCause);
    }

    protected ExhaustedRetriesException(String message, String model, int attempts, Throwable lastCause) {
        super(lastCause != null ? message + ": " + lastCause.getMessage() : message, lastCause);
        this.model = model;
        this.attempts = attempts;
    }

    public String getModel() {
        return model;
    }

    public int getAttempts() {
        return attempts;
    }
}
