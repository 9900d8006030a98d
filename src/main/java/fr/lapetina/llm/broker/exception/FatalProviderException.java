package fr.lapetina.llm.broker.exception;

/**
 * The provider rejected the request outright (bad request, authentication failure,
 * content-policy rejection). Never retried.
 */
public final class FatalProviderException extends LlmBrokerException {

    private final String model;
    private final int attempts;

    public FatalProviderException(String model, int attempts, String message, Throwable cause) {
        super("Provider rejected request for model " + model + ": " + message, cause);
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
