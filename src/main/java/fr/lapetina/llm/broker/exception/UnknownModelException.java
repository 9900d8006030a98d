package fr.lapetina.llm.broker.exception;

/**
 * No model (or alias) with the given name is registered, or no adapter serves its provider.
 */
public final class UnknownModelException extends LlmBrokerException {

    private final String name;

    public UnknownModelException(String name) {
        this(name, "Unknown model: " + name);
    }

    public UnknownModelException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
