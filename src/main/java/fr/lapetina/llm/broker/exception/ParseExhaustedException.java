package fr.lapetina.llm.broker.exception;

/**
 * Structured output could not be decoded after the allowed correction attempts.
 */
public final class ParseExhaustedException extends LlmBrokerException {

    private final int attempts;
    private final String lastRawText;

    public ParseExhaustedException(int attempts, String lastRawText, Throwable lastCause) {
        super("Structured output still invalid after " + attempts + " attempts: "
                + (lastCause != null ? lastCause.getMessage() : "unknown error"), lastCause);
        this.attempts = attempts;
        this.lastRawText = lastRawText;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastRawText() {
        return lastRawText;
    }
}
