package fr.lapetina.llm.broker.exception;

/**
 * The final allowed attempt exceeded its per-call timeout.
 */
public final class AttemptTimeoutException extends ExhaustedRetriesException {

    public AttemptTimeoutException(String model, int attempts, Throwable lastCause) {
        super("Final attempt timed out for model " + model + " after " + attempts + " attempts",
                model, attempts, lastCause);
    }
}
