package fr.lapetina.llm.broker.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base class for every failure the broker surfaces to callers.
 *
 * <p>Futures returned by the broker complete exceptionally with a subclass of this type;
 * use {@link #unwrap(Throwable)} to strip the {@link CompletionException} layer added by
 * dependent stages.
 */
public class LlmBrokerException extends RuntimeException {

    public LlmBrokerException(String message) {
        super(message);
    }

    public LlmBrokerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Removes {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
