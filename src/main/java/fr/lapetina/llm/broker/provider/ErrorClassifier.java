package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.exception.LlmBrokerException;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps a raw attempt failure to an {@link ErrorKind}.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorKind classify(Throwable error);

    /**
     * Provider-supplied hint for how long to wait before the next attempt.
     */
    default Optional<Duration> retryAfter(Throwable error) {
        if (LlmBrokerException.unwrap(error) instanceof ProviderException providerException) {
            return providerException.getRetryAfter();
        }
        return Optional.empty();
    }
}
