package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.exception.LlmBrokerException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Default classification: explicit {@link ProviderException} kinds win, timeouts and I/O
 * failures are retryable, anything unrecognized is fatal.
 */
public final class DefaultErrorClassifier implements ErrorClassifier {

    public static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

    @Override
    public ErrorKind classify(Throwable error) {
        Throwable cause = LlmBrokerException.unwrap(error);
        if (cause instanceof ProviderException providerException) {
            return providerException.getKind();
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return ErrorKind.RETRYABLE;
        }
        if (cause instanceof ConnectException
                || cause instanceof HttpConnectTimeoutException
                || cause instanceof IOException) {
            return ErrorKind.RETRYABLE;
        }
        return ErrorKind.FATAL;
    }

    /**
     * 429 is rate-limited; 408 and 5xx are retryable; every other status is fatal.
     */
    public static ErrorKind classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (statusCode == 408 || (statusCode >= 500 && statusCode < 600)) {
            return ErrorKind.RETRYABLE;
        }
        return ErrorKind.FATAL;
    }
}
