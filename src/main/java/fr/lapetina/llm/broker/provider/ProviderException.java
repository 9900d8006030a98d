package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Classified failure raised by a {@link ProviderAdapter}.
 *
 * <p>{@code usage} is set when the provider processed (and may bill) the failed request.
 */
public class ProviderException extends RuntimeException {

    private final ErrorKind kind;
    private final Duration retryAfter;
    private final int statusCode;
    private final TokenUsage usage;

    public ProviderException(ErrorKind kind, String message, Duration retryAfter, int statusCode, TokenUsage usage) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.retryAfter = retryAfter;
        this.statusCode = statusCode;
        this.usage = usage;
    }

    public static ProviderException rateLimited(String message, Duration retryAfter) {
        return new ProviderException(ErrorKind.RATE_LIMITED, message, retryAfter, 429, null);
    }

    public static ProviderException retryable(String message) {
        return new ProviderException(ErrorKind.RETRYABLE, message, null, 0, null);
    }

    public static ProviderException fatal(String message) {
        return new ProviderException(ErrorKind.FATAL, message, null, 0, null);
    }

    /**
     * Builds an exception for an HTTP-like status code, classified by
     * {@link DefaultErrorClassifier#classifyStatus(int)}.
     */
    public static ProviderException forStatus(int statusCode, String message) {
        return new ProviderException(DefaultErrorClassifier.classifyStatus(statusCode),
                message, null, statusCode, null);
    }

    public ProviderException withUsage(TokenUsage usage) {
        return new ProviderException(kind, getMessage(), retryAfter, statusCode, usage);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Optional<TokenUsage> getUsage() {
        return Optional.ofNullable(usage);
    }
}
