package fr.lapetina.llm.broker.retry;

import fr.lapetina.llm.broker.provider.DefaultErrorClassifier;
import fr.lapetina.llm.broker.provider.ErrorClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>{@code maxAttempts} bounds attempts that failed with a retryable classification.
 * Rate-limited attempts do not count against it; they are bounded by
 * {@code maxRateLimitedRetries} only.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double backoffMultiplier,
        Duration jitter,
        Duration maxDelay,
        Duration attemptTimeout,
        int maxRateLimitedRetries,
        ErrorClassifier classifier
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxRateLimitedRetries < 0) {
            throw new IllegalArgumentException("maxRateLimitedRetries must be >= 0");
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        jitter = jitter != null ? jitter : Duration.ZERO;
        classifier = classifier != null ? classifier : DefaultErrorClassifier.INSTANCE;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * Backoff before the attempt following the given failed attempt (1-based):
     * {@code min(base * multiplier^(attempt-1) + jitter, maxDelay)}.
     */
    public Duration delayForAttempt(int attempt) {
        double exponential = baseDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        long jitterMs = jitter.toMillis() > 0
                ? ThreadLocalRandom.current().nextLong(jitter.toMillis() + 1)
                : 0L;
        long delayMs = (long) Math.min(exponential + jitterMs, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0L, delayMs));
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .maxDelay(maxDelay)
                .attemptTimeout(attemptTimeout)
                .maxRateLimitedRetries(maxRateLimitedRetries)
                .classifier(classifier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration jitter = Duration.ofMillis(250);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration attemptTimeout = Duration.ofMinutes(2);
        private int maxRateLimitedRetries = Integer.MAX_VALUE;
        private ErrorClassifier classifier = DefaultErrorClassifier.INSTANCE;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(Duration jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder maxRateLimitedRetries(int maxRateLimitedRetries) {
            this.maxRateLimitedRetries = maxRateLimitedRetries;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier, jitter,
                    maxDelay, attemptTimeout, maxRateLimitedRetries, classifier);
        }
    }
}
