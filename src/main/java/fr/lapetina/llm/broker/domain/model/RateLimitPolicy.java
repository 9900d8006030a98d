package fr.lapetina.llm.broker.domain.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Fixed-window admission policy: at most {@code requestsPerWindow} dispatches per {@code window}.
 * A {@code maxWait} of {@code null} means callers wait for capacity indefinitely.
 */
public record RateLimitPolicy(int requestsPerWindow, Duration window, Duration maxWait) {

    private static final RateLimitPolicy UNLIMITED = new RateLimitPolicy(0, Duration.ZERO, null);

    public RateLimitPolicy {
        if (requestsPerWindow < 0) {
            throw new IllegalArgumentException("requestsPerWindow must be >= 0");
        }
        if (requestsPerWindow > 0 && (window == null || window.isZero() || window.isNegative())) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitPolicy of(int requestsPerWindow, Duration window) {
        return new RateLimitPolicy(requestsPerWindow, window, null);
    }

    public static RateLimitPolicy unlimited() {
        return UNLIMITED;
    }

    public RateLimitPolicy withMaxWait(Duration maxWait) {
        return new RateLimitPolicy(requestsPerWindow, window, maxWait);
    }

    public boolean isUnlimited() {
        return requestsPerWindow == 0;
    }

    public Optional<Duration> getMaxWait() {
        return Optional.ofNullable(maxWait);
    }
}
