package fr.lapetina.llm.broker.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one successful invocation.
 * Immutable and thread-safe.
 *
 * <p>{@code attempts} counts provider attempts across the initial call and any correction
 * calls; {@code parseAttempts} counts structured decode attempts (zero for plain text).
 * {@code ceilingViolation} is set when reconciling the actual cost pushed a budget over its
 * ceiling after the provider had already billed the call.
 */
public record InvocationResult(
        String requestId,
        String model,
        String text,
        Object parsed,
        TokenUsage usage,
        BigDecimal cost,
        Duration latency,
        int attempts,
        int parseAttempts,
        String ceilingViolation
) {
    public InvocationResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        usage = usage != null ? usage : TokenUsage.ZERO;
        cost = cost != null ? cost : BigDecimal.ZERO;
        latency = latency != null ? latency : Duration.ZERO;
    }

    public boolean hasCeilingViolation() {
        return ceilingViolation != null;
    }

    /**
     * Returns the parsed structured value cast to the requested type.
     */
    public <T> T parsedAs(Class<T> type) {
        return type.cast(parsed);
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .model(model)
                .text(text)
                .parsed(parsed)
                .usage(usage)
                .cost(cost)
                .latency(latency)
                .attempts(attempts)
                .parseAttempts(parseAttempts)
                .ceilingViolation(ceilingViolation);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String text;
        private Object parsed;
        private TokenUsage usage;
        private BigDecimal cost;
        private Duration latency;
        private int attempts;
        private int parseAttempts;
        private String ceilingViolation;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder parsed(Object parsed) {
            this.parsed = parsed;
            return this;
        }

        public Builder usage(TokenUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder cost(BigDecimal cost) {
            this.cost = cost;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder parseAttempts(int parseAttempts) {
            this.parseAttempts = parseAttempts;
            return this;
        }

        public Builder ceilingViolation(String ceilingViolation) {
            this.ceilingViolation = ceilingViolation;
            return this;
        }

        public InvocationResult build() {
            return new InvocationResult(
                    requestId, model, text, parsed, usage, cost, latency,
                    attempts, parseAttempts, ceilingViolation
            );
        }
    }
}
