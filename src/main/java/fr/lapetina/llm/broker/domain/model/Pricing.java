package fr.lapetina.llm.broker.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Per-call pricing of a model. All amounts are exact decimals so repeated charges never drift.
 *
 * <p>When {@code providerReported} is set the model's price list is unknown and the cost the
 * provider reports with each response is charged instead. {@code perCall} is then only the
 * amount reserved before dispatch.
 */
public record Pricing(
        BigDecimal inputPerToken,
        BigDecimal outputPerToken,
        BigDecimal perCall,
        boolean providerReported
) {
    public static final Pricing FREE = new Pricing(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, false);

    public Pricing {
        inputPerToken = inputPerToken != null ? inputPerToken : BigDecimal.ZERO;
        outputPerToken = outputPerToken != null ? outputPerToken : BigDecimal.ZERO;
        perCall = perCall != null ? perCall : BigDecimal.ZERO;
        if (inputPerToken.signum() < 0 || outputPerToken.signum() < 0 || perCall.signum() < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }

    public static Pricing perToken(String inputPerToken, String outputPerToken) {
        return new Pricing(new BigDecimal(inputPerToken), new BigDecimal(outputPerToken), BigDecimal.ZERO, false);
    }

    public static Pricing flat(String perCall) {
        return new Pricing(BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal(perCall), false);
    }

    public static Pricing reportedByProvider() {
        return new Pricing(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, true);
    }

    /**
     * Provider-reported pricing reserving {@code estimatedPerCall} before each dispatch.
     */
    public static Pricing reportedByProvider(String estimatedPerCall) {
        return new Pricing(BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal(estimatedPerCall), true);
    }

    /**
     * Cost of one call: {@code inputTokens*inputRate + outputTokens*outputRate + perCall}.
     */
    public BigDecimal cost(TokenUsage usage) {
        Objects.requireNonNull(usage, "usage");
        return inputPerToken.multiply(BigDecimal.valueOf(usage.inputTokens()))
                .add(outputPerToken.multiply(BigDecimal.valueOf(usage.outputTokens())))
                .add(perCall);
    }

    /**
     * Cost of one call, preferring the provider-reported amount when this pricing asks for it.
     */
    public BigDecimal cost(TokenUsage usage, BigDecimal reportedCost) {
        if (providerReported) {
            return reportedCost != null ? reportedCost : BigDecimal.ZERO;
        }
        return cost(usage != null ? usage : TokenUsage.ZERO);
    }
}
