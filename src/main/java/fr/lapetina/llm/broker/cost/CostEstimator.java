package fr.lapetina.llm.broker.cost;

import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.model.Pricing;
import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Pre-dispatch cost estimate used for budget reservations.
 *
 * Input tokens are approximated as one token per four prompt characters (rounded up); output
 * tokens as the request's maximum output tokens. Provider-reported pricing has no price list:
 * its estimate is the larger of the configured per-call estimate and the largest cost the
 * provider has reported so far for the model.
 */
public final class CostEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private final ConcurrentMap<String, BigDecimal> largestReported = new ConcurrentHashMap<>();

    public TokenUsage estimateUsage(InvocationRequest request) {
        String text = request.promptText();
        int chars = text != null ? text.length() : 0;
        int inputTokens = (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        return TokenUsage.of(inputTokens, request.effectiveMaxOutputTokens());
    }

    public BigDecimal estimate(InvocationRequest request) {
        ModelSpec spec = request.model();
        Pricing pricing = spec.pricing();
        if (pricing.providerReported()) {
            return pricing.perCall().max(largestReported.getOrDefault(spec.name(), BigDecimal.ZERO));
        }
        return pricing.cost(estimateUsage(request));
    }

    /**
     * Whether nothing is known yet about what a call to the request's model costs.
     */
    public boolean isUnpriced(InvocationRequest request) {
        return request.model().pricing().providerReported() && estimate(request).signum() == 0;
    }

    /**
     * Feeds a billed cost back into the estimates of provider-reported models.
     */
    public void observe(ModelSpec spec, BigDecimal cost) {
        if (spec.pricing().providerReported() && cost != null && cost.signum() > 0) {
            largestReported.merge(spec.name(), cost, BigDecimal::max);
        }
    }
}
