package fr.lapetina.llm.broker.domain.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Identifies a model, the provider serving it, its pricing and its rate-limit policy.
 * Immutable; registered once in the {@link fr.lapetina.llm.broker.domain.routing.ModelRegistry}.
 */
public record ModelSpec(
        String name,
        String provider,
        Set<ModelCapability> capabilities,
        Pricing pricing,
        RateLimitPolicy rateLimit,
        int defaultMaxOutputTokens,
        boolean chargeFailedAttempts
) {
    public static final String DEFAULT_PROVIDER = "default";
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 1024;

    public ModelSpec {
        Objects.requireNonNull(name, "Model name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Model name must not be blank");
        }
        if (provider == null || provider.isBlank()) {
            provider = providerOf(name);
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of(ModelCapability.TEXT_COMPLETION)
                : Set.copyOf(capabilities);
        pricing = pricing != null ? pricing : Pricing.FREE;
        rateLimit = rateLimit != null ? rateLimit : RateLimitPolicy.unlimited();
        if (defaultMaxOutputTokens <= 0) {
            defaultMaxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;
        }
    }

    /**
     * Derives the provider from a routed name such as {@code openrouter/anthropic/claude-sonnet-4.5}.
     */
    public static String providerOf(String modelName) {
        int slash = modelName.indexOf('/');
        return slash > 0 ? modelName.substring(0, slash) : DEFAULT_PROVIDER;
    }

    public boolean supports(ModelCapability capability) {
        return capabilities.contains(capability);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String provider;
        private final Set<ModelCapability> capabilities = EnumSet.noneOf(ModelCapability.class);
        private Pricing pricing;
        private RateLimitPolicy rateLimit;
        private int defaultMaxOutputTokens;
        private boolean chargeFailedAttempts;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder capability(ModelCapability capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(Set<ModelCapability> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder pricing(Pricing pricing) {
            this.pricing = pricing;
            return this;
        }

        public Builder rateLimit(RateLimitPolicy rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder defaultMaxOutputTokens(int defaultMaxOutputTokens) {
            this.defaultMaxOutputTokens = defaultMaxOutputTokens;
            return this;
        }

        public Builder chargeFailedAttempts(boolean chargeFailedAttempts) {
            this.chargeFailedAttempts = chargeFailedAttempts;
            return this;
        }

        public ModelSpec build() {
            return new ModelSpec(name, provider, capabilities, pricing, rateLimit,
                    defaultMaxOutputTokens, chargeFailedAttempts);
        }
    }
}
