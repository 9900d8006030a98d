package fr.lapetina.llm.broker.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the broker.
 * Designed to be populated from YAML. Monetary amounts are strings so they reach
 * {@link java.math.BigDecimal} without a floating-point detour.
 */
public class BrokerConfig {

    private List<ModelConfig> models = new ArrayList<>();
    private Map<String, String> aliases = new LinkedHashMap<>();
    private RetryConfig retry = new RetryConfig();
    private ParsingConfig parsing = new ParsingConfig();
    private BatchConfig batch = new BatchConfig();
    private BudgetConfig budget = new BudgetConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private UsagePipelineConfig usagePipeline = new UsagePipelineConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public Map<String, String> getAliases() { return aliases; }
    public void setAliases(Map<String, String> aliases) { this.aliases = aliases; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public ParsingConfig getParsing() { return parsing; }
    public void setParsing(ParsingConfig parsing) { this.parsing = parsing; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public BudgetConfig getBudget() { return budget; }
    public void setBudget(BudgetConfig budget) { this.budget = budget; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public UsagePipelineConfig getUsagePipeline() { return usagePipeline; }
    public void setUsagePipeline(UsagePipelineConfig usagePipeline) { this.usagePipeline = usagePipeline; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One model offered by a provider.
     */
    public static class ModelConfig {
        private String name;
        private String provider;
        private List<String> capabilities = new ArrayList<>(List.of("text-completion"));
        private PricingConfig pricing = new PricingConfig();
        private RateLimitConfig rateLimit = new RateLimitConfig();
        private int defaultMaxOutputTokens = 1024;
        private boolean chargeFailedAttempts = false;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

        public PricingConfig getPricing() { return pricing; }
        public void setPricing(PricingConfig pricing) { this.pricing = pricing; }

        public RateLimitConfig getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

        public int getDefaultMaxOutputTokens() { return defaultMaxOutputTokens; }
        public void setDefaultMaxOutputTokens(int tokens) { this.defaultMaxOutputTokens = tokens; }

        public boolean isChargeFailedAttempts() { return chargeFailedAttempts; }
        public void setChargeFailedAttempts(boolean chargeFailedAttempts) { this.chargeFailedAttempts = chargeFailedAttempts; }
    }

    /**
     * Model pricing. Rates are decimal strings, e.g. {@code "0.0000025"}. With
     * {@code providerReported}, {@code estimatedPerCall} is reserved before each call.
     */
    public static class PricingConfig {
        private String inputPerToken = "0";
        private String outputPerToken = "0";
        private String perCall = "0";
        private boolean providerReported = false;
        private String estimatedPerCall = "0";

        public String getInputPerToken() { return inputPerToken; }
        public void setInputPerToken(String inputPerToken) { this.inputPerToken = inputPerToken; }

        public String getOutputPerToken() { return outputPerToken; }
        public void setOutputPerToken(String outputPerToken) { this.outputPerToken = outputPerToken; }

        public String getPerCall() { return perCall; }
        public void setPerCall(String perCall) { this.perCall = perCall; }

        public boolean isProviderReported() { return providerReported; }
        public void setProviderReported(boolean providerReported) { this.providerReported = providerReported; }

        public String getEstimatedPerCall() { return estimatedPerCall; }
        public void setEstimatedPerCall(String estimatedPerCall) { this.estimatedPerCall = estimatedPerCall; }
    }

    /**
     * Per-model rate limit. {@code requestsPerWindow <= 0} disables gating,
     * {@code maxWaitMs <= 0} waits indefinitely.
     */
    public static class RateLimitConfig {
        private int requestsPerWindow = 0;
        private long windowMs = 60000;
        private long maxWaitMs = 0;

        public int getRequestsPerWindow() { return requestsPerWindow; }
        public void setRequestsPerWindow(int requestsPerWindow) { this.requestsPerWindow = requestsPerWindow; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public long getMaxWaitMs() { return maxWaitMs; }
        public void setMaxWaitMs(long maxWaitMs) { this.maxWaitMs = maxWaitMs; }
    }

    /**
     * Retry policy configuration. {@code maxRateLimitedRetries < 0} means unbounded.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private double backoffMultiplier = 2.0;
        private long jitterMs = 250;
        private long maxDelayMs = 30000;
        private long attemptTimeoutMs = 120000;
        private int maxRateLimitedRetries = -1;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getJitterMs() { return jitterMs; }
        public void setJitterMs(long jitterMs) { this.jitterMs = jitterMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public int getMaxRateLimitedRetries() { return maxRateLimitedRetries; }
        public void setMaxRateLimitedRetries(int maxRateLimitedRetries) { this.maxRateLimitedRetries = maxRateLimitedRetries; }
    }

    /**
     * Structured output configuration.
     */
    public static class ParsingConfig {
        private int maxParseAttempts = 3;

        public int getMaxParseAttempts() { return maxParseAttempts; }
        public void setMaxParseAttempts(int maxParseAttempts) { this.maxParseAttempts = maxParseAttempts; }
    }

    /**
     * Default batch options.
     */
    public static class BatchConfig {
        private int concurrencyLimit = 8;
        private boolean failFast = false;
        private String discardedCostPolicy = "retain";

        public int getConcurrencyLimit() { return concurrencyLimit; }
        public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }

        public boolean isFailFast() { return failFast; }
        public void setFailFast(boolean failFast) { this.failFast = failFast; }

        public String getDiscardedCostPolicy() { return discardedCostPolicy; }
        public void setDiscardedCostPolicy(String discardedCostPolicy) { this.discardedCostPolicy = discardedCostPolicy; }
    }

    /**
     * Process-wide budget. A null ceiling means unlimited.
     */
    public static class BudgetConfig {
        private String globalCeiling;

        public String getGlobalCeiling() { return globalCeiling; }
        public void setGlobalCeiling(String globalCeiling) { this.globalCeiling = globalCeiling; }
    }

    /**
     * Shared scheduler running rate-limit re-checks, backoff delays and batch continuations.
     */
    public static class SchedulerConfig {
        private int threads = 2;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Usage telemetry ring buffer configuration.
     */
    public static class UsagePipelineConfig {
        private boolean enabled = true;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_broker";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
