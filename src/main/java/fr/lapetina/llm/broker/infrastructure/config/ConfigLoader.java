package fr.lapetina.llm.broker.infrastructure.config;

import fr.lapetina.llm.broker.batch.BatchOptions;
import fr.lapetina.llm.broker.batch.DiscardedCostPolicy;
import fr.lapetina.llm.broker.domain.model.ModelCapability;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.model.Pricing;
import fr.lapetina.llm.broker.domain.model.RateLimitPolicy;
import fr.lapetina.llm.broker.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link BrokerConfig} from YAML and turns its sections into domain objects.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Validation of model names, aliases and monetary amounts
 *
 * Model specs are immutable once registered, so there is no reload.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<BrokerConfig> currentConfig = new AtomicReference<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(BrokerConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public BrokerConfig load() {
        BrokerConfig config = validate(loadFromPath());
        currentConfig.set(config);
        log.info("Configuration loaded: models={}, aliases={}", config.getModels().size(), config.getAliases().size());
        return config;
    }

    private BrokerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private BrokerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public BrokerConfig loadFromStream(InputStream inputStream) {
        BrokerConfig config = validate(parse(inputStream, "stream"));
        currentConfig.set(config);
        return config;
    }

    private BrokerConfig parse(InputStream inputStream, String source) {
        try {
            BrokerConfig config = yaml.load(inputStream);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the current configuration.
     */
    public BrokerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Creates a default configuration.
     */
    public static BrokerConfig createDefault() {
        return new BrokerConfig();
    }

    /**
     * Checks cross-section consistency.
     *
     * @throws ConfigurationException on the first problem found
     */
    public static BrokerConfig validate(BrokerConfig config) {
        Set<String> names = new HashSet<>();
        for (BrokerConfig.ModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                throw new ConfigurationException("Model entry without a name");
            }
            if (!names.add(model.getName())) {
                throw new ConfigurationException("Duplicate model: " + model.getName());
            }
            toModelSpec(model);
        }
        for (Map.Entry<String, String> alias : config.getAliases().entrySet()) {
            if (!names.contains(alias.getValue())) {
                throw new ConfigurationException("Alias '" + alias.getKey() + "' targets unknown model: " + alias.getValue());
            }
        }
        globalCeiling(config);
        toRetryPolicy(config.getRetry());
        toBatchOptions(config.getBatch());
        int ringBufferSize = config.getUsagePipeline().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("usagePipeline.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
        if (config.getScheduler().getThreads() < 1) {
            throw new ConfigurationException("scheduler.threads must be >= 1");
        }
        return config;
    }

    public static List<ModelSpec> toModelSpecs(BrokerConfig config) {
        List<ModelSpec> specs = new ArrayList<>(config.getModels().size());
        for (BrokerConfig.ModelConfig model : config.getModels()) {
            specs.add(toModelSpec(model));
        }
        return specs;
    }

    public static ModelSpec toModelSpec(BrokerConfig.ModelConfig model) {
        try {
            ModelSpec.Builder builder = ModelSpec.builder()
                    .name(model.getName())
                    .provider(model.getProvider())
                    .pricing(toPricing(model.getPricing()))
                    .rateLimit(toRateLimitPolicy(model.getRateLimit()))
                    .defaultMaxOutputTokens(model.getDefaultMaxOutputTokens())
                    .chargeFailedAttempts(model.isChargeFailedAttempts());
            for (String capability : model.getCapabilities()) {
                builder.capability(ModelCapability.fromConfig(capability));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid model '" + model.getName() + "': " + e.getMessage(), e);
        }
    }

    static Pricing toPricing(BrokerConfig.PricingConfig pricing) {
        if (pricing.isProviderReported()) {
            return new Pricing(BigDecimal.ZERO, BigDecimal.ZERO,
                    amount("pricing.estimatedPerCall", pricing.getEstimatedPerCall()), true);
        }
        return new Pricing(
                amount("pricing.inputPerToken", pricing.getInputPerToken()),
                amount("pricing.outputPerToken", pricing.getOutputPerToken()),
                amount("pricing.perCall", pricing.getPerCall()),
                false
        );
    }

    static RateLimitPolicy toRateLimitPolicy(BrokerConfig.RateLimitConfig rateLimit) {
        if (rateLimit.getRequestsPerWindow() <= 0) {
            return RateLimitPolicy.unlimited();
        }
        RateLimitPolicy policy = RateLimitPolicy.of(rateLimit.getRequestsPerWindow(),
                Duration.ofMillis(rateLimit.getWindowMs()));
        return rateLimit.getMaxWaitMs() > 0
                ? policy.withMaxWait(Duration.ofMillis(rateLimit.getMaxWaitMs()))
                : policy;
    }

    public static RetryPolicy toRetryPolicy(BrokerConfig.RetryConfig retry) {
        try {
            return RetryPolicy.builder()
                    .maxAttempts(retry.getMaxAttempts())
                    .baseDelay(Duration.ofMillis(retry.getBaseDelayMs()))
                    .backoffMultiplier(retry.getBackoffMultiplier())
                    .jitter(Duration.ofMillis(retry.getJitterMs()))
                    .maxDelay(Duration.ofMillis(retry.getMaxDelayMs()))
                    .attemptTimeout(Duration.ofMillis(retry.getAttemptTimeoutMs()))
                    .maxRateLimitedRetries(retry.getMaxRateLimitedRetries() < 0
                            ? Integer.MAX_VALUE
                            : retry.getMaxRateLimitedRetries())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid retry configuration: " + e.getMessage(), e);
        }
    }

    public static BatchOptions toBatchOptions(BrokerConfig.BatchConfig batch) {
        DiscardedCostPolicy policy;
        try {
            policy = DiscardedCostPolicy.valueOf(batch.getDiscardedCostPolicy().trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid batch.discardedCostPolicy: " + batch.getDiscardedCostPolicy(), e);
        }
        try {
            return new BatchOptions(batch.getConcurrencyLimit(), batch.isFailFast(), policy);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid batch configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return the configured process-wide ceiling, or null when unlimited
     */
    public static BigDecimal globalCeiling(BrokerConfig config) {
        String ceiling = config.getBudget().getGlobalCeiling();
        return ceiling == null || ceiling.isBlank() ? null : amount("budget.globalCeiling", ceiling);
    }

    private static BigDecimal amount(String key, String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid amount for " + key + ": " + value, e);
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
