package fr.lapetina.llm.broker;

import fr.lapetina.llm.broker.batch.BatchScheduler;
import fr.lapetina.llm.broker.cost.CostEstimator;
import fr.lapetina.llm.broker.cost.CostTracker;
import fr.lapetina.llm.broker.disruptor.UsageEventPipeline;
import fr.lapetina.llm.broker.domain.event.UsageRecorder;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.domain.routing.ModelRegistry;
import fr.lapetina.llm.broker.domain.routing.ModelRouter;
import fr.lapetina.llm.broker.infrastructure.config.BrokerConfig;
import fr.lapetina.llm.broker.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.broker.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.broker.invoker.ModelInvoker;
import fr.lapetina.llm.broker.parsing.StructuredOutputParser;
import fr.lapetina.llm.broker.provider.ProviderAdapter;
import fr.lapetina.llm.broker.ratelimit.RateLimiter;
import fr.lapetina.llm.broker.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for creating a fully-wired {@link LlmBroker} from configuration.
 * Provider adapters are supplied by the application; everything else comes from YAML.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BrokerFactory factory = BrokerFactory.create("broker.yaml", openRouterAdapter).start()) {
 *     LlmBroker broker = factory.getBroker();
 *     // use broker...
 * }
 * }</pre>
 */
public class BrokerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrokerFactory.class);

    private final BrokerConfig config;
    private final ModelRouter router;
    private final MetricsRegistry metricsRegistry;
    private final UsageEventPipeline usagePipeline;
    private final ScheduledExecutorService scheduler;
    private final CostTracker costTracker;
    private final LlmBroker broker;

    protected BrokerFactory(String configPath, Collection<? extends ProviderAdapter> adapters) {
        log.info("Initializing BrokerFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics and usage telemetry
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;
        this.usagePipeline = config.getUsagePipeline().isEnabled()
                ? UsageEventPipeline.builder().fromConfig(config).metricsRegistry(metricsRegistry).build()
                : null;
        UsageRecorder recorder = usagePipeline != null ? usagePipeline : UsageRecorder.NOOP;

        // Register models, aliases and adapters
        ModelRegistry registry = new ModelRegistry();
        for (ModelSpec spec : ConfigLoader.toModelSpecs(config)) {
            registry.register(spec);
        }
        this.router = new ModelRouter(registry);
        for (Map.Entry<String, String> alias : config.getAliases().entrySet()) {
            router.alias(alias.getKey(), alias.getValue());
        }
        for (ProviderAdapter adapter : adapters) {
            router.registerAdapter(adapter);
        }

        this.scheduler = Executors.newScheduledThreadPool(config.getScheduler().getThreads(),
                new BrokerThreadFactory("broker-scheduler"));

        // Build the invocation stack
        this.costTracker = new CostTracker(ConfigLoader.globalCeiling(config), recorder);
        RateLimiter rateLimiter = new RateLimiter(scheduler);
        RetryExecutor retryExecutor = new RetryExecutor(router, rateLimiter, scheduler);
        ModelInvoker invoker = new ModelInvoker(
                retryExecutor,
                costTracker,
                new CostEstimator(),
                new StructuredOutputParser(config.getParsing().getMaxParseAttempts()),
                ConfigLoader.toRetryPolicy(config.getRetry()),
                recorder
        );
        BatchScheduler batchScheduler = new BatchScheduler(invoker, costTracker, scheduler);

        this.broker = new LlmBroker(router, invoker, batchScheduler, costTracker,
                ConfigLoader.toBatchOptions(config.getBatch()));

        log.info("BrokerFactory initialized: models={}, aliases={}, adapters={}",
                registry.size(), config.getAliases().size(), adapters.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BrokerFactory create(String configPath, ProviderAdapter... adapters) {
        return new BrokerFactory(configPath, Arrays.asList(adapters));
    }

    public static BrokerFactory create(String configPath, Collection<? extends ProviderAdapter> adapters) {
        return new BrokerFactory(configPath, List.copyOf(adapters));
    }

    /**
     * Starts the usage pipeline.
     */
    public BrokerFactory start() {
        if (usagePipeline != null) {
            usagePipeline.start();
        }
        log.info("Broker started");
        return this;
    }

    public LlmBroker getBroker() {
        return broker;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    public ModelRouter getRouter() {
        return router;
    }

    public CostTracker getCostTracker() {
        return costTracker;
    }

    /**
     * @return the metrics registry, or null when metrics are disabled
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * @return the usage pipeline, or null when it is disabled
     */
    public UsageEventPipeline getUsagePipeline() {
        return usagePipeline;
    }

    @Override
    public void close() {
        log.info("Shutting down BrokerFactory...");

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (usagePipeline != null) {
            try {
                usagePipeline.close();
            } catch (Exception e) {
                log.warn("Error closing usage pipeline", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("BrokerFactory shut down");
    }

    /**
     * Daemon threads for the shared scheduler.
     */
    private static class BrokerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        BrokerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
