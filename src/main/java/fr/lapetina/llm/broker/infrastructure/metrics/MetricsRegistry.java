package fr.lapetina.llm.broker.infrastructure.metrics;

import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt and invocation counters per model and outcome
 * - Latency timers per model
 * - Token and spend counters per model
 * - Usage pipeline gauges (ring buffer capacity, dropped events)
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "llm_broker";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> invocationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> invocationTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> tokenCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> costCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> budgetCounters = new ConcurrentHashMap<>();

    // Pipeline gauges
    private final AtomicLong ringBufferRemaining = new AtomicLong(0);
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_usage_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the usage ring buffer")
                .register(registry);

        Gauge.builder(prefix + "_usage_events_dropped", droppedEvents, AtomicLong::get)
                .description("Usage events dropped because the ring buffer was full")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Counts one provider attempt and records its latency.
     */
    public void recordAttempt(String model, InvocationState outcome, ErrorKind errorKind, Duration latency) {
        String kind = errorKind != null ? errorKind.name() : "NONE";
        String key = model + ":" + outcome.name() + ":" + kind;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Provider attempts")
                        .tag("model", model)
                        .tag("outcome", outcome.name())
                        .tag("error_kind", kind)
                        .register(registry)
        ).increment();

        if (latency != null) {
            attemptTimers.computeIfAbsent(model, k ->
                    Timer.builder(prefix + "_attempt_latency")
                            .description("Provider attempt latency")
                            .tag("model", model)
                            .publishPercentileHistogram()
                            .register(registry)
            ).record(latency);
        }
    }

    /**
     * Counts one finished logical invocation and records its end-to-end latency.
     */
    public void recordInvocation(String model, InvocationState outcome, Duration latency) {
        String key = model + ":" + outcome.name();
        invocationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_invocations_total")
                        .description("Logical invocations")
                        .tag("model", model)
                        .tag("outcome", outcome.name())
                        .register(registry)
        ).increment();

        if (latency != null) {
            invocationTimers.computeIfAbsent(model, k ->
                    Timer.builder(prefix + "_invocation_latency")
                            .description("End-to-end invocation latency")
                            .tag("model", model)
                            .publishPercentileHistogram()
                            .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                            .register(registry)
            ).record(latency);
        }
    }

    /**
     * Adds charged tokens and spend for a model.
     */
    public void recordCharge(String model, TokenUsage usage, BigDecimal cost) {
        if (usage != null) {
            tokenCounter(model, "input").increment(usage.inputTokens());
            tokenCounter(model, "output").increment(usage.outputTokens());
        }
        if (cost != null) {
            costCounters.computeIfAbsent(model, k ->
                    Counter.builder(prefix + "_spend_total")
                            .description("Charged spend")
                            .tag("model", model)
                            .register(registry)
            ).increment(cost.doubleValue());
        }
    }

    /**
     * Counts a closed budget scope, split by whether it ended over its ceiling.
     */
    public void recordBudgetClosed(boolean overCeiling) {
        String key = overCeiling ? "over" : "within";
        budgetCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_budgets_closed_total")
                        .description("Closed budget scopes")
                        .tag("ceiling", key)
                        .register(registry)
        ).increment();
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    public void setDroppedEvents(long value) {
        droppedEvents.set(value);
    }

    private Counter tokenCounter(String model, String direction) {
        return tokenCounters.computeIfAbsent(model + ":" + direction, k ->
                Counter.builder(prefix + "_tokens_total")
                        .description("Charged tokens")
                        .tag("model", model)
                        .tag("direction", direction)
                        .register(registry));
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
