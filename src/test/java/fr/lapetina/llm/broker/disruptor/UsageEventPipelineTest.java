package fr.lapetina.llm.broker.disruptor;

import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;
import fr.lapetina.llm.broker.infrastructure.config.BrokerConfig;
import fr.lapetina.llm.broker.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsageEventPipelineTest {

    private MetricsRegistry metrics;
    private UsageEventPipeline pipeline;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry();
        pipeline = UsageEventPipeline.builder()
                .ringBufferSize(64)
                .waitStrategy("yielding")
                .metricsRegistry(metrics)
                .build();
        pipeline.start();
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        metrics.close();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private double count(String name, String... tags) {
        Counter counter = metrics.getRegistry().find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }

    @Test
    @DisplayName("should turn usage events into metrics")
    void shouldRecordMetrics() throws Exception {
        pipeline.onAttempt("r1", "stub/m", 1, InvocationState.RETRYING, ErrorKind.RATE_LIMITED, Duration.ofMillis(12));
        pipeline.onAttempt("r1", "stub/m", 2, InvocationState.SUCCEEDED, null, Duration.ofMillis(8));
        pipeline.onCharge("r1", "stub/m", TokenUsage.of(100, 20), new BigDecimal("0.25"), "job");
        pipeline.onInvocationSucceeded("r1", "stub/m", 2, TokenUsage.of(100, 20), new BigDecimal("0.25"),
                Duration.ofMillis(30));
        pipeline.onInvocationFailed("r2", "stub/m", InvocationState.FAILED,
                new IllegalStateException("boom"), Duration.ofMillis(5));
        pipeline.onBudgetClosed("job", new BigDecimal("1.50"), new BigDecimal("1.00"));

        awaitCondition(() -> pipeline.getProcessedCount() == 6);

        assertThat(count("llm_broker_attempts_total", "model", "stub/m", "outcome", "RETRYING", "error_kind", "RATE_LIMITED"))
                .isEqualTo(1.0);
        assertThat(count("llm_broker_attempts_total", "model", "stub/m", "outcome", "SUCCEEDED", "error_kind", "NONE"))
                .isEqualTo(1.0);
        assertThat(count("llm_broker_tokens_total", "model", "stub/m", "direction", "input")).isEqualTo(100.0);
        assertThat(count("llm_broker_spend_total", "model", "stub/m")).isEqualTo(0.25);
        assertThat(count("llm_broker_invocations_total", "outcome", "SUCCEEDED")).isEqualTo(1.0);
        assertThat(count("llm_broker_invocations_total", "outcome", "FAILED")).isEqualTo(1.0);
        assertThat(count("llm_broker_budgets_closed_total", "ceiling", "over")).isEqualTo(1.0);
        assertThat(metrics.scrape()).contains("llm_broker_attempts_total");
    }

    @Test
    @DisplayName("should drain every published event")
    void shouldDrain() throws Exception {
        for (int i = 0; i < 40; i++) {
            pipeline.onCharge("r" + i, "stub/m", TokenUsage.of(1, 1), BigDecimal.ONE, "global");
        }

        awaitCondition(() -> pipeline.getProcessedCount() == 40);

        awaitCondition(pipeline::isDrained);
        assertThat(pipeline.getDroppedCount()).isZero();
        assertThat(pipeline.getRemainingCapacity()).isEqualTo(64);
    }

    @Test
    @DisplayName("should drop events once closed instead of blocking")
    void shouldDropWhenClosed() {
        pipeline.close();

        pipeline.onCharge("late", "stub/m", TokenUsage.of(1, 1), BigDecimal.ONE, "global");

        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.getDroppedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should run without a metrics registry")
    void shouldRunWithoutMetrics() throws Exception {
        try (UsageEventPipeline bare = UsageEventPipeline.builder().ringBufferSize(8).build()) {
            bare.start();
            bare.onBudgetClosed("job", BigDecimal.ZERO, null);

            awaitCondition(() -> bare.getProcessedCount() == 1);
        }
    }

    @Test
    @DisplayName("should build from configuration and reject invalid ring buffer sizes")
    void shouldBuildFromConfig() {
        BrokerConfig config = new BrokerConfig();
        config.getUsagePipeline().setRingBufferSize(128);

        try (UsageEventPipeline configured = UsageEventPipeline.builder().fromConfig(config).build()) {
            assertThat(configured.getRemainingCapacity()).isEqualTo(128);
        }
        assertThatThrownBy(() -> UsageEventPipeline.builder().ringBufferSize(100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
