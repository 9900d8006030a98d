package fr.lapetina.llm.broker.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.broker.disruptor.handlers.MetricsHandler;
import fr.lapetina.llm.broker.disruptor.handlers.ReportHandler;
import fr.lapetina.llm.broker.domain.event.InvocationState;
import fr.lapetina.llm.broker.domain.event.UsageEvent;
import fr.lapetina.llm.broker.domain.event.UsageEventFactory;
import fr.lapetina.llm.broker.domain.event.UsageRecorder;
import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;
import fr.lapetina.llm.broker.infrastructure.config.BrokerConfig;
import fr.lapetina.llm.broker.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Disruptor ring buffer carrying broker telemetry off the invocation path.
 *
 * Publishers are the threads completing invocation stages, so the producer type is MULTI.
 * Publishing never blocks: when the ring buffer is full the event is dropped and counted.
 *
 * Handler order: Metrics -> Report (report clears the event).
 */
public final class UsageEventPipeline implements UsageRecorder, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UsageEventPipeline.class);

    private final Disruptor<UsageEvent> disruptor;
    private final RingBuffer<UsageEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private final MetricsHandler metricsHandler;
    private final ReportHandler reportHandler;
    private final MetricsRegistry metricsRegistry;

    private UsageEventPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = new UsageThreadFactory("usage-pipeline");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new UsageEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        this.metricsHandler = metricsRegistry != null ? new MetricsHandler(metricsRegistry) : null;
        this.reportHandler = new ReportHandler();

        if (metricsHandler != null) {
            disruptor.handleEventsWith(metricsHandler).then(reportHandler);
        } else {
            disruptor.handleEventsWith(reportHandler);
        }

        disruptor.setDefaultExceptionHandler(new UsageExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("UsageEventPipeline created: ringBufferSize={}, waitStrategy={}, metrics={}",
                builder.ringBufferSize, builder.waitStrategy, metricsHandler != null);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("UsageEventPipeline started");
        }
    }

    @Override
    public void onAttempt(String requestId, String model, int attempt,
                          InvocationState outcome, ErrorKind errorKind, Duration latency) {
        publish(event -> event.initializeAttempt(requestId, model, attempt, outcome, errorKind, latency));
    }

    @Override
    public void onCharge(String requestId, String model, TokenUsage usage, BigDecimal cost, String budget) {
        publish(event -> event.initializeCharge(requestId, model, usage, cost, budget));
    }

    @Override
    public void onInvocationSucceeded(String requestId, String model, int attempts,
                                      TokenUsage usage, BigDecimal cost, Duration latency) {
        publish(event -> event.initializeInvocation(requestId, model, attempts, usage, cost, latency));
    }

    @Override
    public void onInvocationFailed(String requestId, String model, InvocationState outcome,
                                   Throwable error, Duration latency) {
        String message = error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : null;
        publish(event -> event.initializeFailure(requestId, model, outcome, message, latency));
    }

    @Override
    public void onBudgetClosed(String budget, BigDecimal spent, BigDecimal ceiling) {
        publish(event -> event.initializeBudgetClosed(budget, spent, ceiling));
    }

    private void publish(Consumer<UsageEvent> initializer) {
        if (!running.get()) {
            drop("pipeline not running");
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            drop("ring buffer full");
            return;
        }

        try {
            initializer.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
        }
    }

    private void drop(String reason) {
        long count = dropped.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.setDroppedEvents(count);
        }
        log.debug("Usage event dropped: reason={}, droppedTotal={}", reason, count);
    }

    /**
     * Events dropped because the pipeline was stopped or its ring buffer full.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * Events fully processed by the final handler.
     */
    public long getProcessedCount() {
        return reportHandler.getProcessed();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * True when every published event went through all handlers.
     */
    public boolean isDrained() {
        return ringBuffer.remainingCapacity() == ringBuffer.getBufferSize();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gracefully shuts down the pipeline, draining published events.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down UsageEventPipeline...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("UsageEventPipeline shut down gracefully: processed={}, dropped={}",
                        reportHandler.getProcessed(), dropped.get());
            } catch (TimeoutException e) {
                log.warn("UsageEventPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for the pipeline's consumer threads. Daemon: telemetry never keeps the JVM alive.
     */
    private static class UsageThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        UsageThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs handler failures; a broken handler never stops the pipeline.
     */
    private static class UsageExceptionHandler implements ExceptionHandler<UsageEvent> {

        private static final Logger log = LoggerFactory.getLogger(UsageExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, UsageEvent event) {
            log.error("Exception in usage handler: sequence={}, event={}", sequence, event, ex);
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during usage pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during usage pipeline shutdown", ex);
        }
    }

    /**
     * Builder for UsageEventPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        /**
         * Optional. Without a registry only the report handler runs.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(BrokerConfig config) {
            ringBufferSize(config.getUsagePipeline().getRingBufferSize());
            this.waitStrategy = config.getUsagePipeline().getWaitStrategy();
            return this;
        }

        public UsageEventPipeline build() {
            return new UsageEventPipeline(this);
        }
    }
}
