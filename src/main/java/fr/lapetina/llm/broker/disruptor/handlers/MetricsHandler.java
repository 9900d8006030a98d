package fr.lapetina.llm.broker.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.broker.domain.event.UsageEvent;
import fr.lapetina.llm.broker.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * First stage handler: records Micrometer metrics for each usage event.
 *
 * Sets MDC context (requestId, model, budget) for the duration of the event.
 */
public final class MetricsHandler implements EventHandler<UsageEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(UsageEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(UsageEvent event) {
        if (event.getRequestId() != null) {
            MDC.put("requestId", event.getRequestId());
        }
        if (event.getModel() != null) {
            MDC.put("model", event.getModel());
        }
        if (event.getBudget() != null) {
            MDC.put("budget", event.getBudget());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("model");
        MDC.remove("budget");
    }

    private void recordMetrics(UsageEvent event) {
        switch (event.getType()) {
            case ATTEMPT -> metricsRegistry.recordAttempt(
                    event.getModel(), event.getOutcome(), event.getErrorKind(), event.getLatency());
            case CHARGE -> metricsRegistry.recordCharge(event.getModel(), event.getUsage(), event.getCost());
            case INVOCATION_SUCCEEDED, INVOCATION_FAILED -> {
                metricsRegistry.recordInvocation(event.getModel(), event.getOutcome(), event.getLatency());
                if (event.getErrorMessage() != null) {
                    log.debug("Invocation error recorded: outcome={}, message={}",
                            event.getOutcome(), event.getErrorMessage());
                }
            }
            case BUDGET_CLOSED -> metricsRegistry.recordBudgetClosed(
                    event.getCeiling() != null && event.getCost().compareTo(event.getCeiling()) > 0);
        }
    }
}
