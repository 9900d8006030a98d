package fr.lapetina.llm.broker.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.broker.domain.event.UsageEvent;
import fr.lapetina.llm.broker.domain.event.UsageEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Final stage handler: writes one structured log line per usage event and clears the event
 * for reuse.
 */
public final class ReportHandler implements EventHandler<UsageEvent> {

    private static final Logger log = LoggerFactory.getLogger(ReportHandler.class);

    private final AtomicLong processed = new AtomicLong();

    @Override
    public void onEvent(UsageEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getType() != null) {
                report(event);
                processed.incrementAndGet();
            }
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }

    private void report(UsageEvent event) {
        UsageEventType type = event.getType();
        switch (type) {
            case ATTEMPT -> log.debug("Usage attempt: requestId={}, model={}, attempt={}, outcome={}, errorKind={}, latencyMs={}",
                    event.getRequestId(),
                    event.getModel(),
                    event.getAttempts(),
                    event.getOutcome(),
                    event.getErrorKind(),
                    event.getLatency() != null ? event.getLatency().toMillis() : -1);
            case CHARGE -> log.info("Usage charge: requestId={}, model={}, budget={}, inputTokens={}, outputTokens={}, cost={}",
                    event.getRequestId(),
                    event.getModel(),
                    event.getBudget(),
                    event.getUsage() != null ? event.getUsage().inputTokens() : 0,
                    event.getUsage() != null ? event.getUsage().outputTokens() : 0,
                    event.getCost() != null ? event.getCost().toPlainString() : "0");
            case INVOCATION_SUCCEEDED -> log.info("Usage invocation: requestId={}, model={}, attempts={}, cost={}, latencyMs={}",
                    event.getRequestId(),
                    event.getModel(),
                    event.getAttempts(),
                    event.getCost() != null ? event.getCost().toPlainString() : "0",
                    event.getLatency() != null ? event.getLatency().toMillis() : -1);
            case INVOCATION_FAILED -> log.warn("Usage invocation failed: requestId={}, model={}, outcome={}, error={}",
                    event.getRequestId(),
                    event.getModel(),
                    event.getOutcome(),
                    event.getErrorMessage());
            case BUDGET_CLOSED -> log.info("Usage budget closed: budget={}, spent={}, ceiling={}",
                    event.getBudget(),
                    event.getCost() != null ? event.getCost().toPlainString() : "0",
                    event.getCeiling() != null ? event.getCeiling().toPlainString() : "unlimited");
        }
    }

    /**
     * Events reported since start.
     */
    public long getProcessed() {
        return processed.get();
    }
}
