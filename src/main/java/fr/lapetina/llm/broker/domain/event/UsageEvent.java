package fr.lapetina.llm.broker.domain.event;

import fr.lapetina.llm.broker.domain.model.ErrorKind;
import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Event object for the usage ring buffer.
 *
 * Mutable holder reused across the ring buffer. Only the publisher (between claim and
 * publish) and the pipeline handlers touch it.
 */
public final class UsageEvent {

    private UsageEventType type;
    private String requestId;
    private String model;
    private InvocationState outcome;
    private ErrorKind errorKind;
    private String errorMessage;
    private int attempts;
    private Duration latency;
    private TokenUsage usage;
    private BigDecimal cost;
    private String budget;
    private BigDecimal ceiling;
    private Instant occurredAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.requestId = null;
        this.model = null;
        this.outcome = null;
        this.errorKind = null;
        this.errorMessage = null;
        this.attempts = 0;
        this.latency = null;
        this.usage = null;
        this.cost = null;
        this.budget = null;
        this.ceiling = null;
        this.occurredAt = null;
    }

    public void initializeAttempt(String requestId, String model, int attempt,
                                  InvocationState outcome, ErrorKind errorKind, Duration latency) {
        clear();
        this.type = UsageEventType.ATTEMPT;
        this.requestId = requestId;
        this.model = model;
        this.attempts = attempt;
        this.outcome = outcome;
        this.errorKind = errorKind;
        this.latency = latency;
        this.occurredAt = Instant.now();
    }

    public void initializeCharge(String requestId, String model, TokenUsage usage,
                                 BigDecimal cost, String budget) {
        clear();
        this.type = UsageEventType.CHARGE;
        this.requestId = requestId;
        this.model = model;
        this.usage = usage;
        this.cost = cost;
        this.budget = budget;
        this.occurredAt = Instant.now();
    }

    public void initializeInvocation(String requestId, String model, int attempts, TokenUsage usage,
                                     BigDecimal cost, Duration latency) {
        clear();
        this.type = UsageEventType.INVOCATION_SUCCEEDED;
        this.requestId = requestId;
        this.model = model;
        this.outcome = InvocationState.SUCCEEDED;
        this.attempts = attempts;
        this.usage = usage;
        this.cost = cost;
        this.latency = latency;
        this.occurredAt = Instant.now();
    }

    public void initializeFailure(String requestId, String model, InvocationState outcome,
                                  String errorMessage, Duration latency) {
        clear();
        this.type = UsageEventType.INVOCATION_FAILED;
        this.requestId = requestId;
        this.model = model;
        this.outcome = outcome;
        this.errorMessage = errorMessage;
        this.latency = latency;
        this.occurredAt = Instant.now();
    }

    public void initializeBudgetClosed(String budget, BigDecimal spent, BigDecimal ceiling) {
        clear();
        this.type = UsageEventType.BUDGET_CLOSED;
        this.budget = budget;
        this.cost = spent;
        this.ceiling = ceiling;
        this.occurredAt = Instant.now();
    }

    public UsageEventType getType() {
        return type;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getModel() {
        return model;
    }

    public InvocationState getOutcome() {
        return outcome;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getLatency() {
        return latency;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public String getBudget() {
        return budget;
    }

    public BigDecimal getCeiling() {
        return ceiling;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "UsageEvent{" +
                "type=" + type +
                ", requestId='" + requestId + '\'' +
                ", model='" + model + '\'' +
                ", outcome=" + outcome +
                ", budget='" + budget + '\'' +
                ", cost=" + cost +
                '}';
    }
}
