package fr.lapetina.llm.broker.domain.event;

/**
 * Kinds of telemetry published to the usage pipeline.
 */
public enum UsageEventType {
    /** One provider attempt finished (success, retry or failure) */
    ATTEMPT,

    /** An amount was charged against a budget chain */
    CHARGE,

    /** A logical invocation finished successfully */
    INVOCATION_SUCCEEDED,

    /** A logical invocation finished with an error */
    INVOCATION_FAILED,

    /** A budget scope was closed */
    BUDGET_CLOSED
}
