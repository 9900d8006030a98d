package fr.lapetina.llm.broker.domain.model;

/**
 * Classification of a failed provider attempt. Drives the retry policy.
 */
public enum ErrorKind {
    /** Provider asked us to slow down; retried regardless of the attempt budget */
    RATE_LIMITED,

    /** Timeouts, transient server errors, connection failures */
    RETRYABLE,

    /** Bad request, authentication failure, content-policy rejection */
    FATAL
}
