package fr.lapetina.llm.broker.domain.event;

/**
 * Lifecycle state of one provider call as driven by the retry executor.
 *
 * <pre>
 * PENDING -> WAITING_FOR_PERMIT -> IN_FLIGHT -> SUCCEEDED
 *                 ^                   |
 *                 +---- RETRYING <----+-> FAILED
 * </pre>
 * CANCELLED may be entered from any non-terminal state at a suspend point.
 */
public enum InvocationState {
    /** Created, nothing attempted yet */
    PENDING,

    /** Waiting for rate-limit capacity */
    WAITING_FOR_PERMIT,

    /** Request sent to the provider */
    IN_FLIGHT,

    /** Backing off before the next attempt */
    RETRYING,

    /** Provider answered successfully */
    SUCCEEDED,

    /** Terminal failure: fatal, exhausted, or rejected before dispatch */
    FAILED,

    /** Cooperative cancellation observed */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
