package fr.lapetina.llm.broker.domain.model;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared by a group of invocations.
 * Checked at every suspend point: permit acquisition, dispatch, and before each retry.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation. Only the first reason is kept.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why != null ? why : "cancelled");
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancelled() + ", reason=" + reason.get() + '}';
    }
}
