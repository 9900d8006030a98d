package fr.lapetina.llm.broker.ratelimit;

import fr.lapetina.llm.broker.domain.model.RateLimitPolicy;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-window counter for one model, shared by all callers targeting it.
 *
 * The window snapshot is immutable and replaced with compare-and-set, so admission
 * never takes a lock and never exceeds {@code requestsPerWindow} in a window.
 */
public final class RateLimitState {

    private record Window(long start, int used) {
    }

    private final String model;
    private final RateLimitPolicy policy;
    private final long windowNanos;
    private final AtomicReference<Window> window;

    RateLimitState(String model, RateLimitPolicy policy, long now) {
        this.model = model;
        this.policy = policy;
        this.windowNanos = policy.window().toNanos();
        this.window = new AtomicReference<>(new Window(now, 0));
    }

    /**
     * Reserves one unit in the current window.
     *
     * @return the permit, or null if the window is full
     */
    Permit tryAcquire(long now) {
        while (true) {
            Window current = window.get();
            Window next;
            if (now - current.start() >= windowNanos) {
                next = new Window(now, 1);
            } else if (current.used() < policy.requestsPerWindow()) {
                next = new Window(current.start(), current.used() + 1);
            } else {
                return null;
            }
            if (window.compareAndSet(current, next)) {
                return new Permit(model, this, next.start());
            }
        }
    }

    /**
     * Returns a unit to the window it was taken from. No-op once that window has rolled over.
     */
    boolean release(Permit permit) {
        while (true) {
            Window current = window.get();
            if (current.start() != permit.getWindowStart() || current.used() == 0) {
                return false;
            }
            if (window.compareAndSet(current, new Window(current.start(), current.used() - 1))) {
                return true;
            }
        }
    }

    /**
     * Nanoseconds until the current window rolls over.
     */
    long nanosUntilNextWindow(long now) {
        long remaining = window.get().start() + windowNanos - now;
        return Math.max(0L, remaining);
    }

    public String getModel() {
        return model;
    }

    public RateLimitPolicy getPolicy() {
        return policy;
    }

    /**
     * Units admitted in the window currently on record.
     */
    public int getUsedInWindow() {
        return window.get().used();
    }
}
