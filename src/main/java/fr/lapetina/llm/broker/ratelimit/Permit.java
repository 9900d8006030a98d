package fr.lapetina.llm.broker.ratelimit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One unit of rate-limit capacity reserved for a dispatch.
 *
 * A permit is either consumed by sending the call or handed back through
 * {@link RateLimiter#release(Permit)} when the call never went out.
 */
public final class Permit {

    private final String model;
    private final RateLimitState state;
    private final long windowStart;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(String model, RateLimitState state, long windowStart) {
        this.model = model;
        this.state = state;
        this.windowStart = windowStart;
    }

    static Permit unlimited(String model) {
        return new Permit(model, null, 0L);
    }

    public String getModel() {
        return model;
    }

    long getWindowStart() {
        return windowStart;
    }

    RateLimitState getState() {
        return state;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        return "Permit{model='" + model + "', windowStart=" + windowStart + ", released=" + released.get() + '}';
    }
}
