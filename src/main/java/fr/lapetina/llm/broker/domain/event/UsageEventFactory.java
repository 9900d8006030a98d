package fr.lapetina.llm.broker.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link UsageEvent} slots for the usage ring buffer.
 */
public final class UsageEventFactory implements EventFactory<UsageEvent> {

    @Override
    public UsageEvent newInstance() {
        return new UsageEvent();
    }
}
