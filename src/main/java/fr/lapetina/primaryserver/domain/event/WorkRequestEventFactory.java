package fr.lapetina.primaryserver.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer slots.
 */
public final class WorkRequestEventFactory implements EventFactory<WorkRequestEvent> {

    @Override
    public WorkRequestEvent newInstance() {
        return new WorkRequestEvent();
    }
}
