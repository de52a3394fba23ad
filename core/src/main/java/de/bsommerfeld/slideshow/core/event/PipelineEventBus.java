package de.bsommerfeld.slideshow.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that carries progress events
 * from the pipeline stages to whoever reports them. Delivery is synchronous
 * on the posting thread.
 */
@Singleton
public class PipelineEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineEventBus.class);
    private final EventBus eventBus;

    public PipelineEventBus() {
        this.eventBus = new EventBus("SlideshowMachine-EventBus");
    }

    public void post(Object event) {
        LOG.trace("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
