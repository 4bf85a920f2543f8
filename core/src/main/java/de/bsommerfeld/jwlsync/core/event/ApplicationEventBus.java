package de.bsommerfeld.jwlsync.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around Guava's EventBus that decouples the merge pipeline
 * from whatever renders its status (console view, job table).
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus("JwlSync-EventBus");
    }

    public void post(Object event) {
        // Progress ticks are too chatty for debug output
        if (!(event instanceof SyncEvents.ProgressEvent)) {
            LOG.debug("Posting event: {}", event);
        }
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
