package de.bsommerfeld.channelstate.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} through which connection state
 * changes reach the command and presentation layers. A listener that throws
 * is logged and skipped; it never affects the publisher or other listeners.
 */
@Singleton
public class ConnectionEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionEventBus.class);
    private final EventBus eventBus;

    public ConnectionEventBus() {
        this.eventBus = new EventBus(ConnectionEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
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

    private static void logSubscriberFailure(Throwable error, SubscriberExceptionContext context) {
        LOG.error("Listener {} failed handling {}",
                context.getSubscriber().getClass().getName(), context.getEvent(), error);
    }
}
