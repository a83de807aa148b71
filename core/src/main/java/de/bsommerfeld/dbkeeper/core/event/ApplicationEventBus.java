package de.bsommerfeld.dbkeeper.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's synchronous {@link EventBus}. Delivery happens
 * on the posting thread; a subscriber that throws is logged and never
 * affects the poster, which is what makes events the channel for
 * best-effort side effects.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
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
        LOG.warn("Event subscriber {}#{} failed for {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(), error);
    }
}
