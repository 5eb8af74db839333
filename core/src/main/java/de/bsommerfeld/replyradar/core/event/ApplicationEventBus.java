package de.bsommerfeld.replyradar.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process channel for the run figures in {@link TriageEvents}. Pipeline
 * stages post here instead of knowing who reports them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A subscriber that throws is
 * logged with the event and the failing method, and never disturbs the run
 * or the other subscribers.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting {}", event.getClass().getSimpleName());
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.debug("Registering {} on the run event bus", listener.getClass().getName());
        eventBus.register(listener);
    }

    static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Subscriber {}.{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(), exception);
    }
}
