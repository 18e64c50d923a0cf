package de.bsommerfeld.rentalprice.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the milestones of a pricing run: {@link PipelineEvents.FeaturesAssembledEvent}
 * once per assembled matrix, {@link PipelineEvents.MalformedRecordEvent} for every
 * listing field an engine could not read, {@link PipelineEvents.ModelTrainedEvent} and
 * {@link PipelineEvents.ModelFailedEvent} per regressor, and
 * {@link PipelineEvents.EnsembleBuiltEvent} when at least two models survive.
 * <p>
 * Listeners run synchronously on the posting thread, which may be a feature
 * worker or the training thread. A listener that throws is logged and never
 * aborts the run.
 */
@Singleton
public class PipelineEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineEventBus.class);
    private final EventBus eventBus;

    public PipelineEventBus() {
        this.eventBus = new EventBus(PipelineEventBus::onListenerFailure);
    }

    public void post(Object event) {
        // one per bad field, too chatty even for DEBUG
        if (!(event instanceof PipelineEvents.MalformedRecordEvent)) {
            LOG.debug("Pipeline event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Listener registered: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Listener unregistered: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.warn("Listener {}.{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent().getClass().getSimpleName(), exception);
    }
}
