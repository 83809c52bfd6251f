package com.eventdaemon.gateway;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns event emission for every {@link GatewayEvent} in the process.
 *
 * <p>An emission is delivered in two stages:
 * <ol>
 *   <li>the event's primary subscribers, in subscription order;</li>
 *   <li>every registered mirror {@link EventSink}, in registration order.</li>
 * </ol>
 *
 * <p>Each subscriber and each sink is invoked in its own try/catch. A failing subscriber does
 * not prevent later subscribers from running, and a failing sink never reaches the emitter:
 * primary delivery has always completed before any sink is called.
 */
@Component
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<EventSink> sinks = new CopyOnWriteArrayList<>();

    public void dispatch(GatewayEvent event, EventPayload payload) {
        for (EventSubscriber subscriber : event.getSubscribers()) {
            try {
                subscriber.onEvent(payload);
            } catch (Exception e) {
                log.error("Subscriber {} failed on {}: {}", subscriber, event.getName(), e.getMessage(), e);
            }
        }

        for (EventSink sink : sinks) {
            try {
                sink.onEmit(event, payload);
            } catch (Exception e) {
                log.error("Mirror sink {} failed on {}: {}", sink, event.getName(), e.getMessage(), e);
            }
        }
    }

    public void addSink(EventSink sink) {
        sinks.add(sink);
        log.debug("Mirror sink added: {} (total: {})", sink, sinks.size());
    }

    public boolean removeSink(EventSink sink) {
        boolean removed = sinks.remove(sink);
        if (removed) {
            log.debug("Mirror sink removed: {} (total: {})", sink, sinks.size());
        }
        return removed;
    }

    /** Snapshot of the registered sinks. */
    public List<EventSink> getSinks() {
        return List.copyOf(sinks);
    }
}
