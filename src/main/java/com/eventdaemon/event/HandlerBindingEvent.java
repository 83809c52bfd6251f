package com.eventdaemon.event;

import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after the registry binds its handlers to a connection. {@code missingEvents}
 * lists registered event names the connection does not publish.
 */
public class HandlerBindingEvent extends ApplicationEvent {

    private final int bound;
    private final int failed;
    private final List<String> missingEvents;

    public HandlerBindingEvent(Object source, int bound, int failed, List<String> missingEvents) {
        super(source);
        this.bound = bound;
        this.failed = failed;
        this.missingEvents = List.copyOf(missingEvents);
    }

    public int getBound() {
        return bound;
    }

    public int getFailed() {
        return failed;
    }

    public List<String> getMissingEvents() {
        return missingEvents;
    }
}
