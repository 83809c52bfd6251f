package com.eventdaemon.gateway;

/**
 * Secondary receiver of every emission handled by the {@link EventDispatcher}, regardless of
 * which event fired. Sinks run after the event's own subscribers.
 */
@FunctionalInterface
public interface EventSink {

    void onEmit(GatewayEvent event, EventPayload payload) throws Exception;
}
