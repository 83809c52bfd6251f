package com.eventdaemon.gateway;

/**
 * A primary subscriber attached to one {@link GatewayEvent}.
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(EventPayload payload) throws Exception;
}
