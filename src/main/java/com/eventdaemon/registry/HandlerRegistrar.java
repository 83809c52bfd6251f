package com.eventdaemon.registry;

/**
 * Registration capability handed to {@link HandlerModule#registerHandlers(HandlerRegistrar)}.
 */
public interface HandlerRegistrar {

    /**
     * Returns a collector that records handlers under {@code eventName}.
     *
     * @param eventName name of the gateway event, e.g. {@code "barUpdateEvent"}
     */
    HandlerCollector collect(String eventName);
}
