package com.eventdaemon.bridge;

import com.eventdaemon.gateway.EventPayload;

@FunctionalInterface
public interface SignalReceiver {

    /**
     * @param sender the object that sent the signal; for bridged emissions, the
     *     {@link com.eventdaemon.gateway.GatewayEvent} that fired
     */
    void receive(Object sender, EventPayload payload) throws Exception;
}
