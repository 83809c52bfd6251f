package com.eventdaemon.registry;

import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.GatewayConnection;

/**
 * Handler that completes its work before returning. Runs inline on the dispatch loop and
 * holds it for its whole duration.
 */
@FunctionalInterface
public interface SyncEventHandler extends EventHandler {

    void handle(GatewayConnection connection, EventPayload payload) throws Exception;
}
