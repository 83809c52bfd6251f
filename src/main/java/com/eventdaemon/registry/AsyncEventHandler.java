package com.eventdaemon.registry;

import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.GatewayConnection;
import java.util.concurrent.CompletionStage;

/**
 * Handler that returns a pending result. The dispatch loop does not wait for the returned
 * stage; later events may be delivered before it completes.
 */
@FunctionalInterface
public interface AsyncEventHandler extends EventHandler {

    CompletionStage<?> handle(GatewayConnection connection, EventPayload payload) throws Exception;
}
