package com.eventdaemon.registry;

import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.EventSubscriber;
import com.eventdaemon.gateway.GatewayConnection;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscriber that calls a registered handler with the connection prepended to the event
 * payload. Asynchronous handlers are started and left running; their failures are logged when
 * the returned stage completes.
 */
public final class BoundHandler implements EventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(BoundHandler.class);

    private final HandlerRegistration registration;
    private final GatewayConnection connection;

    public BoundHandler(HandlerRegistration registration, GatewayConnection connection) {
        this.registration = registration;
        this.connection = connection;
    }

    @Override
    public void onEvent(EventPayload payload) throws Exception {
        switch (registration.getKind()) {
            case SYNC -> ((SyncEventHandler) registration.getHandler()).handle(connection, payload);
            case ASYNC -> {
                CompletionStage<?> pending =
                        ((AsyncEventHandler) registration.getHandler()).handle(connection, payload);
                if (pending != null) {
                    pending.whenComplete((result, error) -> {
                        if (error != null) {
                            log.error(
                                    "Async handler {} on {} failed: {}",
                                    registration.getName(),
                                    registration.getEventName(),
                                    error.getMessage(),
                                    error);
                        }
                    });
                }
            }
        }
    }

    public HandlerRegistration getRegistration() {
        return registration;
    }

    @Override
    public String toString() {
        return registration.getName() + " -> " + registration.getEventName();
    }
}
