package com.eventdaemon.event;

import com.eventdaemon.core.ConnectionState;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published by {@link com.eventdaemon.core.ConnectionManager} on every connection state
 * transition, including the loss of an established session.
 */
public class ConnectionStateEvent extends ApplicationEvent {

    private final ConnectionState previousState;
    private final ConnectionState newState;
    private final String message;
    private final LocalDateTime occurredAt;

    public ConnectionStateEvent(
            Object source, ConnectionState previousState, ConnectionState newState, String message) {
        super(source);
        this.previousState = previousState;
        this.newState = newState;
        this.message = message;
        this.occurredAt = LocalDateTime.now();
    }

    public ConnectionState getPreviousState() {
        return previousState;
    }

    public ConnectionState getNewState() {
        return newState;
    }

    public String getMessage() {
        return message;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
