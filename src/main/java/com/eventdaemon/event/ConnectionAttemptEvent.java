package com.eventdaemon.event;

import org.springframework.context.ApplicationEvent;

/** Published after each individual connection attempt, successful or not. */
public class ConnectionAttemptEvent extends ApplicationEvent {

    private final int attempt;
    private final int maxAttempts;
    private final boolean succeeded;
    private final String error;

    public ConnectionAttemptEvent(Object source, int attempt, int maxAttempts, boolean succeeded, String error) {
        super(source);
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.succeeded = succeeded;
        this.error = error;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    /** Failure description, or null when the attempt succeeded. */
    public String getError() {
        return error;
    }
}
