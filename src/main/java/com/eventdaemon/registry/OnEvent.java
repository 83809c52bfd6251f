package com.eventdaemon.registry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public method of a loaded handler class as a handler for the named event.
 *
 * <p>The method must take {@code (GatewayConnection, EventPayload)}. A {@code void} method is
 * registered as {@link HandlerKind#SYNC}; a method returning a
 * {@link java.util.concurrent.CompletionStage} is registered as {@link HandlerKind#ASYNC}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface OnEvent {

    /** Gateway event name. */
    String value();
}
