package com.eventdaemon.registry;

import com.eventdaemon.gateway.GatewayConnection;
import org.slf4j.Logger;

/**
 * Entry points a loaded handler class may implement. Both are optional: a class that
 * contributes nothing is loaded without effect. Classes that do not implement this interface
 * can still contribute handlers through {@link OnEvent} methods.
 */
public interface HandlerModule {

    /** Called once per discovery pass, before any connection is bound. */
    default void registerHandlers(HandlerRegistrar registrar) {}

    /** Called after this module's handlers are bound to the live connection. */
    default void setup(GatewayConnection connection, Logger logger) throws Exception {}
}
