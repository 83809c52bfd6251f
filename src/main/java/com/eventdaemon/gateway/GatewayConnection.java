package com.eventdaemon.gateway;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The broker gateway connection the daemon drives. Every component that needs to talk to the
 * gateway goes through this interface; the wire protocol lives entirely behind it.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link SimulatedGatewayConnection} for paper mode and tests</li>
 *   <li>{@link KiteGatewayConnection} for the live Kite Connect ticker</li>
 * </ul>
 */
public interface GatewayConnection {

    /**
     * Starts one connection attempt.
     *
     * @param config connection parameters (host, port, client id, timeout, read-only, account)
     * @return a future completing when the session is up, or failing with the attempt's error
     */
    CompletableFuture<Void> connect(ConnectionConfig config);

    /**
     * Tears down the session. Completes once the connection has released its resources.
     */
    CompletableFuture<Void> disconnect();

    boolean isConnected();

    /**
     * Runs the dispatch loop on the calling thread. Blocks until the connection is dropped or
     * a fatal error escapes the loop.
     */
    void run();

    /**
     * Looks up a named event.
     *
     * @param name event name, e.g. {@code "orderStatusEvent"}
     * @return the event, or empty if this connection does not publish it
     */
    Optional<GatewayEvent> event(String name);

    Set<String> getEventNames();
}
