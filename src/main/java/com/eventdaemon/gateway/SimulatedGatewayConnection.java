package com.eventdaemon.gateway;

import com.eventdaemon.exception.GatewayException;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process gateway used for paper mode, demos and tests. Publishes the standard gateway
 * events; {@link #publish(String, Object...)} injects an emission as if it had arrived from
 * the wire.
 *
 * <p>{@link #failNextConnects(int)} makes the next connection attempts fail so that retry
 * behavior can be exercised without a real gateway.
 */
public class SimulatedGatewayConnection extends AbstractGatewayConnection {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGatewayConnection.class);

    private final AtomicInteger refusalsRemaining = new AtomicInteger();
    private final AtomicInteger connectCalls = new AtomicInteger();

    private volatile ConnectionConfig config;

    public SimulatedGatewayConnection(EventDispatcher dispatcher) {
        this(dispatcher, GatewayEventNames.STANDARD);
    }

    public SimulatedGatewayConnection(EventDispatcher dispatcher, Collection<String> eventNames) {
        super(dispatcher, eventNames);
    }

    @Override
    public CompletableFuture<Void> connect(ConnectionConfig config) {
        connectCalls.incrementAndGet();
        if (refusalsRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            return CompletableFuture.failedFuture(new GatewayException(
                    "Simulated gateway refused connection to " + config.getHost() + ":" + config.getPort()));
        }

        this.config = config;
        markConnected();
        log.info(
                "Simulated gateway session opened (clientId={}, readonly={}, account='{}')",
                config.getClientId(),
                config.isReadonly(),
                config.getAccount());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        markDisconnected();
        log.info("Simulated gateway session closed");
        return CompletableFuture.completedFuture(null);
    }

    public void publish(String eventName, Object... args) {
        publish(eventName, EventPayload.of(args));
    }

    public void publish(String eventName, EventPayload payload) {
        post(eventName, payload);
    }

    /** Simulates the gateway dropping the session. */
    public void dropConnection() {
        log.warn("Simulated gateway dropped the session");
        markDisconnected();
    }

    public void failNextConnects(int count) {
        refusalsRemaining.set(count);
    }

    public int getConnectCalls() {
        return connectCalls.get();
    }

    /** Parameters of the last successful connection, or {@code null} before the first one. */
    public ConnectionConfig getConfig() {
        return config;
    }
}
