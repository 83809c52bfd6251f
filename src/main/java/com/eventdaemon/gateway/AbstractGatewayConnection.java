package com.eventdaemon.gateway;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event table and single-threaded dispatch loop shared by the gateway connections.
 *
 * <p>Emissions never run on the thread that produced them. I/O callbacks call
 * {@link #post(String, EventPayload)}, which queues the emission; {@link #run()} drains the
 * queue on the caller's thread. All handler code therefore runs on one thread, in arrival
 * order, and a slow synchronous handler delays every later event.
 *
 * <p>Dropping the connection queues {@code disconnectedEvent} followed by a stop marker, so
 * handlers observe the disconnect before {@link #run()} returns.
 */
public abstract class AbstractGatewayConnection implements GatewayConnection {

    private static final Logger log = LoggerFactory.getLogger(AbstractGatewayConnection.class);

    private static final Runnable STOP = () -> {};

    private final Map<String, GatewayEvent> events;
    private final BlockingQueue<Runnable> dispatchQueue = new LinkedBlockingQueue<>();

    private volatile boolean connected;
    private volatile boolean dispatching;

    protected AbstractGatewayConnection(EventDispatcher dispatcher, Collection<String> eventNames) {
        Map<String, GatewayEvent> table = new LinkedHashMap<>();
        for (String name : eventNames) {
            table.put(name, new GatewayEvent(name, dispatcher));
        }
        this.events = Collections.unmodifiableMap(table);
    }

    @Override
    public Optional<GatewayEvent> event(String name) {
        return Optional.ofNullable(events.get(name));
    }

    @Override
    public Set<String> getEventNames() {
        return events.keySet();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public boolean isDispatching() {
        return dispatching;
    }

    /** Number of emissions waiting for the dispatch loop. */
    public int getPendingCount() {
        return (int) dispatchQueue.stream().filter(task -> task != STOP).count();
    }

    @Override
    public void run() {
        dispatching = true;
        log.info("Dispatch loop started ({} pending)", getPendingCount());
        try {
            while (true) {
                Runnable task = dispatchQueue.take();
                if (task == STOP) {
                    break;
                }
                task.run();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch loop interrupted");
        } finally {
            dispatching = false;
            log.info("Dispatch loop stopped");
        }
    }

    /**
     * Queues an emission of {@code eventName} for the dispatch loop. Names this connection does
     * not publish are dropped.
     */
    public void post(String eventName, EventPayload payload) {
        GatewayEvent event = events.get(eventName);
        if (event == null) {
            log.debug("Dropping emission for unknown event {}", eventName);
            return;
        }
        dispatchQueue.add(() -> event.emit(payload));
    }

    /** Marks the session up and queues {@code connectedEvent}. */
    protected void markConnected() {
        // A stop marker left over from an earlier session must not end the next loop
        dispatchQueue.removeIf(task -> task == STOP);
        connected = true;
        post(GatewayEventNames.CONNECTED, EventPayload.empty());
    }

    /** Marks the session down, queues {@code disconnectedEvent} and ends the dispatch loop. */
    protected void markDisconnected() {
        boolean wasConnected = connected;
        connected = false;
        if (wasConnected) {
            post(GatewayEventNames.DISCONNECTED, EventPayload.empty());
        }
        dispatchQueue.add(STOP);
    }
}
