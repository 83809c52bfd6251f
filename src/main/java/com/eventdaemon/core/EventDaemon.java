package com.eventdaemon.core;

import com.eventdaemon.registry.EventRegistry;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Top-level run sequence: connect, load and bind handlers, seal the registry, then run the
 * dispatch loop until the connection ends or the daemon is stopped.
 */
@Service
public class EventDaemon {

    private static final Logger log = LoggerFactory.getLogger(EventDaemon.class);

    private final ConnectionManager connectionManager;
    private final EventRegistry eventRegistry;

    public EventDaemon(ConnectionManager connectionManager, EventRegistry eventRegistry) {
        this.connectionManager = connectionManager;
        this.eventRegistry = eventRegistry;
    }

    /**
     * Blocks until the dispatch loop ends.
     *
     * @throws com.eventdaemon.exception.ConnectionFailedException if the gateway is unreachable
     */
    public void run() {
        log.info("Starting event daemon");
        try {
            connectionManager.connect().join();
        } catch (CompletionException e) {
            throw e.getCause() instanceof RuntimeException cause ? cause : e;
        }

        eventRegistry.discoverHandlers();
        eventRegistry.bindTo(connectionManager.getConnection());
        eventRegistry.seal();

        connectionManager.start();
        log.info("Event daemon finished");
    }

    public void stop() {
        connectionManager.stop();
    }
}
