package com.eventdaemon.recovery;

import com.eventdaemon.bridge.EventBridge;
import com.eventdaemon.core.ConnectionManager;
import com.eventdaemon.loader.HandlerLoader;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Stops the daemon when the application context closes (SIGINT/SIGTERM).
 *
 * <p>Runs in a high phase so it stops before other components. The shutdown sequence:
 * <ol>
 *   <li>Stop the connection manager, which disconnects and ends the dispatch loop</li>
 *   <li>Remove the event bridge from the dispatcher</li>
 *   <li>Release handler class loaders</li>
 * </ol>
 *
 * <p>Async handlers still in flight are not cancelled.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final ConnectionManager connectionManager;
    private final EventBridge eventBridge;
    private final HandlerLoader handlerLoader;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            ConnectionManager connectionManager, EventBridge eventBridge, HandlerLoader handlerLoader) {
        this.connectionManager = connectionManager;
        this.eventBridge = eventBridge;
        this.handlerLoader = handlerLoader;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            stopConnection();
            unpatchBridge();
            releaseHandlers();
            log.info("Graceful shutdown completed successfully");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void stopConnection() {
        connectionManager.stop();
    }

    void unpatchBridge() {
        if (eventBridge.isPatched()) {
            eventBridge.unpatch();
        }
    }

    void releaseHandlers() {
        try {
            handlerLoader.close();
            log.info("Handler class loaders released");
        } catch (RuntimeException e) {
            log.warn("Failed to release handler class loaders", e);
        }
    }
}
