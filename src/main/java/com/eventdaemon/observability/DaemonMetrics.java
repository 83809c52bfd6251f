package com.eventdaemon.observability;

import com.eventdaemon.bridge.EventBridge;
import com.eventdaemon.core.ConnectionManager;
import com.eventdaemon.core.ConnectionState;
import com.eventdaemon.event.ConnectionAttemptEvent;
import com.eventdaemon.event.ConnectionStateEvent;
import com.eventdaemon.event.HandlerBindingEvent;
import com.eventdaemon.event.HandlerDiscoveryEvent;
import com.eventdaemon.registry.EventRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the daemon:
 * <ul>
 *   <li><b>daemon.handlers.loaded</b> (counter, outcome=success|failure): handler files per discovery pass</li>
 *   <li><b>daemon.handlers.bound</b> (counter, outcome=success|failure): subscriptions and setup hooks</li>
 *   <li><b>daemon.connection.attempts</b> (counter, outcome=success|failure)</li>
 *   <li><b>daemon.connection.transitions</b> (counter, state): connection state changes</li>
 *   <li><b>daemon.bridge.failures</b> (function counter): signal receiver failures</li>
 *   <li><b>daemon.registrations</b> (gauge): current handler registrations</li>
 *   <li><b>daemon.connection.state</b> (gauge 0/1): whether the gateway is connected</li>
 * </ul>
 *
 * <p>Gauges are read on scrape. Counters are driven by application events.
 */
@Service
public class DaemonMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter filesLoaded;
    private final Counter filesFailed;
    private final Counter handlersBound;
    private final Counter handlersFailed;
    private final Counter attemptsSucceeded;
    private final Counter attemptsFailed;

    public DaemonMetrics(
            MeterRegistry meterRegistry,
            EventRegistry eventRegistry,
            ConnectionManager connectionManager,
            EventBridge eventBridge) {
        this.meterRegistry = meterRegistry;

        this.filesLoaded = outcomeCounter("daemon.handlers.loaded", "Handler files loaded", "success");
        this.filesFailed = outcomeCounter("daemon.handlers.loaded", "Handler files loaded", "failure");
        this.handlersBound = outcomeCounter("daemon.handlers.bound", "Handlers bound to the connection", "success");
        this.handlersFailed = outcomeCounter("daemon.handlers.bound", "Handlers bound to the connection", "failure");
        this.attemptsSucceeded = outcomeCounter("daemon.connection.attempts", "Gateway connection attempts", "success");
        this.attemptsFailed = outcomeCounter("daemon.connection.attempts", "Gateway connection attempts", "failure");

        FunctionCounter.builder("daemon.bridge.failures", eventBridge, EventBridge::getFailureCount)
                .description("Signal receiver failures caught by the event bridge")
                .register(meterRegistry);

        meterRegistry.gauge("daemon.registrations", eventRegistry, EventRegistry::getRegistrationCount);
        meterRegistry.gauge(
                "daemon.connection.state",
                connectionManager,
                manager -> manager.getState() == ConnectionState.CONNECTED ? 1.0 : 0.0);
    }

    private Counter outcomeCounter(String name, String description, String outcome) {
        return Counter.builder(name)
                .description(description)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onHandlerDiscovery(HandlerDiscoveryEvent event) {
        filesLoaded.increment(event.getLoadedFiles());
        filesFailed.increment(event.getFailedFiles());
    }

    @EventListener
    @Order(20)
    public void onHandlerBinding(HandlerBindingEvent event) {
        handlersBound.increment(event.getBound());
        handlersFailed.increment(event.getFailed());
    }

    @EventListener
    @Order(20)
    public void onConnectionAttempt(ConnectionAttemptEvent event) {
        if (event.isSucceeded()) {
            attemptsSucceeded.increment();
        } else {
            attemptsFailed.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onConnectionState(ConnectionStateEvent event) {
        Counter.builder("daemon.connection.transitions")
                .description("Gateway connection state transitions")
                .tag("state", event.getNewState().name())
                .register(meterRegistry)
                .increment();
    }

    // Expose for testing
    Counter getFilesLoaded() {
        return filesLoaded;
    }

    Counter getFilesFailed() {
        return filesFailed;
    }

    Counter getAttemptsFailed() {
        return attemptsFailed;
    }
}
