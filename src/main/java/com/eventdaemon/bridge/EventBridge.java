package com.eventdaemon.bridge;

import com.eventdaemon.gateway.EventDispatcher;
import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.EventSink;
import com.eventdaemon.gateway.GatewayEvent;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors every gateway event emission onto the {@link SignalChannel} named after the event.
 *
 * <p>{@link #patch()} registers the bridge as a mirror sink on the {@link EventDispatcher};
 * {@link #unpatch()} removes it. Mirroring happens after the event's own subscribers have run,
 * with the same payload. Receiver failures are logged and counted; they never reach the
 * emitter.
 */
@Component
public class EventBridge implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(EventBridge.class);

    private final EventDispatcher eventDispatcher;
    private final SignalRegistry signalRegistry;

    private final AtomicBoolean patched = new AtomicBoolean(false);
    private final AtomicLong failureCount = new AtomicLong();

    public EventBridge(EventDispatcher eventDispatcher, SignalRegistry signalRegistry) {
        this.eventDispatcher = eventDispatcher;
        this.signalRegistry = signalRegistry;
    }

    public void patch() {
        if (!patched.compareAndSet(false, true)) {
            log.warn("EventBridge is already patched");
            return;
        }
        eventDispatcher.addSink(this);
        log.info("EventBridge patch applied");
    }

    public void unpatch() {
        if (!patched.compareAndSet(true, false)) {
            log.warn("EventBridge is not patched");
            return;
        }
        eventDispatcher.removeSink(this);
        log.info("EventBridge patch removed");
    }

    public boolean isPatched() {
        return patched.get();
    }

    /** Returns the channel for {@code eventName}, creating it if absent. */
    public SignalChannel getSignal(String eventName) {
        return signalRegistry.signal(eventName);
    }

    @Override
    public void onEmit(GatewayEvent event, EventPayload payload) {
        try {
            signalRegistry.signal(event.getName()).send(event, payload);
        } catch (Exception e) {
            failureCount.incrementAndGet();
            log.error("Error in signal bridge for event {}: {}", event.getName(), e.getMessage(), e);
        }
    }

    /** Receiver failures caught since startup. */
    public long getFailureCount() {
        return failureCount.get();
    }

    @Override
    public String toString() {
        return "EventBridge";
    }
}
