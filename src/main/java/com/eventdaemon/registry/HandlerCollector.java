package com.eventdaemon.registry;

import java.security.CodeSource;

/**
 * Records handlers under a single event name. Applying the collector never wraps the handler:
 * the instance passed in is returned as-is and can still be called directly.
 *
 * <pre>{@code
 * SyncEventHandler onStatus = registry.collect("orderStatusEvent").sync((ib, payload) -> {
 *     log.info("Order status: {}", payload.arg(0));
 * });
 * }</pre>
 */
public final class HandlerCollector {

    private final EventRegistry registry;
    private final String eventName;
    private final String sourcePath;

    HandlerCollector(EventRegistry registry, String eventName, String sourcePath) {
        this.registry = registry;
        this.eventName = eventName;
        this.sourcePath = sourcePath;
    }

    public String getEventName() {
        return eventName;
    }

    public <H extends EventHandler> H apply(H handler) {
        return apply(displayName(handler), handler);
    }

    public <H extends EventHandler> H apply(String name, H handler) {
        registry.record(HandlerRegistration.builder()
                .eventName(eventName)
                .handler(handler)
                .kind(HandlerKind.of(handler))
                .sourcePath(sourcePath != null ? sourcePath : sourceOf(handler))
                .name(name)
                .build());
        return handler;
    }

    public SyncEventHandler sync(SyncEventHandler handler) {
        return apply(handler);
    }

    public AsyncEventHandler async(AsyncEventHandler handler) {
        return apply(handler);
    }

    static String displayName(Object handler) {
        String className = handler.getClass().getName();
        int lambdaMarker = className.indexOf("$$Lambda");
        return lambdaMarker >= 0 ? className.substring(0, lambdaMarker) + "::lambda" : className;
    }

    static String sourceOf(Object handler) {
        CodeSource codeSource = handler.getClass().getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return "<unknown>";
        }
        return codeSource.getLocation().getPath();
    }
}
