package com.eventdaemon.registry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One handler recorded under one event name. Never mutated; discarded when the registry is
 * cleared.
 */
@Value
@Builder
public class HandlerRegistration {

    @NonNull
    String eventName;

    @NonNull
    EventHandler handler;

    @NonNull
    HandlerKind kind;

    /** File the handler was loaded from, or the code source of its class. */
    @NonNull
    String sourcePath;

    /** Display name used in log lines. */
    @NonNull
    String name;
}
