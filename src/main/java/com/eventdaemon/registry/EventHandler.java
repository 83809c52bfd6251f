package com.eventdaemon.registry;

/**
 * Common supertype of the two handler shapes. A registered handler is one of
 * {@link SyncEventHandler} or {@link AsyncEventHandler}; the registry records which one at
 * registration time as a {@link HandlerKind}.
 */
public interface EventHandler {}
