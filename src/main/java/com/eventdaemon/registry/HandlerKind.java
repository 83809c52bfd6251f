package com.eventdaemon.registry;

public enum HandlerKind {
    SYNC,
    ASYNC;

    /**
     * Classifies a handler by the interface it implements.
     *
     * @throws IllegalArgumentException if the handler is neither a {@link SyncEventHandler}
     *     nor an {@link AsyncEventHandler}
     */
    public static HandlerKind of(EventHandler handler) {
        if (handler instanceof SyncEventHandler) {
            return SYNC;
        }
        if (handler instanceof AsyncEventHandler) {
            return ASYNC;
        }
        throw new IllegalArgumentException("Handler " + handler.getClass().getName()
                + " must implement SyncEventHandler or AsyncEventHandler");
    }
}
