package com.eventdaemon.gateway;

/**
 * Selects the {@link GatewayConnection} implementation wired at startup.
 */
public enum GatewayMode {

    /** Live Kite Connect WebSocket ticker. */
    LIVE,

    /** In-process simulated gateway (paper mode, demos, tests). */
    SIMULATED
}
