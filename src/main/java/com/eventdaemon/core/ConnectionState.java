package com.eventdaemon.core;

/**
 * Connection lifecycle of the daemon.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED
 *      ^              |              |
 *      +--------------+--------------+
 * </pre>
 *
 * <p>CONNECTING covers every attempt allowed by the retry policy, including the waits between
 * them. Exhausting the attempts or losing an established session returns to DISCONNECTED.
 */
public enum ConnectionState {

    /** No session and no attempt in progress. */
    DISCONNECTED,

    /** An attempt, or a wait between attempts, is in progress. */
    CONNECTING,

    /** The gateway reported the session up. */
    CONNECTED
}
