package com.tablesync.domain.enums;

/**
 * Lifecycle of a pooled channel.
 *
 * <p>Valid transitions:
 * <pre>
 * CONNECTING -> ACTIVE -> ERROR -> CONNECTING (after backoff)
 *                  |         |
 *                  +---------+--> CLOSED (teardown, or reconnect cap exceeded)
 * </pre>
 */
public enum ChannelStatus {

    /** Join requested, waiting for the transport to confirm. */
    CONNECTING,

    /** Joined; events are flowing. */
    ACTIVE,

    /** Join, heartbeat or transport failure. A reconnect is scheduled. */
    ERROR,

    /** Terminal. The channel is no longer part of the pool. */
    CLOSED
}
