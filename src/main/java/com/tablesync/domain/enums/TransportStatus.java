package com.tablesync.domain.enums;

/**
 * Connection status reported by the change-feed transport for a channel.
 */
public enum TransportStatus {
    CONNECTING,
    ACTIVE,
    ERROR,
    TIMED_OUT,
    CLOSED;

    /** True for statuses that mean the channel is no longer delivering events. */
    public boolean isFailure() {
        return this == ERROR || this == TIMED_OUT || this == CLOSED;
    }
}
