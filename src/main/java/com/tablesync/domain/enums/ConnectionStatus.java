package com.tablesync.domain.enums;

/**
 * Aggregate status of the whole channel pool, as shown on health dashboards.
 */
public enum ConnectionStatus {

    /** Every channel in the pool is ACTIVE. */
    CONNECTED,

    /** Some channels are ACTIVE, others are connecting or failed. */
    DEGRADED,

    /** No channel is ACTIVE but at least one is connecting or waiting to reconnect. */
    RECONNECTING,

    /** The pool is empty or every channel is closed. */
    DISCONNECTED
}
