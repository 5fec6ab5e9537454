package com.tablesync.domain.enums;

/**
 * State of a registered subscription entry.
 */
public enum SubscriptionState {

    /** Attached to a channel (which may itself be reconnecting). */
    ACTIVE,

    /** Its channel exceeded the reconnect cap. Owners have been notified; no more events arrive. */
    FAILED,

    /** Unregistered. */
    REMOVED
}
