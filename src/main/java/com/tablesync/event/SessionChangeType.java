package com.tablesync.event;

/**
 * Kinds of session change relevant to real-time subscriptions.
 */
public enum SessionChangeType {
    /** A session appeared where there was none. Queued subscriptions activate. */
    SIGNED_IN,
    /** The session went away. Active subscriptions are torn down and queued again. */
    SIGNED_OUT,
    /** Identity or role changed. Role filters are recomputed and subscriptions recreated. */
    SCOPE_CHANGED,
    /** Same identity and role (e.g. token refresh). Nothing to do. */
    REFRESHED
}
