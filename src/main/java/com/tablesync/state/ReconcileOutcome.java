package com.tablesync.state;

/** What an authoritative value did to an entity's optimistic patch. */
public enum ReconcileOutcome {
    /** There was no patch to reconcile. */
    NO_PENDING_PATCH,
    /** The event is at least as new as the patch; the patch was dropped in favour of it. */
    SUPERSEDED,
    /** The event predates the patch; the patch keeps overlaying the new committed value. */
    RETAINED
}
