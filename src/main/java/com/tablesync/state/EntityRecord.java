package com.tablesync.state;

import com.tablesync.realtime.RealtimeScheduler.ScheduledTask;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Committed value plus optional optimistic overlay for one entity. Guarded by the owning
 * {@link OptimisticStateStore}.
 */
class EntityRecord {

    Map<String, Object> committed;
    Instant committedAt;

    Map<String, Object> pendingPatch;
    Instant pendingAppliedAt;
    final List<CompletableFuture<Map<String, Object>>> waiters = new ArrayList<>();
    ScheduledTask timeoutTask;

    /** Bumped whenever the pending patch is replaced or cleared; stale timeouts compare against it. */
    long patchGeneration;

    boolean hasPendingPatch() {
        return pendingPatch != null;
    }

    boolean isEmpty() {
        return committed == null && pendingPatch == null;
    }

    /** Merges {@code patch} into the pending overlay. The overlay's time becomes the newest of the two. */
    void overlay(Map<String, Object> patch, Instant appliedAt) {
        if (pendingPatch == null) {
            pendingPatch = new LinkedHashMap<>(patch);
            pendingAppliedAt = appliedAt;
        } else {
            pendingPatch.putAll(patch);
            if (appliedAt.isAfter(pendingAppliedAt)) {
                pendingAppliedAt = appliedAt;
            }
        }
        patchGeneration++;
    }

    /** Drops the overlay and hands back whoever was waiting on it. */
    List<CompletableFuture<Map<String, Object>>> clearPatch() {
        pendingPatch = null;
        pendingAppliedAt = null;
        patchGeneration++;
        if (timeoutTask != null) {
            timeoutTask.cancel();
            timeoutTask = null;
        }
        List<CompletableFuture<Map<String, Object>>> released = new ArrayList<>(waiters);
        waiters.clear();
        return released;
    }

    /** Committed value with the overlay on top, or null if neither exists. */
    Map<String, Object> effective() {
        if (isEmpty()) {
            return null;
        }
        Map<String, Object> merged = committed != null ? new LinkedHashMap<>(committed) : new LinkedHashMap<>();
        if (pendingPatch != null) {
            merged.putAll(pendingPatch);
        }
        return merged;
    }
}
