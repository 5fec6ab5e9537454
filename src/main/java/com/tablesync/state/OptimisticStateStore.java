package com.tablesync.state;

import com.tablesync.config.RealtimeProperties;
import com.tablesync.exception.StaleOptimisticPatchException;
import com.tablesync.realtime.RealtimeScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Local view of entities that lets a write show up immediately and reconciles it with the
 * change feed afterwards.
 *
 * <p>Each entity has a committed value (last authoritative state) and at most one pending
 * optimistic patch, which reads overlay on top of it. An authoritative event whose commit time is
 * at or after the patch's applied time supersedes the patch, whether or not the values agree. An
 * older event updates the committed value but leaves the patch in place, so a late echo of an
 * earlier write cannot flicker the UI backwards. A patch that sees no superseding event within
 * the timeout is rolled back.
 *
 * <p>Thread-safe. Futures are completed outside the store's lock.
 */
@Service
public class OptimisticStateStore {

    private static final Logger log = LoggerFactory.getLogger(OptimisticStateStore.class);

    private final RealtimeScheduler realtimeScheduler;
    private final Duration patchTimeout;

    private final Map<EntityKey, EntityRecord> records = new HashMap<>();

    public OptimisticStateStore(RealtimeScheduler realtimeScheduler, RealtimeProperties properties) {
        this.realtimeScheduler = realtimeScheduler;
        this.patchTimeout = properties.getOptimisticPatchTimeout();
    }

    /**
     * Applies {@code patch} on top of the entity now. The returned future completes with the
     * authoritative value once an event at least as new as the patch arrives, completes
     * exceptionally with {@link StaleOptimisticPatchException} if none arrives in time, and is
     * cancelled by {@link #revert(EntityKey)}.
     */
    public CompletableFuture<Map<String, Object>> applyOptimistic(EntityKey key, Map<String, Object> patch) {
        return applyOptimistic(key, patch, realtimeScheduler.now());
    }

    public CompletableFuture<Map<String, Object>> applyOptimistic(
            EntityKey key, Map<String, Object> patch, Instant appliedAt) {
        CompletableFuture<Map<String, Object>> confirmation = new CompletableFuture<>();
        synchronized (this) {
            EntityRecord record = records.computeIfAbsent(key, k -> new EntityRecord());
            record.overlay(patch, appliedAt);
            record.waiters.add(confirmation);
            if (record.timeoutTask != null) {
                record.timeoutTask.cancel();
            }
            long generation = record.patchGeneration;
            record.timeoutTask = realtimeScheduler.schedule(() -> expire(key, generation), patchTimeout);
        }
        log.debug("Optimistic patch on {}/{}: {}", key.getTable(), key.getId(), patch.keySet());
        return confirmation;
    }

    /** Records an authoritative value from the change feed (or a refetch) and reconciles any patch. */
    public ReconcileOutcome applyAuthoritative(EntityKey key, Map<String, Object> value, Instant eventTimestamp) {
        Instant at = eventTimestamp != null ? eventTimestamp : realtimeScheduler.now();
        List<CompletableFuture<Map<String, Object>>> confirmed;
        Map<String, Object> effective;
        ReconcileOutcome outcome;
        synchronized (this) {
            EntityRecord record = records.computeIfAbsent(key, k -> new EntityRecord());
            record.committed = new LinkedHashMap<>(value);
            record.committedAt = at;

            if (!record.hasPendingPatch()) {
                return ReconcileOutcome.NO_PENDING_PATCH;
            }
            if (at.isBefore(record.pendingAppliedAt)) {
                log.debug("Event for {}/{} at {} predates optimistic patch at {}; keeping patch",
                        key.getTable(), key.getId(), at, record.pendingAppliedAt);
                return ReconcileOutcome.RETAINED;
            }
            confirmed = record.clearPatch();
            effective = unmodifiable(record.effective());
            outcome = ReconcileOutcome.SUPERSEDED;
        }
        confirmed.forEach(future -> future.complete(effective));
        return outcome;
    }

    /**
     * Records a deletion. A patch newer than the deletion survives (the row reads as the patch
     * alone); otherwise the entity is gone and its waiters complete with an empty map.
     */
    public ReconcileOutcome applyDeletion(EntityKey key, Instant eventTimestamp) {
        Instant at = eventTimestamp != null ? eventTimestamp : realtimeScheduler.now();
        List<CompletableFuture<Map<String, Object>>> confirmed;
        synchronized (this) {
            EntityRecord record = records.get(key);
            if (record == null) {
                return ReconcileOutcome.NO_PENDING_PATCH;
            }
            record.committed = null;
            record.committedAt = at;
            if (record.hasPendingPatch() && at.isBefore(record.pendingAppliedAt)) {
                return ReconcileOutcome.RETAINED;
            }
            boolean hadPatch = record.hasPendingPatch();
            confirmed = record.clearPatch();
            records.remove(key);
            if (!hadPatch) {
                return ReconcileOutcome.NO_PENDING_PATCH;
            }
        }
        confirmed.forEach(future -> future.complete(Map.of()));
        return ReconcileOutcome.SUPERSEDED;
    }

    /** Effective value: committed with any pending patch on top. Empty if the entity is unknown. */
    public synchronized Optional<Map<String, Object>> read(EntityKey key) {
        EntityRecord record = records.get(key);
        return record == null ? Optional.empty() : Optional.ofNullable(unmodifiable(record.effective()));
    }

    /** Effective values of every known entity of {@code table}, keyed by id. */
    public synchronized Map<String, Map<String, Object>> readAll(String table) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        records.forEach((key, record) -> {
            if (key.getTable().equals(table)) {
                Map<String, Object> value = record.effective();
                if (value != null) {
                    result.put(key.getId(), Collections.unmodifiableMap(value));
                }
            }
        });
        return result;
    }

    public synchronized boolean hasPendingPatch(EntityKey key) {
        EntityRecord record = records.get(key);
        return record != null && record.hasPendingPatch();
    }

    /**
     * Drops the pending patch without waiting for the server, e.g. after the write request itself
     * failed. Waiting futures are cancelled.
     *
     * @return true if there was a patch to drop
     */
    public boolean revert(EntityKey key) {
        List<CompletableFuture<Map<String, Object>>> cancelled;
        synchronized (this) {
            EntityRecord record = records.get(key);
            if (record == null || !record.hasPendingPatch()) {
                return false;
            }
            cancelled = record.clearPatch();
            if (record.isEmpty()) {
                records.remove(key);
            }
        }
        log.info("Reverted optimistic patch on {}/{}", key.getTable(), key.getId());
        cancelled.forEach(future -> future.cancel(false));
        return true;
    }

    /**
     * Replaces the committed state of a whole table with a fresh fetch taken at
     * {@code snapshotTime}. Rows are reconciled as authoritative values; known rows absent from the
     * snapshot are treated as deleted at that time.
     *
     * @param rows rows of the table, each carrying an {@code id} column
     */
    public void applySnapshot(String table, Collection<Map<String, Object>> rows, Instant snapshotTime) {
        Set<EntityKey> seen = new HashSet<>();
        for (Map<String, Object> row : rows) {
            Object id = row.get("id");
            if (id == null) {
                log.warn("Snapshot row of {} without id ignored", table);
                continue;
            }
            EntityKey key = EntityKey.of(table, id);
            seen.add(key);
            applyAuthoritative(key, row, snapshotTime);
        }

        List<EntityKey> missing = new ArrayList<>();
        synchronized (this) {
            for (EntityKey key : records.keySet()) {
                if (key.getTable().equals(table) && !seen.contains(key)) {
                    missing.add(key);
                }
            }
        }
        missing.forEach(key -> applyDeletion(key, snapshotTime));
        log.info("Applied snapshot of {}: {} rows, {} removed", table, seen.size(), missing.size());
    }

    public synchronized int size() {
        return records.size();
    }

    private void expire(EntityKey key, long generation) {
        List<CompletableFuture<Map<String, Object>>> expired;
        Instant appliedAt;
        synchronized (this) {
            EntityRecord record = records.get(key);
            if (record == null || record.patchGeneration != generation || !record.hasPendingPatch()) {
                return;
            }
            appliedAt = record.pendingAppliedAt;
            record.timeoutTask = null;
            expired = record.clearPatch();
            if (record.isEmpty()) {
                records.remove(key);
            }
        }
        log.warn("Optimistic patch on {}/{} applied at {} not confirmed within {}ms; rolled back",
                key.getTable(), key.getId(), appliedAt, patchTimeout.toMillis());
        StaleOptimisticPatchException failure =
                new StaleOptimisticPatchException(key.getTable(), key.getId(), appliedAt, patchTimeout);
        expired.forEach(future -> future.completeExceptionally(failure));
    }

    private static Map<String, Object> unmodifiable(Map<String, Object> value) {
        return value != null ? Collections.unmodifiableMap(value) : null;
    }
}
