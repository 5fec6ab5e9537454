package com.tablesync.exception;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * An optimistic patch was not confirmed by an authoritative event within the timeout and has been
 * rolled back. Recoverable: the caller may retry the write or show the reverted value.
 */
@Getter
public class StaleOptimisticPatchException extends BaseException {

    private final String table;
    private final String entityId;
    private final Instant appliedAt;

    public StaleOptimisticPatchException(String table, String entityId, Instant appliedAt, Duration timeout) {
        super(
                ErrorCode.STALE_OPTIMISTIC_PATCH,
                "Optimistic update to " + table + "/" + entityId + " was not confirmed within "
                        + timeout.toMillis() + "ms and has been rolled back",
                Map.of("table", table, "entityId", entityId, "appliedAt", appliedAt.toString()));
        this.table = table;
        this.entityId = entityId;
        this.appliedAt = appliedAt;
    }
}
