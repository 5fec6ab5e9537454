package com.tablesync.domain.model;

import com.tablesync.domain.enums.EventKind;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * A single row-level change delivered by the change feed.
 *
 * <p>For INSERT and UPDATE, {@code newRecord} holds the row after the change. For DELETE,
 * {@code oldRecord} holds at least the primary key of the removed row. {@code commitTimestamp}
 * is the backend's commit time and is what optimistic reconciliation compares against.
 */
@Value
@Builder
public class ChangeEvent {

    String table;

    @Builder.Default
    String schema = "public";

    EventKind kind;

    @Builder.Default
    Map<String, Object> newRecord = Map.of();

    @Builder.Default
    Map<String, Object> oldRecord = Map.of();

    Instant commitTimestamp;

    /**
     * Returns the row's {@code id} column, taken from the new record first and the old record
     * otherwise (DELETE events only carry the old one).
     */
    public Optional<String> recordId() {
        Object id = newRecord != null ? newRecord.get("id") : null;
        if (id == null && oldRecord != null) {
            id = oldRecord.get("id");
        }
        return Optional.ofNullable(id).map(String::valueOf);
    }
}
