package com.tablesync.support;

import com.tablesync.domain.enums.EventKind;
import com.tablesync.domain.model.ChangeEvent;
import java.time.Instant;
import java.util.Map;

/** Shorthand for building change events in tests. */
public final class Events {

    private Events() {}

    public static ChangeEvent update(String table, Map<String, Object> row) {
        return ChangeEvent.builder().table(table).kind(EventKind.UPDATE).newRecord(row).build();
    }

    public static ChangeEvent update(String table, Map<String, Object> row, Instant committedAt) {
        return ChangeEvent.builder()
                .table(table)
                .kind(EventKind.UPDATE)
                .newRecord(row)
                .commitTimestamp(committedAt)
                .build();
    }

    public static ChangeEvent insert(String table, Map<String, Object> row) {
        return ChangeEvent.builder().table(table).kind(EventKind.INSERT).newRecord(row).build();
    }

    public static ChangeEvent delete(String table, Map<String, Object> oldRow, Instant committedAt) {
        return ChangeEvent.builder()
                .table(table)
                .kind(EventKind.DELETE)
                .oldRecord(oldRow)
                .commitTimestamp(committedAt)
                .build();
    }
}
