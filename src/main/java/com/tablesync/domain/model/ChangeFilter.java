package com.tablesync.domain.model;

import com.tablesync.domain.enums.EventKind;
import lombok.Builder;
import lombok.Value;

/**
 * What a channel binding asks the transport for: one table, one event kind and an optional
 * server-side predicate in PostgREST filter syntax (e.g. {@code server_id=eq.42}).
 */
@Value
@Builder
public class ChangeFilter {

    String table;

    @Builder.Default
    String schema = "public";

    @Builder.Default
    EventKind eventKind = EventKind.ANY;

    /** Null when the binding is unfiltered. */
    String predicate;

    /**
     * Derived identity used to de-duplicate registrations. Two filters with the same table,
     * kind and predicate share one binding.
     */
    public String identityKey() {
        return schema + "." + table + "|" + eventKind.getWireValue() + "|" + (predicate != null ? predicate : "");
    }
}
