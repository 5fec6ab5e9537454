package com.tablesync.realtime;

import com.tablesync.domain.enums.EventKind;
import com.tablesync.domain.model.ChangeFilter;
import com.tablesync.exception.InvalidSubscriptionException;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A request for change events, validated when built.
 *
 * <p>Required: {@code table} and {@code listener}. Optional knobs:
 * <ul>
 *   <li>{@code predicate} -- explicit server-side filter; when absent the caller's role filter
 *       (if any) applies</li>
 *   <li>{@code throttle} -- at most one delivery per window, last value wins</li>
 *   <li>{@code batchWindow} -- buffer events and deliver them together; fixed window from the first
 *       buffered event, or a quiet period restarted by every event when {@code quietPeriodBatch}</li>
 * </ul>
 */
@Value
public class SubscriptionConfig {

    String table;
    String schema;
    EventKind eventKind;

    @With
    String predicate;

    ChangeListener listener;
    Duration throttle;
    Duration batchWindow;
    boolean quietPeriodBatch;

    /** When false the role filter is never applied, even if no explicit predicate is given. */
    boolean roleFiltered;

    @Builder(toBuilder = true)
    private SubscriptionConfig(
            String table,
            String schema,
            EventKind eventKind,
            String predicate,
            ChangeListener listener,
            Duration throttle,
            Duration batchWindow,
            boolean quietPeriodBatch,
            Boolean roleFiltered) {
        if (table == null || table.isBlank()) {
            throw new InvalidSubscriptionException("Subscription requires a table");
        }
        if (listener == null) {
            throw new InvalidSubscriptionException("Subscription to " + table + " requires a listener");
        }
        requirePositive(throttle, "throttle", table);
        requirePositive(batchWindow, "batchWindow", table);
        if (quietPeriodBatch && batchWindow == null) {
            throw new InvalidSubscriptionException("quietPeriodBatch on " + table + " requires a batchWindow");
        }

        this.table = table;
        this.schema = schema != null ? schema : "public";
        this.eventKind = eventKind != null ? eventKind : EventKind.ANY;
        this.predicate = predicate == null || predicate.isBlank() ? null : predicate;
        this.listener = listener;
        this.throttle = throttle;
        this.batchWindow = batchWindow;
        this.quietPeriodBatch = quietPeriodBatch;
        this.roleFiltered = roleFiltered == null || roleFiltered;
    }

    public boolean isThrottled() {
        return throttle != null;
    }

    public boolean isBatched() {
        return batchWindow != null;
    }

    /** The transport-facing part of this config. */
    public ChangeFilter toFilter() {
        return ChangeFilter.builder()
                .table(table)
                .schema(schema)
                .eventKind(eventKind)
                .predicate(predicate)
                .build();
    }

    private static void requirePositive(Duration window, String name, String table) {
        if (window != null && (window.isZero() || window.isNegative())) {
            throw new InvalidSubscriptionException(name + " on " + table + " must be positive, was " + window);
        }
    }
}
