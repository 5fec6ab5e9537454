package com.tablesync.realtime;

import com.tablesync.domain.enums.EventKind;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Ready-made subscriptions for the kitchen display screens, tuned for their traffic shape:
 * routing changes arrive in bursts when a ticket is fired, station status rarely matters more
 * than once a second.
 */
@Component
public class KitchenSubscriptions {

    static final String ORDER_ROUTING_TABLE = "kds_order_routing";
    static final String STATIONS_TABLE = "kds_stations";

    static final Duration ROUTING_BATCH_WINDOW = Duration.ofMillis(500);
    static final Duration ROUTING_THROTTLE = Duration.ofMillis(100);
    static final Duration STATION_THROTTLE = Duration.ofSeconds(1);
    static final Duration COMPLETION_BATCH_WINDOW = Duration.ofSeconds(1);

    private final RealtimeService realtimeService;

    public KitchenSubscriptions(RealtimeService realtimeService) {
        this.realtimeService = realtimeService;
    }

    /**
     * Routing changes for one station, or for all stations when {@code stationId} is null.
     * Batched over 500ms and never delivered more than once per 100ms.
     */
    public Unsubscribe subscribeToOrderRouting(String stationId, ChangeListener listener) {
        return realtimeService.subscribe(SubscriptionConfig.builder()
                .table(ORDER_ROUTING_TABLE)
                .predicate(stationId != null ? "station_id=eq." + stationId : null)
                .batchWindow(ROUTING_BATCH_WINDOW)
                .throttle(ROUTING_THROTTLE)
                .listener(listener)
                .build());
    }

    public Unsubscribe subscribeToStations(ChangeListener listener) {
        return realtimeService.subscribe(SubscriptionConfig.builder()
                .table(STATIONS_TABLE)
                .throttle(STATION_THROTTLE)
                .listener(listener)
                .build());
    }

    /** Routing rows that just got a completion time, batched per second. */
    public Unsubscribe subscribeToOrderCompletions(ChangeListener listener) {
        return realtimeService.subscribe(SubscriptionConfig.builder()
                .table(ORDER_ROUTING_TABLE)
                .eventKind(EventKind.UPDATE)
                .predicate("completed_at=not.is.null")
                .batchWindow(COMPLETION_BATCH_WINDOW)
                .listener(listener)
                .build());
    }
}
