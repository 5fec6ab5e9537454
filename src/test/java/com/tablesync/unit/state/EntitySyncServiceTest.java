package com.tablesync.unit.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tablesync.config.RealtimeProperties;
import com.tablesync.realtime.RealtimeService;
import com.tablesync.realtime.SubscriptionConfig;
import com.tablesync.realtime.Unsubscribe;
import com.tablesync.state.EntityKey;
import com.tablesync.state.EntitySyncService;
import com.tablesync.state.OptimisticStateStore;
import com.tablesync.support.Events;
import com.tablesync.support.ManualScheduler;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for {@link EntitySyncService}.
 */
class EntitySyncServiceTest {

    private RealtimeService realtimeService;
    private Unsubscribe unsubscribe;
    private ManualScheduler scheduler;
    private OptimisticStateStore store;
    private RealtimeProperties properties;
    private EntitySyncService entitySyncService;

    @BeforeEach
    void setUp() {
        realtimeService = mock(RealtimeService.class);
        unsubscribe = mock(Unsubscribe.class);
        when(realtimeService.subscribe(any())).thenReturn(unsubscribe);
        scheduler = new ManualScheduler();
        properties = new RealtimeProperties();
        properties.getSync().setTables(List.of("orders"));
        store = new OptimisticStateStore(scheduler, properties);
        entitySyncService = new EntitySyncService(realtimeService, store, properties);
    }

    private SubscriptionConfig startAndCapture() {
        entitySyncService.start();
        ArgumentCaptor<SubscriptionConfig> captor = ArgumentCaptor.forClass(SubscriptionConfig.class);
        verify(realtimeService).subscribe(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Updates from the feed become committed values")
    void updatesCommit() {
        SubscriptionConfig config = startAndCapture();

        config.getListener().onChange(Events.update("orders", Map.of("id", 7, "status", "ready"), scheduler.now()));

        assertThat(config.getTable()).isEqualTo("orders");
        assertThat(store.read(EntityKey.of("orders", 7)).orElseThrow()).containsEntry("status", "ready");
    }

    @Test
    @DisplayName("Deletes from the feed remove the entity")
    void deletesRemove() {
        SubscriptionConfig config = startAndCapture();
        config.getListener().onChange(Events.update("orders", Map.of("id", "o1"), scheduler.now()));

        config.getListener().onChange(Events.delete("orders", Map.of("id", "o1"), scheduler.now()));

        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Feed events confirm optimistic patches")
    void confirmsPatches() {
        SubscriptionConfig config = startAndCapture();
        CompletableFuture<Map<String, Object>> confirmation =
                store.applyOptimistic(new EntityKey("orders", "o1"), Map.of("status", "preparing"));
        scheduler.advanceMillis(20);

        config.getListener().onChange(
                Events.update("orders", Map.of("id", "o1", "status", "preparing"), scheduler.now()));

        assertThat(confirmation).isCompleted();
    }

    @Test
    @DisplayName("Events without an id are skipped")
    void skipsEventsWithoutId() {
        SubscriptionConfig config = startAndCapture();

        config.getListener().onChange(Events.update("orders", Map.of("status", "ready"), scheduler.now()));

        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Stop unsubscribes every table")
    void stopUnsubscribes() {
        entitySyncService.start();
        entitySyncService.stop();

        verify(unsubscribe, times(1)).unsubscribe();
    }

    @Test
    @DisplayName("Nothing is subscribed when sync is disabled")
    void disabled() {
        properties.getSync().setEnabled(false);

        entitySyncService.start();

        verify(realtimeService, never()).subscribe(any());
    }
}
