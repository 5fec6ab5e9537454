package com.tablesync.state;

import com.tablesync.config.RealtimeProperties;
import com.tablesync.domain.enums.EventKind;
import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.realtime.RealtimeService;
import com.tablesync.realtime.SubscriptionConfig;
import com.tablesync.realtime.Unsubscribe;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Feeds change events of the configured sync tables into the {@link OptimisticStateStore} as
 * authoritative values.
 */
@Service
public class EntitySyncService {

    private static final Logger log = LoggerFactory.getLogger(EntitySyncService.class);

    private final RealtimeService realtimeService;
    private final OptimisticStateStore stateStore;
    private final RealtimeProperties properties;

    private final List<Unsubscribe> subscriptions = new ArrayList<>();

    public EntitySyncService(
            RealtimeService realtimeService, OptimisticStateStore stateStore, RealtimeProperties properties) {
        this.realtimeService = realtimeService;
        this.stateStore = stateStore;
        this.properties = properties;
    }

    @PostConstruct
    public synchronized void start() {
        if (!properties.getSync().isEnabled()) {
            log.info("Entity sync disabled");
            return;
        }
        for (String table : properties.getSync().getTables()) {
            subscriptions.add(realtimeService.subscribe(
                    SubscriptionConfig.builder().table(table).listener(this::apply).build()));
        }
        log.info("Entity sync following {}", properties.getSync().getTables());
    }

    @PreDestroy
    public synchronized void stop() {
        subscriptions.forEach(Unsubscribe::unsubscribe);
        subscriptions.clear();
    }

    void apply(ChangeEvent event) {
        Optional<String> id = event.recordId();
        if (id.isEmpty()) {
            log.debug("Skipping {} {} event without id", event.getTable(), event.getKind());
            return;
        }
        EntityKey key = new EntityKey(event.getTable(), id.get());
        if (event.getKind() == EventKind.DELETE) {
            stateStore.applyDeletion(key, event.getCommitTimestamp());
        } else {
            stateStore.applyAuthoritative(key, event.getNewRecord(), event.getCommitTimestamp());
        }
    }
}
