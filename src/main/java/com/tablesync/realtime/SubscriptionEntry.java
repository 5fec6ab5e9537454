package com.tablesync.realtime;

import com.tablesync.domain.enums.SubscriptionState;
import com.tablesync.domain.model.ChangeFilter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * One logical subscription: a filter bound on one channel, fanned out to every listener that
 * asked for the same filter. Mutated only under the channel pool's lock.
 */
@Getter
public class SubscriptionEntry {

    private final String id;
    private final ChangeFilter filter;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final Map<String, MessageProcessor> processors = new LinkedHashMap<>();

    @Setter
    private SubscriptionState state = SubscriptionState.ACTIVE;

    /** Channel the filter is bound on, null while unattached or after failure. */
    @Setter
    private String channelName;

    /** When the entry was last attached and its binding not yet confirmed; null otherwise. */
    @Setter
    private Instant awaitingBindingSince;

    SubscriptionEntry(String id, ChangeFilter filter, Instant createdAt) {
        this.id = id;
        this.filter = filter;
        this.createdAt = createdAt;
    }

    public String getTable() {
        return filter.getTable();
    }

    public int listenerCount() {
        return processors.size();
    }

    public boolean isActive() {
        return state == SubscriptionState.ACTIVE;
    }

    /** Snapshot of the processors currently attached, in registration order. */
    public List<MessageProcessor> processors() {
        return new ArrayList<>(processors.values());
    }

    MessageProcessor processor(String listenerId) {
        return processors.get(listenerId);
    }

    void addProcessor(String listenerId, MessageProcessor processor) {
        processors.put(listenerId, processor);
    }

    MessageProcessor removeProcessor(String listenerId) {
        return processors.remove(listenerId);
    }

    List<MessageProcessor> removeAllProcessors() {
        List<MessageProcessor> removed = processors();
        processors.clear();
        return removed;
    }
}
