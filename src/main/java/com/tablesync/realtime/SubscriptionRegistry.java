package com.tablesync.realtime;

import com.tablesync.domain.enums.SubscriptionState;
import com.tablesync.domain.model.ChangeFilter;
import com.tablesync.observability.ConnectionMetricsRecorder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Book-keeping of logical subscriptions and the listeners fanned out from them.
 *
 * <p>Identical registrations (same schema, table, event kind and predicate) share one entry and
 * therefore one channel binding; each caller still gets its own listener slot and
 * {@link MessageProcessor}. An entry lives until its last listener is removed.
 *
 * <p>Not thread-safe on its own. Every call happens under {@link ChannelPoolManager}'s lock,
 * which keeps the registry and the channel attachments consistent with each other.
 */
@Component
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final RealtimeScheduler realtimeScheduler;
    private final ConnectionMetricsRecorder metricsRecorder;

    private final Map<String, SubscriptionEntry> entries = new LinkedHashMap<>();
    private final Map<String, String> activeIdsByIdentity = new HashMap<>();
    private final AtomicLong subscriptionSequence = new AtomicLong();
    private final AtomicLong listenerSequence = new AtomicLong();

    public SubscriptionRegistry(RealtimeScheduler realtimeScheduler, ConnectionMetricsRecorder metricsRecorder) {
        this.realtimeScheduler = realtimeScheduler;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Registers a listener for {@code config}. Returns the existing subscription id when an
     * identical active subscription is already registered.
     */
    public Registration register(SubscriptionConfig config) {
        ChangeFilter filter = config.toFilter();
        String identity = filter.identityKey();

        SubscriptionEntry entry;
        boolean created;
        String existingId = activeIdsByIdentity.get(identity);
        if (existingId != null) {
            entry = entries.get(existingId);
            created = false;
            log.warn("Duplicate subscription to {} ({}); sharing existing subscription {}",
                    filter.getTable(), identity, existingId);
        } else {
            String id = "sub-" + subscriptionSequence.incrementAndGet();
            entry = new SubscriptionEntry(id, filter, realtimeScheduler.now());
            entries.put(id, entry);
            activeIdsByIdentity.put(identity, id);
            created = true;
            log.debug("Registered subscription {} for {}", id, identity);
        }

        String listenerId = entry.getId() + "/" + listenerSequence.incrementAndGet();
        entry.addProcessor(listenerId, new MessageProcessor(entry.getId(), config, realtimeScheduler, metricsRecorder));
        return new Registration(entry.getId(), listenerId, created);
    }

    /**
     * Removes one listener. When it was the last one the whole entry goes with it.
     * The returned processors are not yet closed; the caller closes them outside its lock.
     */
    public Optional<Removal> removeListener(String subscriptionId, String listenerId) {
        SubscriptionEntry entry = entries.get(subscriptionId);
        if (entry == null) {
            return Optional.empty();
        }
        MessageProcessor processor = entry.removeProcessor(listenerId);
        if (processor == null) {
            return Optional.empty();
        }
        boolean entryRemoved = entry.listenerCount() == 0;
        if (entryRemoved) {
            removeEntry(entry);
        }
        return Optional.of(new Removal(entry, List.of(processor), entryRemoved));
    }

    /** Removes the subscription and all of its listeners. Unknown ids yield empty. */
    public Optional<Removal> unregister(String subscriptionId) {
        SubscriptionEntry entry = entries.get(subscriptionId);
        if (entry == null) {
            return Optional.empty();
        }
        removeEntry(entry);
        return Optional.of(new Removal(entry, entry.removeAllProcessors(), true));
    }

    /**
     * Marks the subscription failed: it stays registered (so its owner can still unsubscribe)
     * but no longer de-duplicates new registrations.
     */
    public void markFailed(String subscriptionId) {
        SubscriptionEntry entry = entries.get(subscriptionId);
        if (entry == null) {
            return;
        }
        entry.setState(SubscriptionState.FAILED);
        entry.setChannelName(null);
        activeIdsByIdentity.remove(entry.getFilter().identityKey(), subscriptionId);
    }

    public Optional<SubscriptionEntry> get(String subscriptionId) {
        return Optional.ofNullable(entries.get(subscriptionId));
    }

    public List<SubscriptionEntry> listByTable(String table) {
        List<SubscriptionEntry> result = new ArrayList<>();
        for (SubscriptionEntry entry : entries.values()) {
            if (entry.isActive() && entry.getTable().equals(table)) {
                result.add(entry);
            }
        }
        return result;
    }

    public List<SubscriptionEntry> listByChannel(String channelName) {
        List<SubscriptionEntry> result = new ArrayList<>();
        for (SubscriptionEntry entry : entries.values()) {
            if (entry.isActive() && channelName.equals(entry.getChannelName())) {
                result.add(entry);
            }
        }
        return result;
    }

    /** True if an active subscription exists for the table and (when given) exact predicate. */
    public boolean isSubscribed(String table, String predicate) {
        for (SubscriptionEntry entry : entries.values()) {
            if (entry.isActive()
                    && entry.getTable().equals(table)
                    && (predicate == null || Objects.equals(predicate, entry.getFilter().getPredicate()))) {
                return true;
            }
        }
        return false;
    }

    public int activeCount() {
        int count = 0;
        for (SubscriptionEntry entry : entries.values()) {
            if (entry.isActive()) {
                count++;
            }
        }
        return count;
    }

    /** Drops every entry. Returns all of their processors, unclosed. */
    public List<MessageProcessor> clear() {
        List<MessageProcessor> processors = new ArrayList<>();
        for (SubscriptionEntry entry : entries.values()) {
            entry.setState(SubscriptionState.REMOVED);
            entry.setChannelName(null);
            processors.addAll(entry.removeAllProcessors());
        }
        entries.clear();
        activeIdsByIdentity.clear();
        return processors;
    }

    private void removeEntry(SubscriptionEntry entry) {
        entries.remove(entry.getId());
        activeIdsByIdentity.remove(entry.getFilter().identityKey(), entry.getId());
        entry.setState(SubscriptionState.REMOVED);
        log.debug("Removed subscription {}", entry.getId());
    }

    /** What a removal took out of the registry. */
    @Value
    public static class Removal {

        SubscriptionEntry entry;
        List<MessageProcessor> processors;
        boolean entryRemoved;
    }
}
