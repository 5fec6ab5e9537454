package com.tablesync.realtime;

import com.tablesync.domain.enums.ChannelStatus;
import com.tablesync.realtime.RealtimeScheduler.ScheduledTask;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * Pool-side state of one physical channel. Only {@link ChannelPoolManager} touches it, under its
 * lock.
 *
 * <p>{@code generation} increases on every (re)join. Transport callbacks carry the generation
 * they were registered under, so late callbacks from a previous join are recognised and ignored.
 */
@Getter
class PooledChannel {

    private final String name;
    private final Instant createdAt;
    private final Set<String> subscriptionIds = new LinkedHashSet<>();

    @Setter
    private ChannelStatus status = ChannelStatus.CONNECTING;

    private long generation = 1;

    /** Whether the join of the current generation has taken its snapshot of attached bindings. */
    @Setter
    private boolean joinStarted;
    private int reconnectAttempts;
    private Instant lastActivity;

    /** When the channel last became empty, null while it carries subscriptions. */
    private Instant emptySince;

    private ScheduledTask joinTimeoutTask;
    private ScheduledTask reconnectTask;

    PooledChannel(String name, Instant createdAt) {
        this.name = name;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    void attach(String subscriptionId) {
        subscriptionIds.add(subscriptionId);
        emptySince = null;
    }

    boolean detach(String subscriptionId, Instant now) {
        boolean removed = subscriptionIds.remove(subscriptionId);
        if (removed && subscriptionIds.isEmpty()) {
            emptySince = now;
        }
        return removed;
    }

    boolean isAttached(String subscriptionId) {
        return subscriptionIds.contains(subscriptionId);
    }

    int size() {
        return subscriptionIds.size();
    }

    boolean isEmpty() {
        return subscriptionIds.isEmpty();
    }

    List<String> attachedIds() {
        return List.copyOf(subscriptionIds);
    }

    void clearAttachments() {
        subscriptionIds.clear();
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    long nextGeneration() {
        joinStarted = false;
        return ++generation;
    }

    int recordFailure() {
        return ++reconnectAttempts;
    }

    void resetAttempts() {
        reconnectAttempts = 0;
    }

    void setJoinTimeoutTask(ScheduledTask task) {
        cancel(joinTimeoutTask);
        joinTimeoutTask = task;
    }

    void setReconnectTask(ScheduledTask task) {
        cancel(reconnectTask);
        reconnectTask = task;
    }

    void cancelTimers() {
        setJoinTimeoutTask(null);
        setReconnectTask(null);
    }

    ChannelSnapshot snapshot() {
        return new ChannelSnapshot(name, status, subscriptionIds.size(), reconnectAttempts, lastActivity, emptySince);
    }

    private static void cancel(ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
    }
}
