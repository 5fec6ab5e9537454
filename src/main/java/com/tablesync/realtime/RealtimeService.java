package com.tablesync.realtime;

import com.tablesync.domain.model.ConnectionMetrics;
import com.tablesync.session.SessionGate;
import org.springframework.stereotype.Service;

/**
 * Entry point for application code that wants change events.
 *
 * <p>Subscriptions go through the {@link SessionGate} (queued until sign-in, role filtered) and
 * then the {@link ChannelPoolManager} (de-duplicated, pooled, reconnected).
 */
@Service
public class RealtimeService {

    private final SessionGate sessionGate;
    private final ChannelPoolManager channelPoolManager;

    public RealtimeService(SessionGate sessionGate, ChannelPoolManager channelPoolManager) {
        this.sessionGate = sessionGate;
        this.channelPoolManager = channelPoolManager;
    }

    public Unsubscribe subscribe(SubscriptionConfig config) {
        return sessionGate.subscribe(config);
    }

    public ConnectionMetrics getConnectionHealth() {
        return channelPoolManager.getConnectionHealth();
    }

    /** True if an active subscription exists for {@code table} (and exactly {@code predicate}, if given). */
    public boolean isSubscribed(String table, String predicate) {
        return channelPoolManager.isSubscribed(table, predicate);
    }

    /** Rejoins channels in ERROR now. Returns how many are rejoining. */
    public int reconnect() {
        return channelPoolManager.reconnect();
    }

    /** Drops every subscription, queued or active, and closes every channel. */
    public TeardownReport disconnect() {
        sessionGate.clear();
        return channelPoolManager.disconnect();
    }
}
