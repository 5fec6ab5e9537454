package com.tablesync.domain.model;

import com.tablesync.domain.enums.ConnectionStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of the channel pool's health. Safe to poll at any time.
 */
@Value
@Builder
public class ConnectionMetrics {

    ConnectionStatus status;

    /** Channels currently ACTIVE. */
    int activeChannels;

    /** Channels in the pool in any state. */
    int totalChannels;

    int activeSubscriptions;

    /** Consecutive reconnect attempts outstanding across channels. Resets when a channel rejoins. */
    long reconnectAttempts;

    /** Reconnect attempts since startup. */
    long totalReconnects;

    /** Messages received during the last complete one-second window. */
    long messagesPerSecond;

    long messagesReceived;

    /** Transport-level errors (join failures, heartbeat failures, channel errors). */
    long errorCount;

    /** Subscriber callbacks that threw. */
    long callbackErrors;

    /** Attachments that exceeded the per-channel limit because the pool was full. */
    long forcedReuseCount;

    String lastError;

    Instant lastErrorAt;

    Instant lastHeartbeat;

    /** Round trip of the most recent successful ping, in milliseconds. */
    long heartbeatLatencyMs;

    /** Used subscription slots divided by total slots across the pool (0 when the pool is empty). */
    double channelUtilization;

    /** Mean time from attach until the binding was confirmed, in milliseconds (0 before the first). */
    double averageSubscriptionSetupMs;

    /** Mean time spent in a subscriber callback, in milliseconds (0 before the first). */
    double averageMessageProcessingMs;

    /** Connected, with no reconnect outstanding and no transport error recorded. */
    public boolean isStable() {
        return status == ConnectionStatus.CONNECTED && reconnectAttempts == 0 && errorCount == 0;
    }

    /**
     * Scores the pool from 0 to 100 for dashboards. Latency, errors and reconnects cost points;
     * a mostly empty pool costs a few more because it usually means churn.
     */
    public int healthScore() {
        int score = 100;

        if (heartbeatLatencyMs > 1000) {
            score -= 30;
        } else if (heartbeatLatencyMs > 500) {
            score -= 20;
        } else if (heartbeatLatencyMs > 200) {
            score -= 10;
        }

        score -= (int) Math.min(errorCount * 5, 30);
        score -= (int) Math.min(reconnectAttempts * 10, 30);

        if (totalChannels > 0 && channelUtilization < 0.3) {
            score -= 10;
        }

        return Math.max(0, Math.min(100, score));
    }
}
