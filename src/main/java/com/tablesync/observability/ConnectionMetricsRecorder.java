package com.tablesync.observability;

import com.tablesync.realtime.RealtimeScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Process-wide counters behind {@link com.tablesync.domain.model.ConnectionMetrics}.
 *
 * <p>Written by the channel pool (and by message processors when a subscriber callback throws);
 * read by the health snapshot and by {@link RealtimeMetricsService}. Messages per second is the
 * count of the last complete one-second window on the scheduler's clock. Subscription setup and
 * message processing durations are kept as count plus total, the shape a Micrometer
 * {@code FunctionTimer} reads.
 */
@Component
public class ConnectionMetricsRecorder {

    private final RealtimeScheduler realtimeScheduler;

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong callbackErrors = new AtomicLong();
    private final AtomicLong forcedReuseCount = new AtomicLong();
    private final AtomicLong totalReconnects = new AtomicLong();
    private final AtomicLong subscriptionSetupCount = new AtomicLong();
    private final AtomicLong subscriptionSetupNanos = new AtomicLong();
    private final AtomicLong messageProcessingCount = new AtomicLong();
    private final AtomicLong messageProcessingNanos = new AtomicLong();

    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile Instant lastHeartbeat;
    private volatile long heartbeatLatencyMs;

    // Guarded by this
    private long currentSecond = Long.MIN_VALUE;
    private long currentSecondCount;
    private long previousSecondCount;

    public ConnectionMetricsRecorder(RealtimeScheduler realtimeScheduler) {
        this.realtimeScheduler = realtimeScheduler;
    }

    public void recordMessage() {
        messagesReceived.incrementAndGet();
        long second = realtimeScheduler.now().getEpochSecond();
        synchronized (this) {
            if (second != currentSecond) {
                previousSecondCount = second == currentSecond + 1 ? currentSecondCount : 0;
                currentSecond = second;
                currentSecondCount = 0;
            }
            currentSecondCount++;
        }
    }

    public void recordError(String message) {
        errorCount.incrementAndGet();
        lastError = message;
        lastErrorAt = realtimeScheduler.now();
    }

    public void recordCallbackError() {
        callbackErrors.incrementAndGet();
    }

    public void recordForcedReuse() {
        forcedReuseCount.incrementAndGet();
    }

    public void recordReconnectAttempt() {
        totalReconnects.incrementAndGet();
    }

    public void recordHeartbeat(Instant at) {
        lastHeartbeat = at;
    }

    public void recordHeartbeatLatency(Duration latency) {
        heartbeatLatencyMs = latency.toMillis();
    }

    /** Time from attaching a subscription until the server confirmed its binding. */
    public void recordSubscriptionSetup(Duration duration) {
        subscriptionSetupCount.incrementAndGet();
        subscriptionSetupNanos.addAndGet(Math.max(0, duration.toNanos()));
    }

    /** Time spent inside one {@code onChange} or {@code onBatch} callback. */
    public void recordMessageProcessing(Duration duration) {
        messageProcessingCount.incrementAndGet();
        messageProcessingNanos.addAndGet(Math.max(0, duration.toNanos()));
    }

    public synchronized long getMessagesPerSecond() {
        long second = realtimeScheduler.now().getEpochSecond();
        if (second == currentSecond) {
            return previousSecondCount;
        }
        return second == currentSecond + 1 ? currentSecondCount : 0;
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public long getCallbackErrors() {
        return callbackErrors.get();
    }

    public long getForcedReuseCount() {
        return forcedReuseCount.get();
    }

    public long getTotalReconnects() {
        return totalReconnects.get();
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastErrorAt() {
        return lastErrorAt;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public long getHeartbeatLatencyMs() {
        return heartbeatLatencyMs;
    }

    public long getSubscriptionSetupCount() {
        return subscriptionSetupCount.get();
    }

    public double getSubscriptionSetupTotalMillis() {
        return subscriptionSetupNanos.get() / 1_000_000.0;
    }

    public double getAverageSubscriptionSetupMs() {
        return average(subscriptionSetupNanos.get(), subscriptionSetupCount.get());
    }

    public long getMessageProcessingCount() {
        return messageProcessingCount.get();
    }

    public double getMessageProcessingTotalMillis() {
        return messageProcessingNanos.get() / 1_000_000.0;
    }

    public double getAverageMessageProcessingMs() {
        return average(messageProcessingNanos.get(), messageProcessingCount.get());
    }

    private static double average(long totalNanos, long count) {
        return count == 0 ? 0.0 : totalNanos / 1_000_000.0 / count;
    }
}
