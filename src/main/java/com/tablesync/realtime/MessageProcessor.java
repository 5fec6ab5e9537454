package com.tablesync.realtime;

import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.exception.ChannelClosedException;
import com.tablesync.observability.ConnectionMetricsRecorder;
import com.tablesync.realtime.RealtimeScheduler.ScheduledTask;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shapes the event stream of one listener according to its {@link SubscriptionConfig}.
 *
 * <p>Modes:
 * <ul>
 *   <li>Plain: every event is delivered immediately.</li>
 *   <li>Throttle: the first event of a quiet stream opens a window; when it elapses the latest
 *       event seen in it is delivered. Intermediate values are dropped.</li>
 *   <li>Batch: events are buffered from the first one; when the window elapses (measured from the
 *       first event, or from the most recent one for quiet-period batching) the buffer is
 *       delivered as one list in arrival order.</li>
 *   <li>Batch + throttle: as batch, but a flush is pushed back until one throttle window has
 *       passed since the previous delivery.</li>
 * </ul>
 *
 * <p>Listener callbacks always run outside the processor's lock, so a listener may unsubscribe
 * itself from inside a callback. Exceptions from callbacks are logged and counted, then
 * swallowed: one faulty subscriber never stops delivery to others. Time spent in
 * {@code onChange} and {@code onBatch} is reported to the metrics recorder.
 *
 * <p>{@link #close()} cancels the pending timer and flushes what is buffered exactly once. After
 * that nothing more is delivered.
 */
public class MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final String subscriptionId;
    private final SubscriptionConfig config;
    private final RealtimeScheduler realtimeScheduler;
    private final ConnectionMetricsRecorder metricsRecorder;

    private final Object lock = new Object();

    // Guarded by lock
    private final List<ChangeEvent> buffer = new ArrayList<>();
    private ChangeEvent latest;
    private ScheduledTask pendingTask;
    private long timerGeneration;
    private boolean flushDeferred;
    private Instant lastDeliveryAt;
    private boolean closed;
    private boolean failureNotified;

    public MessageProcessor(
            String subscriptionId,
            SubscriptionConfig config,
            RealtimeScheduler realtimeScheduler,
            ConnectionMetricsRecorder metricsRecorder) {
        this.subscriptionId = subscriptionId;
        this.config = config;
        this.realtimeScheduler = realtimeScheduler;
        this.metricsRecorder = metricsRecorder;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public SubscriptionConfig getConfig() {
        return config;
    }

    public void submit(ChangeEvent event) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (config.isBatched()) {
                buffer.add(event);
                if (config.isQuietPeriodBatch() && !flushDeferred) {
                    cancelPendingTask();
                }
                if (pendingTask == null) {
                    scheduleLocked(this::onBatchWindowElapsed, config.getBatchWindow());
                }
                return;
            }
            if (config.isThrottled()) {
                latest = event;
                if (pendingTask == null) {
                    scheduleLocked(this::onThrottleWindowElapsed, config.getThrottle());
                }
                return;
            }
        }
        deliver(event);
    }

    /** Cancels the pending timer and delivers anything still buffered, exactly once. */
    public void close() {
        List<ChangeEvent> remaining;
        ChangeEvent lastThrottled;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            cancelPendingTask();
            remaining = List.copyOf(buffer);
            buffer.clear();
            lastThrottled = latest;
            latest = null;
        }
        if (!remaining.isEmpty()) {
            log.debug("Flushing {} buffered events for {} on close", remaining.size(), subscriptionId);
            deliverBatch(remaining);
        } else if (lastThrottled != null) {
            deliver(lastThrottled);
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /** Events buffered or held back by the throttle and not yet delivered. */
    public int pendingCount() {
        synchronized (lock) {
            return buffer.size() + (latest != null ? 1 : 0);
        }
    }

    public void notifyConnected() {
        if (!isClosed()) {
            guard("onConnected", () -> config.getListener().onConnected());
        }
    }

    public void notifyDisconnected() {
        if (!isClosed()) {
            guard("onDisconnected", () -> config.getListener().onDisconnected());
        }
    }

    /**
     * Delivers the terminal failure at most once. Events already buffered or held back by the
     * throttle are flushed first, so the listener sees them before the failure.
     */
    public void notifyFailure(ChannelClosedException failure) {
        List<ChangeEvent> remaining;
        ChangeEvent lastThrottled;
        synchronized (lock) {
            if (closed || failureNotified) {
                return;
            }
            failureNotified = true;
            cancelPendingTask();
            remaining = List.copyOf(buffer);
            buffer.clear();
            lastThrottled = latest;
            latest = null;
        }
        if (!remaining.isEmpty()) {
            log.debug("Flushing {} buffered events for {} before failure", remaining.size(), subscriptionId);
            deliverBatch(remaining);
        } else if (lastThrottled != null) {
            deliver(lastThrottled);
        }
        guard("onFailure", () -> config.getListener().onFailure(failure));
    }

    private void onBatchWindowElapsed(long generation) {
        List<ChangeEvent> batch;
        synchronized (lock) {
            if (generation != timerGeneration || closed) {
                return;
            }
            pendingTask = null;
            if (buffer.isEmpty()) {
                return;
            }
            if (config.isThrottled() && lastDeliveryAt != null) {
                Duration wait = Duration.between(realtimeScheduler.now(), lastDeliveryAt.plus(config.getThrottle()));
                if (wait.compareTo(Duration.ZERO) > 0) {
                    flushDeferred = true;
                    scheduleLocked(this::onBatchWindowElapsed, wait);
                    return;
                }
            }
            flushDeferred = false;
            batch = List.copyOf(buffer);
            buffer.clear();
            lastDeliveryAt = realtimeScheduler.now();
        }
        deliverBatch(batch);
    }

    private void onThrottleWindowElapsed(long generation) {
        ChangeEvent event;
        synchronized (lock) {
            if (generation != timerGeneration || closed) {
                return;
            }
            pendingTask = null;
            event = latest;
            latest = null;
            lastDeliveryAt = realtimeScheduler.now();
        }
        if (event != null) {
            deliver(event);
        }
    }

    private void scheduleLocked(LongConsumer handler, Duration delay) {
        long generation = ++timerGeneration;
        pendingTask = realtimeScheduler.schedule(() -> handler.accept(generation), delay);
    }

    private void cancelPendingTask() {
        if (pendingTask != null) {
            pendingTask.cancel();
            pendingTask = null;
        }
        timerGeneration++;
        flushDeferred = false;
    }

    private void deliver(ChangeEvent event) {
        Instant start = realtimeScheduler.now();
        guard("onChange", () -> config.getListener().onChange(event));
        metricsRecorder.recordMessageProcessing(Duration.between(start, realtimeScheduler.now()));
    }

    private void deliverBatch(List<ChangeEvent> events) {
        Instant start = realtimeScheduler.now();
        guard("onBatch", () -> config.getListener().onBatch(events));
        metricsRecorder.recordMessageProcessing(Duration.between(start, realtimeScheduler.now()));
    }

    private void guard(String callback, Runnable invocation) {
        try {
            invocation.run();
        } catch (RuntimeException e) {
            metricsRecorder.recordCallbackError();
            log.error("Subscriber {} callback for {} on {} threw: {}",
                    callback, subscriptionId, config.getTable(), e.getMessage(), e);
        }
    }
}
