package com.tablesync.realtime;

import java.time.Duration;
import java.time.Instant;

/**
 * The one clock and timer source of the real-time layer.
 *
 * <p>Every delayed or periodic action (batch flush, throttle window, heartbeat, reconnect,
 * join timeout, idle sweep, optimistic-patch timeout) goes through this interface, so tests can
 * drive time by hand instead of sleeping. Tasks submitted here never overlap each other.
 */
public interface RealtimeScheduler {

    /** Current time on the scheduler's clock. */
    Instant now();

    /** Runs {@code task} once after {@code delay}. */
    ScheduledTask schedule(Runnable task, Duration delay);

    /** Runs {@code task} every {@code period}, first run one period from now. */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration period);

    /** Handle to a pending task. Cancelling an already-run or cancelled task is a no-op. */
    interface ScheduledTask {

        void cancel();

        boolean isCancelled();
    }
}
