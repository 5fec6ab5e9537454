package com.tablesync.realtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.springframework.scheduling.TaskScheduler;

/**
 * {@link RealtimeScheduler} backed by a Spring {@link TaskScheduler}. Configured with a
 * single-threaded pool in {@link com.tablesync.config.SchedulerConfig}.
 */
public class TaskSchedulerRealtimeScheduler implements RealtimeScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerRealtimeScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        return wrap(taskScheduler.schedule(task, now().plus(delay)));
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        return wrap(taskScheduler.scheduleAtFixedRate(task, now().plus(period), period));
    }

    private ScheduledTask wrap(ScheduledFuture<?> future) {
        return new ScheduledTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }
}
