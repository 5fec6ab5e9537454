package com.tablesync.config;

import com.tablesync.realtime.RealtimeScheduler;
import com.tablesync.realtime.TaskSchedulerRealtimeScheduler;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the single execution context the real-time layer runs its timers on.
 *
 * <p>The pool size is fixed at one: batch flushes, throttle windows, heartbeats, reconnects and
 * optimistic-patch timeouts never run concurrently with each other.
 */
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler realtimeTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("realtime-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(throwable -> log.error("Real-time task failed: {}", throwable.getMessage(), throwable));
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock realtimeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RealtimeScheduler realtimeScheduler(ThreadPoolTaskScheduler realtimeTaskScheduler, Clock realtimeClock) {
        return new TaskSchedulerRealtimeScheduler(realtimeTaskScheduler, realtimeClock);
    }
}
