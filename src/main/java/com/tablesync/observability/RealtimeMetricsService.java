package com.tablesync.observability;

import com.tablesync.event.ChannelStatusEvent;
import com.tablesync.realtime.ChannelPoolManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Publishes the real-time layer's health to Micrometer.
 *
 * <ul>
 *   <li><b>realtime.channels.active</b> (gauge): channels currently ACTIVE</li>
 *   <li><b>realtime.subscriptions.active</b> (gauge): active logical subscriptions</li>
 *   <li><b>realtime.messages.per.second</b> (gauge): last complete one-second window</li>
 *   <li><b>realtime.messages.received</b> (counter): events dispatched to subscriptions</li>
 *   <li><b>realtime.reconnect.attempts</b> (counter): scheduled channel reconnects</li>
 *   <li><b>realtime.callback.errors</b> (counter): subscriber callbacks that threw</li>
 *   <li><b>realtime.channel.transitions</b> (counter, tag {@code status}): channel state changes</li>
 *   <li><b>realtime.subscription.setup</b> (timer): attach until the binding is confirmed</li>
 *   <li><b>realtime.message.processing</b> (timer): time spent in subscriber callbacks</li>
 * </ul>
 *
 * <p>Gauges, function counters and function timers read live values on scrape; only transitions
 * are pushed.
 */
@Service
public class RealtimeMetricsService {

    private final MeterRegistry meterRegistry;

    public RealtimeMetricsService(
            MeterRegistry meterRegistry,
            ChannelPoolManager channelPoolManager,
            ConnectionMetricsRecorder metricsRecorder) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("realtime.channels.active", channelPoolManager, ChannelPoolManager::getActiveChannelCount);
        meterRegistry.gauge(
                "realtime.subscriptions.active", channelPoolManager, ChannelPoolManager::getActiveSubscriptionCount);
        meterRegistry.gauge(
                "realtime.messages.per.second", metricsRecorder, ConnectionMetricsRecorder::getMessagesPerSecond);

        FunctionCounter.builder(
                        "realtime.messages.received", metricsRecorder, ConnectionMetricsRecorder::getMessagesReceived)
                .description("Change events dispatched to subscriptions")
                .register(meterRegistry);
        FunctionCounter.builder(
                        "realtime.reconnect.attempts", metricsRecorder, ConnectionMetricsRecorder::getTotalReconnects)
                .description("Channel reconnects scheduled after a failure")
                .register(meterRegistry);
        FunctionCounter.builder(
                        "realtime.callback.errors", metricsRecorder, ConnectionMetricsRecorder::getCallbackErrors)
                .description("Subscriber callbacks that threw")
                .register(meterRegistry);

        FunctionTimer.builder(
                        "realtime.subscription.setup",
                        metricsRecorder,
                        ConnectionMetricsRecorder::getSubscriptionSetupCount,
                        ConnectionMetricsRecorder::getSubscriptionSetupTotalMillis,
                        TimeUnit.MILLISECONDS)
                .description("Time from attaching a subscription until its binding is confirmed")
                .register(meterRegistry);
        FunctionTimer.builder(
                        "realtime.message.processing",
                        metricsRecorder,
                        ConnectionMetricsRecorder::getMessageProcessingCount,
                        ConnectionMetricsRecorder::getMessageProcessingTotalMillis,
                        TimeUnit.MILLISECONDS)
                .description("Time spent in subscriber onChange and onBatch callbacks")
                .register(meterRegistry);
    }

    /**
     * Counts channel transitions by the status entered.
     * Runs at @Order(20), after anything that reacts to the transition itself.
     */
    @EventListener
    @Order(20)
    public void onChannelStatus(ChannelStatusEvent event) {
        transitionCounter(event.getNewStatus().name()).increment();
    }

    Counter transitionCounter(String status) {
        return Counter.builder("realtime.channel.transitions")
                .description("Channel status transitions, by status entered")
                .tag("status", status)
                .register(meterRegistry);
    }
}
