package com.tablesync.unit.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.exception.ChannelClosedException;
import com.tablesync.observability.ConnectionMetricsRecorder;
import com.tablesync.realtime.ChangeListener;
import com.tablesync.realtime.MessageProcessor;
import com.tablesync.realtime.SubscriptionConfig;
import com.tablesync.support.Events;
import com.tablesync.support.ManualScheduler;
import com.tablesync.support.RecordingListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MessageProcessor}: throttling, batching, their combination, flushing on
 * close and isolation of failing callbacks.
 */
class MessageProcessorTest {

    private ManualScheduler scheduler;
    private ConnectionMetricsRecorder metricsRecorder;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        metricsRecorder = new ConnectionMetricsRecorder(scheduler);
        listener = new RecordingListener();
    }

    private MessageProcessor processor(SubscriptionConfig.SubscriptionConfigBuilder builder) {
        return new MessageProcessor("sub-1", builder.table("orders").listener(listener).build(), scheduler, metricsRecorder);
    }

    private static ChangeEvent event(int n) {
        return Events.update("orders", Map.of("id", "o" + n, "seq", n));
    }

    @Nested
    @DisplayName("Plain delivery")
    class Plain {

        @Test
        @DisplayName("Every event is delivered immediately, in order")
        void deliversImmediately() {
            MessageProcessor processor = processor(SubscriptionConfig.builder());

            processor.submit(event(1));
            processor.submit(event(2));

            assertThat(listener.events).extracting(e -> e.getNewRecord().get("seq")).containsExactly(1, 2);
            assertThat(scheduler.pendingTaskCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Throttle")
    class Throttle {

        @Test
        @DisplayName("Five events within 50ms with a 100ms throttle produce one callback with the last event")
        void fiveEventsOneCallback() {
            MessageProcessor processor = processor(SubscriptionConfig.builder().throttle(Duration.ofMillis(100)));

            for (int i = 1; i <= 5; i++) {
                processor.submit(event(i));
                scheduler.advanceMillis(10);
            }
            assertThat(listener.events).isEmpty();

            scheduler.advanceMillis(200);

            assertThat(listener.events).hasSize(1);
            assertThat(listener.events.get(0).getNewRecord().get("seq")).isEqualTo(5);
        }

        @Test
        @DisplayName("Deliveries are at least one window apart")
        void deliveriesSpacedByWindow() {
            List<Long> deliveredAt = new ArrayList<>();
            ChangeListener timing = e -> deliveredAt.add(scheduler.now().toEpochMilli());
            MessageProcessor processor = new MessageProcessor(
                    "sub-1",
                    SubscriptionConfig.builder().table("orders").throttle(Duration.ofMillis(100)).listener(timing).build(),
                    scheduler,
                    metricsRecorder);

            for (int i = 0; i < 30; i++) {
                processor.submit(event(i));
                scheduler.advanceMillis(10);
            }
            scheduler.advanceMillis(500);

            assertThat(deliveredAt).hasSizeGreaterThanOrEqualTo(2);
            for (int i = 1; i < deliveredAt.size(); i++) {
                assertThat(deliveredAt.get(i) - deliveredAt.get(i - 1)).isGreaterThanOrEqualTo(100);
            }
        }
    }

    @Nested
    @DisplayName("Batch")
    class Batch {

        @Test
        @DisplayName("Events at 0, 100 and 200ms with a 500ms window arrive as one batch at 500ms")
        void fixedWindowBatch() {
            MessageProcessor processor = processor(SubscriptionConfig.builder().batchWindow(Duration.ofMillis(500)));

            processor.submit(event(1));
            scheduler.advanceMillis(100);
            processor.submit(event(2));
            scheduler.advanceMillis(100);
            processor.submit(event(3));

            scheduler.advanceMillis(299);
            assertThat(listener.batches).isEmpty();

            scheduler.advanceMillis(1);
            assertThat(listener.batches).hasSize(1);
            assertThat(listener.batches.get(0))
                    .extracting(e -> e.getNewRecord().get("seq"))
                    .containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Quiet-period batching restarts the window on every event")
        void quietPeriodBatch() {
            MessageProcessor processor = processor(
                    SubscriptionConfig.builder().batchWindow(Duration.ofMillis(300)).quietPeriodBatch(true));

            processor.submit(event(1));
            scheduler.advanceMillis(200);
            processor.submit(event(2));
            scheduler.advanceMillis(200);
            assertThat(listener.batches).isEmpty();

            scheduler.advanceMillis(100);
            assertThat(listener.batches).hasSize(1);
            assertThat(listener.batches.get(0)).hasSize(2);
        }

        @Test
        @DisplayName("With a throttle, a flush waits one throttle window after the previous delivery")
        void batchRespectsThrottle() {
            List<Long> flushedAt = new ArrayList<>();
            ChangeListener timing = new ChangeListener() {
                @Override
                public void onChange(ChangeEvent event) {}

                @Override
                public void onBatch(List<ChangeEvent> events) {
                    flushedAt.add(scheduler.now().toEpochMilli());
                }
            };
            MessageProcessor processor = new MessageProcessor(
                    "sub-1",
                    SubscriptionConfig.builder()
                            .table("kds_order_routing")
                            .batchWindow(Duration.ofMillis(50))
                            .throttle(Duration.ofMillis(200))
                            .listener(timing)
                            .build(),
                    scheduler,
                    metricsRecorder);

            processor.submit(event(1));
            scheduler.advanceMillis(50);
            processor.submit(event(2));
            scheduler.advanceMillis(500);

            assertThat(flushedAt).hasSize(2);
            assertThat(flushedAt.get(1) - flushedAt.get(0)).isGreaterThanOrEqualTo(200);
        }
    }

    @Nested
    @DisplayName("Close")
    class Close {

        @Test
        @DisplayName("Pending batch is flushed exactly once and the timer is cancelled")
        void flushesPendingBatchOnce() {
            MessageProcessor processor = processor(SubscriptionConfig.builder().batchWindow(Duration.ofMillis(500)));
            processor.submit(event(1));
            processor.submit(event(2));

            processor.close();
            processor.close();
            scheduler.advanceMillis(1_000);

            assertThat(listener.batches).hasSize(1);
            assertThat(listener.batches.get(0)).hasSize(2);
        }

        @Test
        @DisplayName("Held-back throttled event is delivered on close")
        void flushesThrottledEvent() {
            MessageProcessor processor = processor(SubscriptionConfig.builder().throttle(Duration.ofMillis(100)));
            processor.submit(event(1));
            processor.submit(event(2));

            processor.close();

            assertThat(listener.events).extracting(e -> e.getNewRecord().get("seq")).containsExactly(2);
        }

        @Test
        @DisplayName("Nothing is delivered after close")
        void nothingAfterClose() {
            MessageProcessor processor = processor(SubscriptionConfig.builder());
            processor.close();

            processor.submit(event(1));
            processor.notifyConnected();

            assertThat(listener.events).isEmpty();
            assertThat(listener.connected).isZero();
        }
    }

    @Nested
    @DisplayName("Callback errors")
    class CallbackErrors {

        @Test
        @DisplayName("A throwing callback is counted and later events still arrive")
        void throwingCallbackIsolated() {
            List<ChangeEvent> received = new ArrayList<>();
            ChangeListener flaky = e -> {
                received.add(e);
                if (received.size() == 1) {
                    throw new IllegalStateException("boom");
                }
            };
            MessageProcessor processor = new MessageProcessor(
                    "sub-1", SubscriptionConfig.builder().table("orders").listener(flaky).build(), scheduler, metricsRecorder);

            processor.submit(event(1));
            processor.submit(event(2));

            assertThat(received).hasSize(2);
            assertThat(metricsRecorder.getCallbackErrors()).isEqualTo(1);
        }

        @Test
        @DisplayName("Terminal failure is delivered at most once, after the pending batch")
        void failureDeliveredOnceAfterBatch() {
            List<String> calls = new ArrayList<>();
            ChangeListener ordered = new ChangeListener() {
                @Override
                public void onChange(ChangeEvent event) {
                    calls.add("change");
                }

                @Override
                public void onBatch(List<ChangeEvent> batch) {
                    calls.add("batch:" + batch.size());
                }

                @Override
                public void onFailure(ChannelClosedException failure) {
                    calls.add("failure");
                }
            };
            MessageProcessor processor = new MessageProcessor(
                    "sub-1",
                    SubscriptionConfig.builder().table("orders").batchWindow(Duration.ofMillis(500)).listener(ordered).build(),
                    scheduler,
                    metricsRecorder);
            processor.submit(event(1));
            processor.submit(event(2));
            ChannelClosedException failure = new ChannelClosedException("realtime-pool-1", 11, null);

            processor.notifyFailure(failure);
            processor.notifyFailure(failure);
            scheduler.advanceMillis(1_000);

            assertThat(calls).containsExactly("batch:2", "failure");
            assertThat(processor.pendingCount()).isZero();
            assertThat(scheduler.pendingTaskCount()).isZero();
        }

        @Test
        @DisplayName("A held-back throttled event is delivered before the terminal failure")
        void throttledEventDeliveredBeforeFailure() {
            MessageProcessor processor = processor(SubscriptionConfig.builder().throttle(Duration.ofMillis(100)));
            processor.submit(event(1));
            ChannelClosedException failure = new ChannelClosedException("realtime-pool-1", 11, null);

            processor.notifyFailure(failure);

            assertThat(listener.events).extracting(e -> e.getNewRecord().get("seq")).containsExactly(1);
            assertThat(listener.failures).containsExactly(failure);
        }
    }

    @Nested
    @DisplayName("Processing time")
    class ProcessingTime {

        @Test
        @DisplayName("Time spent in onChange and onBatch is reported on the scheduler's clock")
        void callbackTimeRecorded() {
            ChangeListener slow = new ChangeListener() {
                @Override
                public void onChange(ChangeEvent event) {
                    scheduler.advanceMillis(4);
                }

                @Override
                public void onBatch(List<ChangeEvent> batch) {
                    scheduler.advanceMillis(8);
                }
            };
            MessageProcessor plain = new MessageProcessor(
                    "sub-1", SubscriptionConfig.builder().table("orders").listener(slow).build(), scheduler, metricsRecorder);
            MessageProcessor batched = new MessageProcessor(
                    "sub-2",
                    SubscriptionConfig.builder().table("orders").batchWindow(Duration.ofMillis(100)).listener(slow).build(),
                    scheduler,
                    metricsRecorder);

            plain.submit(event(1));
            batched.submit(event(2));
            scheduler.advanceMillis(100);

            assertThat(metricsRecorder.getMessageProcessingCount()).isEqualTo(2);
            assertThat(metricsRecorder.getMessageProcessingTotalMillis()).isEqualTo(12.0);
            assertThat(metricsRecorder.getAverageMessageProcessingMs()).isEqualTo(6.0);
        }
    }
}
