package com.tablesync.realtime;

import com.tablesync.config.RealtimeProperties;
import com.tablesync.domain.enums.ChannelStatus;
import com.tablesync.domain.enums.ConnectionStatus;
import com.tablesync.domain.enums.TransportStatus;
import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.domain.model.ConnectionMetrics;
import com.tablesync.event.ChannelStatusEvent;
import com.tablesync.exception.ChannelClosedException;
import com.tablesync.exception.TransportException;
import com.tablesync.observability.ConnectionMetricsRecorder;
import com.tablesync.realtime.RealtimeScheduler.ScheduledTask;
import com.tablesync.transport.RealtimeTransport;
import com.tablesync.transport.TransportListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Multiplexes logical subscriptions onto a bounded pool of transport channels.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Attach: reuse an ACTIVE (then CONNECTING) channel with spare capacity, otherwise open a
 *       new one while below {@code maxChannels}, otherwise force-reuse the least loaded channel</li>
 *   <li>Reconnect: a failed channel is retried with exponential backoff and jitter from
 *       {@link BackoffCalculator}; every attached binding is re-created on the same channel name.
 *       After {@code maxReconnectAttempts} consecutive failures the channel closes and each of its
 *       subscribers is told once through {@link ChangeListener#onFailure}</li>
 *   <li>Heartbeat: every ACTIVE channel is pinged on an interval; a failed ping goes through the
 *       reconnect path, a ping that throws means the channel is defunct and its subscriptions are
 *       re-homed at once</li>
 *   <li>Idle sweep: channels empty for longer than {@code idleTimeout} are torn down</li>
 * </ul>
 *
 * <p>Concurrency: every mutation of pool and registry state happens while holding this object's
 * monitor. Transport calls and subscriber callbacks are collected while holding it and run after
 * it is released, so neither a slow transport nor a re-entrant subscriber can block the pool.
 * A channel has no per-binding unbind: a detached subscription's binding stays on the wire until
 * the channel rejoins or closes, and its events are dropped here.
 */
@Service
public class ChannelPoolManager {

    private static final Logger log = LoggerFactory.getLogger(ChannelPoolManager.class);

    static final String CHANNEL_PREFIX = "realtime-pool-";

    private final RealtimeTransport transport;
    private final SubscriptionRegistry registry;
    private final BackoffCalculator backoffCalculator;
    private final RealtimeScheduler realtimeScheduler;
    private final ConnectionMetricsRecorder metricsRecorder;
    private final RealtimeProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Map<String, PooledChannel> channels = new LinkedHashMap<>();
    private final AtomicInteger channelSequence = new AtomicInteger();

    private ScheduledTask heartbeatTask;
    private ScheduledTask cleanupTask;

    public ChannelPoolManager(
            RealtimeTransport transport,
            SubscriptionRegistry registry,
            BackoffCalculator backoffCalculator,
            RealtimeScheduler realtimeScheduler,
            ConnectionMetricsRecorder metricsRecorder,
            RealtimeProperties properties,
            ApplicationEventPublisher applicationEventPublisher) {
        this.transport = transport;
        this.registry = registry;
        this.backoffCalculator = backoffCalculator;
        this.realtimeScheduler = realtimeScheduler;
        this.metricsRecorder = metricsRecorder;
        this.properties = properties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Starts the heartbeat and idle sweep timers. Idempotent. */
    @PostConstruct
    public synchronized void start() {
        if (heartbeatTask != null) {
            return;
        }
        heartbeatTask = realtimeScheduler.scheduleAtFixedRate(this::heartbeat, properties.getHeartbeatInterval());
        cleanupTask = realtimeScheduler.scheduleAtFixedRate(this::sweepIdleChannels, properties.getCleanupInterval());
        log.info("Channel pool started: maxChannels={}, maxSubscriptionsPerChannel={}, heartbeat={}s",
                properties.getMaxChannels(),
                properties.getMaxSubscriptionsPerChannel(),
                properties.getHeartbeatInterval().toSeconds());
    }

    @PreDestroy
    public void stop() {
        synchronized (this) {
            cancel(heartbeatTask);
            cancel(cleanupTask);
            heartbeatTask = null;
            cleanupTask = null;
        }
        TeardownReport report = disconnect();
        log.info("Channel pool stopped: {} channels closed, {} teardown failures",
                report.getChannelsClosed(), report.getFailures().size());
    }

    // ---- Subscription lifecycle ----

    /**
     * Registers {@code config} and attaches its subscription to a channel. An identical existing
     * subscription is shared instead: the caller gets its own listener on the existing binding.
     */
    public Registration activate(SubscriptionConfig config) {
        List<Runnable> after = new ArrayList<>();
        Registration registration;
        synchronized (this) {
            registration = registry.register(config);
            SubscriptionEntry entry = requireEntry(registration.getSubscriptionId());
            if (registration.isCreated()) {
                attachLocked(entry, after);
            } else {
                PooledChannel channel = channels.get(entry.getChannelName());
                MessageProcessor processor = entry.processor(registration.getListenerId());
                if (channel != null && channel.getStatus() == ChannelStatus.ACTIVE && processor != null) {
                    after.add(processor::notifyConnected);
                }
            }
        }
        runAll(after);
        return registration;
    }

    /**
     * Removes one listener. When it was the subscription's last listener, the subscription is
     * detached from its channel. Pending batched or throttled events are flushed to the listener
     * before this returns. Idempotent.
     */
    public void release(String subscriptionId, String listenerId) {
        SubscriptionRegistry.Removal removal;
        synchronized (this) {
            removal = registry.removeListener(subscriptionId, listenerId).orElse(null);
            if (removal != null && removal.isEntryRemoved()) {
                detachLocked(subscriptionId);
            }
        }
        if (removal != null) {
            removal.getProcessors().forEach(MessageProcessor::close);
        }
    }

    /** Removes the subscription and every listener on it, flushing each one. Idempotent. */
    public void unregister(String subscriptionId) {
        SubscriptionRegistry.Removal removal;
        synchronized (this) {
            removal = registry.unregister(subscriptionId).orElse(null);
            if (removal != null) {
                detachLocked(subscriptionId);
            }
        }
        if (removal != null) {
            removal.getProcessors().forEach(MessageProcessor::close);
        }
    }

    /** Attaches a registered subscription to a channel and returns the channel's name. */
    public String attach(String subscriptionId) {
        List<Runnable> after = new ArrayList<>();
        String channelName;
        synchronized (this) {
            SubscriptionEntry entry = requireEntry(subscriptionId);
            PooledChannel current = channels.get(entry.getChannelName());
            if (current != null && current.isAttached(subscriptionId)) {
                return current.getName();
            }
            channelName = attachLocked(entry, after).getName();
        }
        runAll(after);
        return channelName;
    }

    /**
     * Detaches a subscription from its channel. A channel left empty becomes eligible for idle
     * teardown. Detaching an unattached subscription is a no-op.
     */
    public synchronized void detach(String subscriptionId) {
        detachLocked(subscriptionId);
    }

    // ---- Health ----

    public synchronized ConnectionMetrics getConnectionHealth() {
        int active = 0;
        long outstandingAttempts = 0;
        int usedSlots = 0;
        for (PooledChannel channel : channels.values()) {
            if (channel.getStatus() == ChannelStatus.ACTIVE) {
                active++;
            }
            outstandingAttempts += channel.getReconnectAttempts();
            usedSlots += channel.size();
        }
        int totalSlots = channels.size() * properties.getMaxSubscriptionsPerChannel();

        return ConnectionMetrics.builder()
                .status(connectionStatusLocked())
                .activeChannels(active)
                .totalChannels(channels.size())
                .activeSubscriptions(registry.activeCount())
                .reconnectAttempts(outstandingAttempts)
                .totalReconnects(metricsRecorder.getTotalReconnects())
                .messagesPerSecond(metricsRecorder.getMessagesPerSecond())
                .messagesReceived(metricsRecorder.getMessagesReceived())
                .errorCount(metricsRecorder.getErrorCount())
                .callbackErrors(metricsRecorder.getCallbackErrors())
                .forcedReuseCount(metricsRecorder.getForcedReuseCount())
                .lastError(metricsRecorder.getLastError())
                .lastErrorAt(metricsRecorder.getLastErrorAt())
                .lastHeartbeat(metricsRecorder.getLastHeartbeat())
                .heartbeatLatencyMs(metricsRecorder.getHeartbeatLatencyMs())
                .channelUtilization(totalSlots == 0 ? 0.0 : (double) usedSlots / totalSlots)
                .averageSubscriptionSetupMs(metricsRecorder.getAverageSubscriptionSetupMs())
                .averageMessageProcessingMs(metricsRecorder.getAverageMessageProcessingMs())
                .build();
    }

    public synchronized ConnectionStatus getConnectionStatus() {
        return connectionStatusLocked();
    }

    public synchronized List<ChannelSnapshot> getChannels() {
        List<ChannelSnapshot> snapshots = new ArrayList<>(channels.size());
        for (PooledChannel channel : channels.values()) {
            snapshots.add(channel.snapshot());
        }
        return snapshots;
    }

    public synchronized int getActiveChannelCount() {
        return (int) channels.values().stream()
                .filter(c -> c.getStatus() == ChannelStatus.ACTIVE)
                .count();
    }

    public synchronized int getActiveSubscriptionCount() {
        return registry.activeCount();
    }

    public synchronized boolean isSubscribed(String table, String predicate) {
        return registry.isSubscribed(table, predicate);
    }

    // ---- Manual control ----

    /**
     * Rejoins every channel currently in ERROR without waiting for its backoff delay.
     *
     * @return number of channels rejoining
     */
    public int reconnect() {
        List<Runnable> after = new ArrayList<>();
        int rejoining = 0;
        synchronized (this) {
            for (PooledChannel channel : channels.values()) {
                if (channel.getStatus() == ChannelStatus.ERROR) {
                    rejoinLocked(channel, after);
                    rejoining++;
                }
            }
        }
        log.info("Manual reconnect requested: {} channels rejoining", rejoining);
        runAll(after);
        return rejoining;
    }

    /**
     * Tears down every channel and drops every subscription. Pending batches are flushed to their
     * listeners first, then a CLOSED status event is published per channel. Teardown failures are
     * collected into the report, not thrown.
     */
    public TeardownReport disconnect() {
        List<PooledChannel> closing;
        List<MessageProcessor> processors;
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            closing = new ArrayList<>(channels.values());
            for (PooledChannel channel : closing) {
                ChannelStatus previous = channel.getStatus();
                channel.cancelTimers();
                channel.setStatus(ChannelStatus.CLOSED);
                channel.clearAttachments();
                after.add(statusEvent(channel, previous, "disconnect"));
            }
            channels.clear();
            processors = registry.clear();
        }
        processors.forEach(MessageProcessor::close);
        runAll(after);

        TeardownReport report = teardown(closing);
        if (!report.isClean()) {
            log.warn("Disconnect closed {} channels with {} failures", report.getChannelsClosed(), report.getFailures().size());
        }
        return report;
    }

    // ---- Timers ----

    /** Pings every ACTIVE channel. Runs on the heartbeat interval. */
    public void heartbeat() {
        List<PooledChannel> targets = new ArrayList<>();
        synchronized (this) {
            for (PooledChannel channel : channels.values()) {
                if (channel.getStatus() == ChannelStatus.ACTIVE) {
                    targets.add(channel);
                }
            }
        }
        metricsRecorder.recordHeartbeat(realtimeScheduler.now());

        for (PooledChannel channel : targets) {
            String name = channel.getName();
            long generation;
            synchronized (this) {
                generation = channel.getGeneration();
            }
            Instant sentAt = realtimeScheduler.now();

            CompletableFuture<Void> ping;
            try {
                ping = transport.ping(name);
            } catch (RuntimeException e) {
                log.warn("Heartbeat on {} threw {}; channel is defunct, re-homing its subscriptions",
                        name, e.getMessage());
                removeDefunctChannel(name, generation, e);
                continue;
            }

            ScheduledTask timeout = realtimeScheduler.schedule(
                    () -> onChannelFailure(name, generation,
                            new TransportException("Heartbeat on " + name + " timed out after "
                                    + properties.getJoinTimeout().toMillis() + "ms")),
                    properties.getJoinTimeout());
            ping.whenComplete((ignored, error) -> {
                timeout.cancel();
                if (error != null) {
                    onChannelFailure(name, generation,
                            new TransportException("Heartbeat on " + name + " failed", unwrap(error)));
                } else {
                    metricsRecorder.recordHeartbeatLatency(Duration.between(sentAt, realtimeScheduler.now()));
                }
            });
        }
    }

    /** Tears down channels that have been empty for at least the idle timeout. */
    public TeardownReport sweepIdleChannels() {
        List<PooledChannel> idle = new ArrayList<>();
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            Instant cutoff = realtimeScheduler.now().minus(properties.getIdleTimeout());
            for (PooledChannel channel : new ArrayList<>(channels.values())) {
                Instant emptySince = channel.getEmptySince();
                if (channel.isEmpty() && emptySince != null && !emptySince.isAfter(cutoff)) {
                    ChannelStatus previous = channel.getStatus();
                    channel.cancelTimers();
                    channel.setStatus(ChannelStatus.CLOSED);
                    channels.remove(channel.getName());
                    idle.add(channel);
                    after.add(statusEvent(channel, previous, "idle since " + emptySince));
                }
            }
        }
        if (idle.isEmpty()) {
            return TeardownReport.empty();
        }
        runAll(after);
        TeardownReport report = teardown(idle);
        log.info("Idle sweep closed {} channels ({} failures)", report.getChannelsClosed(), report.getFailures().size());
        return report;
    }

    // ---- Transport callbacks ----

    void dispatch(String channelName, long generation, String subscriptionId, ChangeEvent event) {
        List<MessageProcessor> targets;
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getGeneration() != generation || !channel.isAttached(subscriptionId)) {
                log.debug("Dropping {} event on {} for detached subscription {}",
                        event.getTable(), channelName, subscriptionId);
                return;
            }
            SubscriptionEntry entry = registry.get(subscriptionId).orElse(null);
            if (entry == null || !entry.isActive()) {
                return;
            }
            channel.touch(realtimeScheduler.now());
            metricsRecorder.recordMessage();
            targets = entry.processors();
        }
        for (MessageProcessor processor : targets) {
            processor.submit(event);
        }
    }

    void onTransportStatus(String channelName, long generation, TransportStatus status, Throwable cause) {
        if (status.isFailure()) {
            Throwable failure = cause != null
                    ? cause
                    : new TransportException("Channel " + channelName + " reported " + status);
            onChannelFailure(channelName, generation, failure);
        } else {
            log.debug("Channel {} transport status {}", channelName, status);
        }
    }

    void onChannelFailure(String channelName, long generation, Throwable cause) {
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null
                    || channel.getGeneration() != generation
                    || channel.getStatus() == ChannelStatus.ERROR
                    || channel.getStatus() == ChannelStatus.CLOSED) {
                return;
            }
            ChannelStatus previous = channel.getStatus();
            channel.cancelTimers();
            channel.setStatus(ChannelStatus.ERROR);
            int attempts = channel.recordFailure();
            metricsRecorder.recordError(channelName + ": " + cause.getMessage());
            after.add(statusEvent(channel, previous, cause.getMessage()));

            if (attempts > properties.getMaxReconnectAttempts()) {
                closeChannelLocked(channel, attempts, cause, after);
            } else {
                long delayMs = backoffCalculator.delay(attempts - 1);
                metricsRecorder.recordReconnectAttempt();
                log.warn("Channel {} failed ({}); reconnect attempt {}/{} in {}ms",
                        channelName, cause.getMessage(), attempts, properties.getMaxReconnectAttempts(), delayMs);
                channel.setReconnectTask(
                        realtimeScheduler.schedule(() -> rejoin(channelName), Duration.ofMillis(delayMs)));
                if (previous == ChannelStatus.ACTIVE) {
                    for (MessageProcessor processor : processorsOn(channel)) {
                        after.add(processor::notifyDisconnected);
                    }
                }
            }
        }
        runAll(after);
    }

    // ---- Internals ----

    private PooledChannel attachLocked(SubscriptionEntry entry, List<Runnable> after) {
        entry.setAwaitingBindingSince(realtimeScheduler.now());
        PooledChannel channel = findChannelWithCapacity().orElse(null);
        if (channel == null && channels.size() < properties.getMaxChannels()) {
            channel = createChannelLocked(after);
            channel.attach(entry.getId());
            entry.setChannelName(channel.getName());
            String name = channel.getName();
            after.add(() -> join(name));
            log.debug("Attached {} to new channel {}", entry.getId(), name);
            return channel;
        }
        if (channel == null) {
            channel = channels.values().stream()
                    .min(Comparator.comparingInt(PooledChannel::size))
                    .orElseThrow();
            metricsRecorder.recordForcedReuse();
            log.warn("Channel pool full ({} channels); forcing {} onto {} which already carries {} subscriptions",
                    channels.size(), entry.getId(), channel.getName(), channel.size());
        }

        channel.attach(entry.getId());
        entry.setChannelName(channel.getName());
        // A join that has not started yet will bind it along with the rest
        if (channel.getStatus() == ChannelStatus.ACTIVE
                || (channel.getStatus() == ChannelStatus.CONNECTING && channel.isJoinStarted())) {
            String name = channel.getName();
            long generation = channel.getGeneration();
            after.add(() -> bind(name, generation, entry));
        }
        log.debug("Attached {} to {} ({} subscriptions)", entry.getId(), channel.getName(), channel.size());
        return channel;
    }

    private Optional<PooledChannel> findChannelWithCapacity() {
        int limit = properties.getMaxSubscriptionsPerChannel();
        for (ChannelStatus wanted : List.of(ChannelStatus.ACTIVE, ChannelStatus.CONNECTING)) {
            for (PooledChannel channel : channels.values()) {
                if (channel.getStatus() == wanted && channel.size() < limit) {
                    return Optional.of(channel);
                }
            }
        }
        return Optional.empty();
    }

    private PooledChannel createChannelLocked(List<Runnable> after) {
        String name = CHANNEL_PREFIX + channelSequence.incrementAndGet();
        PooledChannel channel = new PooledChannel(name, realtimeScheduler.now());
        channels.put(name, channel);
        after.add(statusEvent(channel, null, "created"));
        log.info("Opened channel {} ({}/{})", name, channels.size(), properties.getMaxChannels());
        return channel;
    }

    private void detachLocked(String subscriptionId) {
        for (PooledChannel channel : channels.values()) {
            if (channel.detach(subscriptionId, realtimeScheduler.now())) {
                registry.get(subscriptionId).ifPresent(entry -> entry.setChannelName(null));
                if (channel.isEmpty()) {
                    log.info("Channel {} has no subscriptions; closing after {}s idle",
                            channel.getName(), properties.getIdleTimeout().toSeconds());
                }
                return;
            }
        }
    }

    /**
     * Binds every subscription attached to a CONNECTING channel and waits for all of them. On a
     * rejoin the previous binding set is dropped first, then rebuilt under the same name.
     */
    private void join(String channelName) {
        List<SubscriptionEntry> toBind = new ArrayList<>();
        long generation;
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getStatus() != ChannelStatus.CONNECTING || channel.isJoinStarted()) {
                return;
            }
            generation = channel.getGeneration();
            channel.setJoinStarted(true);
            for (String id : channel.attachedIds()) {
                registry.get(id).filter(SubscriptionEntry::isActive).ifPresent(toBind::add);
            }
            channel.setJoinTimeoutTask(realtimeScheduler.schedule(
                    () -> onJoinTimeout(channelName, generation), properties.getJoinTimeout()));
        }

        if (generation > 1) {
            teardownQuietly(channelName);
        }
        CompletableFuture<?>[] bindings = toBind.stream()
                .map(entry -> bindFuture(channelName, generation, entry))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(bindings).whenComplete((ignored, error) -> {
            if (error != null) {
                onChannelFailure(channelName, generation,
                        new TransportException("Join of " + channelName + " failed", unwrap(error)));
            } else {
                onJoinSucceeded(channelName, generation);
            }
        });
    }

    /** Adds one binding to a channel that is already ACTIVE or joining. */
    private void bind(String channelName, long generation, SubscriptionEntry entry) {
        bindFuture(channelName, generation, entry).whenComplete((ignored, error) -> {
            if (error != null) {
                onChannelFailure(channelName, generation,
                        new TransportException("Binding " + entry.getId() + " on " + channelName + " failed",
                                unwrap(error)));
            } else {
                onBindingConfirmed(channelName, generation, entry.getId());
            }
        });
    }

    private CompletableFuture<Void> bindFuture(String channelName, long generation, SubscriptionEntry entry) {
        TransportListener listener = new TransportListener() {
            @Override
            public void onEvent(ChangeEvent event) {
                dispatch(channelName, generation, entry.getId(), event);
            }

            @Override
            public void onStatus(TransportStatus status, Throwable cause) {
                onTransportStatus(channelName, generation, status, cause);
            }
        };
        try {
            return transport.subscribe(channelName, entry.getFilter(), listener);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onJoinSucceeded(String channelName, long generation) {
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getGeneration() != generation
                    || channel.getStatus() != ChannelStatus.CONNECTING) {
                return;
            }
            int previousAttempts = channel.getReconnectAttempts();
            channel.setJoinTimeoutTask(null);
            channel.setStatus(ChannelStatus.ACTIVE);
            channel.resetAttempts();
            channel.touch(realtimeScheduler.now());
            after.add(statusEvent(channel, ChannelStatus.CONNECTING, "joined"));
            for (String id : channel.attachedIds()) {
                registry.get(id).ifPresent(this::recordSetupLocked);
            }
            for (MessageProcessor processor : processorsOn(channel)) {
                after.add(processor::notifyConnected);
            }
            if (previousAttempts > 0) {
                log.info("Channel {} rejoined after {} attempts with {} subscriptions",
                        channelName, previousAttempts, channel.size());
            } else {
                log.info("Channel {} joined with {} subscriptions", channelName, channel.size());
            }
        }
        runAll(after);
    }

    private void onBindingConfirmed(String channelName, long generation, String subscriptionId) {
        List<MessageProcessor> targets;
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getGeneration() != generation
                    || channel.getStatus() != ChannelStatus.ACTIVE || !channel.isAttached(subscriptionId)) {
                return;
            }
            SubscriptionEntry entry = registry.get(subscriptionId).orElse(null);
            if (entry == null) {
                return;
            }
            recordSetupLocked(entry);
            targets = entry.processors();
        }
        targets.forEach(MessageProcessor::notifyConnected);
    }

    private void recordSetupLocked(SubscriptionEntry entry) {
        Instant since = entry.getAwaitingBindingSince();
        if (since != null) {
            metricsRecorder.recordSubscriptionSetup(Duration.between(since, realtimeScheduler.now()));
            entry.setAwaitingBindingSince(null);
        }
    }

    private void onJoinTimeout(String channelName, long generation) {
        boolean stillJoining;
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            stillJoining = channel != null && channel.getGeneration() == generation
                    && channel.getStatus() == ChannelStatus.CONNECTING;
        }
        if (stillJoining) {
            onChannelFailure(channelName, generation, new TransportException(
                    "Join of " + channelName + " timed out after " + properties.getJoinTimeout().toMillis() + "ms"));
        }
    }

    private void rejoin(String channelName) {
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getStatus() != ChannelStatus.ERROR) {
                return;
            }
            rejoinLocked(channel, after);
        }
        runAll(after);
    }

    private void rejoinLocked(PooledChannel channel, List<Runnable> after) {
        channel.setReconnectTask(null);
        channel.nextGeneration();
        channel.setStatus(ChannelStatus.CONNECTING);
        String name = channel.getName();
        after.add(statusEvent(channel, ChannelStatus.ERROR, "rejoining, attempt " + channel.getReconnectAttempts()));
        after.add(() -> join(name));
    }

    private void closeChannelLocked(PooledChannel channel, int attempts, Throwable cause, List<Runnable> after) {
        ChannelClosedException failure = new ChannelClosedException(channel.getName(), attempts, cause);
        List<MessageProcessor> toNotify = processorsOn(channel);
        for (String id : channel.attachedIds()) {
            registry.markFailed(id);
        }
        channel.clearAttachments();
        channel.setStatus(ChannelStatus.CLOSED);
        channels.remove(channel.getName());

        log.error("Channel {} closed after {} failed attempts; {} subscribers notified",
                channel.getName(), attempts, toNotify.size());
        String name = channel.getName();
        after.add(() -> teardownQuietly(name));
        after.add(statusEvent(channel, ChannelStatus.ERROR, failure.getMessage()));
        for (MessageProcessor processor : toNotify) {
            after.add(() -> processor.notifyFailure(failure));
        }
    }

    private void removeDefunctChannel(String channelName, long generation, Throwable cause) {
        List<Runnable> after = new ArrayList<>();
        synchronized (this) {
            PooledChannel channel = channels.get(channelName);
            if (channel == null || channel.getGeneration() != generation) {
                return;
            }
            ChannelStatus previous = channel.getStatus();
            List<String> orphans = channel.attachedIds();
            channel.cancelTimers();
            channel.clearAttachments();
            channel.setStatus(ChannelStatus.CLOSED);
            channels.remove(channelName);
            metricsRecorder.recordError(channelName + ": " + cause.getMessage());
            after.add(() -> teardownQuietly(channelName));
            after.add(statusEvent(channel, previous, "defunct: " + cause.getMessage()));

            for (String id : orphans) {
                registry.get(id).filter(SubscriptionEntry::isActive).ifPresent(entry -> {
                    entry.setChannelName(null);
                    attachLocked(entry, after);
                });
            }
            log.info("Removed defunct channel {}; re-homed {} subscriptions", channelName, orphans.size());
        }
        runAll(after);
    }

    private List<MessageProcessor> processorsOn(PooledChannel channel) {
        List<MessageProcessor> processors = new ArrayList<>();
        for (String id : channel.attachedIds()) {
            registry.get(id).ifPresent(entry -> processors.addAll(entry.processors()));
        }
        return processors;
    }

    private TeardownReport teardown(List<PooledChannel> closing) {
        List<TeardownReport.Failure> failures = new ArrayList<>();
        for (PooledChannel channel : closing) {
            try {
                transport.unsubscribe(channel.getName());
            } catch (RuntimeException e) {
                failures.add(new TeardownReport.Failure(channel.getName(), e));
            }
        }
        for (TeardownReport.Failure failure : failures) {
            log.warn("Teardown of {} failed: {}", failure.getChannelName(), failure.getCause().getMessage());
        }
        return new TeardownReport(closing.size(), failures);
    }

    private void teardownQuietly(String channelName) {
        try {
            transport.unsubscribe(channelName);
        } catch (RuntimeException e) {
            log.warn("Dropping failed binding set on {} failed: {}", channelName, e.getMessage());
        }
    }

    private ConnectionStatus connectionStatusLocked() {
        if (channels.isEmpty()) {
            return ConnectionStatus.DISCONNECTED;
        }
        int active = 0;
        int recovering = 0;
        for (PooledChannel channel : channels.values()) {
            if (channel.getStatus() == ChannelStatus.ACTIVE) {
                active++;
            } else if (channel.getStatus() == ChannelStatus.CONNECTING || channel.getStatus() == ChannelStatus.ERROR) {
                recovering++;
            }
        }
        if (active == channels.size()) {
            return ConnectionStatus.CONNECTED;
        }
        if (active > 0) {
            return ConnectionStatus.DEGRADED;
        }
        return recovering > 0 ? ConnectionStatus.RECONNECTING : ConnectionStatus.DISCONNECTED;
    }

    private SubscriptionEntry requireEntry(String subscriptionId) {
        return registry.get(subscriptionId)
                .orElseThrow(() -> new IllegalStateException("Unknown subscription " + subscriptionId));
    }

    private Runnable statusEvent(PooledChannel channel, ChannelStatus previous, String message) {
        ChannelStatusEvent event = new ChannelStatusEvent(
                this, channel.getName(), previous, channel.getStatus(), channel.size(), message);
        return () -> applicationEventPublisher.publishEvent(event);
    }

    private static void runAll(List<Runnable> actions) {
        for (Runnable action : actions) {
            action.run();
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static void cancel(ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
    }
}
