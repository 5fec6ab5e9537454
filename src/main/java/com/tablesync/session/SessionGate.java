package com.tablesync.session;

import com.tablesync.config.RealtimeProperties;
import com.tablesync.domain.model.RealtimeSession;
import com.tablesync.event.SessionChangedEvent;
import com.tablesync.realtime.ChannelPoolManager;
import com.tablesync.realtime.Registration;
import com.tablesync.realtime.RoleFilter;
import com.tablesync.realtime.SubscriptionConfig;
import com.tablesync.realtime.Unsubscribe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Holds subscriptions back until there is an authenticated session, and re-scopes them when the
 * session's identity or role changes.
 *
 * <p>Lifecycle of a gated subscription:
 * <ul>
 *   <li>No session: queued, nothing reaches the transport.</li>
 *   <li>Session present: activated with the role filter applied, unless the config carries an
 *       explicit predicate or opts out of role filtering.</li>
 *   <li>Identity or role changes: torn down (pending batches flushed) and activated again with the
 *       new role filter.</li>
 *   <li>Sign-out: torn down and queued again.</li>
 * </ul>
 *
 * <p>Lock order is gate first, then pool. The pool never calls back into the gate.
 */
@Service
public class SessionGate {

    private static final Logger log = LoggerFactory.getLogger(SessionGate.class);

    private final ChannelPoolManager channelPoolManager;
    private final RoleFilter roleFilter;
    private final RealtimeProperties properties;

    private final Map<Long, GatedSubscription> subscriptions = new LinkedHashMap<>();
    private final AtomicLong handleSequence = new AtomicLong();

    private RealtimeSession activeSession;

    public SessionGate(
            ChannelPoolManager channelPoolManager,
            RoleFilter roleFilter,
            SessionProvider sessionProvider,
            RealtimeProperties properties) {
        this.channelPoolManager = channelPoolManager;
        this.roleFilter = roleFilter;
        this.properties = properties;
        this.activeSession = sessionProvider.getSession().orElse(null);
    }

    /**
     * Subscribes now if a session exists (or gating is off), otherwise queues the subscription
     * until one does. The returned handle works in either state.
     */
    public Unsubscribe subscribe(SubscriptionConfig config) {
        long handle = handleSequence.incrementAndGet();
        GatedSubscription gated = new GatedSubscription(config);
        synchronized (this) {
            subscriptions.put(handle, gated);
            if (canActivate()) {
                activate(gated);
            } else {
                log.info("No session yet; queued subscription to {} ({} queued)", config.getTable(), pendingCount());
            }
        }
        return () -> cancel(handle);
    }

    @EventListener
    public void onSessionChanged(SessionChangedEvent event) {
        RealtimeSession next = event.getCurrentSession();
        synchronized (this) {
            RealtimeSession previous = activeSession;
            activeSession = next;
            if (!properties.isSessionGatingEnabled()) {
                return;
            }
            if (next == null) {
                if (previous != null) {
                    int deactivated = deactivateAll();
                    log.info("Session ended; {} subscriptions queued until next sign-in", deactivated);
                }
                return;
            }
            if (previous == null) {
                int activated = activatePending();
                log.info("Session started for {} ({}); activated {} queued subscriptions",
                        next.getIdentity(), next.staffRole(), activated);
                return;
            }
            if (!next.sameScopeAs(previous)) {
                deactivateAll();
                int activated = activatePending();
                log.info("Session scope changed from {}/{} to {}/{}; re-subscribed {} subscriptions",
                        previous.getIdentity(), previous.staffRole(), next.getIdentity(), next.staffRole(), activated);
            }
        }
    }

    public synchronized int pendingCount() {
        int count = 0;
        for (GatedSubscription gated : subscriptions.values()) {
            if (gated.registration == null) {
                count++;
            }
        }
        return count;
    }

    public synchronized int activeCount() {
        return subscriptions.size() - pendingCount();
    }

    /** The predicate {@code config} would be bound with under the current session. */
    public synchronized String effectivePredicate(SubscriptionConfig config) {
        return effectiveConfig(config).getPredicate();
    }

    /** Drops every gated subscription, active or queued. Used on full disconnect. */
    public synchronized void clear() {
        subscriptions.clear();
    }

    private synchronized void cancel(long handle) {
        GatedSubscription gated = subscriptions.remove(handle);
        if (gated != null && gated.registration != null) {
            Registration registration = gated.registration;
            gated.registration = null;
            channelPoolManager.release(registration.getSubscriptionId(), registration.getListenerId());
        }
    }

    private boolean canActivate() {
        return !properties.isSessionGatingEnabled() || activeSession != null;
    }

    private void activate(GatedSubscription gated) {
        gated.registration = channelPoolManager.activate(effectiveConfig(gated.config));
    }

    private int activatePending() {
        int activated = 0;
        for (GatedSubscription gated : new ArrayList<>(subscriptions.values())) {
            if (gated.registration == null) {
                activate(gated);
                activated++;
            }
        }
        return activated;
    }

    private int deactivateAll() {
        List<Registration> released = new ArrayList<>();
        for (GatedSubscription gated : subscriptions.values()) {
            if (gated.registration != null) {
                released.add(gated.registration);
                gated.registration = null;
            }
        }
        for (Registration registration : released) {
            channelPoolManager.release(registration.getSubscriptionId(), registration.getListenerId());
        }
        return released.size();
    }

    private SubscriptionConfig effectiveConfig(SubscriptionConfig config) {
        if (!properties.isSessionGatingEnabled()
                || activeSession == null
                || config.getPredicate() != null
                || !config.isRoleFiltered()) {
            return config;
        }
        return roleFilter.filterFor(config.getTable(), activeSession.staffRole(), activeSession.getIdentity())
                .map(config::withPredicate)
                .orElse(config);
    }

    private static final class GatedSubscription {

        private final SubscriptionConfig config;

        /** Null while queued. */
        private Registration registration;

        private GatedSubscription(SubscriptionConfig config) {
            this.config = config;
        }
    }
}
