package com.tablesync.session;

import com.tablesync.domain.model.RealtimeSession;
import com.tablesync.event.SessionChangedEvent;
import com.tablesync.realtime.RealtimeScheduler;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * In-memory {@link SessionProvider}. The authentication layer calls {@link #update} on sign-in
 * and refresh and {@link #clear} on sign-out; every call publishes a {@link SessionChangedEvent}
 * stamped with the scheduler's clock.
 */
@Component
public class SessionHolder implements SessionProvider {

    private static final Logger log = LoggerFactory.getLogger(SessionHolder.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final RealtimeScheduler scheduler;
    private final AtomicReference<RealtimeSession> current = new AtomicReference<>();

    public SessionHolder(ApplicationEventPublisher applicationEventPublisher, RealtimeScheduler scheduler) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.scheduler = scheduler;
    }

    @Override
    public Optional<RealtimeSession> getSession() {
        return Optional.ofNullable(current.get());
    }

    public void update(RealtimeSession session) {
        if (session == null) {
            clear();
            return;
        }
        publishTransition(current.getAndSet(session), session);
    }

    public void clear() {
        RealtimeSession previous = current.getAndSet(null);
        if (previous != null) {
            publishTransition(previous, null);
        }
    }

    private void publishTransition(RealtimeSession previous, RealtimeSession next) {
        SessionChangedEvent event = new SessionChangedEvent(this, previous, next, scheduler.now());
        log.info("Session {}: identity={}, role={}",
                event.getChangeType(),
                next != null ? next.getIdentity() : previous.getIdentity(),
                next != null ? next.getRole() : previous.getRole());
        applicationEventPublisher.publishEvent(event);
    }
}
