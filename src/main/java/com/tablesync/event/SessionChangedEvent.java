package com.tablesync.event;

import com.tablesync.domain.model.RealtimeSession;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the session holder whenever the authenticated session changes.
 *
 * <p>Either session may be null: {@code previousSession} on first sign-in, {@code currentSession}
 * on sign-out. The main listener is {@link com.tablesync.session.SessionGate}.
 */
public class SessionChangedEvent extends ApplicationEvent {

    private final SessionChangeType changeType;
    private final RealtimeSession previousSession;
    private final RealtimeSession currentSession;
    private final Instant occurredAt;

    public SessionChangedEvent(
            Object source, RealtimeSession previousSession, RealtimeSession currentSession, Instant occurredAt) {
        super(source);
        this.previousSession = previousSession;
        this.currentSession = currentSession;
        this.changeType = classify(previousSession, currentSession);
        this.occurredAt = occurredAt;
    }

    public SessionChangeType getChangeType() {
        return changeType;
    }

    public RealtimeSession getPreviousSession() {
        return previousSession;
    }

    public RealtimeSession getCurrentSession() {
        return currentSession;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    static SessionChangeType classify(RealtimeSession previous, RealtimeSession current) {
        if (current == null) {
            return SessionChangeType.SIGNED_OUT;
        }
        if (previous == null) {
            return SessionChangeType.SIGNED_IN;
        }
        return current.sameScopeAs(previous) ? SessionChangeType.REFRESHED : SessionChangeType.SCOPE_CHANGED;
    }
}
