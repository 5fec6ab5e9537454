package com.tablesync.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.tablesync.domain.model.RealtimeSession;
import com.tablesync.event.SessionChangeType;
import com.tablesync.event.SessionChangedEvent;
import com.tablesync.session.SessionHolder;
import com.tablesync.support.ManualScheduler;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link SessionHolder} event publishing.
 */
class SessionHolderTest {

    private ApplicationEventPublisher applicationEventPublisher;
    private ManualScheduler scheduler;
    private SessionHolder sessionHolder;

    @BeforeEach
    void setUp() {
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        scheduler = new ManualScheduler();
        sessionHolder = new SessionHolder(applicationEventPublisher, scheduler);
    }

    private SessionChangedEvent lastEvent() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return (SessionChangedEvent) captor.getValue();
    }

    @Test
    @DisplayName("First update is a sign-in")
    void firstUpdateSignsIn() {
        sessionHolder.update(new RealtimeSession("u1", "cook"));

        assertThat(sessionHolder.getSession()).isPresent();
        assertThat(lastEvent().getChangeType()).isEqualTo(SessionChangeType.SIGNED_IN);
    }

    @Test
    @DisplayName("Role change is a scope change carrying both sessions")
    void roleChangeIsScopeChange() {
        sessionHolder.update(new RealtimeSession("u1", "cook"));
        sessionHolder.update(new RealtimeSession("u1", "admin"));

        SessionChangedEvent event = lastEvent();
        assertThat(event.getChangeType()).isEqualTo(SessionChangeType.SCOPE_CHANGED);
        assertThat(event.getPreviousSession().getRole()).isEqualTo("cook");
        assertThat(event.getCurrentSession().getRole()).isEqualTo("admin");
    }

    @Test
    @DisplayName("A session without identity replacing one with identity is a scope change")
    void missingIdentityIsScopeChange() {
        sessionHolder.update(new RealtimeSession("u1", "server"));
        sessionHolder.update(new RealtimeSession(null, "cook"));

        SessionChangedEvent event = lastEvent();
        assertThat(event.getChangeType()).isEqualTo(SessionChangeType.SCOPE_CHANGED);
        assertThat(event.getCurrentSession().getIdentity()).isNull();
    }

    @Test
    @DisplayName("Two sessions without identity and with the same role are a refresh")
    void missingIdentityOnBothSidesIsRefresh() {
        sessionHolder.update(new RealtimeSession(null, "cook"));
        sessionHolder.update(new RealtimeSession(null, "cook"));

        assertThat(lastEvent().getChangeType()).isEqualTo(SessionChangeType.REFRESHED);
    }

    @Test
    @DisplayName("Events are stamped with the scheduler's clock")
    void occurredAtUsesSchedulerClock() {
        scheduler.advance(Duration.ofMinutes(5));

        sessionHolder.update(new RealtimeSession("u1", "cook"));

        assertThat(lastEvent().getOccurredAt()).isEqualTo(scheduler.now());
    }

    @Test
    @DisplayName("Same identity and role is a refresh")
    void sameScopeIsRefresh() {
        sessionHolder.update(new RealtimeSession("u1", "cook"));
        sessionHolder.update(new RealtimeSession("u1", "cook"));

        assertThat(lastEvent().getChangeType()).isEqualTo(SessionChangeType.REFRESHED);
    }

    @Test
    @DisplayName("Clear signs out, and clearing again publishes nothing")
    void clearSignsOut() {
        sessionHolder.update(new RealtimeSession("u1", "cook"));
        sessionHolder.clear();

        assertThat(lastEvent().getChangeType()).isEqualTo(SessionChangeType.SIGNED_OUT);
        assertThat(sessionHolder.getSession()).isEmpty();
    }

    @Test
    @DisplayName("Clearing without a session publishes nothing")
    void clearWithoutSession() {
        sessionHolder.clear();

        verify(applicationEventPublisher, never()).publishEvent(any(ApplicationEvent.class));
    }
}
