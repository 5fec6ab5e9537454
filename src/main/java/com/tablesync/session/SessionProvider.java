package com.tablesync.session;

import com.tablesync.domain.model.RealtimeSession;
import java.util.Optional;

/**
 * Source of the current authenticated session. Changes are announced with
 * {@link com.tablesync.event.SessionChangedEvent}.
 */
public interface SessionProvider {

    Optional<RealtimeSession> getSession();
}
