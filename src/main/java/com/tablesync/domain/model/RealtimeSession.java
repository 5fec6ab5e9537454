package com.tablesync.domain.model;

import com.tablesync.domain.enums.StaffRole;
import java.util.Objects;
import lombok.Value;

/**
 * The authenticated caller, as far as the real-time layer cares: who they are and what role
 * they act in. Issued by the authentication layer; treated here as opaque.
 */
@Value
public class RealtimeSession {

    String identity;
    String role;

    public StaffRole staffRole() {
        return StaffRole.fromValue(role);
    }

    /**
     * True if both identity and role are the same, i.e. existing role filters are still valid.
     * A missing identity only matches another missing identity.
     */
    public boolean sameScopeAs(RealtimeSession other) {
        return other != null && Objects.equals(identity, other.identity) && staffRole() == other.staffRole();
    }
}
