package com.tablesync.domain.enums;

import java.util.Locale;

/**
 * Roles carried by the authenticated session. Used only to shrink change-feed traffic;
 * access control is enforced by the backend.
 */
public enum StaffRole {
    ADMIN,
    COOK,
    SERVER,
    RESIDENT,

    /** Anything the session reports that this service does not know about. */
    UNKNOWN;

    public static StaffRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
