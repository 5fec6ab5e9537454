package com.tablesync.realtime;

import com.tablesync.domain.enums.StaffRole;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps a caller's role and identity to a server-side predicate that trims change-feed traffic
 * to the rows that caller actually looks at.
 *
 * <p>Policy:
 * <ul>
 *   <li>SERVER on {@code orders}: only their own orders ({@code server_id=eq.<identity>})</li>
 *   <li>COOK on {@code orders}: only orders still being prepared
 *       ({@code status=in.(pending,confirmed,preparing)})</li>
 *   <li>ADMIN: unrestricted</li>
 *   <li>Anything else: unrestricted</li>
 * </ul>
 *
 * <p>This is a bandwidth optimisation, not a security boundary. Unknown roles fail open because
 * the backend enforces row access on its own.
 */
@Component
public class RoleFilter {

    static final String ORDERS_TABLE = "orders";

    /** Order statuses a kitchen still acts on. */
    static final List<String> ACTIVE_PREPARATION_STATUSES = List.of("pending", "confirmed", "preparing");

    public Optional<String> filterFor(String table, String role, String identity) {
        return filterFor(table, StaffRole.fromValue(role), identity);
    }

    public Optional<String> filterFor(String table, StaffRole role, String identity) {
        if (table == null || role == null) {
            return Optional.empty();
        }

        return switch (role) {
            case SERVER -> ORDERS_TABLE.equals(table) && identity != null && !identity.isBlank()
                    ? Optional.of("server_id=eq." + identity)
                    : Optional.empty();
            case COOK -> ORDERS_TABLE.equals(table)
                    ? Optional.of("status=in.(" + String.join(",", ACTIVE_PREPARATION_STATUSES) + ")")
                    : Optional.empty();
            case ADMIN, RESIDENT, UNKNOWN -> Optional.empty();
        };
    }
}
