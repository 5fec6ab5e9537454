package com.tablesync.unit.realtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.tablesync.domain.enums.StaffRole;
import com.tablesync.realtime.RoleFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RoleFilter}.
 */
class RoleFilterTest {

    private final RoleFilter roleFilter = new RoleFilter();

    @Test
    @DisplayName("Cook on orders sees only orders still in preparation")
    void cookOnOrders() {
        assertThat(roleFilter.filterFor("orders", "cook", "u1"))
                .contains("status=in.(pending,confirmed,preparing)");
    }

    @Test
    @DisplayName("Server on orders sees only their own orders")
    void serverOnOrders() {
        assertThat(roleFilter.filterFor("orders", StaffRole.SERVER, "u42")).contains("server_id=eq.u42");
    }

    @Test
    @DisplayName("Server without identity falls back to no filter")
    void serverWithoutIdentity() {
        assertThat(roleFilter.filterFor("orders", "server", " ")).isEmpty();
    }

    @Test
    @DisplayName("Admin is never filtered")
    void adminUnfiltered() {
        assertThat(roleFilter.filterFor("orders", "admin", "u1")).isEmpty();
    }

    @Test
    @DisplayName("Other tables are not filtered for any role")
    void otherTablesUnfiltered() {
        assertThat(roleFilter.filterFor("kds_order_routing", "cook", "u1")).isEmpty();
        assertThat(roleFilter.filterFor("tables", "server", "u1")).isEmpty();
    }

    @Test
    @DisplayName("Unknown roles fail open")
    void unknownRoleFailsOpen() {
        assertThat(roleFilter.filterFor("orders", "sommelier", "u1")).isEmpty();
        assertThat(roleFilter.filterFor("orders", (String) null, "u1")).isEmpty();
    }
}
