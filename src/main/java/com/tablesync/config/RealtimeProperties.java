package com.tablesync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for the channel pool, reconnection, batching and optimistic reconciliation.
 *
 * <p>Binds to the {@code tablesync.realtime.*} prefix in application.properties. Defaults
 * match production; tests construct this class directly and override what they need.
 */
@Validated
@ConfigurationProperties(prefix = "tablesync.realtime")
@Getter
@Setter
public class RealtimeProperties {

    /** Hard cap on physical channels in the pool. */
    @Min(1)
    private int maxChannels = 10;

    /** Nominal subscriptions per channel. Exceeded only by forced reuse when the pool is full. */
    @Min(1)
    private int maxSubscriptionsPerChannel = 20;

    /** How often every ACTIVE channel is pinged. */
    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /** How long a join (or ping) may take before it counts as a failure. */
    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(5);

    /** How long a channel may sit with no subscriptions before it is torn down. */
    @NotNull
    private Duration idleTimeout = Duration.ofMinutes(5);

    /** How often idle channels are swept. */
    @NotNull
    private Duration cleanupInterval = Duration.ofSeconds(60);

    /** Consecutive failed attempts after which a channel is closed for good. */
    @Min(0)
    private int maxReconnectAttempts = 10;

    /** How long an optimistic patch may wait for its authoritative event before rollback. */
    @NotNull
    private Duration optimisticPatchTimeout = Duration.ofSeconds(10);

    /** When false, subscriptions activate immediately and no role filter is applied. */
    private boolean sessionGatingEnabled = true;

    /** Which transport bean to use. Only "loopback" ships with this service. */
    private String transport = "loopback";

    @Valid
    private Backoff backoff = new Backoff();

    @Valid
    private Sync sync = new Sync();

    @Getter
    @Setter
    public static class Backoff {

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        /** Upper bound (exclusive) of the uniform jitter added to every delay. */
        @NotNull
        private Duration maxJitter = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Sync {

        /** Whether the optimistic state store follows the sync tables on startup. */
        private boolean enabled = true;

        /** Tables mirrored into the optimistic state store. */
        private List<String> tables = new ArrayList<>(List.of("orders", "kds_order_routing", "tables"));
    }
}
