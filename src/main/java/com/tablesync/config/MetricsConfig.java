package com.tablesync.config;

import com.tablesync.domain.enums.ChannelStatus;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer filters for the {@code realtime.*} meters. Spring Boot applies every
 * {@link MeterFilter} bean to the registries it creates, before any meter is registered.
 * Meter definitions live in {@link com.tablesync.observability.RealtimeMetricsService}.
 */
@Configuration
public class MetricsConfig {

    static final String APPLICATION = "tablesync";
    static final String TRANSITIONS_METER = "realtime.channel.transitions";

    /** Tags every meter with the application name so dashboards can tell this service apart. */
    @Bean
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", APPLICATION)));
    }

    /**
     * Caps the {@code status} tag of the transition counter at the number of channel statuses.
     * Anything beyond that is a bug upstream and is dropped rather than growing the registry.
     */
    @Bean
    public MeterFilter channelTransitionTagLimit() {
        return MeterFilter.maximumAllowableTags(
                TRANSITIONS_METER, "status", ChannelStatus.values().length, MeterFilter.deny());
    }
}
