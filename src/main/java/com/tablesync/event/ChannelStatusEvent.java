package com.tablesync.event;

import com.tablesync.domain.enums.ChannelStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every channel status transition in the pool.
 *
 * <p>{@code previousStatus} is null for a newly created channel. Listeners use it for metrics and
 * for alerting on channels that end in {@link ChannelStatus#CLOSED}.
 */
@Getter
public class ChannelStatusEvent extends ApplicationEvent {

    private final String channelName;
    private final ChannelStatus previousStatus;
    private final ChannelStatus newStatus;
    private final int subscriptionCount;
    private final String message;

    public ChannelStatusEvent(
            Object source,
            String channelName,
            ChannelStatus previousStatus,
            ChannelStatus newStatus,
            int subscriptionCount,
            String message) {
        super(source);
        this.channelName = channelName;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.subscriptionCount = subscriptionCount;
        this.message = message;
    }
}
