package com.tablesync.realtime;

import com.tablesync.domain.enums.ChannelStatus;
import java.time.Instant;
import lombok.Value;

/** Read-only view of one pooled channel. */
@Value
public class ChannelSnapshot {

    String name;
    ChannelStatus status;
    int subscriptionCount;
    int reconnectAttempts;
    Instant lastActivity;
    Instant emptySince;
}
