package com.tablesync.api.dto.response;

import com.tablesync.domain.enums.ConnectionStatus;
import com.tablesync.domain.model.ConnectionMetrics;
import com.tablesync.realtime.ChannelSnapshot;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Body of GET /api/realtime/health: the pool's aggregate status, score and stability, the full
 * metrics snapshot, and one line per channel.
 */
@Getter
@Builder
public class RealtimeHealthResponse {

    private final ConnectionStatus status;
    private final int healthScore;
    private final boolean stable;
    private final ConnectionMetrics metrics;
    private final List<ChannelSnapshot> channels;
}
