package com.tablesync.api.controller;

import com.tablesync.api.dto.response.RealtimeHealthResponse;
import com.tablesync.domain.model.ConnectionMetrics;
import com.tablesync.exception.InvalidSubscriptionException;
import com.tablesync.realtime.ChannelPoolManager;
import com.tablesync.realtime.RealtimeService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for the real-time layer.
 *
 * <ul>
 *   <li>GET /api/realtime/health -- pool status, health score, metrics and channels</li>
 *   <li>POST /api/realtime/reconnect -- rejoin channels in ERROR without waiting for backoff</li>
 *   <li>GET /api/realtime/subscriptions?table=&amp;predicate= -- whether a subscription is active</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/realtime")
public class RealtimeHealthController {

    private final RealtimeService realtimeService;
    private final ChannelPoolManager channelPoolManager;

    public RealtimeHealthController(RealtimeService realtimeService, ChannelPoolManager channelPoolManager) {
        this.realtimeService = realtimeService;
        this.channelPoolManager = channelPoolManager;
    }

    @GetMapping("/health")
    public ResponseEntity<RealtimeHealthResponse> health() {
        ConnectionMetrics metrics = realtimeService.getConnectionHealth();
        return ResponseEntity.ok(RealtimeHealthResponse.builder()
                .status(metrics.getStatus())
                .healthScore(metrics.healthScore())
                .stable(metrics.isStable())
                .metrics(metrics)
                .channels(channelPoolManager.getChannels())
                .build());
    }

    @PostMapping("/reconnect")
    public ResponseEntity<Map<String, Integer>> reconnect() {
        return ResponseEntity.accepted().body(Map.of("rejoining", realtimeService.reconnect()));
    }

    @GetMapping("/subscriptions")
    public ResponseEntity<Map<String, Object>> isSubscribed(
            @RequestParam(required = false) String table, @RequestParam(required = false) String predicate) {
        if (table == null || table.isBlank()) {
            throw new InvalidSubscriptionException("Query parameter 'table' is required");
        }
        return ResponseEntity.ok(Map.of("table", table, "subscribed", realtimeService.isSubscribed(table, predicate)));
    }
}
