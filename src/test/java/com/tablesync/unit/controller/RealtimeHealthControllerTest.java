package com.tablesync.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tablesync.api.controller.RealtimeHealthController;
import com.tablesync.domain.enums.ChannelStatus;
import com.tablesync.domain.enums.ConnectionStatus;
import com.tablesync.domain.model.ConnectionMetrics;
import com.tablesync.exception.GlobalExceptionHandler;
import com.tablesync.realtime.ChannelPoolManager;
import com.tablesync.realtime.ChannelSnapshot;
import com.tablesync.realtime.RealtimeService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RealtimeHealthController.
 */
@ExtendWith(MockitoExtension.class)
class RealtimeHealthControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RealtimeService realtimeService;

    @Mock
    private ChannelPoolManager channelPoolManager;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RealtimeHealthController(realtimeService, channelPoolManager))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/realtime/health returns status, score, stability, metrics and channels")
    void health() throws Exception {
        when(realtimeService.getConnectionHealth()).thenReturn(ConnectionMetrics.builder()
                .status(ConnectionStatus.CONNECTED)
                .activeChannels(1)
                .totalChannels(1)
                .activeSubscriptions(1)
                .messagesReceived(42)
                .channelUtilization(0.05)
                .averageSubscriptionSetupMs(12.5)
                .averageMessageProcessingMs(0.75)
                .build());
        when(channelPoolManager.getChannels()).thenReturn(List.of(new ChannelSnapshot(
                "realtime-pool-1", ChannelStatus.ACTIVE, 1, 0, Instant.parse("2025-01-01T12:00:00Z"), null)));

        mockMvc.perform(get("/api/realtime/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONNECTED"))
                .andExpect(jsonPath("$.healthScore").value(90))
                .andExpect(jsonPath("$.stable").value(true))
                .andExpect(jsonPath("$.metrics.messagesReceived").value(42))
                .andExpect(jsonPath("$.metrics.averageSubscriptionSetupMs").value(12.5))
                .andExpect(jsonPath("$.metrics.averageMessageProcessingMs").value(0.75))
                .andExpect(jsonPath("$.channels[0].name").value("realtime-pool-1"))
                .andExpect(jsonPath("$.channels[0].status").value("ACTIVE"));
    }

    @Test
    @DisplayName("POST /api/realtime/reconnect returns 202 with the number of channels rejoining")
    void reconnect() throws Exception {
        when(realtimeService.reconnect()).thenReturn(2);

        mockMvc.perform(post("/api/realtime/reconnect"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.rejoining").value(2));
    }

    @Test
    @DisplayName("GET /api/realtime/subscriptions reports whether the table is subscribed")
    void subscriptionQuery() throws Exception {
        when(realtimeService.isSubscribed("orders", "server_id=eq.7")).thenReturn(true);

        mockMvc.perform(get("/api/realtime/subscriptions")
                        .param("table", "orders")
                        .param("predicate", "server_id=eq.7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.table").value("orders"))
                .andExpect(jsonPath("$.subscribed").value(true));
    }

    @Test
    @DisplayName("GET /api/realtime/subscriptions without a table is a 400 INVALID_SUBSCRIPTION")
    void subscriptionQueryWithoutTable() throws Exception {
        mockMvc.perform(get("/api/realtime/subscriptions").param("table", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SUBSCRIPTION"))
                .andExpect(jsonPath("$.path").value("/api/realtime/subscriptions"));
    }
}
