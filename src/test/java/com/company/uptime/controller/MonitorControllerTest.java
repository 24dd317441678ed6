package com.company.uptime.controller;

import com.company.uptime.dto.response.MonitorStatsResponse;
import com.company.uptime.exception.GlobalExceptionHandler;
import com.company.uptime.exception.SubjectAccessDeniedException;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.MonitorService;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MonitorControllerTest {

    @Mock
    private MonitorService monitorService;

    @Mock
    private SchedulerOrchestrator orchestrator;

    @Mock
    private UserContext userContext;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MonitorController controller = new MonitorController(monitorService, orchestrator, userContext,
                new SimpleMeterRegistry());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        when(userContext.getCurrentUserId()).thenReturn("user-1");
    }

    @Test
    @DisplayName("should return monitor statistics for the caller")
    void shouldReturnStats() throws Exception {
        when(monitorService.getStats("42", "user-1")).thenReturn(MonitorStatsResponse.builder()
                .monitorId("42")
                .totalChecks(10L)
                .uptimePercentage(80.0)
                .last24HoursChecks(4)
                .last24HoursUptime(75)
                .averageResponseTimeMs(250)
                .recentResults(List.of())
                .build());

        mockMvc.perform(get("/api/v1/monitors/42/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.monitorId").value("42"))
                .andExpect(jsonPath("$.last24HoursUptime").value(75))
                .andExpect(jsonPath("$.averageResponseTimeMs").value(250));
    }

    @Test
    @DisplayName("should refuse statistics of another user's monitor")
    void shouldRefuseForeignStats() throws Exception {
        when(monitorService.getStats("42", "user-1"))
                .thenThrow(new SubjectAccessDeniedException("monitor:42", "user-1"));

        mockMvc.perform(get("/api/v1/monitors/42/stats"))
                .andExpect(status().isForbidden());
    }
}
