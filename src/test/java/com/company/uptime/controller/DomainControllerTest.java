package com.company.uptime.controller;

import com.company.uptime.domain.Domain;
import com.company.uptime.domain.enums.ScheduleState;
import com.company.uptime.exception.GlobalExceptionHandler;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.DomainService;
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

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DomainControllerTest {

    @Mock
    private DomainService domainService;

    @Mock
    private SchedulerOrchestrator orchestrator;

    @Mock
    private UserContext userContext;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DomainController controller = new DomainController(domainService, orchestrator, userContext,
                new SimpleMeterRegistry());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        when(userContext.getCurrentUserId()).thenReturn("user-1");
    }

    private static Domain expiring(String name, int daysLeft) {
        return Domain.builder()
                .domainName(name)
                .userId("user-1")
                .checkIntervalSeconds(3600)
                .active(true)
                .lastDaysUntilExpiry(daysLeft)
                .expiringSoon(true)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("should list expiring domains with the default window")
    void shouldListExpiringWithDefaultWindow() throws Exception {
        when(orchestrator.stateOf(any())).thenReturn(ScheduleState.SCHEDULED);
        when(domainService.findExpiring(30, "user-1"))
                .thenReturn(List.of(expiring("soon.com", 3), expiring("later.com", 20)));

        mockMvc.perform(get("/api/v1/domains/expiring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].domainName").value("soon.com"))
                .andExpect(jsonPath("$[0].daysUntilExpiry").value(3));
    }

    @Test
    @DisplayName("should pass the requested window through")
    void shouldUseRequestedWindow() throws Exception {
        when(domainService.findExpiring(7, "user-1")).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/domains/expiring").param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
