package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.Domain;
import com.company.uptime.dto.request.CreateDomainRequest;
import com.company.uptime.dto.request.UpdateDomainRequest;
import com.company.uptime.exception.DuplicateSubjectException;
import com.company.uptime.repository.CheckResultRepository;
import com.company.uptime.repository.DomainRepository;
import com.company.uptime.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DomainServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DomainRepository domainRepository;

    @Mock
    private CheckResultRepository checkResultRepository;

    @Mock
    private SchedulerOrchestrator orchestrator;

    private DomainService service;

    @BeforeEach
    void setUp() {
        service = new DomainService(domainRepository, checkResultRepository, orchestrator,
                new UptimeProperties(), new SimpleMeterRegistry(), new MutableClock(NOW));
    }

    @Test
    @DisplayName("should normalize the name, apply defaults and schedule the domain")
    void shouldAddDomain() {
        Domain added = service.addDomain(CreateDomainRequest.builder().domainName(" Example.COM ").build(), "user-1");

        assertThat(added.getDomainName()).isEqualTo("example.com");
        assertThat(added.getCheckIntervalSeconds()).isEqualTo(3600);
        assertThat(added.getAlertDaysBefore()).isEqualTo(30);
        assertThat(added.getEnableExpiryAlerts()).isTrue();
        verify(orchestrator).onSubjectCreated(added);
    }

    @Test
    @DisplayName("should reject a domain that is already tracked")
    void shouldRejectDuplicate() {
        when(domainRepository.save(any())).thenThrow(new DuplicateKeyException("domains_pkey"));

        assertThatThrownBy(() -> service.addDomain(
                CreateDomainRequest.builder().domainName("example.com").build(), "user-1"))
                .isInstanceOf(DuplicateSubjectException.class)
                .hasMessage("Subject already exists: domain:example.com");
        verify(orchestrator, never()).onSubjectCreated(any());
    }

    @Test
    @DisplayName("should re-register when the interval changes")
    void shouldReportIntervalChange() {
        Domain existing = Domain.builder()
                .domainName("example.com")
                .userId("user-1")
                .checkIntervalSeconds(3600)
                .active(true)
                .build();
        when(domainRepository.findByName("example.com")).thenReturn(Optional.of(existing));

        Domain updated = service.updateDomain("example.com",
                UpdateDomainRequest.builder().checkIntervalSeconds(900).build(), "user-1");

        assertThat(updated.getCheckIntervalSeconds()).isEqualTo(900);
        verify(orchestrator).onSubjectUpdated(updated, Set.of(SchedulerOrchestrator.FIELD_CHECK_INTERVAL));
    }

    @Test
    @DisplayName("should list the caller's expiring domains within the requested window")
    void shouldFindExpiring() {
        Domain expiring = Domain.builder().domainName("example.com").userId("user-1").lastDaysUntilExpiry(12).build();
        when(domainRepository.findExpiring("user-1", 30)).thenReturn(List.of(expiring));

        assertThat(service.findExpiring(30, "user-1")).containsExactly(expiring);
    }

    @Test
    @DisplayName("should reject a negative expiry window")
    void shouldRejectNegativeWindow() {
        assertThatThrownBy(() -> service.findExpiring(-1, "user-1"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(domainRepository, never()).findExpiring(any(), anyInt());
    }
}
