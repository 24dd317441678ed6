package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.dto.request.CreateDomainRequest;
import com.company.uptime.dto.request.UpdateDomainRequest;
import com.company.uptime.exception.DuplicateSubjectException;
import com.company.uptime.exception.SubjectAccessDeniedException;
import com.company.uptime.exception.SubjectNotFoundException;
import com.company.uptime.repository.CheckResultRepository;
import com.company.uptime.repository.DomainRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Domain expiry tracking CRUD. Domain names are stored lower-cased and are unique across users.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DomainService {

    private final DomainRepository domainRepository;
    private final CheckResultRepository checkResultRepository;
    private final SchedulerOrchestrator orchestrator;
    private final UptimeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Domain addDomain(CreateDomainRequest request, String userId) {
        String domainName = SubjectRef.normalizeDomain(request.getDomainName());
        Instant now = clock.instant();

        Domain domain = Domain.builder()
                .domainName(domainName)
                .userId(userId)
                .checkIntervalSeconds(request.getCheckIntervalSeconds() != null
                        ? request.getCheckIntervalSeconds()
                        : properties.getScheduler().getDefaultDomainIntervalSeconds())
                .active(true)
                .enableExpiryAlerts(request.getEnableExpiryAlerts() == null || request.getEnableExpiryAlerts())
                .alertDaysBefore(request.getAlertDaysBefore() != null
                        ? request.getAlertDaysBefore()
                        : properties.getScheduler().getExpiryAlertDays())
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            domainRepository.save(domain);
        } catch (DuplicateKeyException e) {
            throw new DuplicateSubjectException(domain.getRef().key());
        }
        log.info("Added domain {} for user {}", domainName, userId);

        orchestrator.onSubjectCreated(domain);
        meterRegistry.counter("subjects.created", "type", "domain").increment();
        return domain;
    }

    public Domain updateDomain(String domainName, UpdateDomainRequest request, String userId) {
        Domain domain = getDomain(domainName, userId);
        Set<String> changed = new HashSet<>();

        if (request.getCheckIntervalSeconds() != null
                && !Objects.equals(request.getCheckIntervalSeconds(), domain.getCheckIntervalSeconds())) {
            domain.setCheckIntervalSeconds(request.getCheckIntervalSeconds());
            changed.add(SchedulerOrchestrator.FIELD_CHECK_INTERVAL);
        }
        if (request.getEnableExpiryAlerts() != null) {
            domain.setEnableExpiryAlerts(request.getEnableExpiryAlerts());
        }
        if (request.getAlertDaysBefore() != null) {
            domain.setAlertDaysBefore(request.getAlertDaysBefore());
        }
        if (request.getActive() != null && !request.getActive().equals(domain.getActive())) {
            domain.setActive(request.getActive());
            changed.add(SchedulerOrchestrator.FIELD_ACTIVE);
        }

        domain.setUpdatedAt(clock.instant());
        domainRepository.update(domain);
        log.info("Updated domain {} (changed: {})", domain.getDomainName(), changed);

        orchestrator.onSubjectUpdated(domain, changed);
        return domain;
    }

    public void removeDomain(String domainName, String userId) {
        Domain domain = getDomain(domainName, userId);

        domainRepository.deleteByName(domain.getDomainName());
        checkResultRepository.deleteBySubject(domain.getRef().key());
        log.info("Removed domain {} for user {}", domain.getDomainName(), userId);

        orchestrator.onSubjectDeleted(domain.getRef());
        meterRegistry.counter("subjects.deleted", "type", "domain").increment();
    }

    public Domain getDomain(String domainName, String userId) {
        SubjectRef ref = SubjectRef.domain(domainName);
        Domain domain = domainRepository.findByName(ref.getId())
                .orElseThrow(() -> new SubjectNotFoundException(ref.key()));

        if (!domain.getUserId().equals(userId)) {
            throw new SubjectAccessDeniedException(ref.key(), userId);
        }
        return domain;
    }

    public List<Domain> listDomains(String userId) {
        return domainRepository.findByUserId(userId);
    }

    public List<Domain> findExpiring(int days, String userId) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        return domainRepository.findExpiring(userId, days);
    }

    public List<CheckResult> recentResults(String domainName, String userId, int limit) {
        Domain domain = getDomain(domainName, userId);
        return checkResultRepository.findRecent(domain.getRef().key(), limit);
    }
}
