package com.company.uptime.service;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.repository.CheckResultRepository;
import com.company.uptime.repository.DomainRepository;
import com.company.uptime.repository.MonitorRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Persists results, rolls them up into the subject's status and counters, then hands the
 * transition to {@link AlertNotificationService}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubjectStatusResultSink implements ResultSink {

    private final CheckResultRepository checkResultRepository;
    private final MonitorRepository monitorRepository;
    private final DomainRepository domainRepository;
    private final AlertNotificationService alertNotificationService;
    private final MeterRegistry meterRegistry;

    @Override
    public void recordResult(SubjectRef ref, CheckResult result) {
        checkResultRepository.append(result);

        switch (ref.getType()) {
            case MONITOR:
                recordMonitorResult(ref, result);
                break;
            case DOMAIN:
                recordDomainResult(ref, result);
                break;
            default:
                throw new IllegalArgumentException("Unsupported subject type: " + ref.getType());
        }

        meterRegistry.counter("checks.recorded",
                "type", ref.getType().getPrefix(),
                "outcome", result.getOutcome().name()
        ).increment();
    }

    private void recordMonitorResult(SubjectRef ref, CheckResult result) {
        Optional<Monitor> previous = monitorRepository.findById(ref.getId());
        if (previous.isEmpty()) {
            log.debug("Monitor {} deleted before its result could be recorded", ref.getId());
            return;
        }

        MonitorStatus status = result.isSuccessful() ? MonitorStatus.UP : MonitorStatus.DOWN;
        monitorRepository.recordCheck(ref.getId(), result, status);
        alertNotificationService.notifyIfThresholdCrossed(previous.get(), result);
    }

    private void recordDomainResult(SubjectRef ref, CheckResult result) {
        Optional<Domain> previous = domainRepository.findByName(ref.getId());
        if (previous.isEmpty()) {
            log.debug("Domain {} deleted before its result could be recorded", ref.getId());
            return;
        }

        Domain domain = previous.get();
        boolean expired = false;
        boolean expiringSoon = false;
        if (result.getDaysUntilExpiry() != null) {
            int days = result.getDaysUntilExpiry();
            expired = days < 0;
            expiringSoon = !expired && days <= alertNotificationService.alertWindowOf(domain);
        }

        domainRepository.recordCheck(ref.getId(), result, expired, expiringSoon);
        alertNotificationService.notifyIfThresholdCrossed(domain, result);
    }
}
