package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.dto.request.CreateMonitorRequest;
import com.company.uptime.dto.request.UpdateMonitorRequest;
import com.company.uptime.dto.response.MonitorStatsResponse;
import com.company.uptime.exception.SubjectAccessDeniedException;
import com.company.uptime.exception.SubjectNotFoundException;
import com.company.uptime.repository.CheckResultRepository;
import com.company.uptime.repository.MonitorRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Monitor CRUD. Every write is committed before the orchestrator is told about it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitorService {

    private static final int DEFAULT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final int STATS_SAMPLE_SIZE = 100;
    private static final int STATS_RECENT_RESULTS = 20;
    private static final Duration STATS_WINDOW = Duration.ofHours(24);

    private final MonitorRepository monitorRepository;
    private final CheckResultRepository checkResultRepository;
    private final SchedulerOrchestrator orchestrator;
    private final UptimeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Monitor createMonitor(CreateMonitorRequest request, String userId) {
        Instant now = clock.instant();

        Monitor monitor = Monitor.builder()
                .monitorId(UUID.randomUUID().toString())
                .userId(userId)
                .name(request.getName().trim())
                .url(request.getUrl().trim())
                .type(request.getType())
                .status(MonitorStatus.PENDING)
                .checkIntervalSeconds(request.getCheckIntervalSeconds() != null
                        ? request.getCheckIntervalSeconds()
                        : properties.getScheduler().getDefaultMonitorIntervalSeconds())
                .timeoutMs(request.getTimeoutMs() != null ? request.getTimeoutMs() : DEFAULT_TIMEOUT_MS)
                .maxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : DEFAULT_MAX_RETRIES)
                .active(true)
                .alertOnDown(request.getAlertOnDown() == null || request.getAlertOnDown())
                .alertOnRecovery(request.getAlertOnRecovery() == null || request.getAlertOnRecovery())
                .createdAt(now)
                .updatedAt(now)
                .build();

        monitorRepository.save(monitor);
        log.info("Created monitor {} ({} {}) for user {}", monitor.getMonitorId(), monitor.getType(), monitor.getUrl(), userId);

        orchestrator.onSubjectCreated(monitor);
        meterRegistry.counter("subjects.created", "type", "monitor").increment();
        return monitor;
    }

    public Monitor updateMonitor(String monitorId, UpdateMonitorRequest request, String userId) {
        Monitor monitor = getMonitor(monitorId, userId);
        Set<String> changed = new HashSet<>();

        if (request.getName() != null) {
            monitor.setName(request.getName().trim());
        }
        if (request.getUrl() != null && !request.getUrl().trim().equals(monitor.getUrl())) {
            monitor.setUrl(request.getUrl().trim());
            changed.add("url");
        }
        if (request.getType() != null && request.getType() != monitor.getType()) {
            monitor.setType(request.getType());
            changed.add("type");
        }
        if (request.getCheckIntervalSeconds() != null
                && !Objects.equals(request.getCheckIntervalSeconds(), monitor.getCheckIntervalSeconds())) {
            monitor.setCheckIntervalSeconds(request.getCheckIntervalSeconds());
            changed.add(SchedulerOrchestrator.FIELD_CHECK_INTERVAL);
        }
        if (request.getTimeoutMs() != null) {
            monitor.setTimeoutMs(request.getTimeoutMs());
        }
        if (request.getMaxRetries() != null) {
            monitor.setMaxRetries(request.getMaxRetries());
        }
        if (request.getAlertOnDown() != null) {
            monitor.setAlertOnDown(request.getAlertOnDown());
        }
        if (request.getAlertOnRecovery() != null) {
            monitor.setAlertOnRecovery(request.getAlertOnRecovery());
        }
        if (request.getActive() != null && !request.getActive().equals(monitor.getActive())) {
            monitor.setActive(request.getActive());
            monitor.setStatus(request.getActive() ? MonitorStatus.PENDING : MonitorStatus.PAUSED);
            changed.add(SchedulerOrchestrator.FIELD_ACTIVE);
        }

        monitor.setUpdatedAt(clock.instant());
        monitorRepository.update(monitor);
        log.info("Updated monitor {} (changed: {})", monitorId, changed);

        orchestrator.onSubjectUpdated(monitor, changed);
        return monitor;
    }

    public void deleteMonitor(String monitorId, String userId) {
        Monitor monitor = getMonitor(monitorId, userId);

        monitorRepository.deleteById(monitorId);
        checkResultRepository.deleteBySubject(monitor.getRef().key());
        log.info("Deleted monitor {} for user {}", monitorId, userId);

        orchestrator.onSubjectDeleted(monitor.getRef());
        meterRegistry.counter("subjects.deleted", "type", "monitor").increment();
    }

    public Monitor getMonitor(String monitorId, String userId) {
        Monitor monitor = monitorRepository.findById(monitorId)
                .orElseThrow(() -> new SubjectNotFoundException(SubjectRef.monitor(monitorId).key()));

        if (!monitor.getUserId().equals(userId)) {
            throw new SubjectAccessDeniedException(monitor.getRef().key(), userId);
        }
        return monitor;
    }

    public List<Monitor> listMonitors(String userId) {
        return monitorRepository.findByUserId(userId);
    }

    public List<CheckResult> recentResults(String monitorId, String userId, int limit) {
        Monitor monitor = getMonitor(monitorId, userId);
        return checkResultRepository.findRecent(monitor.getRef().key(), limit);
    }

    /**
     * Lifetime counters plus uptime and mean latency over the last 24 hours, computed from
     * the 100 most recent results. Both are 0 without recent results.
     */
    public MonitorStatsResponse getStats(String monitorId, String userId) {
        Monitor monitor = getMonitor(monitorId, userId);
        List<CheckResult> sample = checkResultRepository.findRecent(monitor.getRef().key(), STATS_SAMPLE_SIZE);

        Instant since = clock.instant().minus(STATS_WINDOW);
        List<CheckResult> lastDay = sample.stream()
                .filter(result -> !result.getCheckedAt().isBefore(since))
                .collect(Collectors.toList());

        long uptime = 0;
        long averageLatency = 0;
        if (!lastDay.isEmpty()) {
            long successful = lastDay.stream().filter(CheckResult::isSuccessful).count();
            uptime = Math.round(successful * 100.0 / lastDay.size());
            averageLatency = Math.round(lastDay.stream().mapToLong(CheckResult::getLatencyMs).average().orElse(0));
        }

        return MonitorStatsResponse.builder()
                .monitorId(monitor.getMonitorId())
                .totalChecks(monitor.getTotalChecks())
                .successfulChecks(monitor.getSuccessfulChecks())
                .failedChecks(monitor.getFailedChecks())
                .uptimePercentage(monitor.uptimePercentage())
                .last24HoursChecks(lastDay.size())
                .last24HoursUptime(uptime)
                .averageResponseTimeMs(averageLatency)
                .recentResults(sample.stream().limit(STATS_RECENT_RESULTS).collect(Collectors.toList()))
                .build();
    }
}
