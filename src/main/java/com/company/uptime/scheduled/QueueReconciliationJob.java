package com.company.uptime.scheduled;

import com.company.uptime.dto.response.QueueHealthReport;
import com.company.uptime.dto.response.ReconciliationReport;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Backup path for the repeating registrations: an hourly sweep that repairs a stalled
 * schedule, and an advisory health check.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "uptime.scheduler.reconciliation-enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class QueueReconciliationJob {

    private final SchedulerOrchestrator orchestrator;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${uptime.scheduler.reconciliation-interval-ms:3600000}", initialDelay = 300000)
    public void reconcile() {
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            ReconciliationReport report = orchestrator.reconcile();

            if (report.isStalled() || report.getReRegistered() > 0) {
                log.warn("Reconciliation repaired the schedule: {} catch-up checks, {} re-registered, {} failures",
                        report.getCatchUpEnqueued(), report.getReRegistered(), report.getFailures());
            } else {
                log.info("Reconciliation found {} active subjects and {} repeating registrations, nothing to repair",
                        report.getActiveSubjects(), report.getRepeatingBefore());
            }

            sample.stop(meterRegistry.timer("scheduler.reconciliation.duration", "status", "success"));

        } catch (Exception e) {
            log.error("Reconciliation sweep failed", e);
            sample.stop(meterRegistry.timer("scheduler.reconciliation.duration", "status", "failure"));
            meterRegistry.counter("scheduler.reconciliation.failures").increment();
        }
    }

    @Scheduled(fixedDelayString = "${uptime.scheduler.health-check-interval-ms:3600000}", initialDelay = 60000)
    public void checkQueueHealth() {
        try {
            QueueHealthReport report = orchestrator.checkQueueHealth();
            if (!report.isHealthy()) {
                meterRegistry.counter("scheduler.health.unhealthy").increment();
            }
        } catch (Exception e) {
            log.error("Queue health check failed", e);
            meterRegistry.counter("scheduler.health.failures").increment();
        }
    }
}
