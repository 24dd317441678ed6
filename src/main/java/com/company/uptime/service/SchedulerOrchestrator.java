package com.company.uptime.service;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.domain.enums.ScheduleState;
import com.company.uptime.domain.enums.SubjectType;
import com.company.uptime.dto.response.BatchDispatchResult;
import com.company.uptime.dto.response.QueueHealthReport;
import com.company.uptime.dto.response.ReconciliationReport;
import com.company.uptime.dto.response.SubjectQueueResponse;
import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.exception.QueueClosedException;
import com.company.uptime.exception.SubjectNotFoundException;
import com.company.uptime.pacing.Pacer;
import com.company.uptime.queue.AggregateQueueStats;
import com.company.uptime.queue.EnqueueOptions;
import com.company.uptime.queue.Job;
import com.company.uptime.queue.JobKind;
import com.company.uptime.queue.JobQueue;
import com.company.uptime.queue.JobState;
import com.company.uptime.queue.QueueRegistry;
import com.company.uptime.queue.QueueStats;
import com.company.uptime.queue.RepeatableJob;
import com.company.uptime.queue.Schedule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Glue between subject lifecycle and the per-subject job queues. Translates create, update
 * and delete into queue operations, registers every active subject at startup and runs the
 * backup sweep that repairs a stalled schedule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchedulerOrchestrator {

    public static final String FIELD_ACTIVE = "active";
    public static final String FIELD_CHECK_INTERVAL = "checkIntervalSeconds";

    private final QueueRegistry queueRegistry;
    private final SubjectDirectory subjectDirectory;
    private final Pacer pacer;
    private final UptimeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<AggregateQueueStats> lastStats = new AtomicReference<>();

    // ------------------------------------------------------------------
    // Subject lifecycle
    // ------------------------------------------------------------------

    /**
     * Registers the recurring check and enqueues one immediate check. A failed registration
     * leaves the subject unscheduled until the next sweep; a failed immediate enqueue is
     * reported to the caller.
     */
    public void onSubjectCreated(Subject subject) {
        if (!subject.isEnabled()) {
            log.debug("Subject {} created inactive, not scheduling", subject.getRef());
            return;
        }

        SubjectRef ref = subject.getRef();
        JobQueue queue = queueRegistry.getOrCreate(ref);
        scheduleRecurring(queue, subject);

        queue.enqueue(JobKind.SINGLE_CHECK, payloadFor(subject, "created"),
                EnqueueOptions.delayed(properties.getScheduler().getImmediateCheckDelay()));

        meterRegistry.counter("scheduler.subjects.scheduled", "type", ref.getType().getPrefix()).increment();
    }

    /**
     * Deactivation removes the subject's queue. Reactivation, or an active subject without a
     * recurring registration, goes through the create path. An interval change replaces the
     * registration.
     */
    public void onSubjectUpdated(Subject subject, Set<String> changedFields) {
        SubjectRef ref = subject.getRef();

        if (!subject.isEnabled()) {
            if (queueRegistry.remove(ref)) {
                log.info("Subject {} deactivated, queue removed", ref);
            }
            return;
        }

        boolean scheduled = isRecurringRegistered(ref);
        if (!scheduled || changedFields.contains(FIELD_ACTIVE)) {
            onSubjectCreated(subject);
            return;
        }

        if (changedFields.contains(FIELD_CHECK_INTERVAL)) {
            scheduleRecurring(queueRegistry.getOrCreate(ref), subject);
        }
    }

    public void onSubjectDeleted(SubjectRef ref) {
        if (queueRegistry.remove(ref)) {
            meterRegistry.counter("scheduler.subjects.removed", "type", ref.getType().getPrefix()).increment();
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeExistingSubjects() {
        List<Subject> subjects;
        try {
            subjects = subjectDirectory.findAllActive();
        } catch (Exception e) {
            log.error("Could not load active subjects at startup, the next sweep will register them", e);
            return;
        }

        int registered = 0;
        for (Subject subject : subjects) {
            if (scheduleRecurring(queueRegistry.getOrCreate(subject.getRef()), subject)) {
                registered++;
            }
        }
        log.info("Registered recurring checks for {}/{} active subjects", registered, subjects.size());
    }

    // ------------------------------------------------------------------
    // One-off and bulk checks
    // ------------------------------------------------------------------

    public Job enqueueImmediateCheck(SubjectRef ref) {
        Subject subject = subjectDirectory.find(ref)
                .orElseThrow(() -> new SubjectNotFoundException(ref.key()));

        Job job = queueRegistry.getOrCreate(ref)
                .enqueue(JobKind.SINGLE_CHECK, payloadFor(subject, "manual"), EnqueueOptions.immediate());
        log.info("Enqueued manual check {} for {}", job.getId(), ref);
        return job;
    }

    public BatchDispatchResult triggerBulkCheckNow() {
        return dispatchBatch(subjectDirectory.findAllActive(), JobKind.BULK_CHECK, "bulk");
    }

    @Async
    public CompletableFuture<BatchDispatchResult> triggerBulkCheckNowAsync() {
        return CompletableFuture.completedFuture(triggerBulkCheckNow());
    }

    /**
     * Checks every active domain of one user, paced like any other domain batch.
     */
    public BatchDispatchResult triggerUserCheck(String userId) {
        List<Subject> domains = subjectDirectory.findActiveDomains(userId);
        log.info("User check requested for {} ({} active domains)", userId, domains.size());
        return dispatchBatch(domains, JobKind.USER_CHECK, "user");
    }

    @Async
    public CompletableFuture<BatchDispatchResult> triggerUserCheckAsync(String userId) {
        return CompletableFuture.completedFuture(triggerUserCheck(userId));
    }

    /**
     * Enqueues one job per subject in creation order. Monitors go straight in; domains are
     * paced, since their checks end up at third-party registrars. Runs on the calling thread.
     */
    public BatchDispatchResult dispatchBatch(List<Subject> subjects, JobKind kind, String reason) {
        List<Subject> ordered = new ArrayList<>(subjects);
        ordered.sort(SubjectDirectory.CREATION_ORDER);

        List<Subject> domains = new ArrayList<>();
        int enqueued = 0;
        int failed = 0;
        for (Subject subject : ordered) {
            if (subject.getRef().getType() == SubjectType.DOMAIN) {
                domains.add(subject);
            } else if (enqueueQuietly(subject, kind, reason)) {
                enqueued++;
            } else {
                failed++;
            }
        }

        UptimeProperties.Pacing pacing = properties.getPacing();
        Iterator<Subject> paced = pacer.pace(domains, pacing.getMinDelayMs(), pacing.getMaxDelayMs());
        while (paced.hasNext()) {
            if (enqueueQuietly(paced.next(), kind, reason)) {
                enqueued++;
            } else {
                failed++;
            }
        }

        log.info("Dispatched {} {} jobs ({} failed) for {} subjects, {} of them paced",
                enqueued, kind.getValue(), failed, ordered.size(), domains.size());

        return BatchDispatchResult.builder()
                .reason(reason)
                .requested(ordered.size())
                .enqueued(enqueued)
                .failed(failed)
                .build();
    }

    // ------------------------------------------------------------------
    // Backup sweep and health
    // ------------------------------------------------------------------

    /**
     * When no repeating registration exists although subjects are active, enqueues one
     * catch-up check per due subject. Afterwards re-registers every active subject whose
     * recurring key is missing.
     */
    public ReconciliationReport reconcile() {
        AggregateQueueStats stats = queueRegistry.aggregateStats();
        List<Subject> active = subjectDirectory.findAllActive();

        ReconciliationReport report = ReconciliationReport.builder()
                .activeSubjects(active.size())
                .repeatingBefore(stats.getRepeating())
                .build();

        if (active.isEmpty()) {
            report.setCompletedAt(clock.instant());
            return report;
        }

        if (stats.getRepeating() == 0) {
            log.warn("No repeating registrations although {} subjects are active, running catch-up checks",
                    active.size());
            meterRegistry.counter("scheduler.reconciliation.stalled").increment();

            Instant now = clock.instant();
            List<Subject> due = active.stream()
                    .filter(subject -> subject.isDue(now))
                    .collect(Collectors.toList());

            BatchDispatchResult catchUp = dispatchBatch(due, JobKind.SINGLE_CHECK, "catch-up");
            report.setStalled(true);
            report.setDueSubjects(due.size());
            report.setCatchUpEnqueued(catchUp.getEnqueued());
            report.setFailures(catchUp.getFailed());
        }

        int reRegistered = 0;
        for (Subject subject : active) {
            SubjectRef ref = subject.getRef();
            JobQueue queue = queueRegistry.getOrCreate(ref);
            boolean present;
            try {
                present = queue.hasRepeating(ref.recurringJobKey());
            } catch (QueueBackendException | QueueClosedException e) {
                log.warn("Could not inspect recurring registration of {}: {}", ref, e.getMessage());
                report.setFailures(report.getFailures() + 1);
                continue;
            }
            if (present) {
                continue;
            }
            if (scheduleRecurring(queue, subject)) {
                reRegistered++;
            } else {
                report.setFailures(report.getFailures() + 1);
            }
        }
        report.setReRegistered(reRegistered);
        report.setCompletedAt(clock.instant());

        if (reRegistered > 0) {
            log.warn("Re-registered recurring checks for {} subjects", reRegistered);
            meterRegistry.counter("scheduler.reconciliation.reregistered").increment(reRegistered);
        }
        return report;
    }

    public QueueHealthReport checkQueueHealth() {
        AggregateQueueStats stats = queueRegistry.aggregateStats();
        lastStats.set(stats);
        int activeSubjects = subjectDirectory.findAllActive().size();

        List<String> warnings = new ArrayList<>();
        if (stats.getRepeating() == 0 && activeSubjects > 0) {
            warnings.add("No repeating jobs registered although " + activeSubjects + " subjects are active");
            meterRegistry.counter("scheduler.health.no_repeating").increment();
        }
        long threshold = properties.getScheduler().getFailedJobAlertThreshold();
        if (stats.getFailed() > threshold) {
            warnings.add("Failed jobs " + stats.getFailed() + " above threshold " + threshold);
            meterRegistry.counter("scheduler.health.failed_threshold_exceeded").increment();
        }

        warnings.forEach(warning -> log.warn("Queue health: {}", warning));
        log.info("Queue health: {} queues, {} waiting, {} delayed, {} active, {} failed, {} repeating",
                stats.getQueueCount(), stats.getWaiting(), stats.getDelayed(), stats.getActive(),
                stats.getFailed(), stats.getRepeating());

        return QueueHealthReport.builder()
                .healthy(warnings.isEmpty())
                .activeSubjects(activeSubjects)
                .stats(stats)
                .warnings(warnings)
                .build();
    }

    /**
     * Most recent aggregate taken by {@link #checkQueueHealth()}, or {@code null} before the
     * first run.
     */
    public AggregateQueueStats getLastAggregateStats() {
        return lastStats.get();
    }

    // ------------------------------------------------------------------
    // Admin
    // ------------------------------------------------------------------

    public AggregateQueueStats getAggregateQueueStats() {
        AggregateQueueStats stats = queueRegistry.aggregateStats();
        lastStats.set(stats);
        return stats;
    }

    public SubjectQueueResponse getSubjectQueueStats(SubjectRef ref) {
        JobQueue queue = queueFor(ref);
        return SubjectQueueResponse.builder()
                .subjectKey(ref.key())
                .state(stateOf(ref))
                .stats(queue.stats())
                .repeating(queue.listRepeating())
                .build();
    }

    public List<SubjectRef> listSubjects() {
        return queueRegistry.listSubjects();
    }

    public void pauseSubject(SubjectRef ref) {
        queueFor(ref).pause();
    }

    public void resumeSubject(SubjectRef ref) {
        queueFor(ref).resume();
    }

    /**
     * @return number of waiting jobs removed
     */
    public int clearSubjectQueue(SubjectRef ref) {
        return queueFor(ref).drain();
    }

    public List<Job> listJobs(SubjectRef ref, JobState state) {
        return queueFor(ref).listJobs(state);
    }

    public List<RepeatableJob> listRepeating(SubjectRef ref) {
        return queueFor(ref).listRepeating();
    }

    public ScheduleState stateOf(SubjectRef ref) {
        Optional<JobQueue> queue = queueRegistry.find(ref);
        if (queue.isEmpty()) {
            return ScheduleState.UNSCHEDULED;
        }
        try {
            if (!queue.get().hasRepeating(ref.recurringJobKey())) {
                return ScheduleState.UNSCHEDULED;
            }
            QueueStats stats = queue.get().stats();
            return stats.getActive() > 0 ? ScheduleState.CHECKING : ScheduleState.SCHEDULED;
        } catch (QueueClosedException e) {
            return ScheduleState.UNSCHEDULED;
        }
    }

    // ------------------------------------------------------------------

    private boolean scheduleRecurring(JobQueue queue, Subject subject) {
        SubjectRef ref = subject.getRef();
        try {
            queue.registerRepeating(JobKind.RECURRING_CHECK, payloadFor(subject, "schedule"),
                    Schedule.everySeconds(intervalOf(subject)), ref.recurringJobKey());
            return true;
        } catch (QueueBackendException e) {
            log.error("Could not register recurring check for {}, leaving it unscheduled", ref, e);
            meterRegistry.counter("scheduler.registration.failures", "type", ref.getType().getPrefix()).increment();
            return false;
        }
    }

    private boolean enqueueQuietly(Subject subject, JobKind kind, String reason) {
        SubjectRef ref = subject.getRef();
        try {
            queueRegistry.getOrCreate(ref).enqueue(kind, payloadFor(subject, reason), EnqueueOptions.immediate());
            return true;
        } catch (QueueBackendException | QueueClosedException e) {
            log.warn("Could not enqueue {} check for {}: {}", reason, ref, e.getMessage());
            meterRegistry.counter("scheduler.enqueue.failures", "kind", kind.getValue()).increment();
            return false;
        }
    }

    private boolean isRecurringRegistered(SubjectRef ref) {
        return queueRegistry.find(ref)
                .map(queue -> queue.hasRepeating(ref.recurringJobKey()))
                .orElse(false);
    }

    private JobQueue queueFor(SubjectRef ref) {
        Optional<JobQueue> existing = queueRegistry.find(ref);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (subjectDirectory.find(ref).isEmpty()) {
            throw new SubjectNotFoundException(ref.key());
        }
        return queueRegistry.getOrCreate(ref);
    }

    long intervalOf(Subject subject) {
        Integer interval = subject.getCheckIntervalSeconds();
        if (interval != null && interval > 0) {
            return interval;
        }
        return subject.getRef().getType() == SubjectType.DOMAIN
                ? properties.getScheduler().getDefaultDomainIntervalSeconds()
                : properties.getScheduler().getDefaultMonitorIntervalSeconds();
    }

    private static Map<String, String> payloadFor(Subject subject, String reason) {
        Map<String, String> payload = new HashMap<>();
        payload.put("subjectType", subject.getRef().getType().getPrefix());
        payload.put("subjectId", subject.getRef().getId());
        payload.put("reason", reason);
        return payload;
    }
}
