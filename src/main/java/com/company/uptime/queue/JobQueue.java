package com.company.uptime.queue;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.exception.QueueClosedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable delay/repeat queue bound to one subject. Instances are created only by
 * {@link QueueRegistry}.
 * <p>
 * Producer side: {@link #enqueue}, {@link #registerRepeating} and the introspection methods.
 * Consumer side: {@link #dispatchDue}, called periodically by the worker loop.
 */
@Slf4j
public class JobQueue {

    private final String name;
    private final QueueStore store;
    private final Processor processor;
    private final Clock clock;
    private final QueueSettings settings;

    // Serializes read-then-write on repeating registrations
    private final ReentrantLock registrationLock = new ReentrantLock();
    private final AtomicInteger running = new AtomicInteger();
    private volatile boolean closed;

    JobQueue(String name, QueueStore store, Processor processor, Clock clock, QueueSettings settings) {
        this.name = name;
        this.store = store;
        this.processor = processor;
        this.clock = clock;
        this.settings = settings;
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    public Job enqueue(JobKind kind, Map<String, String> payload, EnqueueOptions options) {
        ensureOpen();

        if (options.getJobKey() != null) {
            Optional<Job> pending = findPendingByKey(options.getJobKey());
            if (pending.isPresent()) {
                log.debug("Job {} with key {} still pending on {}, not enqueuing another",
                        pending.get().getId(), options.getJobKey(), name);
                return pending.get();
            }
        }

        Instant now = clock.instant();
        Duration delay = options.getDelay() != null ? options.getDelay() : Duration.ZERO;

        Job job = Job.builder()
                .id(String.valueOf(store.nextSequence()))
                .queueName(name)
                .kind(kind)
                .subjectKey(name)
                .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                .jobKey(options.getJobKey())
                .enqueuedAt(now)
                .readyAt(now.plus(delay))
                .attemptsMade(0)
                .maxAttempts(options.getAttempts() != null ? options.getAttempts() : settings.getAttempts())
                .state(JobState.WAITING)
                .build();

        store.saveJob(job);
        store.addWaiting(job.getId(), job.getReadyAt());

        log.debug("Enqueued {} job {} on {} (ready at {})", kind.getValue(), job.getId(), name, job.getReadyAt());
        return job;
    }

    /**
     * Installs a repeating registration under {@code jobKey}, first removing every existing
     * registration that shares the key. Safe to call on every restart.
     */
    public RepeatableJob registerRepeating(JobKind kind, Map<String, String> payload,
                                           Schedule schedule, String jobKey) {
        registrationLock.lock();
        try {
            ensureOpen();

            for (RepeatableJob existing : store.repeatables()) {
                if (existing.getKey().equals(jobKey)) {
                    store.removeRepeatable(existing.getKey());
                    log.debug("Removed repeating registration {} ({}) on {}",
                            existing.getKey(), existing.getSchedule(), name);
                }
            }

            Instant now = clock.instant();
            RepeatableJob repeatable = RepeatableJob.builder()
                    .key(jobKey)
                    .kind(kind)
                    .subjectKey(name)
                    .schedule(schedule)
                    .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                    .registeredAt(now)
                    .nextFireAt(schedule.nextFireAfter(now))
                    .build();
            store.putRepeatable(repeatable);

            log.info("Registered repeating {} job {} on {} ({})", kind.getValue(), jobKey, name, schedule);
            return repeatable;
        } finally {
            registrationLock.unlock();
        }
    }

    public boolean removeRepeating(String jobKey) {
        registrationLock.lock();
        try {
            ensureOpen();
            return store.removeRepeatable(jobKey);
        } finally {
            registrationLock.unlock();
        }
    }

    public int removeAllRepeating() {
        registrationLock.lock();
        try {
            ensureOpen();
            int removed = 0;
            for (RepeatableJob existing : store.repeatables()) {
                if (store.removeRepeatable(existing.getKey())) {
                    removed++;
                }
            }
            return removed;
        } finally {
            registrationLock.unlock();
        }
    }

    public boolean hasRepeating(String jobKey) {
        ensureOpen();
        return store.findRepeatable(jobKey).isPresent();
    }

    public List<RepeatableJob> listRepeating() {
        ensureOpen();
        List<RepeatableJob> repeatables = new ArrayList<>(store.repeatables());
        repeatables.sort(Comparator.comparing(RepeatableJob::getKey));
        return repeatables;
    }

    public List<Job> listWaiting() {
        ensureOpen();
        return loadJobs(store.waitingIds());
    }

    public List<Job> listActive() {
        ensureOpen();
        return loadJobs(store.activeIds());
    }

    public List<Job> listCompleted() {
        ensureOpen();
        return loadJobs(store.completedIds());
    }

    public List<Job> listFailed() {
        ensureOpen();
        return loadJobs(store.failedIds());
    }

    public List<Job> listJobs(JobState state) {
        switch (state) {
            case ACTIVE:
                return listActive();
            case COMPLETED:
                return listCompleted();
            case FAILED:
                return listFailed();
            default:
                return listWaiting();
        }
    }

    public void pause() {
        ensureOpen();
        store.setPaused(true);
        log.info("Paused queue {}", name);
    }

    public void resume() {
        ensureOpen();
        store.setPaused(false);
        log.info("Resumed queue {}", name);
    }

    public boolean isPaused() {
        ensureOpen();
        return store.isPaused();
    }

    /**
     * Removes all waiting jobs. Repeating registrations stay.
     */
    public int drain() {
        ensureOpen();
        List<String> removed = store.removeAllWaiting();
        store.deleteJobs(removed);
        if (!removed.isEmpty()) {
            log.info("Drained {} waiting jobs from {}", removed.size(), name);
        }
        return removed.size();
    }

    public QueueStats stats() {
        ensureOpen();
        Instant now = clock.instant();
        long waiting = store.countWaiting();
        long delayed = store.countDelayed(now);
        return QueueStats.builder()
                .queueName(name)
                .waiting(waiting - delayed)
                .delayed(delayed)
                .active(store.countActive())
                .completed(store.countCompleted())
                .failed(store.countFailed())
                .repeating(store.countRepeatable())
                .paused(store.isPaused())
                .build();
    }

    // ------------------------------------------------------------------
    // Consumer side
    // ------------------------------------------------------------------

    /**
     * Materializes due repeating registrations, redelivers stalled jobs and hands ready jobs to
     * {@code executor}, up to the configured concurrency.
     *
     * @return number of jobs handed to the executor
     */
    public int dispatchDue(Executor executor) {
        if (closed) {
            return 0;
        }
        Instant now = clock.instant();

        materializeRepeatables(now);
        recoverStalled(now);

        if (store.isPaused()) {
            return 0;
        }

        int capacity = settings.getConcurrency() - running.get();
        if (capacity <= 0) {
            return 0;
        }

        int dispatched = 0;
        for (String jobId : store.findReadyWaiting(now, capacity)) {
            if (closed) {
                break;
            }
            if (!store.claim(jobId, now)) {
                // Another worker got it first
                continue;
            }
            Optional<Job> claimed = store.findJob(jobId);
            if (claimed.isEmpty()) {
                log.warn("Claimed job {} on {} has no stored body, dropping it", jobId, name);
                store.removeActive(jobId);
                continue;
            }

            Job waiting = claimed.get();
            Job active = waiting.toBuilder()
                    .state(JobState.ACTIVE)
                    .startedAt(now)
                    .attemptsMade(waiting.getAttemptsMade() + 1)
                    .build();
            store.saveJob(active);

            running.incrementAndGet();
            try {
                executor.execute(() -> process(active));
                dispatched++;
            } catch (RejectedExecutionException e) {
                running.decrementAndGet();
                log.warn("Worker pool rejected job {} on {}, returning it to waiting", jobId, name);
                store.removeActive(jobId);
                store.saveJob(waiting);
                store.addWaiting(jobId, now);
                break;
            }
        }
        return dispatched;
    }

    private void materializeRepeatables(Instant now) {
        for (RepeatableJob candidate : store.repeatables()) {
            Instant fireAt = candidate.getNextFireAt();
            if (fireAt == null || fireAt.isAfter(now)) {
                continue;
            }

            registrationLock.lock();
            try {
                Optional<RepeatableJob> current = store.findRepeatable(candidate.getKey());
                if (current.isEmpty() || !fireAt.equals(current.get().getNextFireAt())) {
                    // Re-registered or advanced meanwhile
                    continue;
                }
                RepeatableJob repeatable = current.get();

                // Deterministic id: concurrent dispatchers materialize the same fire only once
                Job job = Job.builder()
                        .id("repeat:" + repeatable.getKey() + ":" + fireAt.toEpochMilli())
                        .queueName(name)
                        .kind(repeatable.getKind())
                        .subjectKey(name)
                        .payload(repeatable.getPayload() != null
                                ? new HashMap<>(repeatable.getPayload()) : new HashMap<>())
                        .repeatKey(repeatable.getKey())
                        .enqueuedAt(now)
                        .readyAt(fireAt)
                        .attemptsMade(0)
                        .maxAttempts(settings.getAttempts())
                        .state(JobState.WAITING)
                        .build();

                if (store.saveJobIfAbsent(job)) {
                    store.addWaiting(job.getId(), fireAt);
                    log.debug("Materialized job {} on {}", job.getId(), name);
                }

                Instant next = repeatable.getSchedule().advance(fireAt, now);
                store.putRepeatable(repeatable.toBuilder().nextFireAt(next).build());
            } finally {
                registrationLock.unlock();
            }
        }
    }

    private void recoverStalled(Instant now) {
        Instant cutoff = now.minus(settings.getAckTimeout());
        for (String jobId : store.findStalled(cutoff)) {
            if (!store.requeueStalled(jobId, now)) {
                continue;
            }
            store.findJob(jobId).ifPresent(job -> {
                store.saveJob(job.toBuilder()
                        .state(JobState.WAITING)
                        .startedAt(null)
                        .readyAt(now)
                        .build());
                log.warn("Job {} on {} stalled since {}, redelivering", jobId, name, job.getStartedAt());
            });
        }
    }

    private void process(Job job) {
        MDC.put("queue", name);
        MDC.put("jobId", job.getId());
        try {
            CheckResult result;
            try {
                result = processor.handle(job);
            } catch (Exception e) {
                onFailure(job, e);
                return;
            }
            onSuccess(job, result);
        } catch (QueueBackendException e) {
            // Job stays active and is redelivered once the ack timeout passes
            log.error("Could not record outcome of job {} on {}", job.getId(), name, e);
        } finally {
            running.decrementAndGet();
            MDC.remove("jobId");
            MDC.remove("queue");
        }
    }

    private void onSuccess(Job job, CheckResult result) {
        if (closed) {
            log.debug("Queue {} closed while job {} ran, discarding result", name, job.getId());
            return;
        }
        if (!store.removeActive(job.getId())) {
            log.debug("Job {} on {} no longer active, discarding result", job.getId(), name);
            return;
        }

        store.saveJob(job.toBuilder()
                .state(JobState.COMPLETED)
                .finishedAt(clock.instant())
                .failedReason(null)
                .resultSummary(result != null ? result.summary() : null)
                .build());
        store.deleteJobs(store.pushCompleted(job.getId(), settings.getRetainCompleted()));

        log.debug("Job {} on {} completed", job.getId(), name);
    }

    private void onFailure(Job job, Exception error) {
        if (closed) {
            log.debug("Queue {} closed while job {} ran, discarding failure", name, job.getId());
            return;
        }
        if (!store.removeActive(job.getId())) {
            log.debug("Job {} on {} no longer active, discarding failure", job.getId(), name);
            return;
        }

        Instant now = clock.instant();
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (job.getAttemptsMade() < job.getMaxAttempts()) {
            Duration delay = backoffFor(job.getAttemptsMade());
            Instant readyAt = now.plus(delay);
            store.saveJob(job.toBuilder()
                    .state(JobState.WAITING)
                    .startedAt(null)
                    .readyAt(readyAt)
                    .failedReason(reason)
                    .build());
            store.addWaiting(job.getId(), readyAt);
            log.warn("Job {} on {} failed (attempt {}/{}), retrying in {}ms: {}",
                    job.getId(), name, job.getAttemptsMade(), job.getMaxAttempts(), delay.toMillis(), reason);
            return;
        }

        store.saveJob(job.toBuilder()
                .state(JobState.FAILED)
                .finishedAt(now)
                .failedReason(reason)
                .build());
        store.deleteJobs(store.pushFailed(job.getId(), settings.getRetainFailed()));
        log.error("Job {} on {} failed permanently after {} attempts", job.getId(), name, job.getAttemptsMade(), error);
    }

    Duration backoffFor(int attemptsMade) {
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 20));
        return settings.getBackoff().multipliedBy(1L << exponent);
    }

    // ------------------------------------------------------------------
    // Lifecycle, driven by the registry
    // ------------------------------------------------------------------

    /**
     * No further use permitted. Jobs already handed to workers run to completion but their
     * outcome is discarded.
     */
    public void close() {
        closed = true;
    }

    void destroy() {
        store.destroy();
    }

    int runningCount() {
        return running.get();
    }

    private Optional<Job> findPendingByKey(String jobKey) {
        List<String> ids = new ArrayList<>(store.waitingIds());
        ids.addAll(store.activeIds());
        for (String id : ids) {
            Optional<Job> job = store.findJob(id);
            if (job.isPresent() && jobKey.equals(job.get().getJobKey()) && job.get().getState().isPending()) {
                return job;
            }
        }
        return Optional.empty();
    }

    private List<Job> loadJobs(List<String> ids) {
        List<Job> jobs = new ArrayList<>(ids.size());
        for (String id : ids) {
            store.findJob(id).ifPresent(jobs::add);
        }
        return jobs;
    }

    private void ensureOpen() {
        if (closed) {
            throw new QueueClosedException(name);
        }
    }
}
