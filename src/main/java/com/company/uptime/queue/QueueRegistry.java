package com.company.uptime.queue;

import com.company.uptime.config.UptimeProperties;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.exception.QueueClosedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the subject to queue mapping. The only place a {@link JobQueue} is constructed.
 * <p>
 * Creation and removal for one subject are serialized by a striped lock; lookups and
 * statistics read the concurrent map without locking.
 */
@Component
@Slf4j
public class QueueRegistry {

    private static final int LOCK_STRIPES = 64;

    private final QueueBackend backend;
    private final Processor processor;
    private final Clock clock;
    private final QueueSettings settings;

    private final ConcurrentMap<String, JobQueue> queues = new ConcurrentHashMap<>();
    private final Lock[] locks = new Lock[LOCK_STRIPES];

    @Autowired
    public QueueRegistry(QueueBackend backend, Processor processor, Clock clock, UptimeProperties properties) {
        this(backend, processor, clock, properties.getQueue().toSettings());
    }

    public QueueRegistry(QueueBackend backend, Processor processor, Clock clock, QueueSettings settings) {
        this.backend = backend;
        this.processor = processor;
        this.clock = clock;
        this.settings = settings;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Fails fast when the backend is unreachable.
     */
    @PostConstruct
    public void init() {
        backend.ping();
        log.info("Queue registry ready on {}", backend.describe());
    }

    @PreDestroy
    public void shutdown() {
        List<JobQueue> open = new ArrayList<>(queues.values());
        for (JobQueue queue : open) {
            queue.close();
        }
        queues.clear();
        log.info("Queue registry shut down, closed {} queues", open.size());
    }

    public JobQueue getOrCreate(SubjectRef ref) {
        String key = ref.key();
        JobQueue existing = queues.get(key);
        if (existing != null) {
            return existing;
        }

        Lock lock = lockFor(key);
        lock.lock();
        try {
            existing = queues.get(key);
            if (existing != null) {
                return existing;
            }
            JobQueue queue = new JobQueue(key, backend.open(key), processor, clock, settings);
            queues.put(key, queue);
            log.info("Created job queue {}", key);
            return queue;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobQueue> find(SubjectRef ref) {
        return Optional.ofNullable(queues.get(ref.key()));
    }

    /**
     * Cancels repeating registrations, drains waiting jobs, closes the queue, purges its
     * backend state and forgets it. Unknown subjects are ignored.
     *
     * @return whether a queue was removed
     */
    public boolean remove(SubjectRef ref) {
        String key = ref.key();
        Lock lock = lockFor(key);
        lock.lock();
        try {
            JobQueue queue = queues.get(key);
            if (queue == null) {
                log.debug("No queue registered for {}, nothing to remove", key);
                return false;
            }

            int repeating = queue.removeAllRepeating();
            int drained = queue.drain();
            queue.close();
            queue.destroy();
            queues.remove(key);

            log.info("Removed job queue {} ({} repeating registrations, {} waiting jobs)", key, repeating, drained);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueStats> statsFor(SubjectRef ref) {
        return find(ref).map(JobQueue::stats);
    }

    public AggregateQueueStats aggregateStats() {
        int queueCount = 0;
        long waiting = 0;
        long delayed = 0;
        long active = 0;
        long completed = 0;
        long failed = 0;
        long repeating = 0;
        int paused = 0;

        for (JobQueue queue : liveQueues()) {
            QueueStats stats;
            try {
                stats = queue.stats();
            } catch (QueueClosedException e) {
                // Removed after the snapshot was taken
                continue;
            }
            queueCount++;
            waiting += stats.getWaiting();
            delayed += stats.getDelayed();
            active += stats.getActive();
            completed += stats.getCompleted();
            failed += stats.getFailed();
            repeating += stats.getRepeating();
            if (stats.isPaused()) {
                paused++;
            }
        }

        return AggregateQueueStats.builder()
                .queueCount(queueCount)
                .waiting(waiting)
                .delayed(delayed)
                .active(active)
                .completed(completed)
                .failed(failed)
                .repeating(repeating)
                .pausedQueues(paused)
                .collectedAt(clock.instant())
                .build();
    }

    public List<SubjectRef> listSubjects() {
        List<SubjectRef> subjects = new ArrayList<>();
        for (String key : queues.keySet()) {
            subjects.add(SubjectRef.parse(key));
        }
        subjects.sort(null);
        return subjects;
    }

    public List<JobQueue> liveQueues() {
        return new ArrayList<>(queues.values());
    }

    private Lock lockFor(String key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }
}
