package com.company.uptime.queue;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent state of one named queue. Implementations throw
 * {@link com.company.uptime.exception.QueueBackendException} when the backend fails.
 * <p>
 * {@link #claim} and {@link #requeueStalled} must be atomic across processes: exactly one
 * caller wins for a given job id.
 */
public interface QueueStore {

    long nextSequence();

    void saveJob(Job job);

    /** @return {@code false} if a job with the same id already exists */
    boolean saveJobIfAbsent(Job job);

    Optional<Job> findJob(String jobId);

    void deleteJobs(Collection<String> jobIds);

    void addWaiting(String jobId, Instant readyAt);

    /** Waiting ids whose ready time is not after {@code now}, earliest first. */
    List<String> findReadyWaiting(Instant now, int limit);

    List<String> waitingIds();

    /** Moves a job from waiting to active. */
    boolean claim(String jobId, Instant startedAt);

    boolean removeActive(String jobId);

    List<String> activeIds();

    List<String> findStalled(Instant startedBefore);

    /** Moves a job from active back to waiting. */
    boolean requeueStalled(String jobId, Instant readyAt);

    /** @return ids evicted beyond {@code retain}, oldest last */
    List<String> pushCompleted(String jobId, int retain);

    List<String> pushFailed(String jobId, int retain);

    /** Newest first. */
    List<String> completedIds();

    /** Newest first. */
    List<String> failedIds();

    /** @return the removed ids */
    List<String> removeAllWaiting();

    void putRepeatable(RepeatableJob repeatable);

    Optional<RepeatableJob> findRepeatable(String key);

    boolean removeRepeatable(String key);

    List<RepeatableJob> repeatables();

    void setPaused(boolean paused);

    boolean isPaused();

    long countWaiting();

    long countDelayed(Instant now);

    long countActive();

    long countCompleted();

    long countFailed();

    int countRepeatable();

    /** Deletes every trace of the queue. */
    void destroy();
}
