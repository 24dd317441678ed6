package com.company.uptime.queue.backend;

import com.company.uptime.queue.Job;
import com.company.uptime.queue.QueueStore;
import com.company.uptime.queue.RepeatableJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-local queue state. Every method holds the store monitor, which makes claim and
 * requeue atomic for the workers of this process.
 */
class InMemoryQueueStore implements QueueStore {

    private long sequence;
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, Instant> waiting = new LinkedHashMap<>();
    private final Map<String, Instant> active = new LinkedHashMap<>();
    private final LinkedList<String> completed = new LinkedList<>();
    private final LinkedList<String> failed = new LinkedList<>();
    private final Map<String, RepeatableJob> repeatables = new LinkedHashMap<>();
    private boolean paused;

    @Override
    public synchronized long nextSequence() {
        return ++sequence;
    }

    @Override
    public synchronized void saveJob(Job job) {
        jobs.put(job.getId(), job.toBuilder().build());
    }

    @Override
    public synchronized boolean saveJobIfAbsent(Job job) {
        if (jobs.containsKey(job.getId())) {
            return false;
        }
        jobs.put(job.getId(), job.toBuilder().build());
        return true;
    }

    @Override
    public synchronized Optional<Job> findJob(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.toBuilder().build());
    }

    @Override
    public synchronized void deleteJobs(Collection<String> jobIds) {
        jobIds.forEach(jobs::remove);
    }

    @Override
    public synchronized void addWaiting(String jobId, Instant readyAt) {
        waiting.put(jobId, readyAt);
    }

    @Override
    public synchronized List<String> findReadyWaiting(Instant now, int limit) {
        return waiting.entrySet().stream()
                .filter(e -> !e.getValue().isAfter(now))
                .sorted(Map.Entry.comparingByValue())
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<String> waitingIds() {
        return sortedByTime(waiting);
    }

    @Override
    public synchronized boolean claim(String jobId, Instant startedAt) {
        if (waiting.remove(jobId) == null) {
            return false;
        }
        active.put(jobId, startedAt);
        return true;
    }

    @Override
    public synchronized boolean removeActive(String jobId) {
        return active.remove(jobId) != null;
    }

    @Override
    public synchronized List<String> activeIds() {
        return sortedByTime(active);
    }

    @Override
    public synchronized List<String> findStalled(Instant startedBefore) {
        return active.entrySet().stream()
                .filter(e -> e.getValue().isBefore(startedBefore))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean requeueStalled(String jobId, Instant readyAt) {
        if (active.remove(jobId) == null) {
            return false;
        }
        waiting.put(jobId, readyAt);
        return true;
    }

    @Override
    public synchronized List<String> pushCompleted(String jobId, int retain) {
        return pushAndTrim(completed, jobId, retain);
    }

    @Override
    public synchronized List<String> pushFailed(String jobId, int retain) {
        return pushAndTrim(failed, jobId, retain);
    }

    @Override
    public synchronized List<String> completedIds() {
        return new ArrayList<>(completed);
    }

    @Override
    public synchronized List<String> failedIds() {
        return new ArrayList<>(failed);
    }

    @Override
    public synchronized List<String> removeAllWaiting() {
        List<String> removed = sortedByTime(waiting);
        waiting.clear();
        return removed;
    }

    @Override
    public synchronized void putRepeatable(RepeatableJob repeatable) {
        repeatables.put(repeatable.getKey(), repeatable.toBuilder().build());
    }

    @Override
    public synchronized Optional<RepeatableJob> findRepeatable(String key) {
        RepeatableJob repeatable = repeatables.get(key);
        return repeatable == null ? Optional.empty() : Optional.of(repeatable.toBuilder().build());
    }

    @Override
    public synchronized boolean removeRepeatable(String key) {
        return repeatables.remove(key) != null;
    }

    @Override
    public synchronized List<RepeatableJob> repeatables() {
        return repeatables.values().stream()
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void setPaused(boolean paused) {
        this.paused = paused;
    }

    @Override
    public synchronized boolean isPaused() {
        return paused;
    }

    @Override
    public synchronized long countWaiting() {
        return waiting.size();
    }

    @Override
    public synchronized long countDelayed(Instant now) {
        return waiting.values().stream().filter(readyAt -> readyAt.isAfter(now)).count();
    }

    @Override
    public synchronized long countActive() {
        return active.size();
    }

    @Override
    public synchronized long countCompleted() {
        return completed.size();
    }

    @Override
    public synchronized long countFailed() {
        return failed.size();
    }

    @Override
    public synchronized int countRepeatable() {
        return repeatables.size();
    }

    @Override
    public synchronized void destroy() {
        jobs.clear();
        waiting.clear();
        active.clear();
        completed.clear();
        failed.clear();
        repeatables.clear();
        paused = false;
    }

    private static List<String> pushAndTrim(LinkedList<String> list, String jobId, int retain) {
        list.addFirst(jobId);
        List<String> evicted = new ArrayList<>();
        while (list.size() > Math.max(retain, 0)) {
            evicted.add(list.removeLast());
        }
        return evicted;
    }

    private static List<String> sortedByTime(Map<String, Instant> index) {
        return index.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
