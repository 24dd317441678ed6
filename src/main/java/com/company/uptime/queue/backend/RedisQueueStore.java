package com.company.uptime.queue.backend;

import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.queue.Job;
import com.company.uptime.queue.QueueStore;
import com.company.uptime.queue.RepeatableJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Queue state in Redis.
 * <pre>
 * uptime:queue:{name}:id         counter for job ids
 * uptime:queue:{name}:jobs       hash   id -> job JSON
 * uptime:queue:{name}:waiting    zset   id scored by ready time
 * uptime:queue:{name}:active     zset   id scored by start time
 * uptime:queue:{name}:completed  list   newest first
 * uptime:queue:{name}:failed     list   newest first
 * uptime:queue:{name}:repeat     hash   job key -> registration JSON
 * uptime:queue:{name}:paused     flag
 * </pre>
 * Claiming and stalled redelivery move an id between the two sorted sets in one Lua script, so
 * exactly one caller wins and the id is never in neither set.
 */
@Slf4j
class RedisQueueStore implements QueueStore {

    static final String KEY_PREFIX = "uptime:queue:";

    /** KEYS[1] source zset, KEYS[2] target zset, ARGV[1] job id, ARGV[2] target score. */
    static final RedisScript<Long> MOVE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('ZREM', KEYS[1], ARGV[1]) == 1 then "
                    + "redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1]) "
                    + "return 1 "
                    + "end "
                    + "return 0",
            Long.class);

    private final String queueName;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    RedisQueueStore(String queueName, StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.queueName = queueName;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public long nextSequence() {
        return call("nextSequence", () -> {
            Long next = redisTemplate.opsForValue().increment(key("id"));
            return next != null ? next : 0L;
        });
    }

    @Override
    public void saveJob(Job job) {
        String json = write(job);
        run("saveJob", () -> hash().put(key("jobs"), job.getId(), json));
    }

    @Override
    public boolean saveJobIfAbsent(Job job) {
        String json = write(job);
        return call("saveJobIfAbsent", () -> Boolean.TRUE.equals(hash().putIfAbsent(key("jobs"), job.getId(), json)));
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        String json = call("findJob", () -> hash().get(key("jobs"), jobId));
        return json == null ? Optional.empty() : Optional.of(read(json, Job.class));
    }

    @Override
    public void deleteJobs(Collection<String> jobIds) {
        if (jobIds.isEmpty()) {
            return;
        }
        run("deleteJobs", () -> hash().delete(key("jobs"), jobIds.toArray()));
    }

    @Override
    public void addWaiting(String jobId, Instant readyAt) {
        run("addWaiting", () -> redisTemplate.opsForZSet().add(key("waiting"), jobId, readyAt.toEpochMilli()));
    }

    @Override
    public List<String> findReadyWaiting(Instant now, int limit) {
        return call("findReadyWaiting", () -> toList(redisTemplate.opsForZSet()
                .rangeByScore(key("waiting"), Double.NEGATIVE_INFINITY, now.toEpochMilli(), 0, limit)));
    }

    @Override
    public List<String> waitingIds() {
        return call("waitingIds", () -> toList(redisTemplate.opsForZSet().range(key("waiting"), 0, -1)));
    }

    @Override
    public boolean claim(String jobId, Instant startedAt) {
        return call("claim", () -> move(key("waiting"), key("active"), jobId, startedAt));
    }

    @Override
    public boolean removeActive(String jobId) {
        return call("removeActive", () -> {
            Long removed = redisTemplate.opsForZSet().remove(key("active"), jobId);
            return removed != null && removed > 0;
        });
    }

    @Override
    public List<String> activeIds() {
        return call("activeIds", () -> toList(redisTemplate.opsForZSet().range(key("active"), 0, -1)));
    }

    @Override
    public List<String> findStalled(Instant startedBefore) {
        return call("findStalled", () -> toList(redisTemplate.opsForZSet()
                .rangeByScore(key("active"), Double.NEGATIVE_INFINITY, startedBefore.toEpochMilli() - 1)));
    }

    @Override
    public boolean requeueStalled(String jobId, Instant readyAt) {
        return call("requeueStalled", () -> move(key("active"), key("waiting"), jobId, readyAt));
    }

    @Override
    public List<String> pushCompleted(String jobId, int retain) {
        return pushAndTrim("completed", jobId, retain);
    }

    @Override
    public List<String> pushFailed(String jobId, int retain) {
        return pushAndTrim("failed", jobId, retain);
    }

    @Override
    public List<String> completedIds() {
        return call("completedIds", () -> toList(redisTemplate.opsForList().range(key("completed"), 0, -1)));
    }

    @Override
    public List<String> failedIds() {
        return call("failedIds", () -> toList(redisTemplate.opsForList().range(key("failed"), 0, -1)));
    }

    @Override
    public List<String> removeAllWaiting() {
        return call("removeAllWaiting", () -> {
            List<String> ids = toList(redisTemplate.opsForZSet().range(key("waiting"), 0, -1));
            if (!ids.isEmpty()) {
                redisTemplate.opsForZSet().remove(key("waiting"), ids.toArray());
            }
            return ids;
        });
    }

    @Override
    public void putRepeatable(RepeatableJob repeatable) {
        String json = write(repeatable);
        run("putRepeatable", () -> hash().put(key("repeat"), repeatable.getKey(), json));
    }

    @Override
    public Optional<RepeatableJob> findRepeatable(String repeatKey) {
        String json = call("findRepeatable", () -> hash().get(key("repeat"), repeatKey));
        return json == null ? Optional.empty() : Optional.of(read(json, RepeatableJob.class));
    }

    @Override
    public boolean removeRepeatable(String repeatKey) {
        return call("removeRepeatable", () -> {
            Long removed = hash().delete(key("repeat"), repeatKey);
            return removed != null && removed > 0;
        });
    }

    @Override
    public List<RepeatableJob> repeatables() {
        List<String> values = call("repeatables", () -> hash().values(key("repeat")));
        List<RepeatableJob> result = new ArrayList<>();
        if (values != null) {
            for (String json : values) {
                result.add(read(json, RepeatableJob.class));
            }
        }
        return result;
    }

    @Override
    public void setPaused(boolean paused) {
        run("setPaused", () -> {
            if (paused) {
                redisTemplate.opsForValue().set(key("paused"), "1");
            } else {
                redisTemplate.delete(key("paused"));
            }
        });
    }

    @Override
    public boolean isPaused() {
        return call("isPaused", () -> Boolean.TRUE.equals(redisTemplate.hasKey(key("paused"))));
    }

    @Override
    public long countWaiting() {
        return call("countWaiting", () -> nullToZero(redisTemplate.opsForZSet().zCard(key("waiting"))));
    }

    @Override
    public long countDelayed(Instant now) {
        return call("countDelayed", () -> nullToZero(redisTemplate.opsForZSet()
                .count(key("waiting"), now.toEpochMilli() + 1, Double.POSITIVE_INFINITY)));
    }

    @Override
    public long countActive() {
        return call("countActive", () -> nullToZero(redisTemplate.opsForZSet().zCard(key("active"))));
    }

    @Override
    public long countCompleted() {
        return call("countCompleted", () -> nullToZero(redisTemplate.opsForList().size(key("completed"))));
    }

    @Override
    public long countFailed() {
        return call("countFailed", () -> nullToZero(redisTemplate.opsForList().size(key("failed"))));
    }

    @Override
    public int countRepeatable() {
        return call("countRepeatable", () -> (int) nullToZero(hash().size(key("repeat"))));
    }

    @Override
    public void destroy() {
        run("destroy", () -> redisTemplate.delete(List.of(
                key("id"), key("jobs"), key("waiting"), key("active"),
                key("completed"), key("failed"), key("repeat"), key("paused"))));
        log.debug("Deleted Redis state of queue {}", queueName);
    }

    String key(String suffix) {
        return KEY_PREFIX + queueName + ":" + suffix;
    }

    private List<String> pushAndTrim(String list, String jobId, int retain) {
        return call("push " + list, () -> {
            if (retain <= 0) {
                List<String> evicted = toList(redisTemplate.opsForList().range(key(list), 0, -1));
                evicted.add(0, jobId);
                redisTemplate.delete(key(list));
                return evicted;
            }
            redisTemplate.opsForList().leftPush(key(list), jobId);
            List<String> evicted = toList(redisTemplate.opsForList().range(key(list), retain, -1));
            if (!evicted.isEmpty()) {
                redisTemplate.opsForList().trim(key(list), 0, retain - 1L);
            }
            return evicted;
        });
    }

    private boolean move(String from, String to, String jobId, Instant score) {
        Long moved = redisTemplate.execute(MOVE_SCRIPT, List.of(from, to), jobId, String.valueOf(score.toEpochMilli()));
        return moved != null && moved == 1L;
    }

    private HashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new QueueBackendException("Redis " + operation + " failed for queue " + queueName, e);
        }
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new QueueBackendException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new QueueBackendException("Unreadable " + type.getSimpleName() + " in queue " + queueName, e);
        }
    }

    private static List<String> toList(Collection<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0L;
    }
}
