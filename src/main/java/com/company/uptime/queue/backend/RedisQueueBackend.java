package com.company.uptime.queue.backend;

import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.queue.QueueBackend;
import com.company.uptime.queue.QueueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "uptime.queue.backend", havingValue = "redis", matchIfMissing = true)
public class RedisQueueBackend implements QueueBackend {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public QueueStore open(String queueName) {
        return new RedisQueueStore(queueName, stringRedisTemplate, objectMapper);
    }

    @Override
    public void ping() {
        try {
            String reply = stringRedisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            log.debug("Redis ping: {}", reply);
        } catch (DataAccessException e) {
            throw new QueueBackendException("Redis queue backend is unreachable", e);
        }
    }

    @Override
    public String describe() {
        RedisConnectionFactory factory = stringRedisTemplate.getConnectionFactory();
        return "redis (" + (factory != null ? factory.getClass().getSimpleName() : "no connection factory") + ")";
    }
}
