package com.company.uptime.queue.backend;

import com.company.uptime.queue.QueueBackend;
import com.company.uptime.queue.QueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process backend for local runs and tests. State is lost on restart.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "uptime.queue.backend", havingValue = "memory")
public class InMemoryQueueBackend implements QueueBackend {

    private final Map<String, InMemoryQueueStore> stores = new ConcurrentHashMap<>();

    public InMemoryQueueBackend() {
        log.warn("Using in-memory queue backend; queue state will not survive a restart");
    }

    @Override
    public QueueStore open(String queueName) {
        return stores.computeIfAbsent(queueName, name -> new InMemoryQueueStore());
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
