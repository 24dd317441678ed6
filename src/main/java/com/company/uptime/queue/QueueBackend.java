package com.company.uptime.queue;

/**
 * Connection to where queue state lives. One instance is shared by all queues.
 */
public interface QueueBackend {

    QueueStore open(String queueName);

    /**
     * @throws com.company.uptime.exception.QueueBackendException if the backend is unreachable
     */
    void ping();

    String describe();
}
