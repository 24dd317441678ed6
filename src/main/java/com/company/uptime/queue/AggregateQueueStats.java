package com.company.uptime.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Sums over every registered queue. May be slightly stale under concurrent registry changes.
 */
@Value
@Builder
public class AggregateQueueStats {
    int queueCount;
    long waiting;
    long delayed;
    long active;
    long completed;
    long failed;
    long repeating;
    int pausedQueues;
    Instant collectedAt;

    public static AggregateQueueStats empty(Instant collectedAt) {
        return AggregateQueueStats.builder().collectedAt(collectedAt).build();
    }
}
