package com.company.uptime.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class QueueSettings {
    @Builder.Default
    int attempts = 3;
    @Builder.Default
    Duration backoff = Duration.ofSeconds(5);
    @Builder.Default
    int retainCompleted = 10;
    @Builder.Default
    int retainFailed = 50;
    @Builder.Default
    Duration ackTimeout = Duration.ofMinutes(5);
    @Builder.Default
    int concurrency = 1;

    public static QueueSettings defaults() {
        return QueueSettings.builder().build();
    }
}
