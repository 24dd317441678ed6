package com.company.uptime.queue;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueueStats {
    String queueName;
    long waiting;
    long delayed;
    long active;
    long completed;
    long failed;
    int repeating;
    boolean paused;
}
