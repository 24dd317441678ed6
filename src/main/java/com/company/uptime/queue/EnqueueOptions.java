package com.company.uptime.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class EnqueueOptions {

    @Builder.Default
    Duration delay = Duration.ZERO;

    /**
     * When set and a WAITING or ACTIVE job already carries this key, enqueue returns that job
     * instead of adding a new one.
     */
    String jobKey;

    /** Overrides the queue's default attempt count. */
    Integer attempts;

    public static EnqueueOptions immediate() {
        return EnqueueOptions.builder().build();
    }

    public static EnqueueOptions delayed(Duration delay) {
        return EnqueueOptions.builder().delay(delay).build();
    }
}
