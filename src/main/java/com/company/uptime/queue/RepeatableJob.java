package com.company.uptime.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A repeating registration: materializes a new job of {@link #kind} whenever
 * {@link #nextFireAt} passes. At most one exists per {@link #key}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RepeatableJob {
    private String key;
    private JobKind kind;
    private String subjectKey;
    private Schedule schedule;
    private Map<String, String> payload;
    private Instant registeredAt;
    private Instant nextFireAt;
}
