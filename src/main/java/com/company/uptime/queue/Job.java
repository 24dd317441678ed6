package com.company.uptime.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One unit of work on a subject's queue. Stored as JSON by the Redis backend.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private String id;
    private String queueName;
    private JobKind kind;
    private String subjectKey;
    private Map<String, String> payload;

    // Optional caller-supplied key for one-off duplicate suppression
    private String jobKey;
    // Set when materialized from a repeating registration
    private String repeatKey;

    private Instant enqueuedAt;
    private Instant readyAt;
    private Instant startedAt;
    private Instant finishedAt;

    private int attemptsMade;
    private int maxAttempts;
    private JobState state;
    private String failedReason;
    private String resultSummary;
}
