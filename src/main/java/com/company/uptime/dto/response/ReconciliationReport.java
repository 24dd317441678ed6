package com.company.uptime.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one backup sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {
    private int activeSubjects;
    private long repeatingBefore;
    private boolean stalled;
    private int dueSubjects;
    private int catchUpEnqueued;
    private int reRegistered;
    private int failures;
    private Instant completedAt;
}
