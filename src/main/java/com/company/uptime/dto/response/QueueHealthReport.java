package com.company.uptime.dto.response;

import com.company.uptime.queue.AggregateQueueStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueHealthReport {
    private boolean healthy;
    private int activeSubjects;
    private AggregateQueueStats stats;
    private List<String> warnings;
}
