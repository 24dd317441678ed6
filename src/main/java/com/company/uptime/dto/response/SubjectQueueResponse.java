package com.company.uptime.dto.response;

import com.company.uptime.domain.enums.ScheduleState;
import com.company.uptime.queue.QueueStats;
import com.company.uptime.queue.RepeatableJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubjectQueueResponse {
    private String subjectKey;
    private ScheduleState state;
    private QueueStats stats;
    private List<RepeatableJob> repeating;
}
