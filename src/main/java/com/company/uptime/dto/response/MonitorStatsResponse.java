package com.company.uptime.dto.response;

import com.company.uptime.domain.CheckResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorStatsResponse {
    private String monitorId;
    private Long totalChecks;
    private Long successfulChecks;
    private Long failedChecks;
    private double uptimePercentage;
    private int last24HoursChecks;
    private long last24HoursUptime;
    private long averageResponseTimeMs;
    private List<CheckResult> recentResults;
}
