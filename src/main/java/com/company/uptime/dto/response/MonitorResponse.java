package com.company.uptime.dto.response;

import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.domain.enums.MonitorType;
import com.company.uptime.domain.enums.ScheduleState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorResponse {
    private String monitorId;
    private String name;
    private String url;
    private MonitorType type;
    private MonitorStatus status;
    private ScheduleState scheduleState;
    private Integer checkIntervalSeconds;
    private Integer timeoutMs;
    private Integer maxRetries;
    private Boolean active;
    private Instant lastCheckedAt;
    private Long lastResponseTimeMs;
    private Integer lastStatusCode;
    private String lastError;
    private Long totalChecks;
    private Double uptimePercentage;
    private Boolean alertOnDown;
    private Boolean alertOnRecovery;
    private Instant createdAt;
}
