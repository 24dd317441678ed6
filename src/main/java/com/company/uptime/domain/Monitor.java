package com.company.uptime.domain;

import com.company.uptime.domain.enums.MonitorStatus;
import com.company.uptime.domain.enums.MonitorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Monitor implements Subject {
    private String monitorId;
    private String userId;
    private String name;
    private String url;
    private MonitorType type;
    private MonitorStatus status;
    private Integer checkIntervalSeconds;
    private Integer timeoutMs;
    private Integer maxRetries;
    private Boolean active;

    private Instant lastCheckedAt;
    private Long lastResponseTimeMs;
    private Integer lastStatusCode;
    private String lastError;

    private Long totalChecks;
    private Long successfulChecks;
    private Long failedChecks;

    private Boolean alertOnDown;
    private Boolean alertOnRecovery;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public SubjectRef getRef() {
        return SubjectRef.monitor(monitorId);
    }

    public double uptimePercentage() {
        if (totalChecks == null || totalChecks == 0) {
            return 100.0;
        }
        long successful = successfulChecks == null ? 0 : successfulChecks;
        return Math.round(successful * 10000.0 / totalChecks) / 100.0;
    }
}
