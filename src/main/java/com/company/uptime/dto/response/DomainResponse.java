package com.company.uptime.dto.response;

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
public class DomainResponse {
    private String domainName;
    private ScheduleState scheduleState;
    private Integer checkIntervalSeconds;
    private Boolean active;
    private Instant lastCheckedAt;
    private Instant expiryDate;
    private Integer daysUntilExpiry;
    private String registrar;
    private String lastError;
    private Boolean expired;
    private Boolean expiringSoon;
    private Long totalChecks;
    private Boolean enableExpiryAlerts;
    private Integer alertDaysBefore;
    private Instant createdAt;
}
