package com.company.uptime.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Domain implements Subject {
    private String domainName;
    private String userId;
    private Integer checkIntervalSeconds;
    private Boolean active;

    private Instant lastCheckedAt;
    private Instant lastExpiryDate;
    private Integer lastDaysUntilExpiry;
    private String registrar;
    private String lastError;
    private Boolean expired;
    private Boolean expiringSoon;

    private Long totalChecks;
    private Long successfulChecks;
    private Long failedChecks;

    private Boolean enableExpiryAlerts;
    private Integer alertDaysBefore;

    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public SubjectRef getRef() {
        return SubjectRef.domain(domainName);
    }

    /**
     * Also due while the last known expiry lies inside the alert window.
     */
    @Override
    public boolean isDue(Instant now) {
        return Subject.super.isDue(now) || isWithinAlertWindow();
    }

    public boolean isWithinAlertWindow() {
        if (!Boolean.TRUE.equals(enableExpiryAlerts) || lastDaysUntilExpiry == null) {
            return false;
        }
        int threshold = alertDaysBefore != null ? alertDaysBefore : 30;
        return lastDaysUntilExpiry <= threshold;
    }
}
