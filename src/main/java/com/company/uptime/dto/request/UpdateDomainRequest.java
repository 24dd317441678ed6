package com.company.uptime.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateDomainRequest {
    @Min(value = 300, message = "Check interval must be at least 5 minutes")
    @Max(value = 604800, message = "Check interval must be at most one week")
    private Integer checkIntervalSeconds;

    private Boolean active;
    private Boolean enableExpiryAlerts;

    @Min(1)
    @Max(365)
    private Integer alertDaysBefore;
}
