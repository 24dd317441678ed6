package com.company.uptime.dto.request;

import com.company.uptime.domain.enums.MonitorType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMonitorRequest {
    @Size(max = 255)
    private String name;

    @Size(max = 2048)
    private String url;

    private MonitorType type;

    @Min(value = 30, message = "Check interval must be at least 30 seconds")
    @Max(value = 86400, message = "Check interval must be at most one day")
    private Integer checkIntervalSeconds;

    @Min(1000)
    @Max(120000)
    private Integer timeoutMs;

    @Min(0)
    @Max(10)
    private Integer maxRetries;

    private Boolean active;
    private Boolean alertOnDown;
    private Boolean alertOnRecovery;
}
