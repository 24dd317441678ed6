package com.company.uptime.dto.request;

import com.company.uptime.domain.enums.MonitorType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMonitorRequest {
    @NotBlank(message = "Name is required")
    @Size(max = 255)
    private String name;

    @NotBlank(message = "URL or host is required")
    @Size(max = 2048)
    private String url;

    @NotNull(message = "Type is required (HTTP, HTTPS, TCP or PING)")
    private MonitorType type;

    // Optional, defaults from configuration
    @Min(value = 30, message = "Check interval must be at least 30 seconds")
    @Max(value = 86400, message = "Check interval must be at most one day")
    private Integer checkIntervalSeconds;

    @Min(1000)
    @Max(120000)
    private Integer timeoutMs;

    @Min(0)
    @Max(10)
    private Integer maxRetries;

    private Boolean alertOnDown;
    private Boolean alertOnRecovery;
}
