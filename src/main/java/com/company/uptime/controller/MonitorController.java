package com.company.uptime.controller;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Monitor;
import com.company.uptime.dto.request.CreateMonitorRequest;
import com.company.uptime.dto.request.UpdateMonitorRequest;
import com.company.uptime.dto.response.MonitorResponse;
import com.company.uptime.dto.response.MonitorStatsResponse;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.MonitorService;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/monitors")
@Tag(name = "Monitors", description = "Uptime monitors owned by the caller")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class MonitorController {

    private final MonitorService monitorService;
    private final SchedulerOrchestrator orchestrator;
    private final UserContext userContext;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Create a monitor", description = "Schedules recurring checks and runs a first check shortly after")
    public ResponseEntity<MonitorResponse> createMonitor(@Valid @RequestBody CreateMonitorRequest request) {
        String userId = userContext.getCurrentUserId();
        meterRegistry.counter("api.monitors.requests", "endpoint", "create").increment();

        Monitor monitor = monitorService.createMonitor(request, userId);

        return ResponseEntity
                .created(URI.create("/api/v1/monitors/" + monitor.getMonitorId()))
                .body(toResponse(monitor));
    }

    @GetMapping
    @Operation(summary = "List the caller's monitors")
    public ResponseEntity<List<MonitorResponse>> listMonitors() {
        List<MonitorResponse> monitors = monitorService.listMonitors(userContext.getCurrentUserId()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(monitors);
    }

    @GetMapping("/{monitorId}")
    @Operation(summary = "Get one monitor")
    public ResponseEntity<MonitorResponse> getMonitor(@PathVariable String monitorId) {
        return ResponseEntity.ok(toResponse(monitorService.getMonitor(monitorId, userContext.getCurrentUserId())));
    }

    @PatchMapping("/{monitorId}")
    @Operation(summary = "Update a monitor", description = "Interval changes replace the recurring schedule")
    public ResponseEntity<MonitorResponse> updateMonitor(
            @PathVariable String monitorId,
            @Valid @RequestBody UpdateMonitorRequest request) {
        meterRegistry.counter("api.monitors.requests", "endpoint", "update").increment();
        Monitor monitor = monitorService.updateMonitor(monitorId, request, userContext.getCurrentUserId());
        return ResponseEntity.ok(toResponse(monitor));
    }

    @DeleteMapping("/{monitorId}")
    @Operation(summary = "Delete a monitor and its queue")
    public ResponseEntity<Void> deleteMonitor(@PathVariable String monitorId) {
        meterRegistry.counter("api.monitors.requests", "endpoint", "delete").increment();
        monitorService.deleteMonitor(monitorId, userContext.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{monitorId}/results")
    @Operation(summary = "Most recent check results, newest first")
    public ResponseEntity<List<CheckResult>> recentResults(
            @PathVariable String monitorId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(monitorService.recentResults(monitorId, userContext.getCurrentUserId(), limit));
    }

    @GetMapping("/{monitorId}/stats")
    @Operation(summary = "Uptime and response time statistics", description = "24 hour figures come from the latest 100 results")
    public ResponseEntity<MonitorStatsResponse> getStats(@PathVariable String monitorId) {
        meterRegistry.counter("api.monitors.requests", "endpoint", "stats").increment();
        return ResponseEntity.ok(monitorService.getStats(monitorId, userContext.getCurrentUserId()));
    }

    private MonitorResponse toResponse(Monitor monitor) {
        return MonitorResponse.builder()
                .monitorId(monitor.getMonitorId())
                .name(monitor.getName())
                .url(monitor.getUrl())
                .type(monitor.getType())
                .status(monitor.getStatus())
                .scheduleState(orchestrator.stateOf(monitor.getRef()))
                .checkIntervalSeconds(monitor.getCheckIntervalSeconds())
                .timeoutMs(monitor.getTimeoutMs())
                .maxRetries(monitor.getMaxRetries())
                .active(monitor.getActive())
                .lastCheckedAt(monitor.getLastCheckedAt())
                .lastResponseTimeMs(monitor.getLastResponseTimeMs())
                .lastStatusCode(monitor.getLastStatusCode())
                .lastError(monitor.getLastError())
                .totalChecks(monitor.getTotalChecks())
                .uptimePercentage(monitor.uptimePercentage())
                .alertOnDown(monitor.getAlertOnDown())
                .alertOnRecovery(monitor.getAlertOnRecovery())
                .createdAt(monitor.getCreatedAt())
                .build();
    }
}
