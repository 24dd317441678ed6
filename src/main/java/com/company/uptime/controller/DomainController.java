package com.company.uptime.controller;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Domain;
import com.company.uptime.dto.request.CreateDomainRequest;
import com.company.uptime.dto.request.UpdateDomainRequest;
import com.company.uptime.dto.response.DomainResponse;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.DomainService;
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
@RequestMapping("/api/v1/domains")
@Tag(name = "Domains", description = "Domain expiry tracking")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class DomainController {

    private final DomainService domainService;
    private final SchedulerOrchestrator orchestrator;
    private final UserContext userContext;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Track a domain", description = "Schedules WHOIS expiry checks and runs a first lookup shortly after")
    public ResponseEntity<DomainResponse> addDomain(@Valid @RequestBody CreateDomainRequest request) {
        meterRegistry.counter("api.domains.requests", "endpoint", "create").increment();
        Domain domain = domainService.addDomain(request, userContext.getCurrentUserId());

        return ResponseEntity
                .created(URI.create("/api/v1/domains/" + domain.getDomainName()))
                .body(toResponse(domain));
    }

    @GetMapping
    @Operation(summary = "List the caller's domains")
    public ResponseEntity<List<DomainResponse>> listDomains() {
        List<DomainResponse> domains = domainService.listDomains(userContext.getCurrentUserId()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(domains);
    }

    @GetMapping("/expiring")
    @Operation(summary = "List the caller's domains expiring within the given number of days")
    public ResponseEntity<List<DomainResponse>> listExpiring(
            @RequestParam(defaultValue = "30") @Min(0) @Max(3650) int days) {
        meterRegistry.counter("api.domains.requests", "endpoint", "expiring").increment();
        List<DomainResponse> domains = domainService.findExpiring(days, userContext.getCurrentUserId()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(domains);
    }

    @GetMapping("/{domainName}")
    @Operation(summary = "Get one tracked domain")
    public ResponseEntity<DomainResponse> getDomain(@PathVariable String domainName) {
        return ResponseEntity.ok(toResponse(domainService.getDomain(domainName, userContext.getCurrentUserId())));
    }

    @PatchMapping("/{domainName}")
    @Operation(summary = "Update a tracked domain")
    public ResponseEntity<DomainResponse> updateDomain(
            @PathVariable String domainName,
            @Valid @RequestBody UpdateDomainRequest request) {
        meterRegistry.counter("api.domains.requests", "endpoint", "update").increment();
        Domain domain = domainService.updateDomain(domainName, request, userContext.getCurrentUserId());
        return ResponseEntity.ok(toResponse(domain));
    }

    @DeleteMapping("/{domainName}")
    @Operation(summary = "Stop tracking a domain")
    public ResponseEntity<Void> removeDomain(@PathVariable String domainName) {
        meterRegistry.counter("api.domains.requests", "endpoint", "delete").increment();
        domainService.removeDomain(domainName, userContext.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{domainName}/results")
    @Operation(summary = "Most recent WHOIS results, newest first")
    public ResponseEntity<List<CheckResult>> recentResults(
            @PathVariable String domainName,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(domainService.recentResults(domainName, userContext.getCurrentUserId(), limit));
    }

    private DomainResponse toResponse(Domain domain) {
        return DomainResponse.builder()
                .domainName(domain.getDomainName())
                .scheduleState(orchestrator.stateOf(domain.getRef()))
                .checkIntervalSeconds(domain.getCheckIntervalSeconds())
                .active(domain.getActive())
                .lastCheckedAt(domain.getLastCheckedAt())
                .expiryDate(domain.getLastExpiryDate())
                .daysUntilExpiry(domain.getLastDaysUntilExpiry())
                .registrar(domain.getRegistrar())
                .lastError(domain.getLastError())
                .expired(domain.getExpired())
                .expiringSoon(domain.getExpiringSoon())
                .totalChecks(domain.getTotalChecks())
                .enableExpiryAlerts(domain.getEnableExpiryAlerts())
                .alertDaysBefore(domain.getAlertDaysBefore())
                .createdAt(domain.getCreatedAt())
                .build();
    }
}
