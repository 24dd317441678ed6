package com.company.uptime.controller;

import com.company.uptime.domain.SubjectRef;
import com.company.uptime.domain.enums.SubjectType;
import com.company.uptime.dto.response.BatchDispatchResult;
import com.company.uptime.dto.response.QueueHealthReport;
import com.company.uptime.dto.response.ReconciliationReport;
import com.company.uptime.dto.response.SubjectQueueResponse;
import com.company.uptime.queue.AggregateQueueStats;
import com.company.uptime.queue.Job;
import com.company.uptime.queue.JobState;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Operator endpoints over the per-subject queues. Subjects are addressed as
 * {@code /{type}/{id}} with type {@code monitor} or {@code domain}.
 */
@RestController
@RequestMapping("/api/v1/queues")
@Tag(name = "Queue Administration", description = "Inspect and control the per-subject check queues")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
@PreAuthorize("hasRole('ADMIN')")
public class QueueAdminController {

    private final SchedulerOrchestrator orchestrator;
    private final UserContext userContext;
    private final MeterRegistry meterRegistry;

    @GetMapping("/stats")
    @Operation(summary = "Aggregate statistics over all queues")
    public ResponseEntity<AggregateQueueStats> getAggregateStats() {
        meterRegistry.counter("api.queues.requests", "endpoint", "stats").increment();
        return ResponseEntity.ok(orchestrator.getAggregateQueueStats());
    }

    @GetMapping("/subjects")
    @Operation(summary = "List subjects that currently own a queue")
    public ResponseEntity<List<String>> listSubjects() {
        return ResponseEntity.ok(orchestrator.listSubjects().stream()
                .map(SubjectRef::key)
                .collect(Collectors.toList()));
    }

    @GetMapping("/health")
    @Operation(summary = "Run the queue health check now")
    public ResponseEntity<QueueHealthReport> checkHealth() {
        return ResponseEntity.ok(orchestrator.checkQueueHealth());
    }

    @PostMapping("/check-all")
    @Operation(summary = "Check every active subject now", description = "Runs in the background, paced")
    public ResponseEntity<Map<String, Object>> triggerBulkCheck() {
        log.info("Bulk check requested by {}", userContext.getCurrentUserId());
        meterRegistry.counter("api.queues.requests", "endpoint", "check-all").increment();

        reportOutcome(orchestrator.triggerBulkCheckNowAsync(), "check-all");

        Map<String, Object> response = new HashMap<>();
        response.put("status", "accepted");
        response.put("timestamp", Instant.now());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/users/{userId}/check")
    @Operation(summary = "Check every active domain of one user now", description = "Runs in the background, paced")
    public ResponseEntity<Map<String, Object>> triggerUserCheck(@PathVariable String userId) {
        log.info("User check for {} requested by {}", userId, userContext.getCurrentUserId());
        meterRegistry.counter("api.queues.requests", "endpoint", "check-user").increment();

        reportOutcome(orchestrator.triggerUserCheckAsync(userId), "check-user");

        Map<String, Object> response = new HashMap<>();
        response.put("status", "accepted");
        response.put("userId", userId);
        response.put("timestamp", Instant.now());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Run the backup sweep now")
    public ResponseEntity<ReconciliationReport> reconcile() {
        log.info("Reconciliation requested by {}", userContext.getCurrentUserId());
        return ResponseEntity.ok(orchestrator.reconcile());
    }

    @GetMapping("/{type}/{id}")
    @Operation(summary = "Queue statistics and schedule state for one subject")
    public ResponseEntity<SubjectQueueResponse> getSubjectQueue(@PathVariable String type, @PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getSubjectQueueStats(toRef(type, id)));
    }

    @GetMapping("/{type}/{id}/jobs")
    @Operation(summary = "List jobs of one subject in a given state")
    public ResponseEntity<List<Job>> listJobs(
            @PathVariable String type,
            @PathVariable String id,
            @RequestParam(defaultValue = "WAITING") JobState state) {
        return ResponseEntity.ok(orchestrator.listJobs(toRef(type, id), state));
    }

    @PostMapping("/{type}/{id}/check")
    @Operation(summary = "Enqueue an immediate check")
    public ResponseEntity<Job> checkNow(@PathVariable String type, @PathVariable String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.enqueueImmediateCheck(toRef(type, id)));
    }

    @PostMapping("/{type}/{id}/pause")
    @Operation(summary = "Stop handing jobs of this subject to workers")
    public ResponseEntity<Map<String, Object>> pause(@PathVariable String type, @PathVariable String id) {
        SubjectRef ref = toRef(type, id);
        orchestrator.pauseSubject(ref);
        log.info("Queue {} paused by {}", ref, userContext.getCurrentUserId());
        return ResponseEntity.ok(statusBody(ref, "paused"));
    }

    @PostMapping("/{type}/{id}/resume")
    @Operation(summary = "Resume a paused subject queue")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String type, @PathVariable String id) {
        SubjectRef ref = toRef(type, id);
        orchestrator.resumeSubject(ref);
        log.info("Queue {} resumed by {}", ref, userContext.getCurrentUserId());
        return ResponseEntity.ok(statusBody(ref, "resumed"));
    }

    @DeleteMapping("/{type}/{id}/jobs")
    @Operation(summary = "Remove all waiting jobs; the recurring registration stays")
    public ResponseEntity<Map<String, Object>> clear(@PathVariable String type, @PathVariable String id) {
        SubjectRef ref = toRef(type, id);
        int removed = orchestrator.clearSubjectQueue(ref);
        log.info("Queue {} cleared by {} ({} jobs)", ref, userContext.getCurrentUserId(), removed);

        Map<String, Object> body = statusBody(ref, "cleared");
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }

    private void reportOutcome(CompletableFuture<BatchDispatchResult> dispatch, String endpoint) {
        dispatch.whenComplete((result, error) -> {
            if (error != null) {
                log.error("Background {} dispatch failed", endpoint, error);
                meterRegistry.counter("api.queues.background.failures", "endpoint", endpoint).increment();
            } else {
                log.info("Background {} dispatch finished: {} enqueued, {} failed",
                        endpoint, result.getEnqueued(), result.getFailed());
            }
        });
    }

    private static SubjectRef toRef(String type, String id) {
        return SubjectRef.of(SubjectType.fromPrefix(type), id);
    }

    private static Map<String, Object> statusBody(SubjectRef ref, String status) {
        Map<String, Object> body = new HashMap<>();
        body.put("subject", ref.key());
        body.put("status", status);
        body.put("timestamp", Instant.now());
        return body;
    }
}
