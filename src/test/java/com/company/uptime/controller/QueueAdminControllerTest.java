package com.company.uptime.controller;

import com.company.uptime.domain.SubjectRef;
import com.company.uptime.dto.response.BatchDispatchResult;
import com.company.uptime.dto.response.ReconciliationReport;
import com.company.uptime.exception.GlobalExceptionHandler;
import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.exception.SubjectNotFoundException;
import com.company.uptime.queue.AggregateQueueStats;
import com.company.uptime.queue.Job;
import com.company.uptime.queue.JobKind;
import com.company.uptime.queue.JobState;
import com.company.uptime.security.UserContext;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueueAdminControllerTest {

    @Mock
    private SchedulerOrchestrator orchestrator;

    @Mock
    private UserContext userContext;

    private SimpleMeterRegistry meterRegistry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        QueueAdminController controller = new QueueAdminController(orchestrator, userContext, meterRegistry);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ========================================================================
    // Aggregate endpoints
    // ========================================================================

    @Nested
    @DisplayName("Aggregate endpoints")
    class AggregateTests {

        @Test
        @DisplayName("should return aggregate queue statistics")
        void shouldReturnStats() throws Exception {
            when(orchestrator.getAggregateQueueStats()).thenReturn(AggregateQueueStats.builder()
                    .queueCount(2)
                    .waiting(3)
                    .repeating(2)
                    .collectedAt(Instant.parse("2026-03-01T10:00:00Z"))
                    .build());

            mockMvc.perform(get("/api/v1/queues/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.queueCount").value(2))
                    .andExpect(jsonPath("$.waiting").value(3))
                    .andExpect(jsonPath("$.repeating").value(2));
        }

        @Test
        @DisplayName("should list subject keys")
        void shouldListSubjects() throws Exception {
            when(orchestrator.listSubjects()).thenReturn(List.of(
                    SubjectRef.domain("example.com"), SubjectRef.monitor("42")));

            mockMvc.perform(get("/api/v1/queues/subjects"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0]").value("domain:example.com"))
                    .andExpect(jsonPath("$[1]").value("monitor:42"));
        }

        @Test
        @DisplayName("should accept a bulk check and run it in the background")
        void shouldAcceptBulkCheck() throws Exception {
            when(orchestrator.triggerBulkCheckNowAsync()).thenReturn(CompletableFuture.completedFuture(
                    BatchDispatchResult.builder().reason("bulk").requested(2).enqueued(2).build()));

            mockMvc.perform(post("/api/v1/queues/check-all"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("accepted"));

            verify(orchestrator).triggerBulkCheckNowAsync();
            assertThat(meterRegistry.counter("api.queues.background.failures", "endpoint", "check-all").count())
                    .isZero();
        }

        @Test
        @DisplayName("should count a bulk check that fails in the background")
        void shouldCountFailedBulkCheck() throws Exception {
            CompletableFuture<BatchDispatchResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(new IllegalStateException("database unavailable"));
            when(orchestrator.triggerBulkCheckNowAsync()).thenReturn(failed);

            mockMvc.perform(post("/api/v1/queues/check-all"))
                    .andExpect(status().isAccepted());

            assertThat(meterRegistry.counter("api.queues.background.failures", "endpoint", "check-all").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should accept a check of one user's domains")
        void shouldAcceptUserCheck() throws Exception {
            when(orchestrator.triggerUserCheckAsync("user-7")).thenReturn(CompletableFuture.completedFuture(
                    BatchDispatchResult.builder().reason("user").requested(3).enqueued(3).build()));

            mockMvc.perform(post("/api/v1/queues/users/user-7/check"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("accepted"))
                    .andExpect(jsonPath("$.userId").value("user-7"));

            verify(orchestrator).triggerUserCheckAsync("user-7");
        }

        @Test
        @DisplayName("should return the reconciliation report")
        void shouldReconcile() throws Exception {
            when(orchestrator.reconcile()).thenReturn(ReconciliationReport.builder()
                    .activeSubjects(3)
                    .stalled(true)
                    .catchUpEnqueued(3)
                    .build());

            mockMvc.perform(post("/api/v1/queues/reconcile"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.stalled").value(true))
                    .andExpect(jsonPath("$.catchUpEnqueued").value(3));
        }

        @Test
        @DisplayName("should answer 503 when the queue backend is down")
        void shouldMapBackendFailure() throws Exception {
            when(orchestrator.getAggregateQueueStats())
                    .thenThrow(new QueueBackendException("Redis hlen failed for queue monitor:42"));

            mockMvc.perform(get("/api/v1/queues/stats"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.message").value("Job queue backend is unavailable"));
        }
    }

    // ========================================================================
    // Subject endpoints
    // ========================================================================

    @Nested
    @DisplayName("Subject endpoints")
    class SubjectTests {

        @Test
        @DisplayName("should enqueue an immediate check for a domain")
        void shouldEnqueueCheck() throws Exception {
            SubjectRef ref = SubjectRef.domain("example.com");
            when(orchestrator.enqueueImmediateCheck(ref)).thenReturn(Job.builder()
                    .id("7")
                    .queueName("domain:example.com")
                    .kind(JobKind.SINGLE_CHECK)
                    .state(JobState.WAITING)
                    .build());

            mockMvc.perform(post("/api/v1/queues/domain/Example.COM/check"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.id").value("7"))
                    .andExpect(jsonPath("$.kind").value("SINGLE_CHECK"));
        }

        @Test
        @DisplayName("should list jobs in the requested state")
        void shouldListJobsByState() throws Exception {
            SubjectRef ref = SubjectRef.monitor("42");
            when(orchestrator.listJobs(ref, JobState.FAILED)).thenReturn(List.of(Job.builder()
                    .id("3")
                    .state(JobState.FAILED)
                    .failedReason("database down")
                    .build()));

            mockMvc.perform(get("/api/v1/queues/monitor/42/jobs").param("state", "FAILED"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].failedReason").value("database down"));
        }

        @Test
        @DisplayName("should pause and resume a subject queue")
        void shouldPauseAndResume() throws Exception {
            SubjectRef ref = SubjectRef.monitor("42");

            mockMvc.perform(post("/api/v1/queues/monitor/42/pause"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("paused"));
            mockMvc.perform(post("/api/v1/queues/monitor/42/resume"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("resumed"));

            verify(orchestrator).pauseSubject(ref);
            verify(orchestrator).resumeSubject(ref);
        }

        @Test
        @DisplayName("should report how many waiting jobs were cleared")
        void shouldClearQueue() throws Exception {
            when(orchestrator.clearSubjectQueue(SubjectRef.monitor("42"))).thenReturn(4);

            mockMvc.perform(delete("/api/v1/queues/monitor/42/jobs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.subject").value("monitor:42"))
                    .andExpect(jsonPath("$.removed").value(4));
        }

        @Test
        @DisplayName("should answer 404 for an unknown subject")
        void shouldMapUnknownSubject() throws Exception {
            SubjectRef ref = SubjectRef.monitor("missing");
            doThrow(new SubjectNotFoundException(ref.key())).when(orchestrator).pauseSubject(ref);

            mockMvc.perform(post("/api/v1/queues/monitor/missing/pause"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Subject not found: monitor:missing"));
        }

        @Test
        @DisplayName("should answer 400 for an unknown subject type")
        void shouldRejectUnknownType() throws Exception {
            mockMvc.perform(get("/api/v1/queues/server/1"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Unknown subject type: server"));
        }
    }
}
