package com.company.uptime.service;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.exception.ProbeException;
import com.company.uptime.probe.ProbeExecutor;
import com.company.uptime.queue.Job;
import com.company.uptime.queue.Processor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Worker body shared by every queue: load the subject, probe it, record the outcome.
 * <p>
 * A failed probe is a recorded result, not a job failure. Only infrastructure errors
 * (database, interrupts) escape and make the queue retry the job.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SubjectCheckProcessor implements Processor {

    private final SubjectDirectory subjectDirectory;
    private final ProbeExecutor probeExecutor;
    private final ResultSink resultSink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @return the recorded result, or {@code null} when the subject is gone or inactive
     */
    @Override
    public CheckResult handle(Job job) {
        SubjectRef ref = SubjectRef.parse(job.getSubjectKey());

        Optional<Subject> subject = subjectDirectory.find(ref);
        if (subject.isEmpty()) {
            log.info("Skipping {} job {}: subject {} no longer exists", job.getKind(), job.getId(), ref);
            meterRegistry.counter("checks.skipped", "reason", "missing").increment();
            return null;
        }
        if (!subject.get().isEnabled()) {
            log.debug("Skipping {} job {}: subject {} is inactive", job.getKind(), job.getId(), ref);
            meterRegistry.counter("checks.skipped", "reason", "inactive").increment();
            return null;
        }

        Instant start = clock.instant();
        CheckResult result;
        try {
            result = probeExecutor.execute(subject.get());
        } catch (ProbeException e) {
            Instant end = clock.instant();
            log.info("Check of {} failed ({}): {}", ref, e.getReason(), e.getMessage());
            result = CheckResult.fromProbeException(ref, e, Duration.between(start, end).toMillis(), end);
        }

        resultSink.recordResult(ref, result);

        meterRegistry.counter("checks.executed",
                "kind", job.getKind().getValue(),
                "outcome", result.getOutcome().name()
        ).increment();

        return result;
    }
}
