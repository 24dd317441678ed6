package com.company.uptime.probe;

import com.company.uptime.domain.CheckResult;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.enums.ProbeFailureReason;
import com.company.uptime.exception.ProbeException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes a subject to the first probe that supports it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompositeProbeExecutor implements ProbeExecutor {

    private final List<Probe> probes;
    private final MeterRegistry meterRegistry;

    @Override
    public CheckResult execute(Subject subject) {
        Probe probe = probes.stream()
                .filter(p -> p.supports(subject))
                .findFirst()
                .orElseThrow(() -> new ProbeException(ProbeFailureReason.UNSUPPORTED,
                        "No probe supports " + subject.getRef()));

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            CheckResult result = probe.probe(subject);
            outcome = result.getOutcome().name().toLowerCase();
            return result;
        } catch (ProbeException e) {
            outcome = e.getReason().name().toLowerCase();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("probe.duration", "kind", probe.kind(), "outcome", outcome));
        }
    }
}
