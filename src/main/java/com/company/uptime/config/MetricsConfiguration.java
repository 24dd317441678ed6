package com.company.uptime.config;

import com.company.uptime.queue.AggregateQueueStats;
import com.company.uptime.queue.QueueRegistry;
import com.company.uptime.service.SchedulerOrchestrator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.ToDoubleFunction;

/**
 * Queue gauges. Counts come from the snapshot taken by the last health check so a scrape
 * never fans out to the backend.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final QueueRegistry queueRegistry;
    private final SchedulerOrchestrator orchestrator;

    @Bean
    public MeterBinder queueMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("queue.subjects", queueRegistry, r -> r.liveQueues().size())
                    .description("Number of subjects with a live job queue")
                    .register(reg);

            snapshotGauge(reg, "queue.jobs.waiting", "Jobs ready to run", AggregateQueueStats::getWaiting);
            snapshotGauge(reg, "queue.jobs.delayed", "Jobs waiting for their delay", AggregateQueueStats::getDelayed);
            snapshotGauge(reg, "queue.jobs.active", "Jobs being processed", AggregateQueueStats::getActive);
            snapshotGauge(reg, "queue.jobs.failed", "Retained failed jobs", AggregateQueueStats::getFailed);
            snapshotGauge(reg, "queue.repeating", "Repeating registrations", AggregateQueueStats::getRepeating);

            log.info("Queue metrics registered");
        };
    }

    private void snapshotGauge(MeterRegistry reg, String name, String description,
                               ToDoubleFunction<AggregateQueueStats> value) {
        Gauge.builder(name, orchestrator, o -> {
                    AggregateQueueStats stats = o.getLastAggregateStats();
                    return stats != null ? value.applyAsDouble(stats) : 0;
                })
                .description(description)
                .register(reg);
    }
}
