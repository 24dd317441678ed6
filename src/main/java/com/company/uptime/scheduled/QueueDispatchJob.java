package com.company.uptime.scheduled;

import com.company.uptime.exception.QueueBackendException;
import com.company.uptime.exception.QueueClosedException;
import com.company.uptime.queue.JobQueue;
import com.company.uptime.queue.QueueRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Worker loop: polls every live queue and hands ready jobs to the probe worker pool.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "uptime.queue.worker-enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class QueueDispatchJob {

    private final QueueRegistry queueRegistry;
    private final Executor workerExecutor;
    private final MeterRegistry meterRegistry;

    public QueueDispatchJob(QueueRegistry queueRegistry,
                            @Qualifier("probeWorkerExecutor") Executor workerExecutor,
                            MeterRegistry meterRegistry) {
        this.queueRegistry = queueRegistry;
        this.workerExecutor = workerExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${uptime.queue.poll-interval-ms:1000}", initialDelay = 5000)
    public void dispatchDueJobs() {
        int dispatched = 0;

        for (JobQueue queue : queueRegistry.liveQueues()) {
            try {
                dispatched += queue.dispatchDue(workerExecutor);
            } catch (QueueClosedException e) {
                log.debug("Queue {} removed during dispatch", queue.getName());
            } catch (QueueBackendException e) {
                log.error("Dispatch failed for queue {}", queue.getName(), e);
                meterRegistry.counter("queue.dispatch.failures").increment();
            }
        }

        if (dispatched > 0) {
            log.debug("Dispatched {} jobs to workers", dispatched);
            meterRegistry.counter("queue.jobs.dispatched").increment(dispatched);
        }
    }
}
