package com.company.uptime.config;

import com.company.uptime.queue.QueueSettings;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binds the {@code uptime.*} keys of application.yml.
 */
@Component
@ConfigurationProperties(prefix = "uptime")
@ToString
@Getter
@Setter
public class UptimeProperties {

    private Queue queue = new Queue();
    private Scheduler scheduler = new Scheduler();
    private Pacing pacing = new Pacing();
    private Whois whois = new Whois();

    @ToString
    @Getter
    @Setter
    public static class Queue {
        /** redis or memory */
        private String backend = "redis";
        private int attempts = 3;
        private Duration backoff = Duration.ofSeconds(5);
        private int retainCompleted = 10;
        private int retainFailed = 50;
        /** Active jobs older than this are redelivered. */
        private Duration ackTimeout = Duration.ofMinutes(5);
        private int concurrencyPerQueue = 1;
        private int workerThreads = 8;
        private int workerQueueCapacity = 500;
        /** Set to false on API-only nodes that should not process jobs. */
        private boolean workerEnabled = true;
        private long pollIntervalMs = 1000;

        public QueueSettings toSettings() {
            return QueueSettings.builder()
                    .attempts(attempts)
                    .backoff(backoff)
                    .retainCompleted(retainCompleted)
                    .retainFailed(retainFailed)
                    .ackTimeout(ackTimeout)
                    .concurrency(concurrencyPerQueue)
                    .build();
        }
    }

    @ToString
    @Getter
    @Setter
    public static class Scheduler {
        private int defaultMonitorIntervalSeconds = 60;
        private int defaultDomainIntervalSeconds = 3600;
        private Duration immediateCheckDelay = Duration.ofSeconds(1);
        private long failedJobAlertThreshold = 100;
        private int expiryAlertDays = 30;
        private boolean reconciliationEnabled = true;
        private long reconciliationIntervalMs = 3600000;
        private long healthCheckIntervalMs = 3600000;
    }

    @ToString
    @Getter
    @Setter
    public static class Pacing {
        private long minDelayMs = 3000;
        private long maxDelayMs = 5000;
    }

    @ToString
    @Getter
    @Setter
    public static class Whois {
        private long jitterMinMs = 2000;
        private long jitterMaxMs = 5000;
        private int timeoutMs = 15000;
        private String ianaServer = "whois.iana.org";
        private int port = 43;
    }
}
