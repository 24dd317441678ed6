package com.company.uptime.config;

import com.company.uptime.pacing.Pacer;
import com.company.uptime.pacing.Sleeper;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools and time sources shared by the queues and the orchestrator.
 */
@Configuration
@RequiredArgsConstructor
public class SchedulingConfig {

    private final UptimeProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Pacer pacer() {
        return new Pacer(Sleeper.system(), new Random());
    }

    /**
     * Runs probe jobs. A full pool rejects, and the queue keeps the job waiting for the next
     * dispatch round.
     */
    @Bean(name = "probeWorkerExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor probeWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getQueue().getWorkerThreads());
        executor.setMaxPoolSize(properties.getQueue().getWorkerThreads());
        executor.setQueueCapacity(properties.getQueue().getWorkerQueueCapacity());
        executor.setThreadNamePrefix("probe-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Default executor for {@code @Async}: alert delivery and background bulk checks.
     */
    @Bean(name = "taskExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("uptime-async-");
        executor.initialize();
        return executor;
    }
}
