package com.patchpilot.orchestrator.config;

import com.patchpilot.orchestrator.resilience.RetryPolicy;
import com.patchpilot.orchestrator.resilience.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: the clock every time computation reads, the
 * sleeper every wait goes through, the retry policy, and the thread pools.
 */
@Configuration
@EnableConfigurationProperties(PatchPilotProperties.class)
public class OrchestratorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    RetryPolicy retryPolicy(PatchPilotProperties props, Sleeper sleeper) {
        PatchPilotProperties.Retry retry = props.retry();
        return new RetryPolicy(new RetryPolicy.Settings(
                retry.maxRetries(),
                Duration.ofMillis(retry.baseDelayMs()),
                Duration.ofMillis(retry.maxDelayMs()),
                retry.jitter()), sleeper);
    }

    /**
     * Fires watchdog timeouts. Being the only ScheduledExecutorService in the
     * context, it also runs the @Scheduled session recovery.
     */
    @Bean(destroyMethod = "shutdownNow")
    ScheduledExecutorService watchdogScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("watchdog"));
    }

    /**
     * One thread per batch job. Jobs block on the batch's semaphore inside the
     * pool, so the pool itself must not cap concurrency.
     */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService batchExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("batch-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService runnerExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("autonomous-runner"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
