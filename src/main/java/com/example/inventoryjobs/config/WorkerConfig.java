package com.example.inventoryjobs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools of the worker.
 * <p>
 * - taskWorkerExecutor: fixed pool sized by {@code jobs.worker.concurrency}, one task per thread
 * - taskWatchdogScheduler: interrupts workers whose task passed its deadline
 * - taskExecutor: backs {@code @Async} (Slack alerts)
 */
@Slf4j
@EnableAsync
@Configuration
public class WorkerConfig {

    @Bean(name = "taskWorkerExecutor")
    public ExecutorService taskWorkerExecutor(JobsProperties properties) {
        var concurrency = properties.getWorker().getConcurrency();
        log.info("Creating task worker pool with {} threads", concurrency);
        return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("task-worker-"));
    }

    @Bean(name = "taskWatchdogScheduler")
    public ScheduledExecutorService taskWatchdogScheduler() {
        var factory = new CustomizableThreadFactory("task-watchdog-");
        factory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(factory);
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
