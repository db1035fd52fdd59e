package com.picfactory.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads for the per-job execution loops.
 *
 * Each started job holds one thread for as long as its loop runs. There is no
 * queue and no upper bound, so every started job gets its loop immediately.
 */
@Configuration
@EnableConfigurationProperties(PicFactoryProperties.class)
public class SchedulerConfig {

    @Bean(name = "jobLoopExecutor")
    public ThreadPoolTaskExecutor jobLoopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("job-loop-");
        executor.setDaemon(true);
        // Loops blocked in a wait are interrupted at shutdown.
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
