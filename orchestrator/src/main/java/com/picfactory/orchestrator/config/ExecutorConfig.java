package com.picfactory.orchestrator.config;

import com.picfactory.orchestrator.executor.BrowserTaskExecutor;
import com.picfactory.orchestrator.executor.DisabledTaskExecutor;
import com.picfactory.orchestrator.executor.OfflineTaskExecutor;
import com.picfactory.orchestrator.executor.TaskExecutor;
import com.picfactory.orchestrator.service.FileService;
import com.picfactory.orchestrator.session.RemoteSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the one TaskExecutor the scheduler talks to:
 * offline if enabled, else live if enabled, else disabled.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean
    public TaskExecutor taskExecutor(PicFactoryProperties properties,
                                     FileService files,
                                     RemoteSessionManager sessions,
                                     Clock clock) {
        PicFactoryProperties.Executor executor = properties.getExecutor();
        if (executor.isOffline()) {
            log.info("Task executor: offline (latency {})", executor.getOfflineLatency());
            return new OfflineTaskExecutor(files, executor.getOfflineLatency());
        }
        if (executor.isLive()) {
            log.info("Task executor: live browser against {}", properties.getBrowser().getSurfaceUrl());
            return new BrowserTaskExecutor(sessions, files, properties.getBrowser(), clock);
        }
        log.warn("Task executor: disabled; every task will fail until PICFACTORY_ENABLE_REAL_RUNNER "
                + "or PICFACTORY_MOCK_RUNNER is set");
        return new DisabledTaskExecutor();
    }
}
