package com.memstack.ingest.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that runs group workers.
 *
 * <p>Queue capacity is zero and the maximum pool size is unbounded, so starting a
 * worker never waits behind another group's worker. On shutdown running workers are
 * interrupted (no waiting for queued tasks) and given a grace period to unwind.
 */
@Slf4j
@Configuration
public class QueueExecutorConfig {

    public static final String GROUP_WORKER_EXECUTOR = "groupWorkerExecutor";

    @Bean(name = GROUP_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor groupWorkerExecutor(QueueProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(properties.getCoreWorkers());
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(properties.getWorkerThreadPrefix());

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(properties.getShutdownAwaitSeconds());

        executor.initialize();

        log.info("✅ Group worker executor configured: core={}, prefix={}, shutdownAwait={}s",
                properties.getCoreWorkers(),
                properties.getWorkerThreadPrefix(),
                properties.getShutdownAwaitSeconds());

        return executor;
    }
}
