package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for usage notifications. When saturated, work is dropped rather than queued
 * without limit or run on the request thread.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "usageExecutor")
    public ThreadPoolTaskExecutor usageExecutor(GatekeeperProperties properties, GatekeeperMetrics metrics) {
        GatekeeperProperties.UsageExecutor cfg = properties.getUsageExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("usage-");
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn("Usage executor saturated, dropping usage notification");
            metrics.usageNotificationDropped();
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
