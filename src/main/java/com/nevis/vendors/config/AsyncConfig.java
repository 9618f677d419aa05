package com.nevis.vendors.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "pipelineTaskExecutor")
    public Executor pipelineTaskExecutor(
        @Value("${app.runs.max-concurrent:4}") int maxConcurrentRuns,
        @Value("${app.runs.queue-capacity:50}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentRuns);
        executor.setMaxPoolSize(maxConcurrentRuns);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("plan-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
