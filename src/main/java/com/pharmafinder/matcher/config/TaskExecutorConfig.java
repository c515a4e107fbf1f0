package com.pharmafinder.matcher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${matcher.provider.pool-size:8}")
    private int poolSize;

    @Value("${matcher.provider.queue-capacity:200}")
    private int queueCapacity;

    /**
     * Pool that runs embedding and LLM calls so callers can wait on them with a timeout.
     */
    @Bean("providerCallExecutor")
    public ThreadPoolTaskExecutor providerCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, poolSize));
        executor.setMaxPoolSize(Math.max(1, poolSize));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("ProviderCall-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
