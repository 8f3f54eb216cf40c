package com.movesim.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    private final GeneratorPoolConfig generatorPoolConfig;

    public AsyncConfig(GeneratorPoolConfig generatorPoolConfig) {
        this.generatorPoolConfig = generatorPoolConfig;
    }

    /**
     * One thread per running generator. Queue capacity 0 makes the executor hand each task
     * straight to a thread; once {@code max-pool-size} generators are running further
     * submissions are rejected instead of waiting behind tasks that never finish.
     */
    @Bean("generatorExecutor")
    public ThreadPoolTaskExecutor generatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generatorPoolConfig.getCorePoolSize());
        executor.setMaxPoolSize(generatorPoolConfig.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(generatorPoolConfig.getKeepAliveSeconds());
        executor.setThreadNamePrefix(generatorPoolConfig.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    /** Fires session deadlines. */
    @Bean("sessionScheduler")
    public ThreadPoolTaskScheduler sessionScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("session-deadline-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
