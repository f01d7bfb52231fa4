package net.miragecodex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for miss-path generation.
 *
 * Features:
 * - Generation runs off the servlet thread, so a client disconnect never interrupts it
 * - Bounded pool and queue sized from {@link SearchGenerationProperties}
 * - Waits for running generations on shutdown
 */
@Configuration
public class SearchExecutorConfig {

    private static final int QUEUE_CAPACITY = 200;
    private static final int SHUTDOWN_AWAIT_SECONDS = 180;

    @Bean("searchGenerationExecutor")
    public AsyncTaskExecutor searchGenerationExecutor(SearchGenerationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorPoolSize());
        executor.setMaxPoolSize(properties.getExecutorPoolSize());
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix("search-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        executor.initialize();
        return executor;
    }
}
