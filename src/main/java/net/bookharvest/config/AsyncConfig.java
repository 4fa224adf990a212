package net.bookharvest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for provider work
 *
 * Features:
 * - Bounded pool shared by the generation fan-out, availability checks and corpus lookups
 * - Callers run the task when the queue is full instead of dropping it
 * - Descriptive thread naming pattern for monitoring
 */
@Configuration
public class AsyncConfig {

    /**
     * Creates the executor used for concurrent provider calls.
     *
     * @param corePoolSize threads kept alive
     * @param maxPoolSize burst ceiling
     * @param queueCapacity pending tasks before the caller runs the task itself
     * @return configured executor
     */
    @Bean("providerExecutor")
    public AsyncTaskExecutor providerExecutor(@Value("${app.providers.executor.core-pool-size:8}") int corePoolSize,
                                              @Value("${app.providers.executor.max-pool-size:16}") int maxPoolSize,
                                              @Value("${app.providers.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("provider-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
