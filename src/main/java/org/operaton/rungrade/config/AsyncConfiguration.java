package org.operaton.rungrade.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for asynchronous task execution.
 * Streamed batch jobs run on their own bounded pool, one worker thread per job.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfiguration implements AsyncConfigurer {

    /**
     * Thread pool for streamed batch analysis jobs.
     * When the queue is full the job runs in the request thread, and its events are delivered
     * once the handler returns.
     *
     * @return configured thread pool executor for batch analysis
     */
    @Bean(name = "batchAnalysisExecutor")
    public Executor batchAnalysisExecutor(
            @Value("${rungrade.batch.executor.core-pool-size:2}") int corePoolSize,
            @Value("${rungrade.batch.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${rungrade.batch.executor.queue-capacity:10}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("batch-analysis-");
        executor.setKeepAliveSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // Wait for running jobs on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Initialized batch analysis executor: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);

        return executor;
    }

    /**
     * Exception handler for uncaught exceptions in async methods.
     * Logs the error with context about the failed method.
     *
     * @return async exception handler
     */
    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) ->
            log.error("Uncaught exception in async method '{}' with parameters {}",
                    method.getName(), params, throwable);
    }
}
