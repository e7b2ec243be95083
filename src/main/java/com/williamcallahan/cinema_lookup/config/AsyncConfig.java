/**
 * Configuration for asynchronous lookups
 *
 * @author William Callahan
 *
 * Features:
 * - Dedicated pool for resolveAsync so lookups never run on request threads
 * - Bounded queue with caller-runs fallback when saturated
 * - Custom thread naming for easier debugging
 */

package com.williamcallahan.cinema_lookup.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Executor backing ResolutionOrchestrator.resolveAsync
     * - Core pool of 8 threads, maximum of 32
     * - Queue capacity of 200 lookups
     *
     * @return Configured AsyncTaskExecutor
     */
    @Bean("lookupTaskExecutor")
    public AsyncTaskExecutor lookupTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return lookupTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) ->
            logger.error("Uncaught async exception in {}: {}", method.getName(), throwable.getMessage(), throwable);
    }
}
