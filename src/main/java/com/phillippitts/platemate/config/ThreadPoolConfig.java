package com.phillippitts.platemate.config;

import com.phillippitts.platemate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the conversation round-trips and for location work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for generative chat API calls.
     *
     * <p>Only one request is ever in flight per session, so the pool is small. When the pool and
     * queue are full the caller runs the task ({@link ThreadPoolExecutor.CallerRunsPolicy}).
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread so request ids
     * and the session token follow the call into the worker's log lines.
     *
     * @return executor for chat API round-trips
     */
    @Bean(name = "chatExecutor")
    public Executor chatExecutor() {
        ThreadPoolProperties.ChatPoolProperties chatProps = threadPoolProperties.getChat();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(chatProps.getCorePoolSize());
        executor.setMaxPoolSize(chatProps.getMaxPoolSize());
        executor.setQueueCapacity(chatProps.getQueueCapacity());
        executor.setThreadNamePrefix(chatProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(chatProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for location retries, periodic location updates and geocode lookups.
     *
     * @return scheduler also usable as a plain executor
     */
    @Bean(name = "locationScheduler")
    public ThreadPoolTaskScheduler locationScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties schedProps = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedProps.getPoolSize());
        scheduler.setThreadNamePrefix(schedProps.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setTaskDecorator(mdcPropagatingDecorator());
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
