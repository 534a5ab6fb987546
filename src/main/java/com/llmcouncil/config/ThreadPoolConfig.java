package com.llmcouncil.config;

import com.llmcouncil.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind council fan-out and streaming turns.
 *
 * <p>Both executors copy the submitting thread's Log4j2 ThreadContext (MDC) onto the worker so
 * that requestId and conversationId survive the hop into a per-model call.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for concurrent model calls (stage 1 and stage 2 fan-out, chairman, auxiliary).
     *
     * <p>Defaults to direct handoff (queue capacity 0), so every member's call gets a thread
     * immediately up to the maximum pool size. Rejection policy is
     * {@link ThreadPoolExecutor.CallerRunsPolicy}: past that size the submitting thread runs the
     * call itself, which throttles new turns instead of failing a council member.
     */
    @Bean(name = "councilExecutor")
    public ThreadPoolTaskExecutor councilExecutor() {
        return build(threadPoolProperties.getCouncil());
    }

    /**
     * Executor for background title generation. A title task only waits on the council pool.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return build(threadPoolProperties.getEvent());
    }

    /**
     * Executor for streaming turns, kept apart from the other pools so a waiting turn never
     * occupies a slot its own model calls or its title task need.
     */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        return build(threadPoolProperties.getStream());
    }

    static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
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
