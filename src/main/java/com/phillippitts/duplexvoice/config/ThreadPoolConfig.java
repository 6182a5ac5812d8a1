package com.phillippitts.duplexvoice.config;

import com.phillippitts.duplexvoice.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by the duplex controller and the HTTP event stream.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 *
 * <p>All executors copy the Log4j2 ThreadContext (MDC) from the submitting thread to the worker
 * thread, so request and session correlation IDs survive the hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for the four long-running loops of a duplex session (listen, process, speak, monitor).
     *
     * <p>Defaults: core 4, max 8, no queue. A loop must start on its own thread, never wait in a
     * queue behind another loop, so a full pool rejects with {@link ThreadPoolExecutor.AbortPolicy}
     * and {@code start()} fails fast.
     *
     * @return executor for duplex loops
     */
    @Bean(name = "duplexLoopExecutor")
    public ThreadPoolTaskExecutor duplexLoopExecutor() {
        return build(threadPoolProperties.getLoop(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Small executor for fire-and-forget backchannel playback.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The controller catches the
     * rejection and drops the audio; the backchannel event is still published.
     *
     * @return executor for backchannel playback
     */
    @Bean(name = "backchannelExecutor")
    public ThreadPoolTaskExecutor backchannelExecutor() {
        return build(threadPoolProperties.getBackchannel(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor that pumps controller events into Server-Sent Event emitters, one task per client.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the HTTP layer completes the
     * emitter with an error when no thread is free.
     *
     * @return executor for SSE pumping
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's MDC into the worker and restores the worker's own afterwards.
     */
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
