package com.phillippitts.duplexvoice.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes duplex executor pools via Micrometer.
 *
 * <p>For each of {@code duplex.loop.pool} and {@code duplex.backchannel.pool}:
 * <ul>
 *   <li>{@code .size} - current number of threads</li>
 *   <li>{@code .active} - threads executing a task</li>
 *   <li>{@code .max.size} - configured maximum</li>
 * </ul>
 *
 * <p>Available at {@code GET /actuator/metrics/duplex.loop.pool.active} and in Prometheus
 * format as {@code duplex_loop_pool_active}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> loopExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> backchannelExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("duplexLoopExecutor") ObjectProvider<ThreadPoolTaskExecutor> loopExecutorProvider,
            @Qualifier("backchannelExecutor") ObjectProvider<ThreadPoolTaskExecutor> backchannelExecutorProvider) {
        this.loopExecutorProvider = loopExecutorProvider;
        this.backchannelExecutorProvider = backchannelExecutorProvider;
    }

    @Bean
    public MeterBinder duplexExecutorMetrics() {
        return registry -> {
            bind(registry, "duplex.loop.pool", loopExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "duplex.backchannel.pool",
                    backchannelExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Duplex thread pool metrics registered: duplex.*.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);

        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);

        Gauge.builder(prefix + ".max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .register(registry);
    }
}
