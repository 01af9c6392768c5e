package com.phillippitts.peervoice.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes transcription pool gauges via Micrometer:
 * <ul>
 *   <li>transcription.pool.size</li>
 *   <li>transcription.pool.active</li>
 *   <li>transcription.pool.queued</li>
 *   <li>transcription.pool.completed</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("transcriptionExecutor") ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutorProvider) {
        this.transcriptionExecutorProvider = transcriptionExecutorProvider;
    }

    @Bean
    public MeterBinder transcriptionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = transcriptionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("transcription.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the transcription pool")
                    .register(registry);

            Gauge.builder("transcription.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively running recognizer calls")
                    .register(registry);

            Gauge.builder("transcription.pool.queued", executor, e -> e.getQueue().size())
                    .description("Transcription tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("transcription.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed transcription tasks")
                    .register(registry);

            LOG.info("Transcription pool metrics registered: transcription.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = transcriptionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Transcription pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
